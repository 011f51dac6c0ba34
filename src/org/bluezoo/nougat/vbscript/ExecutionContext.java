/*
 * ExecutionContext.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of nougat, a classic ASP page engine.
 *
 * nougat is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * nougat is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with nougat.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.nougat.vbscript;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The mutable state of one rendering pass: variable and function
 * bindings plus the accumulated output.
 *
 * <p>Names are case-insensitive. Functions live in the same namespace as
 * variables, so binding either replaces the other. Bindings are held in
 * a stack of scopes: the page scope at the bottom and one frame per
 * active function call above it. Lookup consults the current frame and
 * then the page scope.
 *
 * <p>A context belongs to a single rendering pass and is not
 * thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ExecutionContext {

    /**
     * Maximum number of nested function calls.
     */
    public static final int MAX_CALL_DEPTH = 256;

    private final Scope page = new Scope("page");
    private final Deque<Scope> frames = new ArrayDeque<Scope>();
    private final StringBuilder output = new StringBuilder();

    /**
     * Appends text to the output buffer.
     *
     * @param content the text to write
     */
    public void write(String content) {
        if (content != null) {
            output.append(content);
        }
    }

    public String getOutput() {
        return output.toString();
    }

    public int getOutputLength() {
        return output.length();
    }

    /**
     * Returns the buffered output and clears the buffer.
     *
     * @return the output written since the last flush
     */
    public String flush() {
        String content = output.toString();
        output.setLength(0);
        return content;
    }

    /**
     * Binds a variable.
     *
     * <p>Inside a function call an existing local binding is updated
     * first, then an existing page binding; otherwise a new local binding
     * is created. Outside any call the page scope is used.
     *
     * @param name the variable name
     * @param value the value
     */
    public void setVariable(String name, VBValue value) {
        Scope frame = frames.peek();
        if (frame == null || frame.contains(name)) {
            current().put(name, value);
        } else if (page.contains(name)) {
            page.put(name, value);
        } else {
            frame.put(name, value);
        }
    }

    /**
     * Declares a variable in the current scope, binding it to null and
     * replacing any binding of the same name in that scope.
     *
     * @param name the variable name
     */
    public void declare(String name) {
        current().put(name, VBValue.NULL);
    }

    /**
     * Looks up a variable or function.
     *
     * @param name the name
     * @return the bound value, or null if the name is unbound
     */
    public VBValue getVariable(String name) {
        Scope frame = frames.peek();
        if (frame != null) {
            VBValue value = frame.get(name);
            if (value != null) {
                return value;
            }
        }
        return page.get(name);
    }

    public boolean isBound(String name) {
        return getVariable(name) != null;
    }

    /**
     * Binds a function in the page scope.
     *
     * @param name the function name
     * @param function the function value
     */
    public void setFunction(String name, VBValue function) {
        page.put(name, function);
    }

    /**
     * Enters a function call.
     *
     * @param functionName the called function, for diagnostics
     */
    public void pushFrame(String functionName) {
        frames.push(new Scope(functionName));
    }

    /**
     * Leaves the innermost function call, discarding its local bindings.
     */
    public void popFrame() {
        frames.pop();
    }

    public int getCallDepth() {
        return frames.size();
    }

    /**
     * Gets the names visible from the current scope, as first spelled.
     *
     * @return the visible names, locals first
     */
    public List<String> getVariableNames() {
        List<String> names = new ArrayList<String>();
        Scope frame = frames.peek();
        if (frame != null) {
            names.addAll(frame.names());
        }
        for (String name : page.names()) {
            if (frame == null || !frame.contains(name)) {
                names.add(name);
            }
        }
        return Collections.unmodifiableList(names);
    }

    private Scope current() {
        Scope frame = frames.peek();
        return frame != null ? frame : page;
    }

    /**
     * A case-insensitive map of bindings that remembers the first
     * spelling of each name.
     */
    private static class Scope {

        final String name;
        final Map<String, Binding> bindings = new LinkedHashMap<String, Binding>();

        Scope(String name) {
            this.name = name;
        }

        boolean contains(String key) {
            return bindings.containsKey(fold(key));
        }

        VBValue get(String key) {
            Binding binding = bindings.get(fold(key));
            return binding != null ? binding.value : null;
        }

        void put(String key, VBValue value) {
            String folded = fold(key);
            Binding binding = bindings.get(folded);
            if (binding == null) {
                bindings.put(folded, new Binding(key, value));
            } else {
                binding.value = value;
            }
        }

        List<String> names() {
            List<String> names = new ArrayList<String>(bindings.size());
            for (Binding binding : bindings.values()) {
                names.add(binding.name);
            }
            return names;
        }

        static String fold(String key) {
            return key.toLowerCase(Locale.ROOT);
        }

        @Override
        public String toString() {
            return "Scope{" + name + "}";
        }

    }

    private static class Binding {

        final String name;
        VBValue value;

        Binding(String name, VBValue value) {
            this.name = name;
            this.value = value;
        }

    }

}
