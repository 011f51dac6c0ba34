/*
 * CallStatement.java
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

package org.bluezoo.nougat.vbscript.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.bluezoo.nougat.vbscript.VBScriptException;

/**
 * {@code Call name(args)} or a bare {@code name(args)} procedure call.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CallStatement extends Statement {

    private final String name;
    private final List<String> arguments;

    /**
     * @param name the called function
     * @param arguments the argument expression texts
     * @param lineNumber the source line
     */
    public CallStatement(String name, List<String> arguments, int lineNumber) {
        super(lineNumber);
        this.name = name;
        this.arguments = Collections.unmodifiableList(new ArrayList<String>(arguments));
    }

    public String getName() {
        return name;
    }

    public List<String> getArguments() {
        return arguments;
    }

    @Override
    public void accept(StatementVisitor visitor) throws VBScriptException {
        visitor.visitCall(this);
    }

    @Override
    public String toString() {
        return "Call{" + name + arguments + "}";
    }

}
