/*
 * FunctionDeclaration.java
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
 * {@code Function name(params) ... End Function} or the equivalent
 * {@code Sub} form.
 *
 * <p>Executing the declaration binds the name to a function value that
 * refers back to this node, so every call shares the parsed body.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FunctionDeclaration extends Statement {

    private final String name;
    private final List<String> parameters;
    private final Body body;
    private final boolean sub;

    public FunctionDeclaration(String name, List<String> parameters, Body body, boolean sub,
                               int lineNumber) {
        super(lineNumber);
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<String>(parameters));
        this.body = body;
        this.sub = sub;
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public Body getBody() {
        return body;
    }

    /**
     * @return true if this was declared with {@code Sub}
     */
    public boolean isSub() {
        return sub;
    }

    @Override
    public void accept(StatementVisitor visitor) throws VBScriptException {
        visitor.visitFunctionDeclaration(this);
    }

    @Override
    public String toString() {
        return (sub ? "Sub{" : "Function{") + name + parameters + "}";
    }

}
