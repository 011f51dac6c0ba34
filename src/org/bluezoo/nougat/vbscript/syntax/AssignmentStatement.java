/*
 * AssignmentStatement.java
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

import org.bluezoo.nougat.vbscript.VBScriptException;

/**
 * {@code [Set|Let] name = expression}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AssignmentStatement extends Statement {

    private final String name;
    private final String expression;

    public AssignmentStatement(String name, String expression, int lineNumber) {
        super(lineNumber);
        this.name = name;
        this.expression = expression;
    }

    public String getName() {
        return name;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public void accept(StatementVisitor visitor) throws VBScriptException {
        visitor.visitAssignment(this);
    }

    @Override
    public String toString() {
        return "Assignment{" + name + " = " + expression + "}";
    }

}
