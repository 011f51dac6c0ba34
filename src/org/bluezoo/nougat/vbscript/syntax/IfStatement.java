/*
 * IfStatement.java
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
 * {@code If condition Then body [Else body] End If}, in either the
 * single-line or the block form.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class IfStatement extends Statement {

    private final String condition;
    private final Body thenBody;
    private final Body elseBody;

    /**
     * @param condition the condition text
     * @param thenBody the body run when the condition holds
     * @param elseBody the body run otherwise, or null
     * @param lineNumber the source line
     */
    public IfStatement(String condition, Body thenBody, Body elseBody, int lineNumber) {
        super(lineNumber);
        this.condition = condition;
        this.thenBody = thenBody;
        this.elseBody = elseBody;
    }

    public String getCondition() {
        return condition;
    }

    public Body getThenBody() {
        return thenBody;
    }

    /**
     * @return the else body, or null if there is no Else branch
     */
    public Body getElseBody() {
        return elseBody;
    }

    @Override
    public void accept(StatementVisitor visitor) throws VBScriptException {
        visitor.visitIf(this);
    }

    @Override
    public String toString() {
        return "If{" + condition + "}";
    }

}
