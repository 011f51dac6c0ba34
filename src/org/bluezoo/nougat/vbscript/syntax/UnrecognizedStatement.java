/*
 * UnrecognizedStatement.java
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
 * A line no statement form recognised. Parsing succeeds; executing it
 * fails.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UnrecognizedStatement extends Statement {

    private final String text;

    public UnrecognizedStatement(String text, int lineNumber) {
        super(lineNumber);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public void accept(StatementVisitor visitor) throws VBScriptException {
        visitor.visitUnrecognized(this);
    }

    @Override
    public String toString() {
        return "Unrecognized{" + text + "}";
    }

}
