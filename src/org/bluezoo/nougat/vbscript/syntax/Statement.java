/*
 * Statement.java
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
 * Base class for the statement nodes produced by the statement parser.
 *
 * <p>The set of statement kinds is closed: each kind has a method on
 * {@link StatementVisitor}, so adding a kind forces every visitor,
 * including the executor, to handle it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Statement {

    private final int lineNumber;

    protected Statement(int lineNumber) {
        this.lineNumber = lineNumber;
    }

    /**
     * Gets the line where this statement begins.
     *
     * @return the line number (1-based), or -1 if not available
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Dispatches to the visitor method for this statement kind.
     *
     * @param visitor the visitor
     * @throws VBScriptException if the visitor fails
     */
    public abstract void accept(StatementVisitor visitor) throws VBScriptException;

}
