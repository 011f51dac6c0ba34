/*
 * Body.java
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

import java.util.List;

import org.bluezoo.nougat.vbscript.StatementParser;
import org.bluezoo.nougat.vbscript.VBScriptException;

/**
 * The nested body of a block statement.
 *
 * <p>The body keeps the source text found between the block's opening
 * and closing lines and parses it the first time its statements are
 * requested. Later executions reuse the parsed statements.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Body {

    private final String text;
    private final int firstLine;
    private List<Statement> statements;

    /**
     * @param text the body source text
     * @param firstLine the line number of the first character of text
     */
    public Body(String text, int firstLine) {
        this.text = text != null ? text : "";
        this.firstLine = firstLine;
    }

    public String getText() {
        return text;
    }

    public int getFirstLine() {
        return firstLine;
    }

    /**
     * Gets the parsed statements of this body.
     *
     * @return the statements
     * @throws VBScriptException if the body does not parse
     */
    public List<Statement> getStatements() throws VBScriptException {
        if (statements == null) {
            statements = StatementParser.parseAll(text, firstLine);
        }
        return statements;
    }

    @Override
    public String toString() {
        return text;
    }

}
