/*
 * ForStatement.java
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
 * {@code For counter = start To end [Step step] ... Next}.
 *
 * <p>The bounds are kept as expression text and evaluated once when the
 * loop starts.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ForStatement extends Statement {

    private final String counter;
    private final String start;
    private final String end;
    private final String step;
    private final Body body;

    public ForStatement(String counter, String start, String end, String step, Body body,
                        int lineNumber) {
        super(lineNumber);
        this.counter = counter;
        this.start = start;
        this.end = end;
        this.step = step;
        this.body = body;
    }

    public String getCounter() {
        return counter;
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    public String getStep() {
        return step;
    }

    public Body getBody() {
        return body;
    }

    @Override
    public void accept(StatementVisitor visitor) throws VBScriptException {
        visitor.visitFor(this);
    }

    @Override
    public String toString() {
        return "For{" + counter + " = " + start + " To " + end + " Step " + step + "}";
    }

}
