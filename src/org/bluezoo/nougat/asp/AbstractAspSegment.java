/*
 * AbstractAspSegment.java
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

package org.bluezoo.nougat.asp;

/**
 * Base class for segments, holding the content and its source position.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class AbstractAspSegment implements AspSegment {

    private final String content;
    private final int lineNumber;
    private final int columnNumber;

    protected AbstractAspSegment(String content, int lineNumber, int columnNumber) {
        this.content = content;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    @Override
    public String getContent() {
        return content;
    }

    @Override
    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public int getColumnNumber() {
        return columnNumber;
    }

    @Override
    public String toString() {
        return getType() + "(" + content + ")";
    }

}
