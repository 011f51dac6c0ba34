/*
 * AspSegment.java
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
 * A contiguous unit of an ASP page: literal text, script code, an output
 * expression or a directive.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface AspSegment {

    /**
     * The kinds of segment.
     */
    enum Type {
        /** Literal template text */
        TEXT,
        /** Script code between {@code <%} and {@code %>} */
        CODE,
        /** Output expression between {@code <%=} and {@code %>} */
        EXPRESSION,
        /** Page directive between {@code <%@} and {@code %>} */
        DIRECTIVE
    }

    Type getType();

    /**
     * Gets the segment's content: the literal text, or the trimmed text
     * between the delimiters.
     *
     * @return the content
     */
    String getContent();

    /**
     * Gets the line number where the content starts.
     *
     * @return the 1-based line number
     */
    int getLineNumber();

    /**
     * Gets the column number where the content starts.
     *
     * @return the 1-based column number
     */
    int getColumnNumber();

}
