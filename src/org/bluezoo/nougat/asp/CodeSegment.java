/*
 * CodeSegment.java
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
 * Script code, either a block of statements ({@code <% ... %>}) or an
 * output expression ({@code <%= ... %>}).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CodeSegment extends AbstractAspSegment {

    private final boolean expression;

    public CodeSegment(String code, boolean expression, int lineNumber, int columnNumber) {
        super(code, lineNumber, columnNumber);
        this.expression = expression;
    }

    @Override
    public Type getType() {
        return expression ? Type.EXPRESSION : Type.CODE;
    }

    public boolean isExpression() {
        return expression;
    }

}
