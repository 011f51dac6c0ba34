/*
 * AspException.java
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
 * A failure to render one segment of a page, with a numeric code.
 *
 * <p>Script failures keep the code of the underlying
 * {@link org.bluezoo.nougat.vbscript.VBScriptException}; failures of the
 * rendering machinery itself use {@link #INTERNAL_ERROR}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AspException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Code for failures not raised by the script engine.
     */
    public static final int INTERNAL_ERROR = 500;

    private final int code;

    public AspException(int code, String message) {
        super(message);
        this.code = code;
    }

    public AspException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    @Override
    public String toString() {
        return "[Code " + code + "]: " + getMessage();
    }

}
