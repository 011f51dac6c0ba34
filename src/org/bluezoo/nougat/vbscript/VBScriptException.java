/*
 * VBScriptException.java
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

package org.bluezoo.nougat.vbscript;

import java.text.MessageFormat;
import java.util.ResourceBundle;

/**
 * Exception raised while parsing or executing a script.
 *
 * <p>Every failure carries one of the stable {@link ErrorType} codes and,
 * where it is known, the 1-based source line of the statement that
 * failed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class VBScriptException extends Exception {

    private static final long serialVersionUID = 1L;

    static final ResourceBundle L10N =
        ResourceBundle.getBundle("org.bluezoo.nougat.vbscript.L10N");

    /**
     * Error taxonomy with stable numeric codes.
     */
    public enum ErrorType {
        /** Malformed statement or expression text */
        SYNTAX_ERROR(1001),
        /** Operator applied to mismatched operand types */
        TYPE_ERROR(1002),
        /** Reference to an unbound variable */
        NAME_ERROR(1003),
        /** Text that cannot be interpreted as a value */
        VALUE_ERROR(1004),
        /** Well-formed but unsatisfiable operation */
        RUNTIME_ERROR(1005),
        /** Recognised but unsupported, or unrecognised, statement */
        NOT_IMPLEMENTED_ERROR(1006),
        /** Unbalanced block delimiters */
        BLOCK_MISMATCH_ERROR(1007);

        private final int code;

        ErrorType(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    private final ErrorType type;
    private int lineNumber;

    public VBScriptException(ErrorType type, String message) {
        this(type, message, -1, null);
    }

    public VBScriptException(ErrorType type, String message, Throwable cause) {
        this(type, message, -1, cause);
    }

    public VBScriptException(ErrorType type, String message, int lineNumber, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.lineNumber = lineNumber;
    }

    /**
     * Creates an exception whose message is taken from the localised
     * message bundle.
     *
     * @param type the error type
     * @param key the message key
     * @param args the message arguments
     * @return the new exception
     */
    static VBScriptException create(ErrorType type, String key, Object... args) {
        String msg = MessageFormat.format(L10N.getString(key), args);
        return new VBScriptException(type, msg);
    }

    public ErrorType getType() {
        return type;
    }

    /**
     * Gets the numeric error code.
     *
     * @return a code between 1001 and 1007
     */
    public int getCode() {
        return type.getCode();
    }

    /**
     * Gets the line of the statement that failed.
     *
     * @return the line number (1-based), or -1 if not known
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Records the failing line if none has been recorded yet. The
     * innermost statement wins.
     */
    void locate(int line) {
        if (lineNumber < 0) {
            lineNumber = line;
        }
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append("[Code ").append(type.getCode()).append("]: ");
        if (lineNumber >= 0) {
            buf.append("line ").append(lineNumber).append(": ");
        }
        buf.append(getMessage());
        return buf.toString();
    }

}
