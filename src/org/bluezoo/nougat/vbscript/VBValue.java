/*
 * VBValue.java
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

import java.math.BigDecimal;

import org.bluezoo.nougat.vbscript.syntax.FunctionDeclaration;

/**
 * An immutable runtime value.
 *
 * <p>Values are strings, double-precision numbers, booleans, null, or
 * functions. Since instances never change, storing one in several
 * bindings is the same as copying it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class VBValue {

    /**
     * Tolerance for numeric equality.
     */
    public static final double EPSILON = Math.ulp(1.0);

    public static final VBValue NULL = new VBValue(Kind.NULL, null, 0.0, false, null);
    public static final VBValue TRUE = new VBValue(Kind.BOOLEAN, null, 0.0, true, null);
    public static final VBValue FALSE = new VBValue(Kind.BOOLEAN, null, 0.0, false, null);

    /**
     * The value variants.
     */
    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        FUNCTION
    }

    private final Kind kind;
    private final String string;
    private final double number;
    private final boolean bool;
    private final FunctionDeclaration function;

    private VBValue(Kind kind, String string, double number, boolean bool,
                    FunctionDeclaration function) {
        this.kind = kind;
        this.string = string;
        this.number = number;
        this.bool = bool;
        this.function = function;
    }

    public static VBValue string(String s) {
        return new VBValue(Kind.STRING, s != null ? s : "", 0.0, false, null);
    }

    public static VBValue number(double n) {
        return new VBValue(Kind.NUMBER, null, n, false, null);
    }

    public static VBValue bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static VBValue function(FunctionDeclaration declaration) {
        return new VBValue(Kind.FUNCTION, null, 0.0, false, declaration);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isFunction() {
        return kind == Kind.FUNCTION;
    }

    public String asString() {
        return string;
    }

    public double asNumber() {
        return number;
    }

    public boolean asBoolean() {
        return bool;
    }

    public FunctionDeclaration asFunction() {
        return function;
    }

    /**
     * Truthiness used by conditions: booleans are themselves, numbers are
     * true when non-zero, strings when non-empty; null is false and
     * functions are true.
     *
     * @return the truth value
     */
    public boolean isTrue() {
        switch (kind) {
            case BOOLEAN:
                return bool;
            case NUMBER:
                return number != 0.0;
            case STRING:
                return !string.isEmpty();
            case FUNCTION:
                return true;
            default:
                return false;
        }
    }

    /**
     * Script-level equality: same-kind values compare by content, numbers
     * within {@link #EPSILON}; values of different kinds are never equal.
     *
     * @param other the value to compare with
     * @return true if the values are equal
     */
    public boolean equalsValue(VBValue other) {
        if (other == null || kind != other.kind) {
            return false;
        }
        switch (kind) {
            case STRING:
                return string.equals(other.string);
            case NUMBER:
                return Math.abs(number - other.number) < EPSILON;
            case BOOLEAN:
                return bool == other.bool;
            case NULL:
                return true;
            default:
                return function == other.function;
        }
    }

    /**
     * Formats a number for display: integral values without a fractional
     * part, others in plain decimal notation.
     *
     * @param n the number
     * @return the display text
     */
    public static String formatNumber(double n) {
        if (Double.isNaN(n)) {
            return "NaN";
        }
        if (Double.isInfinite(n)) {
            return n > 0 ? "inf" : "-inf";
        }
        if (n == Math.rint(n) && Math.abs(n) < 1e15) {
            return Long.toString((long) n);
        }
        return BigDecimal.valueOf(n).stripTrailingZeros().toPlainString();
    }

    /**
     * Display text used when writing the value to the response.
     */
    @Override
    public String toString() {
        switch (kind) {
            case STRING:
                return string;
            case NUMBER:
                return formatNumber(number);
            case BOOLEAN:
                return bool ? "true" : "false";
            case FUNCTION:
                return "function " + function.getName();
            default:
                return "null";
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof VBValue)) {
            return false;
        }
        VBValue other = (VBValue) obj;
        if (kind != other.kind) {
            return false;
        }
        switch (kind) {
            case STRING:
                return string.equals(other.string);
            case NUMBER:
                return Double.compare(number, other.number) == 0;
            case BOOLEAN:
                return bool == other.bool;
            case FUNCTION:
                return function == other.function;
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        switch (kind) {
            case STRING:
                return string.hashCode();
            case NUMBER:
                return Double.hashCode(number);
            case BOOLEAN:
                return bool ? 1231 : 1237;
            case FUNCTION:
                return System.identityHashCode(function);
            default:
                return 0;
        }
    }

}
