/*
 * TokenType.java
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

/**
 * Lexical categories produced by the {@link Tokenizer}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum TokenType {

    // Keywords
    CLASS,
    FUNCTION,
    SUB,
    CALL,
    DIM,
    IF,
    THEN,
    ELSE,
    ELSEIF,
    END,
    FOR,
    TO,
    STEP,
    NEXT,
    DO,
    LOOP,
    WHILE,
    WEND,
    SELECT,
    CASE,
    WITH,
    SET,
    LET,
    NEW,
    TRUE,
    FALSE,
    NOTHING,
    NULL,
    EMPTY,
    OPTION,
    EXPLICIT,
    PRIVATE,
    PUBLIC,
    AND,
    OR,
    NOT,
    MOD,

    // Operators and punctuation
    PLUS,
    MINUS,
    MULTIPLY,
    DIVIDE,
    INT_DIVIDE,
    POWER,
    CONCAT,
    ASSIGN,
    EQUAL,
    NOT_EQUAL,
    DOT,
    COMMA,
    COLON,
    LEFT_PAREN,
    RIGHT_PAREN,
    GREATER_THAN,
    LESS_THAN,
    GREATER_EQUAL,
    LESS_EQUAL,

    // Literals
    IDENTIFIER,
    STRING_LITERAL,
    INTEGER_LITERAL,
    FLOAT_LITERAL,
    DATE_LITERAL,
    HEX_LITERAL,
    OCT_LITERAL,

    // Structure
    NEW_LINE,
    COMMENT,
    WHITESPACE,
    EOF;

    /**
     * Indicates whether this is one of the numeric literal kinds.
     *
     * @return true for integer, float, hex and octal literals
     */
    public boolean isNumber() {
        return this == INTEGER_LITERAL || this == FLOAT_LITERAL
            || this == HEX_LITERAL || this == OCT_LITERAL;
    }

    /**
     * Indicates whether this token carries no statement content.
     *
     * @return true for newlines, comments, whitespace and end of input
     */
    public boolean isStructural() {
        return this == NEW_LINE || this == COMMENT || this == WHITESPACE || this == EOF;
    }

}
