/*
 * Token.java
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
 * A positioned lexical token.
 *
 * <p>The value of a string literal is its content with the delimiting
 * quotes removed and doubled quotes collapsed; every other token's value
 * is the lexeme as written. The source offsets cover the raw lexeme,
 * delimiters included, so that a run of tokens can be mapped back to the
 * text it came from.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Token {

    private final TokenType type;
    private final String value;
    private final int line;
    private final int column;
    private final int offset;
    private final int end;
    private final boolean unterminated;

    public Token(TokenType type, String value, int line, int column, int offset, int end) {
        this(type, value, line, column, offset, end, false);
    }

    Token(TokenType type, String value, int line, int column, int offset, int end,
          boolean unterminated) {
        this.type = type;
        this.value = value != null ? value : "";
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.end = end;
        this.unterminated = unterminated;
    }

    public TokenType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    /**
     * Gets the line on which this token starts.
     *
     * @return the line number (1-based)
     */
    public int getLine() {
        return line;
    }

    /**
     * Gets the column at which this token starts.
     *
     * @return the column number (1-based)
     */
    public int getColumn() {
        return column;
    }

    /**
     * Gets the source offset of the first character of the lexeme.
     *
     * @return the start offset
     */
    public int getOffset() {
        return offset;
    }

    /**
     * Gets the source offset just past the last character of the lexeme.
     *
     * @return the end offset (exclusive)
     */
    public int getEnd() {
        return end;
    }

    /**
     * Indicates a string literal whose closing quote was never found.
     *
     * @return true if this string literal ran to the end of input
     */
    public boolean isUnterminated() {
        return unterminated;
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    /**
     * Case-insensitive comparison of an identifier with a word.
     *
     * @param word the word to test
     * @return true if this is an identifier spelled as word
     */
    public boolean isWord(String word) {
        return type == TokenType.IDENTIFIER && value.equalsIgnoreCase(word);
    }

    @Override
    public String toString() {
        return type + "('" + value + "')@" + line + ":" + column;
    }

}
