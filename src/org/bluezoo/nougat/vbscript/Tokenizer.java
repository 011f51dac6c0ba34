/*
 * Tokenizer.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Single-pass scanner turning VBScript source into positioned tokens.
 *
 * <p>This is best-effort lexing, not validation: it never fails.
 * Unrecognised characters are skipped, an unterminated string literal
 * runs to the end of input, and the result always ends with a single
 * {@link TokenType#EOF} token. Comments are kept as
 * {@link TokenType#COMMENT} tokens so that comment-only lines can be
 * recognised downstream. A line continuation (an underscore followed by
 * optional blanks and a line break) produces no token at all.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Tokenizer {

    private static final Map<String, TokenType> KEYWORDS;
    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();
        map.put("CLASS", TokenType.CLASS);
        map.put("FUNCTION", TokenType.FUNCTION);
        map.put("SUB", TokenType.SUB);
        map.put("CALL", TokenType.CALL);
        map.put("DIM", TokenType.DIM);
        map.put("IF", TokenType.IF);
        map.put("THEN", TokenType.THEN);
        map.put("ELSE", TokenType.ELSE);
        map.put("ELSEIF", TokenType.ELSEIF);
        map.put("END", TokenType.END);
        map.put("FOR", TokenType.FOR);
        map.put("TO", TokenType.TO);
        map.put("STEP", TokenType.STEP);
        map.put("NEXT", TokenType.NEXT);
        map.put("DO", TokenType.DO);
        map.put("LOOP", TokenType.LOOP);
        map.put("WHILE", TokenType.WHILE);
        map.put("WEND", TokenType.WEND);
        map.put("SELECT", TokenType.SELECT);
        map.put("CASE", TokenType.CASE);
        map.put("WITH", TokenType.WITH);
        map.put("SET", TokenType.SET);
        map.put("LET", TokenType.LET);
        map.put("NEW", TokenType.NEW);
        map.put("TRUE", TokenType.TRUE);
        map.put("FALSE", TokenType.FALSE);
        map.put("NOTHING", TokenType.NOTHING);
        map.put("NULL", TokenType.NULL);
        map.put("EMPTY", TokenType.EMPTY);
        map.put("OPTION", TokenType.OPTION);
        map.put("EXPLICIT", TokenType.EXPLICIT);
        map.put("PRIVATE", TokenType.PRIVATE);
        map.put("PUBLIC", TokenType.PUBLIC);
        map.put("AND", TokenType.AND);
        map.put("OR", TokenType.OR);
        map.put("NOT", TokenType.NOT);
        map.put("MOD", TokenType.MOD);
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    private final String source;
    private final int length;
    private int pos;
    private int line;
    private int column;

    /**
     * Creates a tokenizer whose first line is line 1.
     *
     * @param source the script source
     */
    public Tokenizer(String source) {
        this(source, 1);
    }

    /**
     * Creates a tokenizer for a fragment of a larger script.
     *
     * @param source the script source
     * @param firstLine the line number of the first character of source
     */
    public Tokenizer(String source, int firstLine) {
        this.source = source != null ? source : "";
        this.length = this.source.length();
        this.line = firstLine;
        this.column = 1;
    }

    /**
     * Convenience method to tokenize a whole script.
     *
     * @param source the script source
     * @return the tokens, terminated by EOF
     */
    public static List<Token> tokenize(String source) {
        return new Tokenizer(source).tokenize();
    }

    /**
     * Scans the source.
     *
     * @return the tokens, terminated by a single EOF token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<Token>();
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == '\n' || c == '\r') {
                tokens.add(newLine());
            } else if (c == ' ' || c == '\t' || Character.isWhitespace(c)) {
                consume();
            } else if (c == '"') {
                tokens.add(string());
            } else if (c == '#') {
                tokens.add(date());
            } else if (isDigit(c) || (c == '&' && isRadixPrefix())) {
                tokens.add(number());
            } else if (c == '\'') {
                consume();
                tokens.add(comment(pos - 1, line, column - 1));
            } else if (c == '_' && isLineContinuation()) {
                consumeLineContinuation();
            } else if (isIdentifierStart(c)) {
                tokens.add(identifier());
            } else {
                Token operator = operator();
                if (operator != null) {
                    tokens.add(operator);
                }
            }
        }
        tokens.add(new Token(TokenType.EOF, "", line, column, length, length));
        return tokens;
    }

    private char consume() {
        char c = source.charAt(pos++);
        if (c == '\n' || (c == '\r' && peek() != '\n')) {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return pos < length ? source.charAt(pos) : '\0';
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < length ? source.charAt(i) : '\0';
    }

    private Token newLine() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        while (pos < length && (peek() == '\n' || peek() == '\r')) {
            consume();
        }
        return new Token(TokenType.NEW_LINE, source.substring(start, pos),
                         startLine, startColumn, start, pos);
    }

    private Token string() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        StringBuilder value = new StringBuilder();
        consume(); // opening quote
        boolean closed = false;
        while (pos < length) {
            char c = consume();
            if (c == '"') {
                if (peek() == '"') {
                    consume();
                    value.append('"');
                } else {
                    closed = true;
                    break;
                }
            } else {
                value.append(c);
            }
        }
        return new Token(TokenType.STRING_LITERAL, value.toString(),
                         startLine, startColumn, start, pos, !closed);
    }

    private Token date() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        consume(); // opening #
        int valueStart = pos;
        while (pos < length && peek() != '#' && peek() != '\n' && peek() != '\r') {
            consume();
        }
        String value = source.substring(valueStart, pos);
        if (peek() == '#') {
            consume();
        }
        return new Token(TokenType.DATE_LITERAL, value, startLine, startColumn, start, pos);
    }

    private Token number() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        TokenType type = TokenType.INTEGER_LITERAL;
        if (peek() == '&') {
            consume();
            if (peek() == 'H' || peek() == 'h') {
                consume();
                type = TokenType.HEX_LITERAL;
                while (isHexDigit(peek())) {
                    consume();
                }
            } else {
                if (peek() == 'O' || peek() == 'o') {
                    consume();
                }
                type = TokenType.OCT_LITERAL;
                while (isOctalDigit(peek())) {
                    consume();
                }
            }
        } else {
            while (isDigit(peek())) {
                consume();
            }
            if (peek() == '.' && isDigit(peek(1))) {
                type = TokenType.FLOAT_LITERAL;
                consume();
                while (isDigit(peek())) {
                    consume();
                }
            }
            char e = peek();
            if ((e == 'E' || e == 'e')
                    && (isDigit(peek(1))
                        || ((peek(1) == '+' || peek(1) == '-') && isDigit(peek(2))))) {
                type = TokenType.FLOAT_LITERAL;
                consume();
                if (peek() == '+' || peek() == '-') {
                    consume();
                }
                while (isDigit(peek())) {
                    consume();
                }
            }
        }
        return new Token(type, source.substring(start, pos), startLine, startColumn, start, pos);
    }

    private Token comment(int start, int startLine, int startColumn) {
        int valueStart = pos;
        while (pos < length && peek() != '\n' && peek() != '\r') {
            consume();
        }
        return new Token(TokenType.COMMENT, source.substring(valueStart, pos),
                         startLine, startColumn, start, pos);
    }

    private Token identifier() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        consume();
        while (pos < length && isIdentifierPart(peek())) {
            consume();
        }
        String value = source.substring(start, pos);
        String upper = value.toUpperCase(Locale.ROOT);
        if ("REM".equals(upper)) {
            while (pos < length && (peek() == ' ' || peek() == '\t')) {
                consume();
            }
            return comment(start, startLine, startColumn);
        }
        TokenType type = KEYWORDS.get(upper);
        return new Token(type != null ? type : TokenType.IDENTIFIER, value,
                         startLine, startColumn, start, pos);
    }

    /**
     * Scans an operator or punctuation character, combining the
     * two-character comparisons. Returns null for a character that is
     * skipped.
     */
    private Token operator() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        char c = consume();
        TokenType type;
        switch (c) {
            case '+':
                type = TokenType.PLUS;
                break;
            case '-':
                type = TokenType.MINUS;
                break;
            case '*':
                type = TokenType.MULTIPLY;
                break;
            case '/':
                type = TokenType.DIVIDE;
                break;
            case '\\':
                type = TokenType.INT_DIVIDE;
                break;
            case '^':
                type = TokenType.POWER;
                break;
            case '&':
                type = TokenType.CONCAT;
                break;
            case '.':
                type = TokenType.DOT;
                break;
            case ',':
                type = TokenType.COMMA;
                break;
            case ':':
                type = TokenType.COLON;
                break;
            case '(':
                type = TokenType.LEFT_PAREN;
                break;
            case ')':
                type = TokenType.RIGHT_PAREN;
                break;
            case '=':
                if (peek() == '=') {
                    consume();
                    type = TokenType.EQUAL;
                } else {
                    type = TokenType.ASSIGN;
                }
                break;
            case '!':
                if (peek() != '=') {
                    return null;
                }
                consume();
                type = TokenType.NOT_EQUAL;
                break;
            case '>':
                if (peek() == '=') {
                    consume();
                    type = TokenType.GREATER_EQUAL;
                } else {
                    type = TokenType.GREATER_THAN;
                }
                break;
            case '<':
                if (peek() == '=') {
                    consume();
                    type = TokenType.LESS_EQUAL;
                } else if (peek() == '>') {
                    consume();
                    type = TokenType.NOT_EQUAL;
                } else {
                    type = TokenType.LESS_THAN;
                }
                break;
            default:
                return null;
        }
        return new Token(type, source.substring(start, pos), startLine, startColumn, start, pos);
    }

    private boolean isLineContinuation() {
        int i = pos + 1;
        while (i < length) {
            char c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                return true;
            }
            if (c != ' ' && c != '\t') {
                return false;
            }
            i++;
        }
        return false;
    }

    private void consumeLineContinuation() {
        consume(); // '_'
        while (peek() == ' ' || peek() == '\t') {
            consume();
        }
        if (peek() == '\r') {
            consume();
        }
        if (peek() == '\n') {
            consume();
        }
    }

    private boolean isRadixPrefix() {
        char next = peek(1);
        if (next == 'H' || next == 'h') {
            return isHexDigit(peek(2));
        }
        if (next == 'O' || next == 'o') {
            return isOctalDigit(peek(2));
        }
        return isOctalDigit(next);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'A' && c <= 'F') || (c >= 'a' && c <= 'f');
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '[';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == ']';
    }

}
