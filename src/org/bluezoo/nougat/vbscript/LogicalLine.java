/*
 * LogicalLine.java
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
import java.util.List;

/**
 * One statement's worth of tokens.
 *
 * <p>A logical line never contains newline, whitespace or EOF tokens.
 * It may end with a {@link TokenType#COMMENT} token; the
 * {@link #getTokens() significant tokens} exclude it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class LogicalLine {

    private final String source;
    private final List<Token> allTokens;
    private final List<Token> tokens;

    LogicalLine(String source, List<Token> allTokens) {
        this.source = source;
        this.allTokens = Collections.unmodifiableList(new ArrayList<Token>(allTokens));
        List<Token> significant = new ArrayList<Token>(allTokens.size());
        for (Token token : allTokens) {
            if (token.getType() != TokenType.COMMENT) {
                significant.add(token);
            }
        }
        this.tokens = Collections.unmodifiableList(significant);
    }

    /**
     * Gets the statement tokens, comments excluded.
     *
     * @return the significant tokens in order
     */
    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Gets every token on the line, comments included.
     *
     * @return all tokens in order
     */
    public List<Token> getAllTokens() {
        return allTokens;
    }

    public boolean isCommentOnly() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * Gets the type of the significant token at the given index, or EOF
     * past the end of the line.
     */
    public TokenType typeAt(int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index).getType() : TokenType.EOF;
    }

    public int getLineNumber() {
        return allTokens.get(0).getLine();
    }

    /**
     * Gets the line on which the last token of this line starts.
     */
    public int getLastLineNumber() {
        return allTokens.get(allTokens.size() - 1).getLine();
    }

    /**
     * Source offset of the first token, comments included.
     */
    public int getStart() {
        return allTokens.get(0).getOffset();
    }

    /**
     * Source offset past the last token, comments included.
     */
    public int getEnd() {
        return allTokens.get(allTokens.size() - 1).getEnd();
    }

    /**
     * Gets the source text spanned by the significant tokens from
     * {@code from} (inclusive) to {@code to} (exclusive).
     *
     * @param from index of the first token
     * @param to index past the last token
     * @return the raw source text, or the empty string for an empty range
     */
    public String getText(int from, int to) {
        if (from >= to || from >= tokens.size()) {
            return "";
        }
        int end = Math.min(to, tokens.size()) - 1;
        return source.substring(tokens.get(from).getOffset(), tokens.get(end).getEnd());
    }

    /**
     * Gets the source text of the statement, comments excluded.
     */
    public String getText() {
        return getText(0, tokens.size());
    }

    @Override
    public String toString() {
        return "LogicalLine{" + getLineNumber() + ": " + getText() + "}";
    }

}
