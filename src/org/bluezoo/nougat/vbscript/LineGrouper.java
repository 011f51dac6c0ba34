/*
 * LineGrouper.java
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
import java.util.List;

/**
 * Regroups a token stream into logical lines.
 *
 * <p>A newline token closes the current line; continuation underscores
 * never reach the grouper, as the tokenizer consumes them with the line
 * break they precede. A colon closes the current line unless an odd
 * number of string literal tokens precede it on that line, in which case
 * it is kept as an ordinary token. Comment tokens stay on their line.
 * Lines left empty are dropped.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LineGrouper {

    private LineGrouper() {
    }

    /**
     * Groups the tokens of the given source into logical lines.
     *
     * @param source the text the tokens were scanned from
     * @param tokens the tokens
     * @return the non-empty logical lines in source order
     */
    public static List<LogicalLine> group(String source, List<Token> tokens) {
        List<LogicalLine> lines = new ArrayList<LogicalLine>();
        List<Token> current = new ArrayList<Token>();
        int strings = 0; // string literals on the current line
        for (Token token : tokens) {
            switch (token.getType()) {
                case NEW_LINE:
                case EOF:
                    close(source, current, lines);
                    strings = 0;
                    break;
                case COLON:
                    if (strings % 2 == 1) {
                        current.add(token);
                    } else {
                        close(source, current, lines);
                        strings = 0;
                    }
                    break;
                case STRING_LITERAL:
                    strings++;
                    current.add(token);
                    break;
                case WHITESPACE:
                    break;
                default:
                    current.add(token);
            }
        }
        close(source, current, lines);
        return lines;
    }

    private static void close(String source, List<Token> current, List<LogicalLine> lines) {
        if (!current.isEmpty()) {
            lines.add(new LogicalLine(source, current));
            current.clear();
        }
    }

}
