/*
 * BlockExtractor.java
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

import java.util.List;

import org.bluezoo.nougat.vbscript.syntax.Body;

/**
 * Locates the body of a block statement across logical lines.
 *
 * <p>Starting at the line that opens the block, every further opening
 * line increments a depth counter and every closing line decrements it;
 * the block ends where the depth returns to zero. The body is the source
 * text strictly between the opening and the closing line. A block that is
 * still open at the end of input is a {@code BLOCK_MISMATCH_ERROR}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class BlockExtractor {

    /**
     * Predicate over logical lines.
     */
    interface LineMatcher {
        boolean matches(LogicalLine line);
    }

    /**
     * The result of an extraction.
     */
    static final class Block {

        final Body body;
        final Body elseBody;
        final int closerIndex;

        Block(Body body, Body elseBody, int closerIndex) {
            this.body = body;
            this.elseBody = elseBody;
            this.closerIndex = closerIndex;
        }

    }

    private final String source;
    private final List<LogicalLine> lines;

    BlockExtractor(String source, List<LogicalLine> lines) {
        this.source = source;
        this.lines = lines;
    }

    /**
     * Extracts a block without a divider.
     */
    Block extract(int openerIndex, LineMatcher opener, LineMatcher closer,
                  String openKeyword, String closeKeyword) throws VBScriptException {
        return extract(openerIndex, opener, closer, null, openKeyword, closeKeyword);
    }

    /**
     * Extracts a block, optionally split in two by the first divider line
     * found at the block's own depth.
     *
     * @param openerIndex index of the opening line
     * @param opener matches lines that open a nested block of this kind
     * @param closer matches lines that close a block of this kind
     * @param divider matches the dividing line, or null
     * @param openKeyword the opening keyword, for diagnostics
     * @param closeKeyword the closing keyword, for diagnostics
     * @return the extracted block
     * @throws VBScriptException if the block is never closed
     */
    Block extract(int openerIndex, LineMatcher opener, LineMatcher closer, LineMatcher divider,
                  String openKeyword, String closeKeyword) throws VBScriptException {
        LogicalLine first = lines.get(openerIndex);
        int depth = 0;
        int dividerIndex = -1;
        for (int i = openerIndex; i < lines.size(); i++) {
            LogicalLine line = lines.get(i);
            if (line.isCommentOnly()) {
                continue;
            }
            if (opener.matches(line)) {
                depth++;
            } else if (closer.matches(line)) {
                depth--;
                if (depth == 0) {
                    return toBlock(first, dividerIndex, i);
                }
            } else if (divider != null && depth == 1 && dividerIndex < 0
                       && divider.matches(line)) {
                dividerIndex = i;
            }
        }
        VBScriptException e = VBScriptException.create(
            VBScriptException.ErrorType.BLOCK_MISMATCH_ERROR, "parse.block_mismatch",
            openKeyword, closeKeyword, String.valueOf(first.getLineNumber()));
        e.locate(first.getLineNumber());
        throw e;
    }

    private Block toBlock(LogicalLine first, int dividerIndex, int closerIndex) {
        LogicalLine last = lines.get(closerIndex);
        int bodyStart = first.getEnd();
        int bodyLine = first.getLastLineNumber();
        if (dividerIndex < 0) {
            Body body = new Body(source.substring(bodyStart, last.getStart()), bodyLine);
            return new Block(body, null, closerIndex);
        }
        LogicalLine divider = lines.get(dividerIndex);
        Body body = new Body(source.substring(bodyStart, divider.getStart()), bodyLine);
        // the divider keyword itself is the first token of its line
        Token keyword = divider.get(0);
        Body elseBody = new Body(source.substring(keyword.getEnd(), last.getStart()),
                                 keyword.getLine());
        return new Block(body, elseBody, closerIndex);
    }

}
