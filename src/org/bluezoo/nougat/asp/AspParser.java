/*
 * AspParser.java
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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Splits an ASP document into segments.
 *
 * <p>Script regions are delimited by {@code <%} and the first following
 * {@code %>}; they may span lines but do not nest. A region starting
 * {@code <%=} is an output expression and one starting {@code <%@} is a
 * directive. For example:
 * <pre>
 * &lt;%@ Language="VBScript" %&gt;
 * &lt;html&gt;
 * &lt;body&gt;
 *   &lt;% Dim name : name = "World" %&gt;
 *   &lt;h1&gt;Hello &lt;%= name %&gt;&lt;/h1&gt;
 * &lt;/body&gt;
 * &lt;/html&gt;
 * </pre>
 *
 * <p>Text outside script regions becomes text segments, except that
 * whitespace-only text is dropped. Script regions whose content is only
 * whitespace are dropped too. A {@code <%} that is never closed is kept
 * as literal text, so splitting never fails.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AspParser {

    private static final Logger LOGGER = Logger.getLogger(AspParser.class.getName());

    private static final String SCRIPT_START = "<%";
    private static final String SCRIPT_END = "%>";
    private static final String EXPRESSION_START = "<%=";
    private static final String DIRECTIVE_START = "<%@";

    /**
     * Parses a page from a stream.
     *
     * @param input the page source
     * @param encoding the character encoding, or null for UTF-8
     * @param uri the page URI, for diagnostics
     * @return the parsed page
     * @throws IOException if the stream cannot be read
     */
    public AspPage parse(InputStream input, String encoding, String uri) throws IOException {
        StringBuilder content = new StringBuilder();
        try (Reader reader = new InputStreamReader(input, encoding != null ? encoding : "UTF-8")) {
            char[] buf = new char[4096];
            for (int len = reader.read(buf); len != -1; len = reader.read(buf)) {
                content.append(buf, 0, len);
            }
        }
        return parse(content.toString(), uri);
    }

    /**
     * Parses a page held in memory.
     *
     * @param content the page source
     * @param uri the page URI, or null
     * @return the parsed page
     */
    public AspPage parse(String content, String uri) {
        AspPage page = new AspPage(uri);
        int pos = 0;
        int line = 1;
        int column = 1;
        while (pos < content.length()) {
            int start = content.indexOf(SCRIPT_START, pos);
            int end = start == -1 ? -1 : content.indexOf(SCRIPT_END, start + SCRIPT_START.length());
            if (end == -1) {
                // No more complete script regions: rest is text
                addText(page, content.substring(pos), line, column);
                break;
            }
            if (start > pos) {
                String text = content.substring(pos, start);
                addText(page, text, line, column);
                int[] lineCol = updatePosition(text, line, column);
                line = lineCol[0];
                column = lineCol[1];
            }
            AspSegment.Type type = AspSegment.Type.CODE;
            int contentStart = start + SCRIPT_START.length();
            if (content.startsWith(EXPRESSION_START, start)) {
                type = AspSegment.Type.EXPRESSION;
                contentStart = start + EXPRESSION_START.length();
            } else if (content.startsWith(DIRECTIVE_START, start)) {
                type = AspSegment.Type.DIRECTIVE;
                contentStart = start + DIRECTIVE_START.length();
            }
            if (contentStart > end) {
                // "<%=%>" and the like: the marker overlaps the end delimiter
                contentStart = end;
            }
            String raw = content.substring(contentStart, end);
            String code = raw.trim();
            if (!code.isEmpty()) {
                String leading = content.substring(start, contentStart + raw.indexOf(code));
                int[] codePos = updatePosition(leading, line, column);
                if (type == AspSegment.Type.DIRECTIVE) {
                    page.addSegment(new DirectiveSegment(code, codePos[0], codePos[1]));
                } else {
                    boolean expression = type == AspSegment.Type.EXPRESSION;
                    page.addSegment(new CodeSegment(code, expression, codePos[0], codePos[1]));
                }
            }
            pos = end + SCRIPT_END.length();
            int[] lineCol = updatePosition(content.substring(start, pos), line, column);
            line = lineCol[0];
            column = lineCol[1];
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Parsed " + page);
        }
        return page;
    }

    private void addText(AspPage page, String text, int line, int column) {
        if (!text.trim().isEmpty()) {
            page.addSegment(new TextSegment(text, line, column));
        }
    }

    /**
     * Updates line and column position based on text content.
     */
    private int[] updatePosition(String text, int currentLine, int currentColumn) {
        int line = currentLine;
        int column = currentColumn;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new int[]{line, column};
    }

}
