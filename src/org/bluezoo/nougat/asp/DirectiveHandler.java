/*
 * DirectiveHandler.java
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

import java.text.MessageFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.nougat.vbscript.ExecutionContext;
import org.bluezoo.nougat.vbscript.VBScriptException;

/**
 * Processes page directives such as
 * {@code <%@ Language="VBScript" CodePage=65001 %>}.
 *
 * <p>Attribute names are case-insensitive and values may be quoted with
 * either quote character or left unquoted. Only the {@code Language}
 * attribute affects rendering: any language other than VBScript fails.
 * Other attributes are accepted and ignored.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DirectiveHandler extends SegmentHandler {

    private static final Logger LOGGER = Logger.getLogger(DirectiveHandler.class.getName());

    static final String LANGUAGE = "language";
    static final String VBSCRIPT = "VBScript";

    @Override
    protected boolean canHandle(AspSegment segment) {
        return segment.getType() == AspSegment.Type.DIRECTIVE;
    }

    @Override
    protected void process(AspSegment segment, ExecutionContext context) throws AspException {
        Map<String, String> attributes = parseAttributes(segment.getContent());
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            String name = entry.getKey();
            String value = entry.getValue();
            if (LANGUAGE.equals(name)) {
                if (!VBSCRIPT.equalsIgnoreCase(value)) {
                    String message = MessageFormat.format(L10N.getString("err.language"), value);
                    throw new AspException(
                        VBScriptException.ErrorType.NOT_IMPLEMENTED_ERROR.getCode(), message);
                }
            } else if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Ignoring page directive attribute " + name + "=" + value);
            }
        }
    }

    /**
     * Parses directive attributes. Names are folded to lower case.
     *
     * @param attributeString the directive content
     * @return the attributes in document order
     * @throws AspException if the attribute syntax is invalid
     */
    static Map<String, String> parseAttributes(String attributeString) throws AspException {
        Map<String, String> attributes = new LinkedHashMap<String, String>();
        int length = attributeString.length();
        int pos = 0;
        while (pos < length) {
            pos = skipWhitespace(attributeString, pos);
            if (pos >= length) {
                break;
            }
            int nameStart = pos;
            while (pos < length && (Character.isLetterOrDigit(attributeString.charAt(pos))
                                    || attributeString.charAt(pos) == '_')) {
                pos++;
            }
            if (pos == nameStart) {
                throw syntaxError(attributeString);
            }
            String name = attributeString.substring(nameStart, pos).toLowerCase(Locale.ROOT);
            pos = skipWhitespace(attributeString, pos);
            if (pos >= length || attributeString.charAt(pos) != '=') {
                throw syntaxError(attributeString);
            }
            pos = skipWhitespace(attributeString, pos + 1);
            if (pos >= length) {
                throw syntaxError(attributeString);
            }
            String value;
            char quote = attributeString.charAt(pos);
            if (quote == '"' || quote == '\'') {
                int valueStart = ++pos;
                while (pos < length && attributeString.charAt(pos) != quote) {
                    pos++;
                }
                if (pos >= length) {
                    throw syntaxError(attributeString);
                }
                value = attributeString.substring(valueStart, pos);
                pos++; // closing quote
            } else {
                int valueStart = pos;
                while (pos < length && !Character.isWhitespace(attributeString.charAt(pos))) {
                    pos++;
                }
                value = attributeString.substring(valueStart, pos);
            }
            attributes.put(name, value);
        }
        return attributes;
    }

    private static int skipWhitespace(String s, int pos) {
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static AspException syntaxError(String attributeString) {
        String message = MessageFormat.format(L10N.getString("err.directive"), attributeString);
        return new AspException(VBScriptException.ErrorType.SYNTAX_ERROR.getCode(), message);
    }

}
