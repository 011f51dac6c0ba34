/*
 * AspRenderer.java
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.nougat.vbscript.ExecutionContext;
import org.bluezoo.nougat.vbscript.VBScriptInterpreter;

/**
 * Renders ASP pages.
 *
 * <p>Segments are dispatched in document order through a chain of text,
 * directive and code handlers, all sharing one execution context. A
 * segment that fails does not stop rendering: the output it wrote before
 * failing is kept, an HTML comment describing the failure is appended
 * (unless disabled with {@link #setErrorComments}), and rendering
 * continues with the next segment.
 *
 * <p>A renderer holds no per-page state and may be shared between
 * threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AspRenderer {

    private static final Logger LOGGER = Logger.getLogger(AspRenderer.class.getName());
    private static final ResourceBundle L10N =
        ResourceBundle.getBundle("org.bluezoo.nougat.asp.L10N");

    private final AspParser parser = new AspParser();
    private final SegmentHandler chain;
    private volatile boolean errorComments = true;

    public AspRenderer() {
        this(new VBScriptInterpreter());
    }

    public AspRenderer(VBScriptInterpreter interpreter) {
        chain = new TextHandler();
        chain.setNext(new DirectiveHandler()).setNext(new CodeHandler(interpreter));
    }

    /**
     * Sets whether segment failures are written to the output as HTML
     * comments. They are always logged.
     *
     * @param errorComments false to omit the comments
     */
    public void setErrorComments(boolean errorComments) {
        this.errorComments = errorComments;
    }

    public boolean isErrorComments() {
        return errorComments;
    }

    public AspParser getParser() {
        return parser;
    }

    /**
     * Renders a document held in memory with a fresh execution context.
     *
     * @param document the page source
     * @return the rendered output
     */
    public String render(String document) {
        ExecutionContext context = new ExecutionContext();
        render(parser.parse(document, null), context);
        return context.getOutput();
    }

    /**
     * Renders a parsed page into the given context.
     *
     * @param page the page
     * @param context the execution context receiving the output
     * @return the segment failures, in document order
     */
    public List<AspException> render(AspPage page, ExecutionContext context) {
        List<AspException> errors = new ArrayList<AspException>();
        for (AspSegment segment : page.getSegments()) {
            try {
                chain.handle(segment, context);
            } catch (AspException e) {
                errors.add(e);
                if (LOGGER.isLoggable(Level.WARNING)) {
                    String where = page.getUri() != null ? page.getUri() : "document";
                    LOGGER.warning(where + ": " + e);
                }
                if (errorComments) {
                    context.write(errorComment(e));
                }
            }
        }
        if (!errors.isEmpty() && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("render.errors"),
                                             String.valueOf(errors.size()),
                                             String.valueOf(page.getSegments().size())));
        }
        return Collections.unmodifiableList(errors);
    }

    /**
     * Formats a failure as an HTML comment. A {@code --} inside the
     * message would end the comment early, so it is broken up.
     */
    static String errorComment(AspException e) {
        String text = e.toString();
        while (text.contains("--")) {
            text = text.replace("--", "- -");
        }
        return "<!-- Error: " + text + " -->";
    }

}
