/*
 * SegmentHandler.java
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
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.nougat.vbscript.ExecutionContext;

/**
 * A link in the chain of handlers that segments are dispatched through.
 *
 * <p>Each handler either claims a segment and processes it or passes it
 * to the next handler. A segment that reaches the end of the chain
 * unclaimed is an error. Chains are built with {@link #setNext}, which
 * returns its argument so that calls can be strung together:
 * <pre>
 * SegmentHandler chain = new TextHandler();
 * chain.setNext(new DirectiveHandler()).setNext(new CodeHandler(interpreter));
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class SegmentHandler {

    private static final Logger LOGGER = Logger.getLogger(SegmentHandler.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.nougat.asp.L10N");

    private SegmentHandler next;

    /**
     * Sets the handler that receives segments this one does not claim.
     *
     * @param next the next handler
     * @return the next handler
     */
    public SegmentHandler setNext(SegmentHandler next) {
        this.next = next;
        return next;
    }

    public SegmentHandler getNext() {
        return next;
    }

    /**
     * Dispatches a segment to the first handler in the chain that claims
     * it.
     *
     * @param segment the segment
     * @param context the execution context of the rendering pass
     * @throws AspException if the claiming handler fails, or no handler
     * claims the segment
     */
    public final void handle(AspSegment segment, ExecutionContext context) throws AspException {
        if (canHandle(segment)) {
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest(getClass().getSimpleName() + " handling " + segment.getType()
                              + " at line " + segment.getLineNumber());
            }
            process(segment, context);
        } else if (next != null) {
            next.handle(segment, context);
        } else {
            String message = MessageFormat.format(L10N.getString("err.no_handler"),
                                                  segment.getType(),
                                                  String.valueOf(segment.getLineNumber()));
            throw new AspException(AspException.INTERNAL_ERROR, message);
        }
    }

    /**
     * Indicates whether this handler claims the segment.
     *
     * @param segment the segment
     * @return true to process the segment here
     */
    protected abstract boolean canHandle(AspSegment segment);

    /**
     * Processes a claimed segment.
     *
     * @param segment the segment
     * @param context the execution context of the rendering pass
     * @throws AspException if processing fails
     */
    protected abstract void process(AspSegment segment, ExecutionContext context)
        throws AspException;

}
