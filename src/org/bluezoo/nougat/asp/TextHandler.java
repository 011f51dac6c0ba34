/*
 * TextHandler.java
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

import org.bluezoo.nougat.vbscript.ExecutionContext;

/**
 * Copies literal text to the output.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TextHandler extends SegmentHandler {

    @Override
    protected boolean canHandle(AspSegment segment) {
        return segment.getType() == AspSegment.Type.TEXT;
    }

    @Override
    protected void process(AspSegment segment, ExecutionContext context) {
        context.write(segment.getContent());
    }

}
