/*
 * CodeHandler.java
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

import org.bluezoo.nougat.vbscript.ExecutionContext;
import org.bluezoo.nougat.vbscript.VBScriptException;
import org.bluezoo.nougat.vbscript.VBScriptInterpreter;

/**
 * Runs script code through the interpreter. An output expression
 * {@code <%= expr %>} runs as {@code Response.Write expr}.
 *
 * <p>Interpreter failures are reported with their own error code; the
 * message names the document line of the failing statement.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CodeHandler extends SegmentHandler {

    private final VBScriptInterpreter interpreter;

    public CodeHandler(VBScriptInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    @Override
    protected boolean canHandle(AspSegment segment) {
        return segment.getType() == AspSegment.Type.CODE
            || segment.getType() == AspSegment.Type.EXPRESSION;
    }

    @Override
    protected void process(AspSegment segment, ExecutionContext context) throws AspException {
        String code = segment.getContent();
        if (segment.getType() == AspSegment.Type.EXPRESSION) {
            code = "Response.Write " + code;
        }
        try {
            interpreter.execute(code, context);
        } catch (VBScriptException e) {
            int line = segment.getLineNumber();
            if (e.getLineNumber() > 0) {
                line += e.getLineNumber() - 1;
            }
            String message = MessageFormat.format(L10N.getString("err.script"),
                                                  String.valueOf(line), e.getMessage());
            throw new AspException(e.getCode(), message, e);
        }
    }

}
