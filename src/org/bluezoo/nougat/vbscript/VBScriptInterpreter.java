/*
 * VBScriptInterpreter.java
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

import org.bluezoo.nougat.vbscript.syntax.Statement;

/**
 * Entry point for running VBScript source.
 *
 * <p>The interpreter holds no state: all bindings and output live in the
 * {@link ExecutionContext} supplied with each call, so one instance may
 * serve concurrent rendering passes that each own their context.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class VBScriptInterpreter {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    /**
     * Parses and executes script source. Each statement is executed before
     * the next is parsed, so the effects of statements preceding a
     * malformed one remain.
     *
     * @param source the script source
     * @param context the execution context
     * @throws VBScriptException if parsing or execution fails
     */
    public void execute(String source, ExecutionContext context) throws VBScriptException {
        StatementParser parser = new StatementParser(source);
        StatementExecutor executor = new StatementExecutor(context, evaluator);
        while (parser.hasNext()) {
            executor.execute(parser.next());
        }
    }

    /**
     * Parses script source without executing it.
     *
     * @param source the script source
     * @return the statements
     * @throws VBScriptException if the source does not parse
     */
    public List<Statement> parse(String source) throws VBScriptException {
        return StatementParser.parseAll(source);
    }

}
