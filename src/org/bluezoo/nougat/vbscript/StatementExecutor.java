/*
 * StatementExecutor.java
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
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.nougat.vbscript.syntax.AssignmentStatement;
import org.bluezoo.nougat.vbscript.syntax.Body;
import org.bluezoo.nougat.vbscript.syntax.CallStatement;
import org.bluezoo.nougat.vbscript.syntax.DimStatement;
import org.bluezoo.nougat.vbscript.syntax.ForStatement;
import org.bluezoo.nougat.vbscript.syntax.FunctionDeclaration;
import org.bluezoo.nougat.vbscript.syntax.IfStatement;
import org.bluezoo.nougat.vbscript.syntax.ResponseWriteStatement;
import org.bluezoo.nougat.vbscript.syntax.Statement;
import org.bluezoo.nougat.vbscript.syntax.StatementVisitor;
import org.bluezoo.nougat.vbscript.syntax.UnrecognizedStatement;
import org.bluezoo.nougat.vbscript.syntax.WhileStatement;

/**
 * Executes statements against one execution context.
 *
 * <p>An executor is created for each rendering pass and is bound to that
 * pass's context. Errors propagate immediately; the failing statement's
 * line is recorded on the exception if no nested statement recorded one
 * first.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StatementExecutor implements StatementVisitor {

    private static final Logger LOGGER = Logger.getLogger(StatementExecutor.class.getName());

    /**
     * Maximum nesting of If, For and While bodies being executed.
     */
    public static final int MAX_BLOCK_DEPTH = 256;

    private final ExecutionContext context;
    private final ExpressionEvaluator evaluator;
    private int blockDepth;

    public StatementExecutor(ExecutionContext context) {
        this(context, new ExpressionEvaluator());
    }

    public StatementExecutor(ExecutionContext context, ExpressionEvaluator evaluator) {
        this.context = context;
        this.evaluator = evaluator;
    }

    public ExecutionContext getContext() {
        return context;
    }

    /**
     * Executes a single statement.
     *
     * @param statement the statement
     * @throws VBScriptException if execution fails
     */
    public void execute(Statement statement) throws VBScriptException {
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Executing " + statement + " at line " + statement.getLineNumber());
        }
        try {
            statement.accept(this);
        } catch (VBScriptException e) {
            e.locate(statement.getLineNumber());
            throw e;
        }
    }

    /**
     * Executes statements in order, stopping at the first failure.
     *
     * @param statements the statements
     * @throws VBScriptException if a statement fails
     */
    public void executeAll(List<Statement> statements) throws VBScriptException {
        for (Statement statement : statements) {
            execute(statement);
        }
    }

    private void executeBody(Body body) throws VBScriptException {
        executeAll(body.getStatements());
    }

    private void executeBlock(Body body) throws VBScriptException {
        if (blockDepth >= MAX_BLOCK_DEPTH) {
            throw VBScriptException.create(VBScriptException.ErrorType.RUNTIME_ERROR,
                                           "exec.block_depth", String.valueOf(MAX_BLOCK_DEPTH));
        }
        blockDepth++;
        try {
            executeBody(body);
        } finally {
            blockDepth--;
        }
    }

    @Override
    public void visitResponseWrite(ResponseWriteStatement statement) throws VBScriptException {
        context.write(evaluator.evaluateOutput(statement.getExpression(), context));
    }

    @Override
    public void visitDim(DimStatement statement) throws VBScriptException {
        for (String name : statement.getNames()) {
            context.declare(name);
        }
    }

    @Override
    public void visitAssignment(AssignmentStatement statement) throws VBScriptException {
        VBValue value = evaluator.evaluate(statement.getExpression(),
                                           ExpressionEvaluator.Mode.ASSIGNMENT, context);
        context.setVariable(statement.getName(), value);
    }

    @Override
    public void visitIf(IfStatement statement) throws VBScriptException {
        if (evaluator.test(statement.getCondition(), context)) {
            executeBlock(statement.getThenBody());
        } else if (statement.getElseBody() != null) {
            executeBlock(statement.getElseBody());
        }
    }

    @Override
    public void visitFor(ForStatement statement) throws VBScriptException {
        double start = bound(statement.getStart(), "start");
        double end = bound(statement.getEnd(), "end");
        double step = bound(statement.getStep(), "step");
        if (step == 0.0) {
            throw VBScriptException.create(VBScriptException.ErrorType.RUNTIME_ERROR,
                                           "exec.for_step_zero", statement.getCounter());
        }
        String counter = statement.getCounter();
        double value = start;
        while (step > 0.0 ? value <= end : value >= end) {
            checkInterrupted();
            context.setVariable(counter, VBValue.number(value));
            executeBlock(statement.getBody());
            value += step;
        }
        context.setVariable(counter, VBValue.number(value));
    }

    private double bound(String text, String which) throws VBScriptException {
        VBValue value = evaluator.evaluate(text, ExpressionEvaluator.Mode.ARGUMENT, context);
        if (!value.isNumber()) {
            throw VBScriptException.create(VBScriptException.ErrorType.TYPE_ERROR,
                                           "exec.for_bound", which, text);
        }
        return value.asNumber();
    }

    @Override
    public void visitWhile(WhileStatement statement) throws VBScriptException {
        while (evaluator.test(statement.getCondition(), context)) {
            checkInterrupted();
            executeBlock(statement.getBody());
        }
    }

    @Override
    public void visitFunctionDeclaration(FunctionDeclaration statement) throws VBScriptException {
        context.setFunction(statement.getName(), VBValue.function(statement));
    }

    @Override
    public void visitCall(CallStatement statement) throws VBScriptException {
        String name = statement.getName();
        VBValue target = context.getVariable(name);
        if (target == null || !target.isFunction()) {
            throw VBScriptException.create(VBScriptException.ErrorType.RUNTIME_ERROR,
                                           "exec.unknown_function", name);
        }
        FunctionDeclaration function = target.asFunction();
        List<String> parameters = function.getParameters();
        List<String> arguments = statement.getArguments();
        if (parameters.size() != arguments.size()) {
            throw VBScriptException.create(VBScriptException.ErrorType.SYNTAX_ERROR,
                                           "exec.argument_count", function.getName(),
                                           String.valueOf(parameters.size()),
                                           String.valueOf(arguments.size()));
        }
        if (context.getCallDepth() >= ExecutionContext.MAX_CALL_DEPTH) {
            throw VBScriptException.create(VBScriptException.ErrorType.RUNTIME_ERROR,
                                           "exec.call_depth", function.getName(),
                                           String.valueOf(ExecutionContext.MAX_CALL_DEPTH));
        }
        // arguments are evaluated in the caller's scope
        List<VBValue> values = new ArrayList<VBValue>(arguments.size());
        for (String argument : arguments) {
            values.add(evaluator.evaluate(argument, ExpressionEvaluator.Mode.ARGUMENT, context));
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Calling " + function.getName() + values);
        }
        context.pushFrame(function.getName());
        try {
            for (int i = 0; i < parameters.size(); i++) {
                context.declare(parameters.get(i));
                context.setVariable(parameters.get(i), values.get(i));
            }
            executeBody(function.getBody());
        } finally {
            context.popFrame();
        }
    }

    @Override
    public void visitUnrecognized(UnrecognizedStatement statement) throws VBScriptException {
        throw VBScriptException.create(VBScriptException.ErrorType.NOT_IMPLEMENTED_ERROR,
                                       "exec.not_implemented", statement.getText());
    }

    private void checkInterrupted() throws VBScriptException {
        if (Thread.currentThread().isInterrupted()) {
            throw VBScriptException.create(VBScriptException.ErrorType.RUNTIME_ERROR,
                                           "exec.interrupted");
        }
    }

}
