/*
 * StatementVisitor.java
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

package org.bluezoo.nougat.vbscript.syntax;

import org.bluezoo.nougat.vbscript.VBScriptException;

/**
 * Visitor over the statement kinds.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface StatementVisitor {

    /**
     * Visits a {@code Response.Write} statement.
     *
     * @param statement the statement
     * @throws VBScriptException if processing fails
     */
    void visitResponseWrite(ResponseWriteStatement statement) throws VBScriptException;

    /**
     * Visits a {@code Dim} declaration.
     *
     * @param statement the statement
     * @throws VBScriptException if processing fails
     */
    void visitDim(DimStatement statement) throws VBScriptException;

    /**
     * Visits an assignment.
     *
     * @param statement the statement
     * @throws VBScriptException if processing fails
     */
    void visitAssignment(AssignmentStatement statement) throws VBScriptException;

    /**
     * Visits an {@code If} statement.
     *
     * @param statement the statement
     * @throws VBScriptException if processing fails
     */
    void visitIf(IfStatement statement) throws VBScriptException;

    /**
     * Visits a {@code For} loop.
     *
     * @param statement the statement
     * @throws VBScriptException if processing fails
     */
    void visitFor(ForStatement statement) throws VBScriptException;

    /**
     * Visits a {@code While} loop.
     *
     * @param statement the statement
     * @throws VBScriptException if processing fails
     */
    void visitWhile(WhileStatement statement) throws VBScriptException;

    /**
     * Visits a {@code Function} or {@code Sub} declaration.
     *
     * @param statement the statement
     * @throws VBScriptException if processing fails
     */
    void visitFunctionDeclaration(FunctionDeclaration statement) throws VBScriptException;

    /**
     * Visits a procedure call.
     *
     * @param statement the statement
     * @throws VBScriptException if processing fails
     */
    void visitCall(CallStatement statement) throws VBScriptException;

    /**
     * Visits a line that no statement form recognised.
     *
     * @param statement the statement
     * @throws VBScriptException if processing fails
     */
    void visitUnrecognized(UnrecognizedStatement statement) throws VBScriptException;

}
