/*
 * StatementParser.java
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
import java.util.Collections;
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
import org.bluezoo.nougat.vbscript.syntax.UnrecognizedStatement;
import org.bluezoo.nougat.vbscript.syntax.WhileStatement;

/**
 * Turns logical lines into statement nodes.
 *
 * <p>The parser dispatches on the first token of each logical line. Block
 * statements ({@code For}, {@code While}, {@code Function}, {@code Sub}
 * and block {@code If}) take their body from the following lines, up to
 * the matching closing line, and parsing resumes after it. Statements are
 * produced one at a time so that a caller can execute each before the
 * next is parsed.
 *
 * <p>Lines whose leading token matches no statement form become
 * {@link UnrecognizedStatement}s; they only fail when executed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StatementParser {

    private static final Logger LOGGER = Logger.getLogger(StatementParser.class.getName());

    private static final BlockExtractor.LineMatcher FOR_OPENER = new BlockExtractor.LineMatcher() {
        @Override
        public boolean matches(LogicalLine line) {
            return line.typeAt(0) == TokenType.FOR;
        }
    };
    private static final BlockExtractor.LineMatcher FOR_CLOSER = new BlockExtractor.LineMatcher() {
        @Override
        public boolean matches(LogicalLine line) {
            return line.typeAt(0) == TokenType.NEXT;
        }
    };
    private static final BlockExtractor.LineMatcher WHILE_OPENER = new BlockExtractor.LineMatcher() {
        @Override
        public boolean matches(LogicalLine line) {
            return line.typeAt(0) == TokenType.WHILE;
        }
    };
    private static final BlockExtractor.LineMatcher WHILE_CLOSER = new BlockExtractor.LineMatcher() {
        @Override
        public boolean matches(LogicalLine line) {
            return line.typeAt(0) == TokenType.WEND;
        }
    };
    private static final BlockExtractor.LineMatcher IF_OPENER = new BlockExtractor.LineMatcher() {
        @Override
        public boolean matches(LogicalLine line) {
            return line.typeAt(0) == TokenType.IF && line.typeAt(line.size() - 1) == TokenType.THEN;
        }
    };
    private static final BlockExtractor.LineMatcher IF_CLOSER = new EndMatcher(TokenType.IF);
    private static final BlockExtractor.LineMatcher ELSE_DIVIDER = new BlockExtractor.LineMatcher() {
        @Override
        public boolean matches(LogicalLine line) {
            return line.typeAt(0) == TokenType.ELSE || line.typeAt(0) == TokenType.ELSEIF;
        }
    };

    private final String source;
    private final List<LogicalLine> lines;
    private final BlockExtractor extractor;
    private int index;

    /**
     * Creates a parser for a script whose first line is line 1.
     *
     * @param source the script source
     */
    public StatementParser(String source) {
        this(source, 1);
    }

    /**
     * Creates a parser for a fragment of a larger script.
     *
     * @param source the script source
     * @param firstLine the line number of the first character of source
     */
    public StatementParser(String source, int firstLine) {
        this.source = source != null ? source : "";
        List<Token> tokens = new Tokenizer(this.source, firstLine).tokenize();
        this.lines = LineGrouper.group(this.source, tokens);
        this.extractor = new BlockExtractor(this.source, lines);
    }

    /**
     * Parses a whole script.
     *
     * @param source the script source
     * @return the statements in order
     * @throws VBScriptException if any statement is malformed
     */
    public static List<Statement> parseAll(String source) throws VBScriptException {
        return parseAll(source, 1);
    }

    /**
     * Parses a whole script fragment.
     *
     * @param source the script source
     * @param firstLine the line number of the first character of source
     * @return the statements in order
     * @throws VBScriptException if any statement is malformed
     */
    public static List<Statement> parseAll(String source, int firstLine) throws VBScriptException {
        StatementParser parser = new StatementParser(source, firstLine);
        List<Statement> statements = new ArrayList<Statement>();
        while (parser.hasNext()) {
            statements.add(parser.next());
        }
        return Collections.unmodifiableList(statements);
    }

    /**
     * Indicates whether another statement remains. Comment-only lines are
     * skipped.
     *
     * @return true if {@link #next} will return a statement
     */
    public boolean hasNext() {
        while (index < lines.size() && lines.get(index).isCommentOnly()) {
            index++;
        }
        return index < lines.size();
    }

    /**
     * Parses the next statement.
     *
     * @return the statement
     * @throws VBScriptException if the statement is malformed
     */
    public Statement next() throws VBScriptException {
        if (!hasNext()) {
            throw new IllegalStateException();
        }
        LogicalLine line = lines.get(index);
        try {
            Statement statement = parseLine(line);
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest("Parsed " + statement + " at line " + statement.getLineNumber());
            }
            return statement;
        } catch (VBScriptException e) {
            e.locate(line.getLineNumber());
            throw e;
        }
    }

    private Statement parseLine(LogicalLine line) throws VBScriptException {
        int lineNumber = line.getLineNumber();
        switch (line.typeAt(0)) {
            case DIM:
                index++;
                return parseDim(line);
            case SET:
            case LET:
                index++;
                return parseAssignment(line, 1);
            case IF:
                return parseIf(line);
            case FOR:
                return parseFor(line);
            case WHILE:
                return parseWhile(line);
            case PUBLIC:
            case PRIVATE:
                if (line.typeAt(1) == TokenType.FUNCTION || line.typeAt(1) == TokenType.SUB) {
                    return parseFunction(line, 1);
                }
                index++;
                return new UnrecognizedStatement(line.getText(), lineNumber);
            case FUNCTION:
            case SUB:
                return parseFunction(line, 0);
            case CALL:
                index++;
                return parseCall(line);
            case IDENTIFIER:
                index++;
                return parseIdentifierStatement(line);
            case ELSEIF:
                throw VBScriptException.create(VBScriptException.ErrorType.NOT_IMPLEMENTED_ERROR,
                                               "parse.elseif");
            case ELSE:
            case NEXT:
            case WEND:
            case END:
                throw VBScriptException.create(VBScriptException.ErrorType.BLOCK_MISMATCH_ERROR,
                                               "parse.unexpected", line.getText());
            default:
                index++;
                return new UnrecognizedStatement(line.getText(), lineNumber);
        }
    }

    private Statement parseDim(LogicalLine line) throws VBScriptException {
        if (line.size() < 2) {
            throw syntaxError("parse.dim_empty", line.getText());
        }
        List<String> names = new ArrayList<String>();
        for (int i = 1; i < line.size(); i += 2) {
            if (line.typeAt(i) != TokenType.IDENTIFIER) {
                throw syntaxError("parse.dim_name", line.get(i).getValue());
            }
            names.add(line.get(i).getValue());
            if (i + 1 < line.size() && line.typeAt(i + 1) != TokenType.COMMA) {
                throw syntaxError("parse.dim_name", line.getText(i + 1, line.size()));
            }
            if (i + 1 == line.size() - 1) {
                throw syntaxError("parse.dim_name", line.getText());
            }
        }
        return new DimStatement(names, line.getLineNumber());
    }

    private Statement parseAssignment(LogicalLine line, int nameIndex) throws VBScriptException {
        if (line.typeAt(nameIndex) != TokenType.IDENTIFIER
                || line.typeAt(nameIndex + 1) != TokenType.ASSIGN
                || line.size() <= nameIndex + 2) {
            throw syntaxError("parse.assignment", line.getText());
        }
        String name = line.get(nameIndex).getValue();
        String expression = line.getText(nameIndex + 2, line.size());
        return new AssignmentStatement(name, expression, line.getLineNumber());
    }

    private Statement parseIdentifierStatement(LogicalLine line) throws VBScriptException {
        Token first = line.get(0);
        if (first.isWord("Response") && line.typeAt(1) == TokenType.DOT
                && line.size() > 2 && line.get(2).isWord("Write")) {
            return parseResponseWrite(line);
        }
        if (line.typeAt(1) == TokenType.ASSIGN) {
            return parseAssignment(line, 0);
        }
        if (line.size() == 1) {
            return new CallStatement(first.getValue(), Collections.<String>emptyList(),
                                     line.getLineNumber());
        }
        if (line.typeAt(1) == TokenType.LEFT_PAREN && matchingParen(line, 1) == line.size() - 1) {
            List<String> args = splitArguments(line, 2, line.size() - 1);
            return new CallStatement(first.getValue(), args, line.getLineNumber());
        }
        if (line.typeAt(1) == TokenType.DOT) {
            // object member access
            return new UnrecognizedStatement(line.getText(), line.getLineNumber());
        }
        // Name arg1, arg2
        List<String> args = splitArguments(line, 1, line.size());
        return new CallStatement(first.getValue(), args, line.getLineNumber());
    }

    private Statement parseResponseWrite(LogicalLine line) throws VBScriptException {
        int from = 3;
        int to = line.size();
        if (from >= to) {
            throw syntaxError("parse.response_write", line.getText());
        }
        if (line.typeAt(from) == TokenType.LEFT_PAREN && matchingParen(line, from) == to - 1) {
            from++;
            to--;
            if (from >= to) {
                throw syntaxError("parse.response_write", line.getText());
            }
        }
        return new ResponseWriteStatement(line.getText(from, to), line.getLineNumber());
    }

    private Statement parseIf(LogicalLine line) throws VBScriptException {
        int lineNumber = line.getLineNumber();
        int thenIndex = find(line, TokenType.THEN, 1);
        if (thenIndex < 0) {
            throw syntaxError("parse.if_then", line.getText());
        }
        if (thenIndex == 1) {
            throw syntaxError("parse.if_condition", line.getText());
        }
        String condition = line.getText(1, thenIndex);
        if (thenIndex == line.size() - 1) {
            BlockExtractor.Block block = extractor.extract(index, IF_OPENER, IF_CLOSER, ELSE_DIVIDER,
                                                           "If", "End If");
            if (block.elseBody != null) {
                LogicalLine divider = findDivider(block.closerIndex);
                if (divider != null && divider.typeAt(0) == TokenType.ELSEIF) {
                    throw VBScriptException.create(
                        VBScriptException.ErrorType.NOT_IMPLEMENTED_ERROR, "parse.elseif");
                }
            }
            index = block.closerIndex + 1;
            return new IfStatement(condition, block.body, block.elseBody, lineNumber);
        }
        index++;
        int size = line.size();
        if (size < thenIndex + 3 || line.typeAt(size - 2) != TokenType.END
                || line.typeAt(size - 1) != TokenType.IF) {
            throw syntaxError("parse.if_end", line.getText());
        }
        int bodyEnd = size - 2;
        int elseIndex = -1;
        int nested = 0;
        for (int i = thenIndex + 1; i < bodyEnd; i++) {
            TokenType type = line.typeAt(i);
            if (type == TokenType.IF) {
                nested++;
            } else if (type == TokenType.END && line.typeAt(i + 1) == TokenType.IF) {
                nested--;
                i++;
            } else if (type == TokenType.ELSEIF && nested == 0) {
                throw VBScriptException.create(VBScriptException.ErrorType.NOT_IMPLEMENTED_ERROR,
                                               "parse.elseif");
            } else if (type == TokenType.ELSE && nested == 0) {
                elseIndex = i;
                break;
            }
        }
        if (elseIndex < 0) {
            Body body = new Body(line.getText(thenIndex + 1, bodyEnd), lineNumber);
            return new IfStatement(condition, body, null, lineNumber);
        }
        Body body = new Body(line.getText(thenIndex + 1, elseIndex), lineNumber);
        Body elseBody = new Body(line.getText(elseIndex + 1, bodyEnd), lineNumber);
        return new IfStatement(condition, body, elseBody, lineNumber);
    }

    /**
     * Finds the divider line of the block If that opens at the current
     * index and closes at closerIndex.
     */
    private LogicalLine findDivider(int closerIndex) {
        int depth = 0;
        for (int i = index; i < closerIndex; i++) {
            LogicalLine line = lines.get(i);
            if (IF_OPENER.matches(line)) {
                depth++;
            } else if (IF_CLOSER.matches(line)) {
                depth--;
            } else if (depth == 1 && ELSE_DIVIDER.matches(line)) {
                return line;
            }
        }
        return null;
    }

    private Statement parseFor(LogicalLine line) throws VBScriptException {
        if (line.typeAt(1) != TokenType.IDENTIFIER || line.typeAt(2) != TokenType.ASSIGN) {
            throw syntaxError("parse.for", line.getText());
        }
        int toIndex = find(line, TokenType.TO, 3);
        if (toIndex <= 3 || toIndex == line.size() - 1) {
            throw syntaxError("parse.for", line.getText());
        }
        int stepIndex = find(line, TokenType.STEP, toIndex + 1);
        String step = "1";
        int endTo = line.size();
        if (stepIndex >= 0) {
            if (stepIndex == toIndex + 1 || stepIndex == line.size() - 1) {
                throw syntaxError("parse.for", line.getText());
            }
            step = line.getText(stepIndex + 1, line.size());
            endTo = stepIndex;
        }
        String counter = line.get(1).getValue();
        String start = line.getText(3, toIndex);
        String end = line.getText(toIndex + 1, endTo);
        BlockExtractor.Block block = extractor.extract(index, FOR_OPENER, FOR_CLOSER, "For", "Next");
        index = block.closerIndex + 1;
        return new ForStatement(counter, start, end, step, block.body, line.getLineNumber());
    }

    private Statement parseWhile(LogicalLine line) throws VBScriptException {
        if (line.size() < 2) {
            throw syntaxError("parse.while", line.getText());
        }
        String condition = line.getText(1, line.size());
        BlockExtractor.Block block = extractor.extract(index, WHILE_OPENER, WHILE_CLOSER,
                                                       "While", "Wend");
        index = block.closerIndex + 1;
        return new WhileStatement(condition, block.body, line.getLineNumber());
    }

    private Statement parseFunction(LogicalLine line, int keywordIndex) throws VBScriptException {
        final TokenType kind = line.typeAt(keywordIndex);
        boolean sub = kind == TokenType.SUB;
        String keyword = sub ? "Sub" : "Function";
        int nameIndex = keywordIndex + 1;
        if (line.typeAt(nameIndex) != TokenType.IDENTIFIER) {
            throw syntaxError("parse.function", keyword, line.getText());
        }
        List<String> parameters = new ArrayList<String>();
        int next = nameIndex + 1;
        if (next < line.size()) {
            if (line.typeAt(next) != TokenType.LEFT_PAREN
                    || line.typeAt(line.size() - 1) != TokenType.RIGHT_PAREN) {
                throw syntaxError("parse.function", keyword, line.getText());
            }
            parameters = parseParameters(line, next + 1, line.size() - 1);
        }
        BlockExtractor.LineMatcher opener = new BlockExtractor.LineMatcher() {
            @Override
            public boolean matches(LogicalLine l) {
                int i = (l.typeAt(0) == TokenType.PUBLIC || l.typeAt(0) == TokenType.PRIVATE) ? 1 : 0;
                return l.typeAt(i) == kind;
            }
        };
        BlockExtractor.Block block = extractor.extract(index, opener, new EndMatcher(kind),
                                                       keyword, "End " + keyword);
        index = block.closerIndex + 1;
        return new FunctionDeclaration(line.get(nameIndex).getValue(), parameters, block.body, sub,
                                       line.getLineNumber());
    }

    private List<String> parseParameters(LogicalLine line, int from, int to) throws VBScriptException {
        List<String> parameters = new ArrayList<String>();
        boolean expectName = true;
        for (int i = from; i < to; i++) {
            Token token = line.get(i);
            if (expectName) {
                if (token.isWord("ByVal") || token.isWord("ByRef")) {
                    continue;
                }
                if (!token.is(TokenType.IDENTIFIER)) {
                    throw syntaxError("parse.parameter", line.getText(from, to));
                }
                parameters.add(token.getValue());
                expectName = false;
            } else {
                if (!token.is(TokenType.COMMA)) {
                    throw syntaxError("parse.parameter", line.getText(from, to));
                }
                expectName = true;
            }
        }
        if (expectName && !parameters.isEmpty()) {
            throw syntaxError("parse.parameter", line.getText(from, to));
        }
        return parameters;
    }

    private Statement parseCall(LogicalLine line) throws VBScriptException {
        if (line.typeAt(1) != TokenType.IDENTIFIER) {
            throw syntaxError("parse.call", line.getText());
        }
        String name = line.get(1).getValue();
        if (line.size() == 2) {
            return new CallStatement(name, Collections.<String>emptyList(), line.getLineNumber());
        }
        if (line.typeAt(2) != TokenType.LEFT_PAREN || matchingParen(line, 2) != line.size() - 1) {
            throw syntaxError("parse.call", line.getText());
        }
        return new CallStatement(name, splitArguments(line, 3, line.size() - 1), line.getLineNumber());
    }

    /**
     * Splits the tokens between from and to on top-level commas.
     */
    private List<String> splitArguments(LogicalLine line, int from, int to) throws VBScriptException {
        List<String> args = new ArrayList<String>();
        if (from >= to) {
            return args;
        }
        int depth = 0;
        int start = from;
        for (int i = from; i < to; i++) {
            TokenType type = line.typeAt(i);
            if (type == TokenType.LEFT_PAREN) {
                depth++;
            } else if (type == TokenType.RIGHT_PAREN) {
                depth--;
            } else if (type == TokenType.COMMA && depth == 0) {
                if (i == start) {
                    throw syntaxError("parse.call", line.getText());
                }
                args.add(line.getText(start, i));
                start = i + 1;
            }
        }
        if (start >= to) {
            throw syntaxError("parse.call", line.getText());
        }
        args.add(line.getText(start, to));
        return args;
    }

    /**
     * Finds the first token of the given type at parenthesis depth zero.
     */
    private static int find(LogicalLine line, TokenType type, int from) {
        int depth = 0;
        for (int i = from; i < line.size(); i++) {
            TokenType t = line.typeAt(i);
            if (t == TokenType.LEFT_PAREN) {
                depth++;
            } else if (t == TokenType.RIGHT_PAREN) {
                depth--;
            } else if (t == type && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the index of the parenthesis closing the one at open, or -1.
     */
    private static int matchingParen(LogicalLine line, int open) {
        int depth = 0;
        for (int i = open; i < line.size(); i++) {
            TokenType t = line.typeAt(i);
            if (t == TokenType.LEFT_PAREN) {
                depth++;
            } else if (t == TokenType.RIGHT_PAREN) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static VBScriptException syntaxError(String key, Object... args) {
        return VBScriptException.create(VBScriptException.ErrorType.SYNTAX_ERROR, key, args);
    }

    /**
     * Matches {@code End <keyword>} lines.
     */
    private static class EndMatcher implements BlockExtractor.LineMatcher {

        private final TokenType keyword;

        EndMatcher(TokenType keyword) {
            this.keyword = keyword;
        }

        @Override
        public boolean matches(LogicalLine line) {
            return line.typeAt(0) == TokenType.END && line.typeAt(1) == keyword;
        }

    }

}
