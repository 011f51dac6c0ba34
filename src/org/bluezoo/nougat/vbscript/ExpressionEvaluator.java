/*
 * ExpressionEvaluator.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates expression text against an execution context.
 *
 * <p>Expressions are tokenized and evaluated by recursive descent, from
 * the loosest binding operator to the tightest:
 * <ol>
 *   <li>{@code Or}</li>
 *   <li>{@code And}</li>
 *   <li>{@code Not}</li>
 *   <li>comparison: {@code = == <> != < > <= >=}</li>
 *   <li>concatenation: {@code &}</li>
 *   <li>addition: {@code + -}</li>
 *   <li>{@code Mod}</li>
 *   <li>integer division: {@code \}</li>
 *   <li>multiplication: {@code * /}</li>
 *   <li>unary minus</li>
 *   <li>exponentiation: {@code ^}</li>
 * </ol>
 *
 * <p>The {@link Mode} tells the evaluator where the text came from, which
 * decides the error reported for unresolvable names and malformed text.
 * In {@link Mode#CONDITION} the concatenation operator requires two
 * strings and stores its result back into the variable named by its left
 * operand; in the other modes it converts both operands to their display
 * text and has no side effect.
 *
 * <p>The evaluator holds no state and may be shared between threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ExpressionEvaluator {

    private static final Logger LOGGER = Logger.getLogger(ExpressionEvaluator.class.getName());

    /**
     * Maximum nesting of parentheses and prefix operators in one
     * expression.
     */
    public static final int MAX_NESTING_DEPTH = 256;

    /**
     * The place an expression appears in.
     */
    public enum Mode {

        /** An {@code If} or {@code While} condition */
        CONDITION(VBScriptException.ErrorType.NAME_ERROR,
                  VBScriptException.ErrorType.SYNTAX_ERROR),
        /** The right-hand side of an assignment */
        ASSIGNMENT(VBScriptException.ErrorType.RUNTIME_ERROR,
                   VBScriptException.ErrorType.RUNTIME_ERROR),
        /** The operand of {@code Response.Write} */
        OUTPUT(VBScriptException.ErrorType.VALUE_ERROR,
               VBScriptException.ErrorType.VALUE_ERROR),
        /** A procedure argument or loop bound */
        ARGUMENT(VBScriptException.ErrorType.NAME_ERROR,
                 VBScriptException.ErrorType.SYNTAX_ERROR);

        final VBScriptException.ErrorType unbound;
        final VBScriptException.ErrorType malformed;

        Mode(VBScriptException.ErrorType unbound, VBScriptException.ErrorType malformed) {
            this.unbound = unbound;
            this.malformed = malformed;
        }

    }

    /**
     * Evaluates expression text.
     *
     * @param text the expression text
     * @param mode where the expression appears
     * @param context the execution context
     * @return the value
     * @throws VBScriptException if the expression cannot be evaluated
     */
    public VBValue evaluate(String text, Mode mode, ExecutionContext context)
            throws VBScriptException {
        Parser parser = new Parser(text, mode, context);
        VBValue value = parser.parse();
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Evaluated " + mode + " " + text + " -> " + value);
        }
        return value;
    }

    /**
     * Evaluates a condition for its truth value.
     *
     * @param condition the condition text
     * @param context the execution context
     * @return true if the condition holds
     * @throws VBScriptException if the condition cannot be evaluated
     */
    public boolean test(String condition, ExecutionContext context) throws VBScriptException {
        return evaluate(condition, Mode.CONDITION, context).isTrue();
    }

    /**
     * Evaluates an expression to the text written to the response.
     *
     * @param text the expression text
     * @param context the execution context
     * @return the display text of the value
     * @throws VBScriptException if the expression cannot be evaluated
     */
    public String evaluateOutput(String text, ExecutionContext context) throws VBScriptException {
        return evaluate(text, Mode.OUTPUT, context).toString();
    }

    /**
     * Recursive descent over the significant tokens of one expression.
     */
    private static class Parser {

        private final String text;
        private final Mode mode;
        private final ExecutionContext context;
        private final List<Token> tokens;
        private int pos;
        private int depth;

        Parser(String text, Mode mode, ExecutionContext context) {
            this.text = text != null ? text.trim() : "";
            this.mode = mode;
            this.context = context;
            this.tokens = new ArrayList<Token>();
            for (Token token : Tokenizer.tokenize(this.text)) {
                if (!token.getType().isStructural() || token.is(TokenType.EOF)) {
                    tokens.add(token);
                }
            }
        }

        VBValue parse() throws VBScriptException {
            if (peek().is(TokenType.EOF)) {
                throw malformed();
            }
            VBValue value = or();
            if (!peek().is(TokenType.EOF)) {
                throw malformed();
            }
            return value;
        }

        private VBValue or() throws VBScriptException {
            VBValue left = and();
            while (match(TokenType.OR)) {
                VBValue right = and();
                checkLogical(left, right, "Or");
                left = VBValue.bool(left.asBoolean() || right.asBoolean());
            }
            return left;
        }

        private VBValue and() throws VBScriptException {
            VBValue left = not();
            while (match(TokenType.AND)) {
                VBValue right = not();
                checkLogical(left, right, "And");
                left = VBValue.bool(left.asBoolean() && right.asBoolean());
            }
            return left;
        }

        private VBValue not() throws VBScriptException {
            if (match(TokenType.NOT)) {
                enter();
                VBValue operand = not();
                depth--;
                if (!operand.isBoolean()) {
                    throw error(VBScriptException.ErrorType.TYPE_ERROR, "expr.type_not",
                                operand.getKind());
                }
                return VBValue.bool(!operand.asBoolean());
            }
            return comparison();
        }

        private VBValue comparison() throws VBScriptException {
            VBValue left = concatenation();
            while (true) {
                TokenType op = peek().getType();
                switch (op) {
                    case ASSIGN:
                    case EQUAL:
                        pos++;
                        left = VBValue.bool(left.equalsValue(concatenation()));
                        break;
                    case NOT_EQUAL:
                        pos++;
                        left = VBValue.bool(!left.equalsValue(concatenation()));
                        break;
                    case LESS_THAN:
                    case GREATER_THAN:
                    case LESS_EQUAL:
                    case GREATER_EQUAL:
                        Token operator = tokens.get(pos++);
                        left = ordering(left, concatenation(), operator);
                        break;
                    default:
                        return left;
                }
            }
        }

        private VBValue ordering(VBValue left, VBValue right, Token operator)
                throws VBScriptException {
            if (!left.isNumber() || !right.isNumber()) {
                throw error(VBScriptException.ErrorType.RUNTIME_ERROR, "expr.ordering",
                            operator.getValue(), left.getKind(), right.getKind());
            }
            double l = left.asNumber();
            double r = right.asNumber();
            switch (operator.getType()) {
                case LESS_THAN:
                    return VBValue.bool(l < r);
                case GREATER_THAN:
                    return VBValue.bool(l > r);
                case LESS_EQUAL:
                    return VBValue.bool(l <= r);
                default:
                    return VBValue.bool(l >= r);
            }
        }

        private VBValue concatenation() throws VBScriptException {
            int start = pos;
            VBValue left = additive();
            // the variable rebound by a condition concatenation
            String target = null;
            if (pos == start + 1 && tokens.get(start).is(TokenType.IDENTIFIER)) {
                target = tokens.get(start).getValue();
            }
            while (match(TokenType.CONCAT)) {
                VBValue right = additive();
                if (mode == Mode.CONDITION) {
                    if (!left.isString() || !right.isString()) {
                        throw error(VBScriptException.ErrorType.TYPE_ERROR, "expr.type_concat",
                                    left.getKind(), right.getKind());
                    }
                    left = VBValue.string(left.asString() + right.asString());
                    if (target != null) {
                        context.setVariable(target, left);
                    }
                } else {
                    left = VBValue.string(left.toString() + right.toString());
                }
            }
            return left;
        }

        private VBValue additive() throws VBScriptException {
            VBValue left = modulus();
            while (true) {
                if (match(TokenType.PLUS)) {
                    VBValue right = modulus();
                    if (left.isString() && right.isString()) {
                        left = VBValue.string(left.asString() + right.asString());
                    } else {
                        checkArithmetic(left, right, "+");
                        left = VBValue.number(left.asNumber() + right.asNumber());
                    }
                } else if (match(TokenType.MINUS)) {
                    VBValue right = modulus();
                    checkArithmetic(left, right, "-");
                    left = VBValue.number(left.asNumber() - right.asNumber());
                } else {
                    return left;
                }
            }
        }

        private VBValue modulus() throws VBScriptException {
            VBValue left = integerDivision();
            while (match(TokenType.MOD)) {
                VBValue right = integerDivision();
                checkArithmetic(left, right, "Mod");
                long divisor = Math.round(right.asNumber());
                if (divisor == 0L) {
                    throw error(VBScriptException.ErrorType.RUNTIME_ERROR, "expr.division_by_zero");
                }
                left = VBValue.number(Math.round(left.asNumber()) % divisor);
            }
            return left;
        }

        private VBValue integerDivision() throws VBScriptException {
            VBValue left = multiplicative();
            while (match(TokenType.INT_DIVIDE)) {
                VBValue right = multiplicative();
                checkArithmetic(left, right, "\\");
                long divisor = Math.round(right.asNumber());
                if (divisor == 0L) {
                    throw error(VBScriptException.ErrorType.RUNTIME_ERROR, "expr.division_by_zero");
                }
                left = VBValue.number(Math.round(left.asNumber()) / divisor);
            }
            return left;
        }

        private VBValue multiplicative() throws VBScriptException {
            VBValue left = unary();
            while (true) {
                if (match(TokenType.MULTIPLY)) {
                    VBValue right = unary();
                    checkArithmetic(left, right, "*");
                    left = VBValue.number(left.asNumber() * right.asNumber());
                } else if (match(TokenType.DIVIDE)) {
                    VBValue right = unary();
                    checkArithmetic(left, right, "/");
                    if (right.asNumber() == 0.0) {
                        throw error(VBScriptException.ErrorType.RUNTIME_ERROR,
                                    "expr.division_by_zero");
                    }
                    left = VBValue.number(left.asNumber() / right.asNumber());
                } else {
                    return left;
                }
            }
        }

        private VBValue unary() throws VBScriptException {
            if (match(TokenType.MINUS)) {
                enter();
                VBValue operand = unary();
                depth--;
                if (!operand.isNumber()) {
                    throw error(VBScriptException.ErrorType.TYPE_ERROR, "expr.type_arithmetic",
                                "-", VBValue.Kind.NUMBER, operand.getKind());
                }
                return VBValue.number(-operand.asNumber());
            }
            if (match(TokenType.PLUS)) {
                enter();
                VBValue operand = unary();
                depth--;
                return operand;
            }
            return power();
        }

        private VBValue power() throws VBScriptException {
            VBValue left = primary();
            while (match(TokenType.POWER)) {
                VBValue right;
                if (match(TokenType.MINUS)) {
                    right = primary();
                    checkArithmetic(left, right, "^");
                    right = VBValue.number(-right.asNumber());
                } else {
                    right = primary();
                }
                checkArithmetic(left, right, "^");
                left = VBValue.number(Math.pow(left.asNumber(), right.asNumber()));
            }
            return left;
        }

        private VBValue primary() throws VBScriptException {
            Token token = peek();
            switch (token.getType()) {
                case LEFT_PAREN:
                    pos++;
                    enter();
                    VBValue inner = or();
                    depth--;
                    if (!match(TokenType.RIGHT_PAREN)) {
                        throw malformed();
                    }
                    return inner;
                case STRING_LITERAL:
                    if (token.isUnterminated()) {
                        throw malformed();
                    }
                    pos++;
                    return VBValue.string(token.getValue());
                case INTEGER_LITERAL:
                case FLOAT_LITERAL:
                    pos++;
                    return number(token.getValue(), token.getValue(), 10);
                case HEX_LITERAL:
                    pos++;
                    return number(token.getValue(), token.getValue().substring(2), 16);
                case OCT_LITERAL:
                    pos++;
                    String digits = token.getValue().substring(1);
                    if (digits.startsWith("O") || digits.startsWith("o")) {
                        digits = digits.substring(1);
                    }
                    return number(token.getValue(), digits, 8);
                case DATE_LITERAL:
                    pos++;
                    return VBValue.string(token.getValue());
                case TRUE:
                    pos++;
                    return VBValue.TRUE;
                case FALSE:
                    pos++;
                    return VBValue.FALSE;
                case NULL:
                case NOTHING:
                case EMPTY:
                    pos++;
                    return VBValue.NULL;
                case IDENTIFIER:
                    pos++;
                    VBValue value = context.getVariable(token.getValue());
                    if (value == null) {
                        throw error(mode.unbound, "expr.unbound", token.getValue());
                    }
                    return value;
                default:
                    throw malformed();
            }
        }

        private VBValue number(String literal, String digits, int radix) throws VBScriptException {
            try {
                if (radix == 10) {
                    return VBValue.number(Double.parseDouble(digits));
                }
                return VBValue.number(Long.parseLong(digits, radix));
            } catch (NumberFormatException e) {
                String msg = MessageFormat.format(VBScriptException.L10N.getString("expr.number"),
                                                  literal);
                throw new VBScriptException(VBScriptException.ErrorType.VALUE_ERROR, msg, e);
            }
        }

        private void checkLogical(VBValue left, VBValue right, String operator)
                throws VBScriptException {
            if (!left.isBoolean() || !right.isBoolean()) {
                throw error(VBScriptException.ErrorType.TYPE_ERROR, "expr.type_logical",
                            operator, left.getKind(), right.getKind());
            }
        }

        private void checkArithmetic(VBValue left, VBValue right, String operator)
                throws VBScriptException {
            if (!left.isNumber() || !right.isNumber()) {
                throw error(VBScriptException.ErrorType.TYPE_ERROR, "expr.type_arithmetic",
                            operator, left.getKind(), right.getKind());
            }
        }

        private void enter() throws VBScriptException {
            if (++depth > MAX_NESTING_DEPTH) {
                throw error(mode.malformed, "expr.nesting", String.valueOf(MAX_NESTING_DEPTH));
            }
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private boolean match(TokenType type) {
            if (tokens.get(pos).is(type)) {
                pos++;
                return true;
            }
            return false;
        }

        private VBScriptException malformed() {
            return error(mode.malformed, "expr.syntax", text);
        }

        private static VBScriptException error(VBScriptException.ErrorType type, String key,
                                               Object... args) {
            return VBScriptException.create(type, key, args);
        }

    }

}
