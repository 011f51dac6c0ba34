/*
 * ExpressionEvaluatorTest.java
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

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ExpressionEvaluator}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ExpressionEvaluatorTest {

    private ExpressionEvaluator evaluator;
    private ExecutionContext context;

    @Before
    public void setUp() {
        evaluator = new ExpressionEvaluator();
        context = new ExecutionContext();
    }

    private VBValue assign(String text) throws VBScriptException {
        return evaluator.evaluate(text, ExpressionEvaluator.Mode.ASSIGNMENT, context);
    }

    private VBValue condition(String text) throws VBScriptException {
        return evaluator.evaluate(text, ExpressionEvaluator.Mode.CONDITION, context);
    }

    private int failureCode(String text, ExpressionEvaluator.Mode mode) {
        try {
            evaluator.evaluate(text, mode, context);
            fail("Expected failure for: " + text);
            return 0;
        } catch (VBScriptException e) {
            return e.getCode();
        }
    }

    // ===== Literal precedence =====

    @Test
    public void testQuotedTextIsString() throws Exception {
        assertEquals(VBValue.string("5"), assign("\"5\""));
    }

    @Test
    public void testBareNumberIsNumber() throws Exception {
        assertEquals(VBValue.number(5.0), assign("5"));
        assertEquals(VBValue.number(2.5), assign("2.5"));
        assertEquals(VBValue.number(-5.0), assign("-5"));
    }

    @Test
    public void testBooleanKeywordsAnyCase() throws Exception {
        assertSame(VBValue.TRUE, assign("true"));
        assertSame(VBValue.TRUE, assign("TRUE"));
        assertSame(VBValue.TRUE, assign("True"));
        assertSame(VBValue.FALSE, assign("False"));
    }

    @Test
    public void testVariableReferenceCopiesValue() throws Exception {
        context.setVariable("a", VBValue.string("x"));
        assertEquals(VBValue.string("x"), assign("A"));
    }

    @Test
    public void testRadixAndSpecialLiterals() throws Exception {
        assertEquals(VBValue.number(255.0), assign("&HFF"));
        assertEquals(VBValue.number(15.0), assign("&17"));
        assertEquals(VBValue.number(15.0), assign("&O17"));
        assertEquals(VBValue.string("2024-01-31"), assign("#2024-01-31#"));
        assertSame(VBValue.NULL, assign("Null"));
        assertSame(VBValue.NULL, assign("Nothing"));
        assertSame(VBValue.NULL, assign("Empty"));
    }

    // ===== Failure modes =====

    @Test
    public void testUnresolvedAssignmentIsRuntimeError() {
        assertEquals(1005, failureCode("undefinedName", ExpressionEvaluator.Mode.ASSIGNMENT));
        assertEquals(1005, failureCode("1 +", ExpressionEvaluator.Mode.ASSIGNMENT));
    }

    @Test
    public void testUnresolvedOutputIsValueError() {
        assertEquals(1004, failureCode("y", ExpressionEvaluator.Mode.OUTPUT));
        assertEquals(1004, failureCode("\"open", ExpressionEvaluator.Mode.OUTPUT));
    }

    @Test
    public void testUnboundConditionIsNameError() {
        assertEquals(1003, failureCode("y = 1", ExpressionEvaluator.Mode.CONDITION));
        assertEquals(1001, failureCode("1 = = 1", ExpressionEvaluator.Mode.CONDITION));
    }

    private static String nested(String open, String inner, String close, int levels) {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < levels; i++) {
            buf.append(open);
        }
        buf.append(inner);
        for (int i = 0; i < levels; i++) {
            buf.append(close);
        }
        return buf.toString();
    }

    @Test
    public void testNestingWithinLimit() throws Exception {
        String text = nested("(", "1", ")", ExpressionEvaluator.MAX_NESTING_DEPTH);
        assertEquals(VBValue.number(1.0), assign(text));
    }

    @Test
    public void testNestingBeyondLimitIsMalformed() {
        String parens = nested("(", "1", ")", ExpressionEvaluator.MAX_NESTING_DEPTH + 1);
        assertEquals(1001, failureCode(parens, ExpressionEvaluator.Mode.CONDITION));
        assertEquals(1004, failureCode(nested("(", "1", ")", 5000), ExpressionEvaluator.Mode.OUTPUT));
        assertEquals(1005, failureCode(nested("- ", "1", "", 5000), ExpressionEvaluator.Mode.ASSIGNMENT));
        assertEquals(1001, failureCode(nested("Not ", "True", "", 5000), ExpressionEvaluator.Mode.CONDITION));
    }

    @Test
    public void testEmptyExpression() {
        assertEquals(1001, failureCode("  ", ExpressionEvaluator.Mode.CONDITION));
    }

    // ===== Comparison =====

    @Test
    public void testEqualitySpellings() throws Exception {
        assertSame(VBValue.TRUE, condition("1 = 1"));
        assertSame(VBValue.TRUE, condition("1 == 1"));
        assertSame(VBValue.TRUE, condition("1 <> 2"));
        assertSame(VBValue.TRUE, condition("1 != 2"));
        assertSame(VBValue.TRUE, condition("\"a\" = \"a\""));
        assertSame(VBValue.TRUE, condition("Null = Null"));
    }

    @Test
    public void testCrossTypeEqualityIsFalse() throws Exception {
        assertSame(VBValue.FALSE, condition("\"1\" = 1"));
        assertSame(VBValue.TRUE, condition("\"1\" <> 1"));
        assertSame(VBValue.FALSE, condition("True = 1"));
    }

    @Test
    public void testNumericEqualityTolerance() throws Exception {
        assertSame(VBValue.TRUE, condition("0.1 + 0.2 = 0.3"));
    }

    @Test
    public void testOrdering() throws Exception {
        assertSame(VBValue.TRUE, condition("1 < 2"));
        assertSame(VBValue.FALSE, condition("1 > 2"));
        assertSame(VBValue.TRUE, condition("2 <= 2"));
        assertSame(VBValue.TRUE, condition("3 >= 2"));
    }

    @Test
    public void testOrderingRequiresNumbers() {
        assertEquals(1005, failureCode("\"a\" < \"b\"", ExpressionEvaluator.Mode.CONDITION));
        assertEquals(1005, failureCode("True > 1", ExpressionEvaluator.Mode.CONDITION));
    }

    // ===== Logical operators =====

    @Test
    public void testAndOr() throws Exception {
        assertSame(VBValue.TRUE, condition("True And True"));
        assertSame(VBValue.FALSE, condition("True And False"));
        assertSame(VBValue.TRUE, condition("False Or True"));
        assertSame(VBValue.TRUE, condition("1 < 2 And 2 < 3"));
        assertSame(VBValue.TRUE, condition("Not 1 > 2"));
    }

    @Test
    public void testLogicalOperatorsRequireBooleans() {
        assertEquals(1002, failureCode("1 And True", ExpressionEvaluator.Mode.CONDITION));
        assertEquals(1002, failureCode("\"a\" Or \"b\"", ExpressionEvaluator.Mode.CONDITION));
        assertEquals(1002, failureCode("Not 1", ExpressionEvaluator.Mode.CONDITION));
    }

    // ===== Concatenation =====

    @Test
    public void testConditionConcatenationRebindsLeftOperand() throws Exception {
        context.setVariable("a", VBValue.string("foo"));
        context.setVariable("b", VBValue.string("bar"));
        assertTrue(evaluator.test("a & b", context));
        assertEquals(VBValue.string("foobar"), context.getVariable("a"));
        assertEquals(VBValue.string("bar"), context.getVariable("b"));
    }

    @Test
    public void testConditionConcatenationRequiresStrings() {
        context.setVariable("a", VBValue.string("foo"));
        assertEquals(1002, failureCode("a & 1", ExpressionEvaluator.Mode.CONDITION));
    }

    @Test
    public void testOutputConcatenationIsPure() throws Exception {
        context.setVariable("a", VBValue.string("foo"));
        context.setVariable("n", VBValue.number(3.0));
        assertEquals("foo 3", evaluator.evaluateOutput("a & \" \" & n", context));
        assertEquals(VBValue.string("foo"), context.getVariable("a"));
    }

    @Test
    public void testAssignmentConcatenation() throws Exception {
        context.setVariable("first", VBValue.string("Ada"));
        context.setVariable("last", VBValue.string("Lovelace"));
        assertEquals(VBValue.string("Ada Lovelace"), assign("first & \" \" & last"));
    }

    // ===== Arithmetic =====

    @Test
    public void testArithmeticPrecedence() throws Exception {
        assertEquals(VBValue.number(7.0), assign("1 + 2 * 3"));
        assertEquals(VBValue.number(9.0), assign("(1 + 2) * 3"));
        assertEquals(VBValue.number(-4.0), assign("-2 ^ 2"));
        assertEquals(VBValue.number(0.5), assign("2 ^ -1"));
        assertEquals(VBValue.number(3.0), assign("7 \\ 2"));
        assertEquals(VBValue.number(1.0), assign("7 Mod 2"));
        assertEquals(VBValue.number(3.5), assign("7 / 2"));
        assertEquals(VBValue.number(2.0), assign("10 - 4 - 4"));
    }

    @Test
    public void testPlusJoinsStrings() throws Exception {
        assertEquals(VBValue.string("ab"), assign("\"a\" + \"b\""));
    }

    @Test
    public void testArithmeticRequiresNumbers() {
        assertEquals(1002, failureCode("\"a\" * 2", ExpressionEvaluator.Mode.ASSIGNMENT));
        assertEquals(1002, failureCode("True + 1", ExpressionEvaluator.Mode.ASSIGNMENT));
    }

    @Test
    public void testDivisionByZero() {
        assertEquals(1005, failureCode("1 / 0", ExpressionEvaluator.Mode.ASSIGNMENT));
        assertEquals(1005, failureCode("1 \\ 0", ExpressionEvaluator.Mode.ASSIGNMENT));
        assertEquals(1005, failureCode("1 Mod 0", ExpressionEvaluator.Mode.ASSIGNMENT));
    }

    @Test
    public void testTruthiness() throws Exception {
        assertTrue(evaluator.test("1", context));
        assertFalse(evaluator.test("0", context));
        assertTrue(evaluator.test("\"x\"", context));
        assertFalse(evaluator.test("\"\"", context));
        assertFalse(evaluator.test("Null", context));
    }

}
