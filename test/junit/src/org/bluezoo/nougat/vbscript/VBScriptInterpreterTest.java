/*
 * VBScriptInterpreterTest.java
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
 * Unit tests for {@link VBScriptInterpreter} and the statement executor
 * behind it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class VBScriptInterpreterTest {

    private VBScriptInterpreter interpreter;
    private ExecutionContext context;

    @Before
    public void setUp() {
        interpreter = new VBScriptInterpreter();
        context = new ExecutionContext();
    }

    private String run(String source) throws VBScriptException {
        interpreter.execute(source, context);
        return context.getOutput();
    }

    private VBScriptException failure(String source) {
        try {
            interpreter.execute(source, context);
            fail("Expected failure for: " + source);
            return null;
        } catch (VBScriptException e) {
            return e;
        }
    }

    // ===== Output and assignment =====

    @Test
    public void testResponseWrite() throws Exception {
        assertEquals("World", run("Response.Write(\"World\")"));
    }

    @Test
    public void testResponseWriteWithoutParentheses() throws Exception {
        assertEquals("ab", run("Response.Write \"a\" & \"b\""));
    }

    @Test
    public void testAssignmentLiteralPrecedence() throws Exception {
        run("a = \"5\"\nb = 5\nc = true\nd = TRUE\ne = True");
        assertEquals(VBValue.string("5"), context.getVariable("a"));
        assertEquals(VBValue.number(5.0), context.getVariable("b"));
        assertSame(VBValue.TRUE, context.getVariable("c"));
        assertSame(VBValue.TRUE, context.getVariable("d"));
        assertSame(VBValue.TRUE, context.getVariable("e"));
    }

    @Test
    public void testSetAndLetAssign() throws Exception {
        run("Set a = 1\nLet b = 2");
        assertEquals(VBValue.number(1.0), context.getVariable("a"));
        assertEquals(VBValue.number(2.0), context.getVariable("b"));
    }

    @Test
    public void testDimBindsNull() throws Exception {
        assertEquals("null", run("Dim x, y\nResponse.Write(x)"));
        assertSame(VBValue.NULL, context.getVariable("y"));
    }

    @Test
    public void testUnboundOutputIsValueError() {
        VBScriptException e = failure("Dim x\nResponse.Write(y)");
        assertEquals(1004, e.getCode());
        assertEquals(2, e.getLineNumber());
    }

    @Test
    public void testEffectsBeforeFailureRemain() {
        VBScriptException e = failure("Response.Write(\"a\")\nx = \nResponse.Write(\"b\")");
        assertEquals(2, e.getLineNumber());
        assertEquals("a", context.getOutput());
    }

    @Test
    public void testColonAfterStringStaysOnLine() {
        VBScriptException e = failure("x = \"a\" : y = 1");
        assertEquals(1005, e.getCode());
        assertNull(context.getVariable("x"));
        assertNull(context.getVariable("y"));
    }

    @Test
    public void testColonAfterClosedStringPairSeparates() throws Exception {
        run("x = \"a\" & \"b\" : y = 1");
        assertEquals(VBValue.string("ab"), context.getVariable("x"));
        assertEquals(VBValue.number(1.0), context.getVariable("y"));
    }

    @Test
    public void testMemberAccessIsNotImplemented() {
        assertEquals(1006, failure("Response.Redirect \"/\"").getCode());
    }

    // ===== Conditionals =====

    @Test
    public void testBlockIf() throws Exception {
        String source = "x = 3\n"
            + "If x > 2 Then\n"
            + "Response.Write(\"big\")\n"
            + "Else\n"
            + "Response.Write(\"small\")\n"
            + "End If";
        assertEquals("big", run(source));
    }

    @Test
    public void testBlockIfElseBranch() throws Exception {
        String source = "x = 1\n"
            + "If x > 2 Then\n"
            + "Response.Write(\"big\")\n"
            + "Else\n"
            + "Response.Write(\"small\")\n"
            + "End If";
        assertEquals("small", run(source));
    }

    @Test
    public void testSingleLineIf() throws Exception {
        assertEquals("yes", run("If 1 < 2 Then Response.Write(\"yes\") End If"));
    }

    @Test
    public void testConditionWithUnboundName() {
        assertEquals(1003, failure("If y = 1 Then\nEnd If").getCode());
    }

    // ===== Loops =====

    @Test
    public void testForLoop() throws Exception {
        assertEquals("123", run("For i = 1 To 3\nResponse.Write(i)\nNext"));
        assertEquals(VBValue.number(4.0), context.getVariable("i"));
    }

    @Test
    public void testForLoopNegativeStep() throws Exception {
        assertEquals("321", run("For i = 3 To 1 Step -1\nResponse.Write(i)\nNext"));
    }

    @Test
    public void testForLoopFractionalStep() throws Exception {
        assertEquals("00.51", run("For i = 0 To 1 Step 0.5\nResponse.Write(i)\nNext"));
    }

    @Test
    public void testForLoopEmptyRange() throws Exception {
        assertEquals("", run("For i = 5 To 1\nResponse.Write(i)\nNext"));
        assertEquals(VBValue.number(5.0), context.getVariable("i"));
    }

    @Test
    public void testForLoopStepZero() {
        assertEquals(1005, failure("For i = 1 To 3 Step 0\nNext").getCode());
    }

    @Test
    public void testForLoopBoundMustBeNumber() {
        assertEquals(1002, failure("For i = \"a\" To 3\nNext").getCode());
    }

    @Test
    public void testNestedForLoops() throws Exception {
        String source = "For i = 1 To 2\n"
            + "For j = 1 To 2\n"
            + "Response.Write(i & j & \" \")\n"
            + "Next\n"
            + "Next";
        assertEquals("11 12 21 22 ", run(source));
    }

    @Test
    public void testWhileLoop() throws Exception {
        String source = "n = 0\n"
            + "While n < 3\n"
            + "n = n + 1\n"
            + "Response.Write(n)\n"
            + "Wend";
        assertEquals("123", run(source));
    }

    private static String nestedLoops(int levels) {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < levels; i++) {
            buf.append("For i = 1 To 1\n");
        }
        buf.append("Response.Write(\"in\")\n");
        for (int i = 0; i < levels; i++) {
            buf.append("Next\n");
        }
        return buf.toString();
    }

    @Test
    public void testDeeplyNestedLoops() throws Exception {
        assertEquals("in", run(nestedLoops(20)));
    }

    @Test
    public void testBlockNestingLimit() {
        VBScriptException e = failure(nestedLoops(StatementExecutor.MAX_BLOCK_DEPTH + 1));
        assertEquals(1005, e.getCode());
        assertEquals("", context.getOutput());
    }

    @Test
    public void testInterruptedLoop() {
        Thread.currentThread().interrupt();
        try {
            assertEquals(1005, failure("While True\nWend").getCode());
        } finally {
            Thread.interrupted();
        }
    }

    // ===== Procedures =====

    @Test
    public void testSubCallForms() throws Exception {
        String source = "Sub greet(name)\n"
            + "Response.Write(\"Hi \" & name & \";\")\n"
            + "End Sub\n"
            + "greet \"Ann\"\n"
            + "greet(\"Bob\")\n"
            + "Call greet(\"Cy\")";
        assertEquals("Hi Ann;Hi Bob;Hi Cy;", run(source));
    }

    @Test
    public void testFunctionWithTwoParameters() throws Exception {
        String source = "Public Function show(ByVal a, ByRef b)\n"
            + "Response.Write(a + b)\n"
            + "End Function\n"
            + "show 2, 3";
        assertEquals("5", run(source));
    }

    @Test
    public void testLocalsDiscardedAfterCall() throws Exception {
        String source = "total = 1\n"
            + "Sub work()\n"
            + "total = 2\n"
            + "scratch = 3\n"
            + "End Sub\n"
            + "work";
        run(source);
        assertEquals(VBValue.number(2.0), context.getVariable("total"));
        assertNull(context.getVariable("scratch"));
        assertEquals(0, context.getCallDepth());
    }

    @Test
    public void testParameterShadowsGlobal() throws Exception {
        String source = "x = \"outer\"\n"
            + "Sub show(x)\n"
            + "Response.Write(x)\n"
            + "End Sub\n"
            + "show \"inner\"\n"
            + "Response.Write(x)";
        assertEquals("innerouter", run(source));
    }

    @Test
    public void testUnknownFunction() {
        assertEquals(1005, failure("missing 1").getCode());
    }

    @Test
    public void testCallingVariableIsUnknownFunction() {
        assertEquals(1005, failure("x = 1\nx").getCode());
    }

    @Test
    public void testArgumentCountMismatch() {
        String source = "Sub one(a)\nEnd Sub\none 1, 2";
        VBScriptException e = failure(source);
        assertEquals(1001, e.getCode());
        assertEquals(3, e.getLineNumber());
    }

    @Test
    public void testRunawayRecursion() {
        VBScriptException e = failure("Sub again()\nagain\nEnd Sub\nagain");
        assertEquals(1005, e.getCode());
        assertEquals(0, context.getCallDepth());
    }

    @Test
    public void testErrorInsideFunctionReportsInnerLine() {
        String source = "Sub bad()\n"
            + "Response.Write(undefinedName)\n"
            + "End Sub\n"
            + "bad";
        VBScriptException e = failure(source);
        assertEquals(1004, e.getCode());
        assertEquals(2, e.getLineNumber());
    }

    @Test
    public void testParseWithoutExecuting() throws Exception {
        assertEquals(2, interpreter.parse("Dim x\nx = 1").size());
        assertEquals("", context.getOutput());
    }

}
