/*
 * ExecutionContextTest.java
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

import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ExecutionContext}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ExecutionContextTest {

    private ExecutionContext context;

    @Before
    public void setUp() {
        context = new ExecutionContext();
    }

    @Test
    public void testNamesAreCaseInsensitive() {
        context.setVariable("Total", VBValue.number(1.0));
        assertEquals(VBValue.number(1.0), context.getVariable("TOTAL"));
        context.setVariable("total", VBValue.number(2.0));
        assertEquals(VBValue.number(2.0), context.getVariable("Total"));
        assertEquals(Arrays.asList("Total"), context.getVariableNames());
    }

    @Test
    public void testUnboundIsNull() {
        assertNull(context.getVariable("missing"));
        assertFalse(context.isBound("missing"));
    }

    @Test
    public void testDeclareOverwritesWithNull() {
        context.setVariable("x", VBValue.string("old"));
        context.declare("x");
        assertSame(VBValue.NULL, context.getVariable("x"));
    }

    @Test
    public void testFrameLookupFallsBackToPage() {
        context.setVariable("g", VBValue.number(1.0));
        context.pushFrame("f");
        assertEquals(VBValue.number(1.0), context.getVariable("g"));
        context.popFrame();
    }

    @Test
    public void testAssignmentInFrameUpdatesExistingGlobal() {
        context.setVariable("g", VBValue.number(1.0));
        context.pushFrame("f");
        context.setVariable("g", VBValue.number(2.0));
        context.popFrame();
        assertEquals(VBValue.number(2.0), context.getVariable("g"));
    }

    @Test
    public void testNewNameInFrameIsLocal() {
        context.pushFrame("f");
        context.setVariable("local", VBValue.number(1.0));
        assertEquals(1, context.getCallDepth());
        context.popFrame();
        assertNull(context.getVariable("local"));
        assertEquals(0, context.getCallDepth());
    }

    @Test
    public void testDeclaredLocalShadowsGlobal() {
        context.setVariable("x", VBValue.string("global"));
        context.pushFrame("f");
        context.declare("x");
        context.setVariable("x", VBValue.string("local"));
        assertEquals(VBValue.string("local"), context.getVariable("x"));
        assertEquals(Arrays.asList("x"), context.getVariableNames());
        context.popFrame();
        assertEquals(VBValue.string("global"), context.getVariable("x"));
    }

    @Test
    public void testFunctionsShareVariableNamespace() {
        context.setVariable("f", VBValue.number(1.0));
        VBValue function = VBValue.function(null);
        context.setFunction("F", function);
        assertSame(function, context.getVariable("f"));
    }

    @Test
    public void testOutputBuffer() {
        context.write("Hello ");
        context.write(null);
        context.write("World");
        assertEquals("Hello World", context.getOutput());
        assertEquals(11, context.getOutputLength());
        assertEquals("Hello World", context.flush());
        assertEquals("", context.getOutput());
    }

}
