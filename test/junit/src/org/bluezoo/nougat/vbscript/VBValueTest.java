/*
 * VBValueTest.java
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

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link VBValue}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class VBValueTest {

    @Test
    public void testDisplayFormatting() {
        assertEquals("3", VBValue.number(3.0).toString());
        assertEquals("-3", VBValue.number(-3.0).toString());
        assertEquals("2.5", VBValue.number(2.5).toString());
        assertEquals("0.1", VBValue.number(0.1).toString());
        assertEquals("true", VBValue.TRUE.toString());
        assertEquals("false", VBValue.FALSE.toString());
        assertEquals("null", VBValue.NULL.toString());
        assertEquals("text", VBValue.string("text").toString());
    }

    @Test
    public void testSpecialNumbers() {
        assertEquals("NaN", VBValue.formatNumber(Double.NaN));
        assertEquals("inf", VBValue.formatNumber(Double.POSITIVE_INFINITY));
        assertEquals("-inf", VBValue.formatNumber(Double.NEGATIVE_INFINITY));
        assertEquals("1000000000000000", VBValue.formatNumber(1e15));
    }

    @Test
    public void testEqualsValueSameKind() {
        assertTrue(VBValue.string("a").equalsValue(VBValue.string("a")));
        assertFalse(VBValue.string("a").equalsValue(VBValue.string("A")));
        assertTrue(VBValue.number(1.0).equalsValue(VBValue.number(1.0 + VBValue.EPSILON / 2)));
        assertTrue(VBValue.NULL.equalsValue(VBValue.NULL));
        assertTrue(VBValue.TRUE.equalsValue(VBValue.bool(true)));
    }

    @Test
    public void testEqualsValueAcrossKindsIsFalse() {
        assertFalse(VBValue.string("1").equalsValue(VBValue.number(1.0)));
        assertFalse(VBValue.NULL.equalsValue(VBValue.FALSE));
        assertFalse(VBValue.number(0.0).equalsValue(VBValue.FALSE));
        assertFalse(VBValue.NULL.equalsValue(null));
    }

    @Test
    public void testTruthiness() {
        assertTrue(VBValue.TRUE.isTrue());
        assertFalse(VBValue.FALSE.isTrue());
        assertTrue(VBValue.number(-1.0).isTrue());
        assertFalse(VBValue.number(0.0).isTrue());
        assertTrue(VBValue.string("x").isTrue());
        assertFalse(VBValue.string("").isTrue());
        assertFalse(VBValue.NULL.isTrue());
    }

    @Test
    public void testEqualsAndHashCode() {
        assertEquals(VBValue.number(2.0), VBValue.number(2.0));
        assertEquals(VBValue.number(2.0).hashCode(), VBValue.number(2.0).hashCode());
        assertEquals(VBValue.string("s"), VBValue.string("s"));
        assertNotEquals(VBValue.string("2"), VBValue.number(2.0));
    }

}
