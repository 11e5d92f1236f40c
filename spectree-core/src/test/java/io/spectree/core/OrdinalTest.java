/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.spectree.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrdinalTest {

    @Test
    void testFirstOrdinal() {
        Ordinal ordinal = new Ordinal(1);
        assertEquals(List.of(1, 0), ordinal.toList());
        assertEquals(2, ordinal.depth());
        assertEquals("Ordinal(1, 0)", ordinal.toString());
    }

    @Test
    void testNegativeRunStamp() {
        assertThrows(IllegalArgumentException.class, () -> new Ordinal(-1));
    }

    @Test
    void testNextAndBranch() {
        Ordinal a = new Ordinal(1);
        Ordinal b = a.next();
        Ordinal c = a.branch();
        assertEquals(List.of(1, 1), b.toList());
        assertEquals(List.of(1, 0, 0), c.toList());
        assertTrue(a.compareTo(c) < 0);
        assertTrue(c.compareTo(b) < 0);
        // value semantics
        assertEquals(List.of(1, 0), a.toList());
    }

    @Test
    void testNextNewOldPair() {
        Ordinal a = new Ordinal(0).next();
        List<Ordinal> pair = a.nextNewOldPair();
        assertEquals(a.branch(), pair.get(0));
        assertEquals(a.next(), pair.get(1));
    }

    @Test
    void testAncestorSortsBeforeDescendants() {
        Ordinal parent = new Ordinal(0).next().next();
        Ordinal child = parent.branch();
        for (int i = 0; i < 5; i++) {
            assertTrue(parent.compareTo(child) < 0);
            Ordinal grandChild = child.branch();
            assertTrue(child.compareTo(grandChild) < 0);
            assertTrue(parent.compareTo(grandChild) < 0);
            child = child.next();
        }
    }

    @Test
    void testBranchThenNextStaysBelowParentNext() {
        Ordinal parent = new Ordinal(3);
        Ordinal next = parent.next();
        Ordinal child = parent.branch();
        for (int i = 0; i < 100; i++) {
            assertTrue(child.compareTo(parent) > 0);
            assertTrue(child.compareTo(next) < 0);
            child = child.next();
        }
    }

    @Test
    void testSorting() {
        Ordinal a = new Ordinal(0);
        Ordinal a1 = a.branch();
        Ordinal a2 = a1.next();
        Ordinal b = a.next();
        List<Ordinal> list = new ArrayList<>(List.of(b, a2, a, a1));
        Collections.sort(list);
        assertEquals(List.of(a, a1, a2, b), list);
    }

    @Test
    void testEqualsAndHashCode() {
        Ordinal a = new Ordinal(2).next();
        Ordinal b = new Ordinal(2).next();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(0, a.compareTo(b));
        assertNotEquals(a, a.branch());
    }

    @Test
    void testNextOverflowFails() {
        Ordinal last = Ordinal.of(1, Integer.MAX_VALUE);
        assertThrows(ArithmeticException.class, last::next);
        // branching is still possible
        assertEquals(List.of(1, Integer.MAX_VALUE, 0), last.branch().toList());
    }

}
