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

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void testPassed() {
        assertTrue(Outcome.passed().isPassed());
        assertSame(Outcome.PASSED, Outcome.check(true, "unused"));
    }

    @Test
    void testFailedIsLocatedAtCaller() {
        Outcome outcome = Outcome.failed("wrong");
        assertTrue(outcome.isFailed());
        Failure failure = ((Outcome.Failed) outcome).failure();
        assertEquals(FailureKind.ASSERTION, failure.kind());
        assertEquals("wrong", failure.message());
        assertTrue(failure.location().startsWith("OutcomeTest.java:"), failure.location());
        assertNull(failure.cause());
    }

    @Test
    void testFailedFromThrowable() {
        Failure assertion = Failure.of(new AssertionError("expected 1"));
        assertTrue(assertion.isAssertion());
        assertTrue(assertion.location().startsWith("OutcomeTest.java:"), assertion.location());
        Failure unexpected = Failure.of(new NullPointerException());
        assertEquals(FailureKind.UNEXPECTED, unexpected.kind());
        // no message falls back to the exception itself
        assertEquals("java.lang.NullPointerException", unexpected.message());
    }

    @Test
    void testPending() {
        Outcome outcome = Outcome.pending();
        assertFalse(outcome.isPassed());
        assertFalse(outcome.isFailed());
        assertNull(((Outcome.Pending) outcome).reason());
        assertEquals("todo", ((Outcome.Pending) Outcome.pending("todo")).reason());
    }

}
