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

import java.util.Objects;

/**
 * Result of running a test body.
 * Either {@link Passed}, {@link Failed} with a {@link Failure}, or {@link Pending}.
 */
public sealed interface Outcome permits Outcome.Passed, Outcome.Failed, Outcome.Pending {

    Passed PASSED = new Passed();

    record Passed() implements Outcome {
    }

    record Failed(Failure failure) implements Outcome {

        public Failed {
            Objects.requireNonNull(failure, "failure was null");
        }

    }

    /**
     * The test exists but has nothing to verify yet.
     */
    record Pending(String reason) implements Outcome {
    }

    static Outcome passed() {
        return PASSED;
    }

    /**
     * An assertion failure located at the line that called this method.
     */
    static Outcome failed(String message) {
        return new Failed(Failure.assertion(message));
    }

    static Outcome failed(Throwable t) {
        return new Failed(Failure.of(t));
    }

    static Outcome pending() {
        return new Pending(null);
    }

    static Outcome pending(String reason) {
        return new Pending(reason);
    }

    /**
     * Passed when the condition holds, otherwise an assertion failure with the message.
     */
    static Outcome check(boolean condition, String message) {
        return condition ? PASSED : failed(message);
    }

    default boolean isPassed() {
        return this instanceof Passed;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

}
