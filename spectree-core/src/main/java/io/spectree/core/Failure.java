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
 * Failure detail carried by failed tests and aborted suites or runs.
 *
 * @param kind     assertion failure or unexpected fault
 * @param message  display message, never null
 * @param location source position hint such as {@code StackSpec.java:42}, may be null
 * @param cause    the underlying throwable, may be null
 */
public record Failure(FailureKind kind, String message, String location, Throwable cause) {

    // frames never reported as the failure location
    private static final String[] INTERNAL_PACKAGES = {
            "java.", "javax.", "jdk.", "sun.",
            "org.junit.", "org.opentest4j.", "org.assertj.", "org.hamcrest."
    };

    private static final Class<?>[] INTERNAL_CLASSES = {
            Failure.class, Outcome.class, TestBody.class, SuiteRuntime.class
    };

    public Failure {
        Objects.requireNonNull(kind, "kind was null");
        Objects.requireNonNull(message, "message was null");
    }

    /**
     * A described assertion failure, located at the caller of the method that built it.
     */
    public static Failure assertion(String message) {
        return new Failure(FailureKind.ASSERTION, message, callerLocation(), null);
    }

    /**
     * Classifies a throwable: {@link AssertionError} is an assertion failure,
     * anything else is unexpected.
     */
    public static Failure of(Throwable t) {
        FailureKind kind = t instanceof AssertionError ? FailureKind.ASSERTION : FailureKind.UNEXPECTED;
        return new Failure(kind, messageOf(t), locationOf(t), t);
    }

    public static String messageOf(Throwable t) {
        String message = t.getMessage();
        return message == null ? t.toString() : message;
    }

    static String locationOf(Throwable t) {
        for (StackTraceElement element : t.getStackTrace()) {
            if (!isInternal(element.getClassName())) {
                return format(element.getFileName(), element.getLineNumber());
            }
        }
        StackTraceElement[] trace = t.getStackTrace();
        return trace.length == 0 ? null : format(trace[0].getFileName(), trace[0].getLineNumber());
    }

    private static String callerLocation() {
        return StackWalker.getInstance().walk(frames -> frames
                .filter(f -> !isInternal(f.getClassName()))
                .findFirst()
                .map(f -> format(f.getFileName(), f.getLineNumber()))
                .orElse(null));
    }

    private static boolean isInternal(String className) {
        for (String prefix : INTERNAL_PACKAGES) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        for (Class<?> c : INTERNAL_CLASSES) {
            String name = c.getName();
            if (className.equals(name) || className.startsWith(name + "$")) {
                return true;
            }
        }
        return false;
    }

    private static String format(String fileName, int line) {
        if (fileName == null) {
            return null;
        }
        return line > 0 ? fileName + ":" + line : fileName;
    }

    public boolean isAssertion() {
        return kind == FailureKind.ASSERTION;
    }

}
