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

public enum RunEventType {

    RUN_STARTING,
    RUN_COMPLETED,
    RUN_STOPPED,
    RUN_ABORTED,
    SUITE_STARTING,
    SUITE_COMPLETED,
    SUITE_ABORTED,
    TEST_STARTING,
    TEST_SUCCEEDED,
    TEST_FAILED,
    TEST_IGNORED,
    TEST_PENDING;

    public boolean isTerminal() {
        return this == RUN_COMPLETED || this == RUN_STOPPED || this == RUN_ABORTED;
    }

    public boolean isTestOutcome() {
        return this == TEST_SUCCEEDED || this == TEST_FAILED || this == TEST_IGNORED || this == TEST_PENDING;
    }

}
