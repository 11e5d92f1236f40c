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
 * Enough information for the {@link Rerunner} to rebuild and run a test again.
 *
 * @param suiteId  identifier understood by a {@link SuiteResolver}
 * @param testName full test name, or null to rerun the whole suite
 */
public record Rerun(String suiteId, String testName) {

    public Rerun {
        Objects.requireNonNull(suiteId, "suiteId was null");
    }

    public static Rerun suite(String suiteId) {
        return new Rerun(suiteId, null);
    }

    public static Rerun test(String suiteId, String testName) {
        return new Rerun(suiteId, Objects.requireNonNull(testName, "testName was null"));
    }

    public boolean isSuite() {
        return testName == null;
    }

}
