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

/**
 * Why a run was aborted before or while rebuilding a suite.
 */
public enum AbortReason {

    IDENTIFIER_NOT_FOUND("identifier-not-found"),
    INSTANTIATION_NOT_PERMITTED("instantiation-not-permitted"),
    INSTANTIATION_FAILED("instantiation-failed"),
    ENTRY_POINT_MISSING("required-entry-point-missing"),
    ACCESS_DENIED("access-denied"),
    DEPENDENCY_MISSING("dependency-missing"),
    UNCATEGORIZED("uncategorized");

    private final String label;

    AbortReason(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

}
