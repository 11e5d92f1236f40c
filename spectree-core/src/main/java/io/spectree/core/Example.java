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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single named, taggable test with a deferred body.
 */
public final class Example implements Node {

    /**
     * Position of an example that no branch has taken yet.
     */
    public static final int UNASSIGNED = -1;

    private final Branch parent;
    private final String fullName;
    private final String rawName;
    private final boolean needsShould;
    private final String shortName;
    private final int positionIndex;
    private final TestBody body;
    private final Set<String> tags;

    private Example(Branch parent, String fullName, String rawName, boolean needsShould, String shortName,
                    int positionIndex, TestBody body, Set<String> tags) {
        this.parent = parent;
        this.fullName = fullName;
        this.rawName = rawName;
        this.needsShould = needsShould;
        this.shortName = shortName;
        this.positionIndex = positionIndex;
        this.body = body;
        this.tags = tags;
    }

    /**
     * Creates an example for the branch, deriving its names from the branch prefix.
     * The position stays {@link #UNASSIGNED} until the branch adds it.
     */
    public static Example create(Branch parent, String rawName, boolean needsShould, Set<String> tags, TestBody body) {
        Objects.requireNonNull(parent, "parent was null");
        Objects.requireNonNull(rawName, "rawName was null");
        Objects.requireNonNull(tags, "tags was null");
        Objects.requireNonNull(body, "body was null");
        return new Example(parent, parent.fullName(rawName, needsShould), rawName, needsShould,
                parent.shortName(rawName, needsShould), UNASSIGNED, body,
                Collections.unmodifiableSet(new LinkedHashSet<>(tags)));
    }

    Example withPosition(int index) {
        return new Example(parent, fullName, rawName, needsShould, shortName, index, body, tags);
    }

    @Override
    public Branch getParent() {
        return parent;
    }

    public String getFullName() {
        return fullName;
    }

    public String getRawName() {
        return rawName;
    }

    public boolean isNeedsShould() {
        return needsShould;
    }

    public String getShortName() {
        return shortName;
    }

    public int getPositionIndex() {
        return positionIndex;
    }

    public TestBody getBody() {
        return body;
    }

    public Set<String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return "Example[" + fullName + (tags.isEmpty() ? "" : " " + tags) + "]";
    }

}
