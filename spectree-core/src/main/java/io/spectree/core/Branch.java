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

import io.spectree.common.Resources;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named grouping of examples and nested branches. The root of a suite is an
 * unnamed trunk; every {@code describe} adds a child branch.
 * Children are kept in declaration order and are owned by this branch.
 */
public final class Branch implements Node {

    private final Branch parent;
    private final String name;
    private final List<Node> children = new ArrayList<>();
    private int exampleCount;

    private Branch(Branch parent, String name) {
        this.parent = parent;
        this.name = name;
    }

    public static Branch trunk() {
        return new Branch(null, "");
    }

    Branch describe(String name) {
        Objects.requireNonNull(name, "name was null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("description must not be blank");
        }
        Branch branch = new Branch(this, name);
        children.add(branch);
        return branch;
    }

    /**
     * Takes ownership of an example created for this branch and gives it its position.
     */
    Example add(Example example) {
        if (example.getParent() != this) {
            throw new IllegalArgumentException("example was created for another branch: " + example.getFullName());
        }
        Example placed = example.withPosition(exampleCount++);
        children.add(placed);
        return placed;
    }

    /**
     * The contextual name used to prefix test names, e.g. {@code "A Stack when empty"}.
     */
    public String getPrefix() {
        if (parent == null) {
            return "";
        }
        String parentPrefix = parent.getPrefix();
        if (parentPrefix.isEmpty()) {
            return name;
        }
        return Resources.get("prefixSuffix", parentPrefix, name).trim();
    }

    public String fullName(String rawName, boolean needsShould) {
        String prefix = getPrefix();
        if (prefix.isEmpty()) {
            return needsShould ? Resources.get("itShould", rawName) : rawName;
        }
        return needsShould
                ? Resources.get("prefixShouldSuffix", prefix, rawName)
                : Resources.get("prefixSuffix", prefix, rawName);
    }

    public String shortName(String rawName, boolean needsShould) {
        if (getPrefix().isEmpty()) {
            return needsShould ? Resources.get("itShould", rawName) : rawName;
        }
        return needsShould ? Resources.get("should", rawName) : rawName;
    }

    void collectExamples(List<Example> list) {
        for (Node node : children) {
            if (node instanceof Example) {
                list.add((Example) node);
            } else {
                ((Branch) node).collectExamples(list);
            }
        }
    }

    public boolean isTrunk() {
        return parent == null;
    }

    @Override
    public Branch getParent() {
        return parent;
    }

    public String getName() {
        return name;
    }

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return isTrunk() ? "Branch[trunk]" : "Branch[" + getPrefix() + "]";
    }

}
