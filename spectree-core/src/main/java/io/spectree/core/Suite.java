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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named container of tests and nested suites, authored either by subclassing:
 * <pre>
 * public class StackSpec extends Suite {
 *     public StackSpec() {
 *         describe("A Stack", () -&gt; {
 *             it("be empty when created", () -&gt; assertTrue(new Stack&lt;&gt;().isEmpty()));
 *             describe("when full", () -&gt; behavesLike(fullStack));
 *         });
 *     }
 * }
 * </pre>
 * or through {@link #named(String)} and the same fluent methods.
 * <p>
 * A suite owns its tests. Nested suites are referenced, not owned, and may be
 * shared between parents as long as no cycle is formed. Authoring is not thread
 * safe and is expected to complete before the suite is run.
 */
public class Suite {

    private final String name;
    private String id;
    private final Branch trunk = Branch.trunk();
    private Branch current = trunk;
    private final Map<String, Example> examplesByName = new LinkedHashMap<>();
    private final Set<String> tags = new LinkedHashSet<>();
    private final List<Suite> nestedSuites = new ArrayList<>();
    private TestBody.Step beforeAll;
    private TestBody.Step afterAll;

    protected Suite() {
        this.name = getClass().getSimpleName();
    }

    protected Suite(String name) {
        this.name = Objects.requireNonNull(name, "name was null");
    }

    public static Suite named(String name) {
        return new Suite(name);
    }

    // ========== Authoring ==========

    /**
     * Opens a description. Tests registered inside the block are prefixed with its name.
     */
    public Suite describe(String description, Runnable block) {
        Objects.requireNonNull(block, "block was null");
        Branch parent = current;
        current = current.describe(description);
        try {
            block.run();
        } finally {
            current = parent;
        }
        return this;
    }

    public Suite it(String rawName, TestBody.Step step) {
        return register(rawName, true, Set.of(), TestBody.of(step));
    }

    public Suite it(String rawName, TestBody body) {
        return register(rawName, true, Set.of(), body);
    }

    public Suite it(String rawName, Set<String> tags, TestBody.Step step) {
        return register(rawName, true, tags, TestBody.of(step));
    }

    public Suite it(String rawName, Set<String> tags, TestBody body) {
        return register(rawName, true, tags, body);
    }

    public Suite specify(String rawName, TestBody.Step step) {
        return register(rawName, false, Set.of(), TestBody.of(step));
    }

    public Suite specify(String rawName, TestBody body) {
        return register(rawName, false, Set.of(), body);
    }

    public Suite specify(String rawName, Set<String> tags, TestBody.Step step) {
        return register(rawName, false, tags, TestBody.of(step));
    }

    public Suite specify(String rawName, Set<String> tags, TestBody body) {
        return register(rawName, false, tags, body);
    }

    /**
     * Materializes the behavior's examples under the current description. Adds all
     * of them or, when any name is taken, none.
     */
    public Suite behavesLike(Behavior behavior) {
        Objects.requireNonNull(behavior, "behavior was null");
        List<Example> examples = behavior.materialize(current);
        Set<String> names = new HashSet<>();
        for (Example example : examples) {
            checkNew(example);
            if (!names.add(example.getFullName())) {
                throw duplicate(example);
            }
        }
        for (Example example : examples) {
            add(example);
        }
        return this;
    }

    private Suite register(String rawName, boolean needsShould, Set<String> tags, TestBody body) {
        add(Example.create(current, rawName, needsShould, tags, body));
        return this;
    }

    private void add(Example example) {
        checkNew(example);
        Example placed = current.add(example);
        examplesByName.put(placed.getFullName(), placed);
    }

    private void checkNew(Example example) {
        if (examplesByName.containsKey(example.getFullName())) {
            throw duplicate(example);
        }
        for (String tag : example.getTags()) {
            checkTag(tag);
        }
    }

    private IllegalArgumentException duplicate(Example example) {
        return new IllegalArgumentException("duplicate test name in suite " + name + ": " + example.getFullName());
    }

    public Suite nest(Suite... suites) {
        for (Suite suite : suites) {
            Objects.requireNonNull(suite, "nested suite was null");
            if (suite == this || suite.reaches(this)) {
                throw new IllegalArgumentException("nesting " + suite.getName() + " in " + name + " would form a cycle");
            }
            nestedSuites.add(suite);
        }
        return this;
    }

    private boolean reaches(Suite target) {
        for (Suite nested : nestedSuites) {
            if (nested == target || nested.reaches(target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Tags that apply to every test of this suite when the filter inherits suite tags.
     */
    public Suite tags(String... values) {
        for (String tag : values) {
            checkTag(tag);
            tags.add(tag);
        }
        return this;
    }

    private static void checkTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be blank");
        }
    }

    public Suite beforeAll(TestBody.Step step) {
        this.beforeAll = Objects.requireNonNull(step, "step was null");
        return this;
    }

    public Suite afterAll(TestBody.Step step) {
        this.afterAll = Objects.requireNonNull(step, "step was null");
        return this;
    }

    public Suite id(String value) {
        this.id = value;
        return this;
    }

    // ========== Accessors ==========

    public String getName() {
        return name;
    }

    /**
     * The rerun identifier: the explicit id, else the class name of a subclass, else null.
     */
    public String getId() {
        if (id != null) {
            return id;
        }
        if (getClass() != Suite.class && !getClass().isAnonymousClass()) {
            return getClass().getName();
        }
        return null;
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    public Branch getTrunk() {
        return trunk;
    }

    /**
     * All tests, depth-first in declaration order.
     */
    public List<Example> getExamples() {
        List<Example> list = new ArrayList<>(examplesByName.size());
        trunk.collectExamples(list);
        return list;
    }

    public Example getExample(String fullName) {
        return examplesByName.get(fullName);
    }

    public List<String> getTestNames() {
        List<String> names = new ArrayList<>();
        for (Example example : getExamples()) {
            names.add(example.getFullName());
        }
        return names;
    }

    public List<Suite> getNestedSuites() {
        return Collections.unmodifiableList(nestedSuites);
    }

    TestBody.Step getBeforeAll() {
        return beforeAll;
    }

    TestBody.Step getAfterAll() {
        return afterAll;
    }

    @Override
    public String toString() {
        return "Suite[" + name + "]";
    }

}
