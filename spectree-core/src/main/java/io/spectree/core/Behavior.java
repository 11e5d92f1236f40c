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
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A reusable, composable set of test templates. Registered examples are kept in
 * registration order and only turn into {@link Example}s when materialized under a
 * branch, so the same behavior can be shared by several suites and descriptions.
 * <pre>
 * Behavior nonEmptyStack = new Behavior()
 *         .it("be non-empty", () -&gt; assertFalse(stack.isEmpty()))
 *         .it("return the top item on peek", ...);
 * </pre>
 */
public class Behavior {

    private final List<SharedExample> sharedExamples = new ArrayList<>();

    public Behavior specify(String rawName, TestBody.Step step) {
        return specify(rawName, Set.of(), TestBody.of(step));
    }

    public Behavior specify(String rawName, TestBody body) {
        return specify(rawName, Set.of(), body);
    }

    public Behavior specify(String rawName, Set<String> tags, TestBody body) {
        return registerExample(rawName, false, tags, body);
    }

    public Behavior it(String rawName, TestBody.Step step) {
        return it(rawName, Set.of(), TestBody.of(step));
    }

    public Behavior it(String rawName, TestBody body) {
        return it(rawName, Set.of(), body);
    }

    public Behavior it(String rawName, Set<String> tags, TestBody body) {
        return registerExample(rawName, true, tags, body);
    }

    protected Behavior registerExample(String rawName, boolean needsShould, Set<String> tags, TestBody body) {
        Objects.requireNonNull(tags, "tags was null");
        sharedExamples.add(new SharedExample(rawName, needsShould, tags, body));
        return this;
    }

    /**
     * Appends the examples of another behavior, in their registration order.
     */
    public Behavior behavesLike(Behavior other) {
        Objects.requireNonNull(other, "other was null");
        sharedExamples.addAll(new ArrayList<>(other.sharedExamples));
        return this;
    }

    /**
     * Creates fresh examples named for the branch. Positions are left unassigned.
     */
    public List<Example> materialize(Branch branch) {
        Objects.requireNonNull(branch, "branch was null");
        List<Example> list = new ArrayList<>(sharedExamples.size());
        for (SharedExample shared : sharedExamples) {
            list.add(shared.materialize(branch));
        }
        return list;
    }

    public List<SharedExample> getSharedExamples() {
        return Collections.unmodifiableList(sharedExamples);
    }

    public int size() {
        return sharedExamples.size();
    }

}
