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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Include / exclude tag policy deciding whether a test runs.
 * <p>
 * Rules, evaluated in this order:
 * <ul>
 *   <li>any exclude tag present - skip (reported as ignored when {@code reportExcluded} is on)</li>
 *   <li>include tags given and none present - skip</li>
 *   <li>otherwise - run</li>
 * </ul>
 * An empty include set means there is no include restriction. When
 * {@code inheritSuiteTags} is on (the default) the tags of the owning suite count
 * as tags of each of its tests.
 */
public final class Filter {

    /**
     * Tag for the explicit "ignore" convention used by {@link #defaults()}.
     */
    public static final String IGNORE_TAG = "ignore";

    public enum Decision {
        RUN,
        SKIP,
        SKIP_AND_REPORT
    }

    private final Set<String> includeTags;
    private final Set<String> excludeTags;
    private final boolean reportExcluded;
    private final boolean inheritSuiteTags;

    private Filter(Set<String> includeTags, Set<String> excludeTags, boolean reportExcluded, boolean inheritSuiteTags) {
        this.includeTags = includeTags;
        this.excludeTags = excludeTags;
        this.reportExcluded = reportExcluded;
        this.inheritSuiteTags = inheritSuiteTags;
    }

    public static Filter of(Collection<String> includeTags, Collection<String> excludeTags) {
        return new Filter(copy(includeTags, "includeTags"), copy(excludeTags, "excludeTags"), false, true);
    }

    /**
     * Runs everything except tests tagged {@value #IGNORE_TAG}, which are reported as ignored.
     */
    public static Filter defaults() {
        return new Filter(Collections.emptySet(), Set.of(IGNORE_TAG), true, true);
    }

    public static Filter none() {
        return new Filter(Collections.emptySet(), Collections.emptySet(), false, true);
    }

    private static Set<String> copy(Collection<String> tags, String what) {
        Objects.requireNonNull(tags, what + " was null");
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                throw new IllegalArgumentException(what + " contains a blank tag: " + tags);
            }
        }
        return Collections.unmodifiableSet(new HashSet<>(tags));
    }

    public Filter reportExcluded(boolean value) {
        return new Filter(includeTags, excludeTags, value, inheritSuiteTags);
    }

    public Filter inheritSuiteTags(boolean value) {
        return new Filter(includeTags, excludeTags, reportExcluded, value);
    }

    public Decision apply(Set<String> testTags) {
        return apply(testTags, Collections.emptySet());
    }

    public Decision apply(Set<String> testTags, Set<String> suiteTags) {
        Objects.requireNonNull(testTags, "testTags was null");
        Objects.requireNonNull(suiteTags, "suiteTags was null");
        Set<String> tags = testTags;
        if (inheritSuiteTags && !suiteTags.isEmpty()) {
            tags = new HashSet<>(testTags);
            tags.addAll(suiteTags);
        }
        if (intersects(excludeTags, tags)) {
            return reportExcluded ? Decision.SKIP_AND_REPORT : Decision.SKIP;
        }
        if (!includeTags.isEmpty() && !intersects(includeTags, tags)) {
            return Decision.SKIP;
        }
        return Decision.RUN;
    }

    /**
     * Number of tests in the suite and its nested suites that this filter would run.
     */
    public int runnableCount(Suite suite) {
        int count = 0;
        for (Example example : suite.getExamples()) {
            if (apply(example.getTags(), suite.getTags()) == Decision.RUN) {
                count++;
            }
        }
        for (Suite nested : suite.getNestedSuites()) {
            count += runnableCount(nested);
        }
        return count;
    }

    private static boolean intersects(Set<String> a, Set<String> b) {
        for (String s : a) {
            if (b.contains(s)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getIncludeTags() {
        return includeTags;
    }

    public Set<String> getExcludeTags() {
        return excludeTags;
    }

    public boolean isReportExcluded() {
        return reportExcluded;
    }

    public boolean isInheritSuiteTags() {
        return inheritSuiteTags;
    }

    @Override
    public String toString() {
        return "Filter{include=" + includeTags + ", exclude=" + excludeTags
                + ", reportExcluded=" + reportExcluded + ", inheritSuiteTags=" + inheritSuiteTags + '}';
    }

}
