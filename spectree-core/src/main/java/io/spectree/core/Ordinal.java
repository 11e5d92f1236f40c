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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable position of an event within a run.
 * <p>
 * An ordinal is a sequence of non-negative stamps compared lexicographically,
 * where a sequence that is a prefix of another sorts first. Events produced on
 * different threads can be merged into the order a sequential run would have
 * produced by sorting on their ordinals.
 * <pre>
 * Ordinal a = new Ordinal(1);   // [1, 0]
 * Ordinal b = a.next();         // [1, 1]
 * Ordinal c = a.branch();       // [1, 0, 0]  a &lt; c &lt; b
 * </pre>
 */
public final class Ordinal implements Comparable<Ordinal> {

    private final int[] stamps;

    /**
     * Creates the first ordinal of a run, {@code [runStamp, 0]}.
     */
    public Ordinal(int runStamp) {
        this(new int[]{checkStamp(runStamp), 0});
    }

    private Ordinal(int[] stamps) {
        this.stamps = stamps;
    }

    static Ordinal of(int... stamps) {
        if (stamps.length == 0) {
            throw new IllegalArgumentException("an ordinal needs at least one stamp");
        }
        for (int stamp : stamps) {
            checkStamp(stamp);
        }
        return new Ordinal(stamps.clone());
    }

    private static int checkStamp(int stamp) {
        if (stamp < 0) {
            throw new IllegalArgumentException("stamp must not be negative: " + stamp);
        }
        return stamp;
    }

    /**
     * The immediate successor at the same depth.
     *
     * @throws ArithmeticException if the last stamp is already {@link Integer#MAX_VALUE}
     */
    public Ordinal next() {
        int[] copy = Arrays.copyOf(stamps, stamps.length);
        copy[copy.length - 1] = Math.addExact(copy[copy.length - 1], 1);
        return new Ordinal(copy);
    }

    /**
     * A child lineage that sorts after this ordinal and before {@link #next()}.
     */
    public Ordinal branch() {
        int[] copy = Arrays.copyOf(stamps, stamps.length + 1);
        // new trailing component is already zero
        return new Ordinal(copy);
    }

    /**
     * Returns {@code [branch(), next()]}: the first ordinal for a newly dispatched
     * unit of work, and the ordinal this lineage continues with.
     */
    public List<Ordinal> nextNewOldPair() {
        return List.of(branch(), next());
    }

    public List<Integer> toList() {
        List<Integer> list = new ArrayList<>(stamps.length);
        for (int stamp : stamps) {
            list.add(stamp);
        }
        return Collections.unmodifiableList(list);
    }

    public int depth() {
        return stamps.length;
    }

    @Override
    public int compareTo(Ordinal that) {
        int length = Math.min(stamps.length, that.stamps.length);
        for (int i = 0; i < length; i++) {
            int diff = Integer.compare(stamps[i], that.stamps[i]);
            if (diff != 0) {
                return diff;
            }
        }
        return Integer.compare(stamps.length, that.stamps.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ordinal)) {
            return false;
        }
        return Arrays.equals(stamps, ((Ordinal) o).stamps);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(stamps);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Ordinal(");
        for (int i = 0; i < stamps.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(stamps[i]);
        }
        return sb.append(')').toString();
    }

}
