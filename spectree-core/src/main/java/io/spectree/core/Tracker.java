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

import java.util.List;
import java.util.Objects;

/**
 * Hands out ordinals for one execution lineage.
 * Fork with {@link #nextTracker()} before passing work to another thread.
 */
public class Tracker {

    private Ordinal currentOrdinal;

    public Tracker() {
        this(new Ordinal(0));
    }

    public Tracker(Ordinal firstOrdinal) {
        this.currentOrdinal = Objects.requireNonNull(firstOrdinal, "firstOrdinal was null");
    }

    /**
     * Returns the current ordinal and advances.
     */
    public synchronized Ordinal nextOrdinal() {
        Ordinal ordinal = currentOrdinal;
        currentOrdinal = currentOrdinal.next();
        return ordinal;
    }

    /**
     * Forks a tracker for a unit of work that will run elsewhere. Its ordinals sort
     * after everything this tracker has handed out so far, and before anything it
     * hands out from now on.
     */
    public synchronized Tracker nextTracker() {
        List<Ordinal> pair = currentOrdinal.nextNewOldPair();
        currentOrdinal = pair.get(1);
        return new Tracker(pair.get(0));
    }

    /**
     * The ordinal the next call to {@link #nextOrdinal()} would return.
     */
    public synchronized Ordinal currentOrdinal() {
        return currentOrdinal;
    }

    @Override
    public synchronized String toString() {
        return "Tracker" + currentOrdinal.toList();
    }

}
