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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a {@link SuiteRuntime} needs besides the suite itself.
 *
 * @param reporter    fault isolated reporter all events go to
 * @param stopper     polled before each nested suite and test
 * @param filter      decides which tests run
 * @param config      read-only map handed to every test body
 * @param distributor receives nested suites for concurrent execution, null to run them inline
 * @param tracker     ordinal source for this lineage
 */
public record RunContext(
        CatchReporter reporter,
        Stopper stopper,
        Filter filter,
        Map<String, Object> config,
        Distributor distributor,
        Tracker tracker
) {

    public RunContext {
        Objects.requireNonNull(reporter, "reporter was null");
        Objects.requireNonNull(stopper, "stopper was null");
        Objects.requireNonNull(filter, "filter was null");
        Objects.requireNonNull(config, "config was null");
        Objects.requireNonNull(tracker, "tracker was null");
        config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public RunContext withTracker(Tracker value) {
        return new RunContext(reporter, stopper, filter, config, distributor, value);
    }

}
