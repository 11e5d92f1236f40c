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
import io.spectree.log.LogContext;
import org.slf4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reruns a suite, or a single test of it, identified by a {@link Rerun} descriptor.
 * <p>
 * Resolution failures are reported as one RunAborted event carrying an
 * {@link AbortReason}, never thrown to the caller.
 */
public class Rerunner {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final SuiteResolver resolver;

    public Rerunner(SuiteResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver was null");
    }

    public Ordinal rerun(Rerun rerun, Reporter reporter, Stopper stopper, Filter filter,
                         Map<String, Object> config, Distributor distributor, Ordinal startOrdinal) {
        return rerun(rerun.suiteId(), rerun.testName(), reporter, stopper, filter, config, distributor, startOrdinal);
    }

    /**
     * @param testName     full name of the test to rerun, or null for the whole suite
     * @param startOrdinal first ordinal of the rerun events
     * @return the ordinal following the last event fired
     */
    public Ordinal rerun(String suiteId, String testName, Reporter reporter, Stopper stopper,
                         Set<String> includeTags, Set<String> excludeTags, Map<String, Object> config,
                         Distributor distributor, Ordinal startOrdinal) {
        return rerun(suiteId, testName, reporter, stopper, Filter.of(includeTags, excludeTags),
                config, distributor, startOrdinal);
    }

    public Ordinal rerun(String suiteId, String testName, Reporter reporter, Stopper stopper, Filter filter,
                         Map<String, Object> config, Distributor distributor, Ordinal startOrdinal) {
        Objects.requireNonNull(suiteId, "suiteId was null");
        Objects.requireNonNull(reporter, "reporter was null");
        Objects.requireNonNull(stopper, "stopper was null");
        Objects.requireNonNull(filter, "filter was null");
        Objects.requireNonNull(config, "config was null");
        Objects.requireNonNull(startOrdinal, "startOrdinal was null");
        CatchReporter catchReporter = CatchReporter.wrap(reporter);
        Tracker tracker = new Tracker(startOrdinal);
        try {
            Suite suite = resolver.resolve(suiteId);
            RunContext context = new RunContext(catchReporter, stopper, filter, config, distributor, tracker);
            catchReporter.report(RunEvent.runStarting(tracker.nextOrdinal(),
                    Runner.expectedTestCount(suite, testName, filter)));
            new SuiteRuntime(suite, context).run(testName);
            Runner.reportEnd(catchReporter, stopper, tracker);
        } catch (SuiteResolutionException e) {
            logger.warn("rerun of {} aborted ({}): {}", suiteId, e.getReason().getLabel(), e.getMessage());
            Throwable cause = e.getCause() == null ? e : e.getCause();
            catchReporter.report(RunEvent.runAborted(tracker.nextOrdinal(), e.getReason(), e.getMessage(), cause));
        } catch (Throwable t) {
            String message = Resources.get("bigProblems", t.getClass().getName(), Failure.messageOf(t));
            logger.error(message, t);
            catchReporter.report(RunEvent.runAborted(tracker.nextOrdinal(), AbortReason.UNCATEGORIZED, message, t));
        }
        return tracker.currentOrdinal();
    }

}
