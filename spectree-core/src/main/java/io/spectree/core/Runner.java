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

import io.spectree.common.ConfigLoader;
import io.spectree.common.Resources;
import io.spectree.log.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Main entry point for running suites.
 * <p>
 * Example usage:
 * <pre>
 * RunResult result = Runner.suites(new StackSpec(), new QueueSpec())
 *     .excludeTags("Slow")
 *     .reporter(new ConsoleReporter())
 *     .parallel(4)
 *     .run();
 * </pre>
 */
public final class Runner {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private Runner() {
    }

    /**
     * Runs a suite, bracketed by RunStarting and exactly one of RunCompleted,
     * RunStopped or RunAborted.
     *
     * @param testName    full name of the only test to run, or null for everything
     * @param distributor receives nested suites, or null to run them inline
     * @throws NullPointerException before any event if a required argument is null
     */
    public static void run(Suite suite, String testName, Reporter reporter, Stopper stopper, Filter filter,
                           Map<String, Object> config, Distributor distributor, Tracker tracker) {
        run(suite, testName, reporter, stopper, filter, config, distributor, tracker, null);
    }

    static void run(Suite suite, String testName, Reporter reporter, Stopper stopper, Filter filter,
                    Map<String, Object> config, Distributor distributor, Tracker tracker, Runnable beforeTerminal) {
        Objects.requireNonNull(suite, "suite was null");
        Objects.requireNonNull(reporter, "reporter was null");
        Objects.requireNonNull(stopper, "stopper was null");
        Objects.requireNonNull(filter, "filter was null");
        Objects.requireNonNull(config, "config was null");
        Objects.requireNonNull(tracker, "tracker was null");
        CatchReporter catchReporter = CatchReporter.wrap(reporter);
        RunContext context = new RunContext(catchReporter, stopper, filter, config, distributor, tracker);
        catchReporter.report(RunEvent.runStarting(tracker.nextOrdinal(), expectedTestCount(suite, testName, filter)));
        try {
            new SuiteRuntime(suite, context).run(testName);
            if (beforeTerminal != null) {
                beforeTerminal.run();
            }
            reportEnd(catchReporter, stopper, tracker);
        } catch (Throwable t) {
            String message = Resources.get("runAborted", Failure.messageOf(t));
            logger.error(message, t);
            catchReporter.report(RunEvent.runAborted(tracker.nextOrdinal(), AbortReason.UNCATEGORIZED, message, t));
            SuiteRuntime.rethrowIfFatal(t);
        }
    }

    static void reportEnd(Reporter reporter, Stopper stopper, Tracker tracker) {
        // an interrupted caller may leave distributed suites unfinished
        if (stopper.stopRequested() || Thread.currentThread().isInterrupted()) {
            logger.info(Resources.get("runStopped"));
            reporter.report(RunEvent.runStopped(tracker.nextOrdinal()));
        } else {
            reporter.report(RunEvent.runCompleted(tracker.nextOrdinal()));
        }
    }

    static int expectedTestCount(Suite suite, String testName, Filter filter) {
        if (testName == null) {
            return filter.runnableCount(suite);
        }
        Example example = suite.getExample(testName);
        if (example == null) {
            return 0;
        }
        return filter.apply(example.getTags(), suite.getTags()) == Filter.Decision.RUN ? 1 : 0;
    }

    /**
     * Start building a run of one or more root suites.
     */
    public static Builder suites(Suite... suites) {
        return new Builder().suites(suites);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Builder ==========

    public static class Builder {

        private final List<Suite> suites = new ArrayList<>();
        private final List<Reporter> reporters = new ArrayList<>();
        private final Set<String> includeTags = new LinkedHashSet<>();
        private final Set<String> excludeTags = new LinkedHashSet<>();
        private final Map<String, Object> config = new LinkedHashMap<>();

        private boolean reportExcluded;
        private boolean inheritSuiteTags = true;
        private String configPath;
        private int threadCount = 1;
        private Stopper stopper = Stopper.NEVER;
        private String testName;

        Builder() {
        }

        public Builder suites(Suite... values) {
            suites.addAll(Arrays.asList(values));
            return this;
        }

        public Builder suites(Collection<? extends Suite> values) {
            if (values != null) {
                suites.addAll(values);
            }
            return this;
        }

        public Builder includeTags(String... tags) {
            includeTags.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder includeTags(Collection<String> tags) {
            if (tags != null) {
                includeTags.addAll(tags);
            }
            return this;
        }

        public Builder excludeTags(String... tags) {
            excludeTags.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder excludeTags(Collection<String> tags) {
            if (tags != null) {
                excludeTags.addAll(tags);
            }
            return this;
        }

        /**
         * Report tests skipped by an exclude tag as ignored instead of dropping them silently.
         */
        public Builder reportExcluded(boolean value) {
            this.reportExcluded = value;
            return this;
        }

        public Builder inheritSuiteTags(boolean value) {
            this.inheritSuiteTags = value;
            return this;
        }

        /**
         * Entries added here override entries loaded from {@link #configPath(String)}.
         */
        public Builder config(Map<String, Object> values) {
            if (values != null) {
                config.putAll(values);
            }
            return this;
        }

        public Builder config(String key, Object value) {
            config.put(key, value);
            return this;
        }

        /**
         * JSON config file, {@code classpath:} prefix supported.
         */
        public Builder configPath(String path) {
            this.configPath = path;
            return this;
        }

        public Builder parallel(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be at least 1: " + threads);
            }
            this.threadCount = threads;
            return this;
        }

        public Builder reporter(Reporter reporter) {
            reporters.add(Objects.requireNonNull(reporter, "reporter was null"));
            return this;
        }

        public Builder stopper(Stopper value) {
            this.stopper = Objects.requireNonNull(value, "stopper was null");
            return this;
        }

        /**
         * Run only the test with this full name. Needs exactly one root suite.
         */
        public Builder testName(String value) {
            this.testName = value;
            return this;
        }

        public RunResult run() {
            if (suites.isEmpty()) {
                throw new IllegalStateException("no suites to run");
            }
            if (testName != null && suites.size() > 1) {
                throw new IllegalStateException("a test name needs exactly one suite, got " + suites.size());
            }
            Suite root = suites.size() == 1 ? suites.get(0) : Suite.named("").nest(suites.toArray(new Suite[0]));
            Map<String, Object> runConfig = new LinkedHashMap<>();
            if (configPath != null) {
                runConfig.putAll(ConfigLoader.load(configPath));
            }
            runConfig.putAll(config);
            Filter filter = Filter.of(includeTags, excludeTags)
                    .reportExcluded(reportExcluded)
                    .inheritSuiteTags(inheritSuiteTags);
            RunResult result = new RunResult();
            List<Reporter> all = new ArrayList<>();
            all.add(result);
            all.addAll(reporters);
            CatchReporter reporter = CatchReporter.wrap(all.size() == 1 ? result : new DispatchReporter(all));
            logger.debug("running {} suite(s), threads: {}, {}", suites.size(), threadCount, filter);
            if (threadCount > 1) {
                ConcurrentDistributor distributor =
                        new ConcurrentDistributor(reporter, stopper, filter, runConfig, threadCount);
                try {
                    Runner.run(root, testName, reporter, stopper, filter, runConfig, distributor, new Tracker(),
                            distributor::awaitCompletion);
                } finally {
                    distributor.close();
                    reporter.dispose();
                }
            } else {
                try {
                    Runner.run(root, testName, reporter, stopper, filter, runConfig, null, new Tracker(), null);
                } finally {
                    reporter.dispose();
                }
            }
            return result;
        }

    }

}
