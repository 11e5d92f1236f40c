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

import java.util.Objects;

/**
 * Runs one suite: its nested suites, then its own tests, reporting every step.
 * <p>
 * A suite run is bracketed by SuiteStarting and either SuiteCompleted or
 * SuiteAborted. Faults in test bodies are contained per test. Faults in the
 * before / after hooks, or a request for a test the suite does not have, abort
 * the suite. A {@link VirtualMachineError} is reported and then rethrown.
 */
public class SuiteRuntime {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Suite suite;
    private final RunContext context;

    public SuiteRuntime(Suite suite, RunContext context) {
        this.suite = Objects.requireNonNull(suite, "suite was null");
        this.context = Objects.requireNonNull(context, "context was null");
    }

    /**
     * @param testName full name of the only test to run, or null for the whole suite
     */
    public void run(String testName) {
        report(RunEvent.suiteStarting(nextOrdinal(), suite));
        try {
            runStep(suite.getBeforeAll());
        } catch (Throwable t) {
            rethrowIfFatal(t);
            aborted(t);
            return;
        }
        Throwable error = null;
        try {
            execute(testName);
        } catch (Throwable t) {
            rethrowIfFatal(t);
            error = t;
        }
        try {
            runStep(suite.getAfterAll());
        } catch (Throwable t) {
            rethrowIfFatal(t);
            if (error == null) {
                error = t;
            } else {
                error.addSuppressed(t);
            }
        }
        if (error == null) {
            report(RunEvent.suiteCompleted(nextOrdinal(), suite));
        } else {
            aborted(error);
        }
    }

    /**
     * Without a test name runs nested suites then tests, with one runs only that test.
     */
    public void execute(String testName) {
        if (testName == null) {
            runNestedSuites();
        }
        runTests(testName);
    }

    void runNestedSuites() {
        Distributor distributor = context.distributor();
        for (Suite nested : suite.getNestedSuites()) {
            if (context.stopper().stopRequested()) {
                logger.debug("stop requested, skipping remaining nested suites of {}", suite.getName());
                return;
            }
            if (distributor != null) {
                distributor.put(nested, context.tracker().nextTracker());
            } else {
                new SuiteRuntime(nested, context).run(null);
            }
        }
    }

    void runTests(String testName) {
        if (testName != null) {
            Example example = suite.getExample(testName);
            if (example == null) {
                throw new IllegalArgumentException(Resources.get("testNotFound", suite.getName(), testName));
            }
            if (!context.stopper().stopRequested()) {
                runIfSelected(example);
            }
            return;
        }
        for (Example example : suite.getExamples()) {
            if (context.stopper().stopRequested()) {
                logger.debug("stop requested, skipping remaining tests of {}", suite.getName());
                return;
            }
            runIfSelected(example);
        }
    }

    private void runIfSelected(Example example) {
        switch (context.filter().apply(example.getTags(), suite.getTags())) {
            case RUN:
                runTest(example);
                break;
            case SKIP_AND_REPORT:
                report(RunEvent.testIgnored(nextOrdinal(), suite, example));
                break;
            default:
                logger.trace("filtered out: {}", example.getFullName());
        }
    }

    void runTest(Example example) {
        report(RunEvent.testStarting(nextOrdinal(), suite, example));
        Outcome outcome;
        try {
            outcome = example.getBody().run(context.config());
            if (outcome == null) {
                outcome = new Outcome.Failed(new Failure(FailureKind.UNEXPECTED,
                        "test body returned no outcome", null, null));
            }
        } catch (Throwable t) {
            if (t instanceof VirtualMachineError) {
                report(RunEvent.testFailed(nextOrdinal(), suite, example, Failure.of(t)));
                throw (VirtualMachineError) t;
            }
            outcome = Outcome.failed(t);
        }
        if (outcome instanceof Outcome.Failed) {
            Failure failure = ((Outcome.Failed) outcome).failure();
            report(RunEvent.testFailed(nextOrdinal(), suite, example, failure));
        } else if (outcome instanceof Outcome.Pending) {
            report(RunEvent.testPending(nextOrdinal(), suite, example, ((Outcome.Pending) outcome).reason()));
        } else {
            report(RunEvent.testSucceeded(nextOrdinal(), suite, example));
        }
    }

    private void aborted(Throwable t) {
        String message = Resources.get("suiteAborted", suite.getName(), Failure.messageOf(t));
        logger.warn(message);
        logger.debug("suite abort cause", t);
        report(RunEvent.suiteAborted(nextOrdinal(), suite, message, t));
    }

    private static void runStep(TestBody.Step step) throws Exception {
        if (step != null) {
            step.run();
        }
    }

    static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError) {
            throw (VirtualMachineError) t;
        }
    }

    private Ordinal nextOrdinal() {
        return context.tracker().nextOrdinal();
    }

    private void report(RunEvent event) {
        context.reporter().report(event);
    }

    public Suite getSuite() {
        return suite;
    }

}
