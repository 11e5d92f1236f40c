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
package io.spectree.output;

import io.spectree.core.Reporter;
import io.spectree.core.RunEvent;
import io.spectree.core.RunResult;
import io.spectree.log.LogContext;
import org.slf4j.Logger;

/**
 * Writes one line per test outcome and a summary when the run ends, to the
 * {@code spectree.console} logger.
 */
public class ConsoleReporter implements Reporter {

    private static final Logger logger = LogContext.CONSOLE_LOGGER;

    private static final String LINE = "---------------------------------------------------------";

    private final RunResult tally = new RunResult();

    @Override
    public void report(RunEvent event) {
        tally.report(event);
        switch (event.type()) {
            case SUITE_STARTING:
                logger.info("{}:", event.suiteName());
                break;
            case SUITE_ABORTED:
                logger.error("*** SUITE ABORTED *** {}", event.message());
                break;
            case TEST_SUCCEEDED:
                logger.info("- {}", event.shortName());
                break;
            case TEST_FAILED:
                String location = event.failure().location();
                logger.error("- {} *** FAILED *** {}{}", event.shortName(), event.failure().message(),
                        location == null ? "" : " (" + location + ")");
                break;
            case TEST_IGNORED:
                logger.info("- {} !!! IGNORED !!!", event.shortName());
                break;
            case TEST_PENDING:
                logger.info("- {} (pending{})", event.shortName(),
                        event.message() == null ? "" : ": " + event.message());
                break;
            case RUN_ABORTED:
                logger.error("*** RUN ABORTED *** {}: {}", event.abortReason().getLabel(), event.message());
                summary();
                break;
            case RUN_STOPPED:
                logger.warn("*** RUN STOPPED ***");
                summary();
                break;
            case RUN_COMPLETED:
                summary();
                break;
            default:
                logger.trace("{}", event);
        }
    }

    private void summary() {
        logger.info(LINE);
        logger.info(String.format("elapsed: %6.2fs | expected: %4d", tally.getDurationMillis() / 1000.0,
                tally.getExpectedTestCount()));
        logger.info(String.format("succeeded: %4d | failed: %4d | ignored: %4d | pending: %4d",
                tally.getTestsSucceeded(), tally.getTestsFailed(), tally.getTestsIgnored(), tally.getTestsPending()));
        logger.info(String.format("suites completed: %4d | aborted: %4d",
                tally.getSuitesCompleted(), tally.getSuitesAborted()));
        for (String name : tally.getFailedTests()) {
            logger.info("failed: {}", name);
        }
        logger.info(LINE);
    }

    public RunResult getTally() {
        return tally;
    }

}
