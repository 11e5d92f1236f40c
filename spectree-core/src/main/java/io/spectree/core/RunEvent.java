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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An event fired during a run. Immutable once created.
 * <p>
 * Events are created through the static factories so that each kind carries the
 * fields that make sense for it. Sorting events by {@link #ordinal()} gives the
 * order a sequential run would have produced, even when nested suites ran on
 * other threads.
 *
 * @param type              the event kind
 * @param ordinal           position of this event within the run
 * @param suiteName         suite display name, null for run level events
 * @param suiteId           suite identifier, null if the suite has none
 * @param testName          full test name, null for suite and run level events
 * @param shortName         test name relative to its enclosing description
 * @param message           pending reason, abort message and so on, may be null
 * @param failure           failure detail for failed tests and aborts, may be null
 * @param abortReason       category of a run abort, null otherwise
 * @param rerun             how to rerun the test or suite, may be null
 * @param expectedTestCount number of tests expected to run, only on RUN_STARTING
 * @param threadName        name of the thread that fired the event
 * @param timeStamp         wall clock time in millis
 */
public record RunEvent(
        RunEventType type,
        Ordinal ordinal,
        String suiteName,
        String suiteId,
        String testName,
        String shortName,
        String message,
        Failure failure,
        AbortReason abortReason,
        Rerun rerun,
        Integer expectedTestCount,
        String threadName,
        long timeStamp
) implements Comparable<RunEvent> {

    public RunEvent {
        Objects.requireNonNull(type, "type was null");
        Objects.requireNonNull(ordinal, "ordinal was null");
    }

    private static RunEvent of(RunEventType type, Ordinal ordinal, String suiteName, String suiteId,
                               String testName, String shortName, String message, Failure failure,
                               AbortReason abortReason, Rerun rerun, Integer expectedTestCount) {
        return new RunEvent(type, ordinal, suiteName, suiteId, testName, shortName, message, failure,
                abortReason, rerun, expectedTestCount, Thread.currentThread().getName(), System.currentTimeMillis());
    }

    // ========== Run ==========

    public static RunEvent runStarting(Ordinal ordinal, int expectedTestCount) {
        return of(RunEventType.RUN_STARTING, ordinal, null, null, null, null, null, null, null, null, expectedTestCount);
    }

    public static RunEvent runCompleted(Ordinal ordinal) {
        return of(RunEventType.RUN_COMPLETED, ordinal, null, null, null, null, null, null, null, null, null);
    }

    public static RunEvent runStopped(Ordinal ordinal) {
        return of(RunEventType.RUN_STOPPED, ordinal, null, null, null, null, null, null, null, null, null);
    }

    public static RunEvent runAborted(Ordinal ordinal, AbortReason reason, String message, Throwable cause) {
        Failure failure = new Failure(FailureKind.UNEXPECTED, message,
                cause == null ? null : Failure.locationOf(cause), cause);
        return of(RunEventType.RUN_ABORTED, ordinal, null, null, null, null, message, failure, reason, null, null);
    }

    // ========== Suite ==========

    public static RunEvent suiteStarting(Ordinal ordinal, Suite suite) {
        return of(RunEventType.SUITE_STARTING, ordinal, suite.getName(), suite.getId(), null, null, null, null, null,
                suiteRerun(suite), null);
    }

    public static RunEvent suiteCompleted(Ordinal ordinal, Suite suite) {
        return of(RunEventType.SUITE_COMPLETED, ordinal, suite.getName(), suite.getId(), null, null, null, null, null,
                suiteRerun(suite), null);
    }

    public static RunEvent suiteAborted(Ordinal ordinal, Suite suite, String message, Throwable cause) {
        Failure failure = new Failure(FailureKind.UNEXPECTED, message,
                cause == null ? null : Failure.locationOf(cause), cause);
        return of(RunEventType.SUITE_ABORTED, ordinal, suite.getName(), suite.getId(), null, null, message, failure,
                null, suiteRerun(suite), null);
    }

    // ========== Test ==========

    public static RunEvent testStarting(Ordinal ordinal, Suite suite, Example example) {
        return test(RunEventType.TEST_STARTING, ordinal, suite, example, null, null);
    }

    public static RunEvent testSucceeded(Ordinal ordinal, Suite suite, Example example) {
        return test(RunEventType.TEST_SUCCEEDED, ordinal, suite, example, null, null);
    }

    public static RunEvent testFailed(Ordinal ordinal, Suite suite, Example example, Failure failure) {
        return test(RunEventType.TEST_FAILED, ordinal, suite, example, failure.message(), failure);
    }

    public static RunEvent testIgnored(Ordinal ordinal, Suite suite, Example example) {
        return test(RunEventType.TEST_IGNORED, ordinal, suite, example, null, null);
    }

    public static RunEvent testPending(Ordinal ordinal, Suite suite, Example example, String reason) {
        return test(RunEventType.TEST_PENDING, ordinal, suite, example, reason, null);
    }

    private static RunEvent test(RunEventType type, Ordinal ordinal, Suite suite, Example example,
                                 String message, Failure failure) {
        Rerun rerun = suite.getId() == null ? null : Rerun.test(suite.getId(), example.getFullName());
        return of(type, ordinal, suite.getName(), suite.getId(), example.getFullName(), example.getShortName(),
                message, failure, null, rerun, null);
    }

    private static Rerun suiteRerun(Suite suite) {
        return suite.getId() == null ? null : Rerun.suite(suite.getId());
    }

    // ========== Accessors ==========

    public boolean isTestEvent() {
        return testName != null;
    }

    @Override
    public int compareTo(RunEvent that) {
        return ordinal.compareTo(that.ordinal);
    }

    /**
     * Serializes this event to a map for JSON output.
     */
    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.name());
        map.put("ordinal", ordinal.toList());
        if (suiteName != null) {
            map.put("suite", suiteName);
        }
        if (suiteId != null) {
            map.put("suiteId", suiteId);
        }
        if (testName != null) {
            map.put("test", testName);
            map.put("shortName", shortName);
        }
        if (message != null) {
            map.put("message", message);
        }
        if (failure != null) {
            Map<String, Object> failureMap = new LinkedHashMap<>();
            failureMap.put("kind", failure.kind().name());
            failureMap.put("message", failure.message());
            if (failure.location() != null) {
                failureMap.put("location", failure.location());
            }
            if (failure.cause() != null) {
                failureMap.put("error", failure.cause().getClass().getName());
            }
            map.put("failure", failureMap);
        }
        if (abortReason != null) {
            map.put("abortReason", abortReason.getLabel());
        }
        if (rerun != null) {
            Map<String, Object> rerunMap = new LinkedHashMap<>();
            rerunMap.put("suiteId", rerun.suiteId());
            if (rerun.testName() != null) {
                rerunMap.put("testName", rerun.testName());
            }
            map.put("rerun", rerunMap);
        }
        if (expectedTestCount != null) {
            map.put("expectedTestCount", expectedTestCount);
        }
        map.put("thread", threadName);
        map.put("time", timeStamp);
        return map;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name()).append(' ').append(ordinal);
        if (suiteName != null) {
            sb.append(" suite=").append(suiteName);
        }
        if (testName != null) {
            sb.append(" test=").append(testName);
        }
        if (abortReason != null) {
            sb.append(" reason=").append(abortReason.getLabel());
        }
        if (message != null) {
            sb.append(" message=").append(message);
        }
        return sb.toString();
    }

}
