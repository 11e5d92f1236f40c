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

import io.spectree.common.Json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tally of a run, built by listening to its events.
 */
public class RunResult implements Reporter {

    private int testsSucceeded;
    private int testsFailed;
    private int testsIgnored;
    private int testsPending;
    private int suitesCompleted;
    private int suitesAborted;
    private int expectedTestCount;
    private RunEventType terminal;
    private AbortReason abortReason;
    private String abortMessage;
    private long startTime;
    private long endTime;
    private final List<String> failedTests = new ArrayList<>();

    @Override
    public synchronized void report(RunEvent event) {
        switch (event.type()) {
            case RUN_STARTING:
                startTime = event.timeStamp();
                expectedTestCount = event.expectedTestCount() == null ? 0 : event.expectedTestCount();
                break;
            case TEST_SUCCEEDED:
                testsSucceeded++;
                break;
            case TEST_FAILED:
                testsFailed++;
                failedTests.add(event.testName());
                break;
            case TEST_IGNORED:
                testsIgnored++;
                break;
            case TEST_PENDING:
                testsPending++;
                break;
            case SUITE_COMPLETED:
                suitesCompleted++;
                break;
            case SUITE_ABORTED:
                suitesAborted++;
                break;
            case RUN_ABORTED:
                abortReason = event.abortReason();
                abortMessage = event.message();
                terminal = event.type();
                endTime = event.timeStamp();
                break;
            case RUN_COMPLETED:
            case RUN_STOPPED:
                terminal = event.type();
                endTime = event.timeStamp();
                break;
            default:
                // starting events carry nothing to count
        }
    }

    public synchronized int getTestsSucceeded() {
        return testsSucceeded;
    }

    public synchronized int getTestsFailed() {
        return testsFailed;
    }

    public synchronized int getTestsIgnored() {
        return testsIgnored;
    }

    public synchronized int getTestsPending() {
        return testsPending;
    }

    public synchronized int getTestsCompleted() {
        return testsSucceeded + testsFailed;
    }

    public synchronized int getSuitesCompleted() {
        return suitesCompleted;
    }

    public synchronized int getSuitesAborted() {
        return suitesAborted;
    }

    public synchronized int getExpectedTestCount() {
        return expectedTestCount;
    }

    public synchronized List<String> getFailedTests() {
        return Collections.unmodifiableList(new ArrayList<>(failedTests));
    }

    public synchronized AbortReason getAbortReason() {
        return abortReason;
    }

    public synchronized String getAbortMessage() {
        return abortMessage;
    }

    public synchronized boolean isCompleted() {
        return terminal == RunEventType.RUN_COMPLETED;
    }

    public synchronized boolean isStopped() {
        return terminal == RunEventType.RUN_STOPPED;
    }

    public synchronized boolean isAborted() {
        return terminal == RunEventType.RUN_ABORTED;
    }

    public synchronized boolean isPassed() {
        return testsFailed == 0 && suitesAborted == 0 && terminal != RunEventType.RUN_ABORTED;
    }

    public synchronized long getDurationMillis() {
        return endTime - startTime;
    }

    // ========== Serialization ==========

    public synchronized Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("expected", expectedTestCount);
        map.put("succeeded", testsSucceeded);
        map.put("failed", testsFailed);
        map.put("ignored", testsIgnored);
        map.put("pending", testsPending);
        map.put("suites_completed", suitesCompleted);
        map.put("suites_aborted", suitesAborted);
        map.put("failed_tests", new ArrayList<>(failedTests));
        if (abortReason != null) {
            map.put("abort_reason", abortReason.getLabel());
            map.put("abort_message", abortMessage);
        }
        map.put("duration_millis", endTime - startTime);
        map.put("status", terminal == null ? "unfinished" : statusOf(terminal));
        return map;
    }

    private String statusOf(RunEventType type) {
        switch (type) {
            case RUN_ABORTED:
                return "aborted";
            case RUN_STOPPED:
                return "stopped";
            default:
                return isPassed() ? "passed" : "failed";
        }
    }

    public String toJson() {
        return Json.stringify(toMap());
    }

    @Override
    public synchronized String toString() {
        return "RunResult" + toMap();
    }

}
