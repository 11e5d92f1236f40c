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

import io.spectree.output.EventCollector;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static io.spectree.core.RunEventType.*;
import static org.junit.jupiter.api.Assertions.*;

class ConcurrentDistributorTest {

    private static Suite tree() {
        Suite leaf = Suite.named("Leaf")
                .it("one", () -> Thread.sleep(5))
                .it("two", () -> {
                });
        Suite left = Suite.named("Left")
                .it("left test", () -> Thread.sleep(10))
                .nest(leaf);
        Suite right = Suite.named("Right")
                .it("right test", () -> {
                })
                .it("fails", () -> fail("expected"));
        return Suite.named("Root")
                .it("root test", () -> {
                })
                .nest(left, right);
    }

    private static List<String> describe(List<RunEvent> events) {
        List<String> list = new ArrayList<>();
        for (RunEvent event : events) {
            list.add(event.type() + ":" + (event.testName() == null ? event.suiteName() : event.testName()));
        }
        return list;
    }

    @Test
    void testSortedEventsMatchSequentialRun() {
        EventCollector sequential = new EventCollector();
        Runner.suites(tree()).reporter(sequential).run();
        EventCollector concurrent = new EventCollector();
        RunResult result = Runner.suites(tree()).reporter(concurrent).parallel(4).run();
        assertEquals(describe(sequential.getEvents()), describe(concurrent.getEventsInOrder()));
        assertEquals(5, result.getTestsSucceeded());
        assertEquals(1, result.getTestsFailed());
        assertEquals(4, result.getSuitesCompleted());
        List<RunEvent> ordered = concurrent.getEventsInOrder();
        assertEquals(RUN_COMPLETED, ordered.get(ordered.size() - 1).type());
        // the terminal event is reported only after every distributed suite
        List<RunEvent> arrival = concurrent.getEvents();
        assertEquals(RUN_COMPLETED, arrival.get(arrival.size() - 1).type());
    }

    @Test
    void testNestedSuitesRunOnWorkers() {
        EventCollector events = new EventCollector();
        CatchReporter reporter = CatchReporter.wrap(events);
        ConcurrentDistributor distributor = new ConcurrentDistributor(reporter, Stopper.NEVER, Filter.none(),
                Map.of(), 2);
        try {
            distributor.put(Suite.named("A").it("a", () -> {
            }), new Tracker(new Ordinal(1)));
            distributor.put(Suite.named("B").it("b", () -> {
            }), new Tracker(new Ordinal(2)));
            distributor.awaitCompletion();
        } finally {
            distributor.close();
        }
        Set<String> threads = new HashSet<>();
        for (RunEvent event : events.getEvents()) {
            threads.add(event.threadName());
        }
        assertEquals(2, events.ofType(SUITE_COMPLETED).size());
        for (String thread : threads) {
            assertTrue(thread.startsWith("spectree-worker-"), thread);
        }
    }

    @Test
    void testPutAfterCloseIsRejected() {
        ConcurrentDistributor distributor = new ConcurrentDistributor(new EventCollector(), Stopper.NEVER,
                Filter.none(), Map.of(), 1);
        distributor.close();
        assertThrows(RejectedExecutionException.class, () ->
                distributor.put(Suite.named("late"), new Tracker()));
    }

    @Test
    void testThreadCountValidated() {
        assertThrows(IllegalArgumentException.class, () ->
                new ConcurrentDistributor(new EventCollector(), Stopper.NEVER, Filter.none(), Map.of(), 0));
    }

    @Test
    void testQueuedSuitesDoNotStartAfterStop() throws Exception {
        EventCollector events = new EventCollector();
        Stopper.Flag stopper = Stopper.create();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ConcurrentDistributor distributor = new ConcurrentDistributor(events, stopper, Filter.none(), Map.of(), 1);
        try {
            Suite blocking = Suite.named("Blocking").beforeAll(() -> {
                started.countDown();
                assertTrue(release.await(10, TimeUnit.SECONDS));
            }).it("skipped", () -> {
            });
            distributor.put(blocking, new Tracker(new Ordinal(1)));
            distributor.put(Suite.named("Queued1").it("a", () -> {
            }), new Tracker(new Ordinal(2)));
            distributor.put(Suite.named("Queued2").it("b", () -> {
            }), new Tracker(new Ordinal(3)));
            assertTrue(started.await(10, TimeUnit.SECONDS));
            stopper.requestStop();
            release.countDown();
            assertTrue(distributor.awaitCompletion());
        } finally {
            distributor.close();
        }
        assertEquals(List.of(SUITE_STARTING, SUITE_COMPLETED), events.getTypes());
        assertEquals("Blocking", events.getEvents().get(0).suiteName());
    }

    @Test
    void testInterruptedWaitEndsRunStopped() {
        EventCollector events = new EventCollector();
        CountDownLatch never = new CountDownLatch(1);
        Suite slow = Suite.named("Slow").it("wait", () -> never.await(10, TimeUnit.SECONDS));
        Suite root = Suite.named("Root")
                .it("interrupt caller", () -> Thread.currentThread().interrupt())
                .nest(slow);
        ConcurrentDistributor distributor = new ConcurrentDistributor(events, Stopper.NEVER, Filter.none(),
                Map.of(), 1);
        try {
            Runner.run(root, null, events, Stopper.NEVER, Filter.none(), Map.of(), distributor, new Tracker(),
                    distributor::awaitCompletion);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
            distributor.close();
        }
        assertEquals(1, events.ofType(RUN_STOPPED).size());
        assertTrue(events.ofType(RUN_COMPLETED).isEmpty());
    }

}
