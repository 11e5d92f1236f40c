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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Helpers for running a suite into an {@link EventCollector}.
 * <pre>
 * EventCollector events = TestUtils.run(Suite.named("Math").it("add", () -&gt; assertEquals(2, 1 + 1)));
 * </pre>
 */
public class TestUtils {

    public static EventCollector run(Suite suite) {
        return run(suite, null, Filter.none());
    }

    public static EventCollector run(Suite suite, Filter filter) {
        return run(suite, null, filter);
    }

    public static EventCollector run(Suite suite, String testName, Filter filter) {
        EventCollector collector = new EventCollector();
        Runner.run(suite, testName, collector, Stopper.NEVER, filter, Map.of(), null, new Tracker());
        return collector;
    }

    /**
     * Full test names of the events of the given type, in arrival order.
     */
    public static List<String> testNames(EventCollector collector, RunEventType type) {
        List<String> names = new ArrayList<>();
        for (RunEvent event : collector.ofType(type)) {
            names.add(event.testName());
        }
        return names;
    }

    /**
     * Run level events with increasing ordinals, for exercising reporters.
     */
    public static List<RunEvent> sampleEvents(int count) {
        Tracker tracker = new Tracker();
        List<RunEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(RunEvent.runStarting(tracker.nextOrdinal(), i));
        }
        return events;
    }

}
