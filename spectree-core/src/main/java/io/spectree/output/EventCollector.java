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
import io.spectree.core.RunEventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every event it receives. Safe to use from several threads.
 */
public class EventCollector implements Reporter {

    private final List<RunEvent> events = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean disposed;

    @Override
    public void report(RunEvent event) {
        events.add(event);
    }

    @Override
    public void dispose() {
        disposed = true;
    }

    /**
     * Events in arrival order.
     */
    public List<RunEvent> getEvents() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    /**
     * Events sorted by ordinal, the order a sequential run would have produced.
     */
    public List<RunEvent> getEventsInOrder() {
        List<RunEvent> list = getEvents();
        Collections.sort(list);
        return list;
    }

    public List<RunEvent> ofType(RunEventType type) {
        List<RunEvent> list = new ArrayList<>();
        for (RunEvent event : getEvents()) {
            if (event.type() == type) {
                list.add(event);
            }
        }
        return list;
    }

    public List<RunEventType> getTypes() {
        List<RunEventType> list = new ArrayList<>();
        for (RunEvent event : getEvents()) {
            list.add(event.type());
        }
        return list;
    }

    public int size() {
        return events.size();
    }

    public boolean isDisposed() {
        return disposed;
    }

}
