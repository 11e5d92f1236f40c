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

import io.spectree.log.LogContext;
import org.slf4j.Logger;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fans each event out to several reporters on one dispatch thread.
 * <p>
 * Events are delivered in the order they arrive, so reporters never see
 * concurrent calls even when suites run in parallel. Each reporter is isolated
 * by a {@link CatchReporter}. {@link #dispose()} delivers everything still
 * queued, disposes every reporter and stops the thread.
 */
public class DispatchReporter implements Reporter {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final List<CatchReporter> reporters;
    private final ExecutorService executor;

    public DispatchReporter(List<? extends Reporter> reporters) {
        this(reporters, System.err);
    }

    public DispatchReporter(List<? extends Reporter> reporters, PrintStream out) {
        List<CatchReporter> list = new ArrayList<>(reporters.size());
        for (Reporter reporter : reporters) {
            list.add(reporter instanceof CatchReporter ? (CatchReporter) reporter : new CatchReporter(reporter, out));
        }
        this.reporters = Collections.unmodifiableList(list);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "spectree-dispatch");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void report(RunEvent event) {
        try {
            executor.execute(() -> {
                for (CatchReporter reporter : reporters) {
                    reporter.report(event);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("event after dispose dropped: {}", event);
        }
    }

    @Override
    public void dispose() {
        if (executor.isShutdown()) {
            return;
        }
        try {
            executor.execute(() -> reporters.forEach(CatchReporter::dispose));
        } catch (RejectedExecutionException e) {
            logger.debug("dispatch reporter already disposed");
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("dispatch thread did not finish within a minute");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public List<CatchReporter> getReporters() {
        return reporters;
    }

}
