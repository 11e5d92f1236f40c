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

import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs distributed suites on a fixed pool of worker threads. A suite running on a
 * worker distributes its own nested suites back to this pool.
 * <p>
 * Call {@link #awaitCompletion()} from the thread that started the run before
 * reporting the terminal event, then {@link #close()}.
 */
public class ConcurrentDistributor implements Distributor, AutoCloseable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final CatchReporter reporter;
    private final Stopper stopper;
    private final Filter filter;
    private final Map<String, Object> config;
    private final ExecutorService executor;
    private final Queue<Future<?>> pending = new ConcurrentLinkedQueue<>();

    public ConcurrentDistributor(Reporter reporter, Stopper stopper, Filter filter,
                                 Map<String, Object> config, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be at least 1: " + threadCount);
        }
        this.reporter = CatchReporter.wrap(Objects.requireNonNull(reporter, "reporter was null"));
        this.stopper = Objects.requireNonNull(stopper, "stopper was null");
        this.filter = Objects.requireNonNull(filter, "filter was null");
        this.config = Objects.requireNonNull(config, "config was null");
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threadCount, r -> {
            Thread thread = new Thread(r, "spectree-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void put(Suite suite, Tracker tracker) {
        Objects.requireNonNull(suite, "suite was null");
        Objects.requireNonNull(tracker, "tracker was null");
        RunContext context = new RunContext(reporter, stopper, filter, config, this, tracker);
        logger.debug("distributing suite: {}", suite.getName());
        pending.add(executor.submit(() -> {
            if (stopper.stopRequested()) {
                logger.debug("stop requested, not starting distributed suite: {}", suite.getName());
                return;
            }
            new SuiteRuntime(suite, context).run(null);
        }));
    }

    /**
     * Blocks until every distributed suite has finished, including suites
     * distributed while waiting.
     * <p>
     * If the waiting thread is interrupted, the suites still pending are cancelled
     * and the interrupt flag is left set, so the run ends with RunStopped.
     *
     * @return false if interrupted before every suite finished
     */
    public boolean awaitCompletion() {
        Future<?> future;
        while ((future = pending.poll()) != null) {
            try {
                future.get();
            } catch (ExecutionException e) {
                logger.error("distributed suite failed: {}", e.getCause().toString(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("interrupted while waiting for distributed suites, cancelling the rest");
                future.cancel(true);
                Future<?> remaining;
                while ((remaining = pending.poll()) != null) {
                    remaining.cancel(true);
                }
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("worker pool did not terminate, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

}
