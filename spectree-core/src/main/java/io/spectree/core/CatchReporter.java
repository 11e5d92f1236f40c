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

import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Wraps a user supplied reporter so that nothing it throws, short of a
 * {@link VirtualMachineError}, can reach the run.
 * <p>
 * Each fault produces exactly one line on the diagnostic stream, written with a
 * single {@code println} so that concurrent deliveries never interleave within a
 * line. The stack trace goes to the runtime logger at DEBUG.
 */
public class CatchReporter implements Reporter {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Reporter reporter;
    private final PrintStream out;

    public CatchReporter(Reporter reporter) {
        this(reporter, System.err);
    }

    public CatchReporter(Reporter reporter, PrintStream out) {
        this.reporter = Objects.requireNonNull(reporter, "reporter was null");
        this.out = Objects.requireNonNull(out, "out was null");
    }

    /**
     * Wraps the reporter unless it is already a {@link CatchReporter}.
     */
    public static CatchReporter wrap(Reporter reporter) {
        if (reporter instanceof CatchReporter) {
            return (CatchReporter) reporter;
        }
        return new CatchReporter(reporter);
    }

    @Override
    public void report(RunEvent event) {
        dispatch("report", event, r -> r.report(event));
    }

    @Override
    public void dispose() {
        dispatch("dispose", null, Reporter::dispose);
    }

    void dispatch(String methodName, RunEvent event, Consumer<Reporter> call) {
        try {
            call.accept(reporter);
        } catch (Throwable t) {
            SuiteRuntime.rethrowIfFatal(t);
            handleReporterException(t, methodName, event);
        }
    }

    private void handleReporterException(Throwable e, String methodName, RunEvent event) {
        String line = Resources.get("reporterThrew", methodName, e, event == null ? "dispose" : event);
        out.println(singleLine(line));
        logger.debug("reporter {} failed in {}", reporter.getClass().getName(), methodName, e);
    }

    private static String singleLine(String s) {
        return s.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
    }

    public Reporter getReporter() {
        return reporter;
    }

}
