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
package io.spectree.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Category loggers shared across the engine.
 * <p>
 * Configure in your logback.xml:
 * <pre>
 * &lt;logger name="spectree.console" level="INFO"&gt;
 *     &lt;appender-ref ref="STDOUT" /&gt;
 * &lt;/logger&gt;
 * </pre>
 */
public final class LogContext {

    /** Logger for the runtime (traversal, distribution, rerun, reporter faults) */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("spectree.runtime");

    /** Logger for console output (test results and run summary) */
    public static final Logger CONSOLE_LOGGER = LoggerFactory.getLogger("spectree.console");

    private LogContext() {
    }

}
