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

import io.spectree.common.Json;
import io.spectree.core.Reporter;
import io.spectree.core.RunEvent;
import io.spectree.log.LogContext;
import org.slf4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Streams every event to a JSON Lines (.jsonl) file, one object per line:
 * <pre>
 * {"type":"RUN_STARTING","ordinal":[0,0],"expectedTestCount":3,"thread":"main","time":1734345000000}
 * {"type":"SUITE_STARTING","ordinal":[0,1],"suite":"StackSpec","suiteId":"com.acme.StackSpec",...}
 * </pre>
 * Lines are flushed as they are written so the file can be tailed during a run.
 */
public class JsonLinesReporter implements Reporter {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Path path;
    private final BufferedWriter writer;
    private boolean closed;

    public JsonLinesReporter(Path path) {
        this.path = path;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to open " + path, e);
        }
        logger.debug("JSON Lines report started: {}", path);
    }

    @Override
    public void report(RunEvent event) {
        writeLine(Json.stringify(event.toJson()));
    }

    private synchronized void writeLine(String line) {
        if (closed) {
            throw new IllegalStateException("reporter already disposed: " + path);
        }
        try {
            writer.write(line);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write " + path, e);
        }
    }

    @Override
    public synchronized void dispose() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to close " + path, e);
        }
        logger.debug("JSON Lines report written: {}", path);
    }

    public Path getPath() {
        return path;
    }

}
