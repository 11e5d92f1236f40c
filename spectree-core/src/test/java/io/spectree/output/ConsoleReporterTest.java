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

import io.spectree.core.RunResult;
import io.spectree.core.Runner;
import io.spectree.core.Suite;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest {

    @Test
    void testTallyMatchesRun() {
        ConsoleReporter console = new ConsoleReporter();
        Suite suite = Suite.named("Console")
                .specify("ok", () -> {
                })
                .specify("bad", () -> fail("nope"))
                .specify("skipped", Set.of("ignore"), () -> {
                });
        RunResult result = Runner.suites(suite)
                .excludeTags("ignore")
                .reportExcluded(true)
                .reporter(console)
                .run();
        RunResult tally = console.getTally();
        assertEquals(result.getTestsSucceeded(), tally.getTestsSucceeded());
        assertEquals(1, tally.getTestsFailed());
        assertEquals(1, tally.getTestsIgnored());
        assertTrue(tally.isCompleted());
    }

}
