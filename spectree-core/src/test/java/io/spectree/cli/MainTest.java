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
package io.spectree.cli;

import io.spectree.cli.fixtures.CliFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private static final String PASSING = CliFixtures.PassingSuite.class.getName();
    private static final String FAILING = CliFixtures.FailingSuite.class.getName();

    @TempDir
    Path tempDir;

    @Test
    void testExitCodes() {
        assertEquals(0, Main.execute(PASSING));
        assertEquals(1, Main.execute(FAILING));
        assertEquals(1, Main.execute(PASSING, FAILING));
        assertEquals(1, Main.execute("does.not.Exist"));
    }

    @Test
    void testUsageErrors() {
        assertEquals(2, Main.execute());
        assertEquals(2, Main.execute("--no-such-option", PASSING));
        assertEquals(2, Main.execute("-n", "it should pass", PASSING, FAILING));
    }

    @Test
    void testRerunSingleTest() {
        assertEquals(0, Main.execute("-n", "it should pass", PASSING));
        assertEquals(1, Main.execute("-n", "it should fail", FAILING));
        // unknown test aborts the suite
        assertEquals(1, Main.execute("-n", "it should fly", PASSING));
        assertEquals(1, Main.execute("-n", "it should pass", "does.not.Exist"));
    }

    @Test
    void testParallelWithTagsAndOutput() throws Exception {
        Path output = tempDir.resolve("events.jsonl");
        assertEquals(0, Main.execute("-T", "2", "-x", "Slow", "--report-excluded", "-o", output.toString(),
                PASSING, PASSING));
        List<String> lines = Files.readAllLines(output);
        assertTrue(lines.get(0).contains("RUN_STARTING"), lines.get(0));
        assertTrue(lines.get(lines.size() - 1).contains("RUN_COMPLETED"));
        long ignored = lines.stream().filter(line -> line.contains("TEST_IGNORED")).count();
        assertEquals(2, ignored);
    }

    @Test
    void testConfigOption() {
        assertEquals(0, Main.execute("-c", "classpath:spectree-config.json", PASSING));
    }

    @Test
    void testParse() {
        Main main = Main.parse("-T", "3", "-i", "Fast", "-i", "Db", PASSING);
        assertEquals(3, main.threads);
        assertEquals(List.of("Fast", "Db"), main.includeTags);
        assertEquals(List.of(PASSING), main.suiteClasses);
    }

}
