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
package io.spectree.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testClasspath() {
        Map<String, Object> config = ConfigLoader.load("classpath:spectree-config.json");
        assertEquals("http://localhost:8080", config.get("baseUrl"));
        assertEquals(3, ((Number) config.get("retries")).intValue());
        assertEquals(List.of("stack", "queue"), config.get("features"));
        // key order is kept
        assertEquals(List.of("baseUrl", "retries", "features"), List.copyOf(config.keySet()));
    }

    @Test
    void testFile() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"env\":\"dev\"}");
        assertEquals(Map.of("env", "dev"), ConfigLoader.load(file.toString()));
    }

    @Test
    void testMissingIsEmpty() {
        assertTrue(ConfigLoader.load("classpath:no-such-config.json").isEmpty());
        assertTrue(ConfigLoader.load(tempDir.resolve("missing.json").toString()).isEmpty());
    }

    @Test
    void testMalformed() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ not json");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(broken.toString()));
        Path array = tempDir.resolve("array.json");
        Files.writeString(array, "[1, 2]");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(array.toString()));
    }

}
