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

import io.spectree.log.LogContext;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Loads the run config, a JSON object handed read-only to every test body.
 * <p>
 * Paths starting with {@code classpath:} are looked up on the classpath first and
 * then relative to the working directory. Other paths are plain file paths.
 */
public final class ConfigLoader {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final String CLASSPATH_PREFIX = "classpath:";

    private ConfigLoader() {
    }

    /**
     * @return the parsed object, or an empty map if the file does not exist
     * @throws IllegalArgumentException if the file is not a JSON object
     */
    public static Map<String, Object> load(String path) {
        Objects.requireNonNull(path, "path was null");
        String text = read(path);
        if (text == null) {
            logger.debug("config not found: {}", path);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> config = Json.parseObject(text);
            logger.debug("loaded config from {}", path);
            return config;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid config " + path + ": " + e.getMessage(), e);
        }
    }

    private static String read(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            String name = path.substring(CLASSPATH_PREFIX.length());
            if (name.startsWith("/")) {
                name = name.substring(1);
            }
            try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(name)) {
                if (is != null) {
                    return new String(is.readAllBytes(), StandardCharsets.UTF_8);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read config " + path, e);
            }
            logger.debug("config not on classpath, trying working directory: {}", name);
            return readFile(Path.of(name));
        }
        return readFile(Path.of(path));
    }

    private static String readFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read config " + file, e);
        }
    }

}
