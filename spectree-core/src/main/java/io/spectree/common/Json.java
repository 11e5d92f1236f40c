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

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.JSONParser;

import java.util.List;
import java.util.Map;

import static net.minidev.json.JSONValue.defaultReader;

/**
 * Thin json-smart wrapper. Parsed objects keep their key order.
 */
public final class Json {

    private static final JSONStyle JSON_STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    private Json() {
    }

    public static boolean isMapOrList(Object o) {
        return o instanceof Map || o instanceof List;
    }

    public static Object parseStrict(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("invalid json: input is null or blank");
        }
        try {
            JSONParser parser = new JSONParser(JSONParser.MODE_RFC4627);
            return parser.parse(json, defaultReader.DEFAULT_ORDERED);
        } catch (Exception e) {
            throw new IllegalArgumentException("invalid json: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json) {
        Object result = parseStrict(json);
        if (!(result instanceof Map)) {
            throw new IllegalArgumentException("invalid json: not a JSON object");
        }
        return (Map<String, Object>) result;
    }

    public static String stringify(Object o) {
        if (isMapOrList(o)) {
            return JSONValue.toJSONString(o, JSON_STYLE);
        }
        return o == null ? "" : o.toString();
    }

}
