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
package io.drivelabs.common;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the already-parsed configuration document tree. A document is
 * made of {@link Map} (mapping), {@link List} (sequence) and plain scalar
 * objects, which is what a YAML or JSON loader hands back.
 */
public class Documents {

    private Documents() {
        // only static methods
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object node) {
        if (node instanceof Map) {
            return (Map<String, Object>) node;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> asList(Object node) {
        if (node instanceof List) {
            return (List<Object>) node;
        }
        return null;
    }

    public static boolean isScalar(Object node) {
        return node != null && !(node instanceof Map) && !(node instanceof List);
    }

    public static String kindOf(Object node) {
        if (node == null) {
            return "null";
        }
        if (node instanceof Map) {
            return "mapping";
        }
        if (node instanceof List) {
            return "sequence";
        }
        return "scalar '" + node + "'";
    }

    public static String child(String path, String key) {
        if (path == null || path.isEmpty()) {
            return key;
        }
        return path + "." + key;
    }

    public static String index(String path, int index) {
        return (path == null ? "" : path) + "[" + index + "]";
    }

    /**
     * Walks down nested mappings, returns null as soon as a key is missing.
     */
    public static Object at(Object node, String... keys) {
        Object current = node;
        for (String key : keys) {
            Map<String, Object> map = asMap(current);
            if (map == null) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }

    public static String readOptional(Map<String, Object> node, String key, String defaultValue) {
        if (node == null) {
            return defaultValue;
        }
        Object value = node.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!isScalar(value)) {
            throw new ScenarioException(key, "expected a scalar but found " + kindOf(value));
        }
        return value.toString();
    }

    public static String readRequired(Map<String, Object> node, String key, String path) {
        Object value = node == null ? null : node.get(key);
        if (value == null) {
            throw new ScenarioException(path, "requires hash '" + key + "'");
        }
        if (!isScalar(value)) {
            throw new ScenarioException(child(path, key), "expected a scalar but found " + kindOf(value));
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            throw new ScenarioException(child(path, key), "must not be empty");
        }
        return text;
    }

    public static long readRequiredId(Map<String, Object> node, String key, String path) {
        Object value = node == null ? null : node.get(key);
        if (value == null) {
            throw new ScenarioException(path, "requires hash '" + key + "'");
        }
        return toId(value, child(path, key));
    }

    public static double readRequiredNumber(Map<String, Object> node, String key, String path) {
        Object value = node == null ? null : node.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value == null) {
            throw new ScenarioException(path, "requires hash '" + key + "'");
        }
        throw new ScenarioException(child(path, key), "expected a number but found " + kindOf(value));
    }

    /**
     * Converts a scalar to a traffic light style identifier: a non-negative integer.
     */
    public static long toId(Object value, String path) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long id = ((Number) value).longValue();
            if (id < 0) {
                throw new ScenarioException(path, "expected a non-negative integer but found " + id);
            }
            return id;
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            if (big.signum() < 0 || big.bitLength() > 63) {
                throw new ScenarioException(path, "integer out of range: " + big);
            }
            return big.longValue();
        }
        throw new ScenarioException(path, "expected a non-negative integer but found " + kindOf(value));
    }

}
