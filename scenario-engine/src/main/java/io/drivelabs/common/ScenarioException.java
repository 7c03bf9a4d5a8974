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

/**
 * Raised when a scenario document cannot be turned into something runnable.
 * Carries the location of the offending node (for example
 * {@code Story.EndCondition.Success.All[1]}) when one is known.
 */
public class ScenarioException extends RuntimeException {

    private final String path;

    public ScenarioException(String message) {
        this(null, message, null);
    }

    public ScenarioException(String path, String message) {
        this(path, message, null);
    }

    public ScenarioException(String path, String message, Throwable cause) {
        super(format(path, message), cause);
        this.path = path;
    }

    private static String format(String path, String message) {
        if (path == null || path.isEmpty()) {
            return message;
        }
        return path + ": " + message;
    }

    public String getPath() {
        return path;
    }

}
