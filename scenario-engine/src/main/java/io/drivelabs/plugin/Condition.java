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
package io.drivelabs.plugin;

import io.drivelabs.intersection.IntersectionManager;
import io.drivelabs.simulator.Simulator;

import java.util.Map;

/**
 * A predicate referenced from a scenario as {@code Type: <name>} and looked up
 * in the condition registry as {@code <name>Condition}.
 */
public interface Condition {

    /**
     * Called once at load time with the mapping that referenced this condition.
     *
     * @return false (or an exception) if the condition cannot be used
     */
    boolean configure(Map<String, Object> node, Simulator simulator);

    /**
     * Called once per tick. Expected to be read-mostly but nothing enforces it.
     */
    boolean update(IntersectionManager intersections);

    String getType();

    String getName();

}
