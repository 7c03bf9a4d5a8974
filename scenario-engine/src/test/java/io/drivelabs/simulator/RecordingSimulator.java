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
package io.drivelabs.simulator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Simulator double that records every actuation as {@code color:<id>:<value>}
 * or {@code arrow:<id>:<value>}.
 */
public class RecordingSimulator implements Simulator {

    public final List<String> calls = new ArrayList<>();
    public final Set<Long> rejected = new HashSet<>();
    public double moveDistance;

    @Override
    public boolean setTrafficLightColor(long id, String color) {
        calls.add("color:" + id + ":" + color);
        return !rejected.contains(id);
    }

    @Override
    public boolean setTrafficLightArrow(long id, String arrow) {
        calls.add("arrow:" + id + ":" + arrow);
        return !rejected.contains(id);
    }

    @Override
    public double getMoveDistance() {
        return moveDistance;
    }

}
