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

/**
 * Actuation and query primitives offered by the driving simulator.
 * <p>
 * The engine treats every call as an opaque synchronous operation. Only the
 * success flag of an actuation matters to callers such as
 * {@link io.drivelabs.intersection.Intersection}.
 */
public interface Simulator {

    /**
     * @param id traffic light identifier
     * @param color for example {@code Red}, {@code Green} or {@code Blank}
     * @return true if the simulator accepted the request
     */
    boolean setTrafficLightColor(long id, String color);

    /**
     * @param id traffic light identifier
     * @param arrow for example {@code Left}, {@code Straight} or {@code Blank}
     * @return true if the simulator accepted the request
     */
    boolean setTrafficLightArrow(long id, String arrow);

    /**
     * Distance travelled by the ego vehicle since the scenario started, in meters.
     */
    double getMoveDistance();

}
