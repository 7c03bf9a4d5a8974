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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stand-in simulator that keeps traffic light states in memory and moves the
 * ego vehicle a fixed distance on every {@link #step()}. Used for dry runs
 * from the command line and by tests.
 */
public class InMemorySimulator implements Simulator {

    static final Logger logger = LoggerFactory.getLogger(InMemorySimulator.class);

    private final Map<Long, String> colors = new LinkedHashMap<>();
    private final Map<Long, String> arrows = new LinkedHashMap<>();

    private double distancePerStep;
    private double moveDistance;

    public InMemorySimulator() {
        this(0);
    }

    public InMemorySimulator(double distancePerStep) {
        this.distancePerStep = distancePerStep;
    }

    @Override
    public boolean setTrafficLightColor(long id, String color) {
        logger.debug("traffic light {} color: {}", id, color);
        colors.put(id, color);
        return true;
    }

    @Override
    public boolean setTrafficLightArrow(long id, String arrow) {
        logger.debug("traffic light {} arrow: {}", id, arrow);
        arrows.put(id, arrow);
        return true;
    }

    @Override
    public double getMoveDistance() {
        return moveDistance;
    }

    public void step() {
        moveDistance += distancePerStep;
    }

    public void setDistancePerStep(double distancePerStep) {
        this.distancePerStep = distancePerStep;
    }

    public String getColor(long id) {
        return colors.get(id);
    }

    public String getArrow(long id) {
        return arrows.get(id);
    }

    public Map<Long, String> getColors() {
        return Collections.unmodifiableMap(colors);
    }

}
