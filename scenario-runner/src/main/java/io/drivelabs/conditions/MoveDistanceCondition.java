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
package io.drivelabs.conditions;

import io.drivelabs.common.Documents;
import io.drivelabs.intersection.IntersectionManager;
import io.drivelabs.plugin.ConditionBase;

import java.util.Map;

/**
 * True once the ego vehicle has travelled at least {@code Value} meters.
 */
public class MoveDistanceCondition extends ConditionBase {

    private double value;

    public MoveDistanceCondition() {
        super("MoveDistance");
    }

    @Override
    protected void read(Map<String, Object> node) {
        value = Documents.readRequiredNumber(node, "Value", type);
    }

    @Override
    public boolean update(IntersectionManager intersections) {
        return simulator.getMoveDistance() >= value;
    }

}
