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
import io.drivelabs.intersection.Intersection;
import io.drivelabs.intersection.IntersectionManager;
import io.drivelabs.plugin.ConditionBase;

import java.util.Map;
import java.util.Optional;

/**
 * True while the intersection owning {@code TrafficLightId} is in {@code StateName}.
 * <pre>
 * Type: IntersectionState
 * TrafficLightId: 34802
 * StateName: Red
 * </pre>
 */
public class IntersectionStateCondition extends ConditionBase {

    private long trafficLightId;
    private String stateName;

    public IntersectionStateCondition() {
        super("IntersectionState");
    }

    @Override
    protected void read(Map<String, Object> node) {
        trafficLightId = Documents.readRequiredId(node, Intersection.TRAFFIC_LIGHT_ID, type);
        stateName = Documents.readRequired(node, "StateName", type);
    }

    @Override
    public boolean update(IntersectionManager intersections) {
        Optional<Intersection> intersection = intersections.find(trafficLightId);
        return intersection.isPresent() && stateName.equals(intersection.get().getCurrentState());
    }

}
