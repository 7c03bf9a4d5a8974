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
package io.drivelabs.actions;

import io.drivelabs.common.Documents;
import io.drivelabs.intersection.Intersection;
import io.drivelabs.intersection.IntersectionManager;
import io.drivelabs.plugin.ActionBase;

import java.util.Map;

/**
 * Requests a state change from the intersection owning a traffic light.
 * <pre>
 * Type: ChangeIntersection
 * Params:
 *   TrafficLightId: 34802
 *   StateName: Green
 * </pre>
 */
public class ChangeIntersectionAction extends ActionBase {

    private long trafficLightId;
    private String stateName;

    public ChangeIntersectionAction() {
        super("ChangeIntersection");
    }

    @Override
    protected void readParams(Map<String, Object> params) {
        trafficLightId = Documents.readRequiredId(params, Intersection.TRAFFIC_LIGHT_ID, PARAMS);
        stateName = Documents.readRequired(params, "StateName", PARAMS);
    }

    @Override
    public boolean update(IntersectionManager intersections) {
        return intersections.changeTo(trafficLightId, stateName);
    }

}
