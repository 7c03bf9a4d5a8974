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

import io.drivelabs.common.ScenarioException;
import io.drivelabs.intersection.Intersection;
import io.drivelabs.intersection.IntersectionManager;
import io.drivelabs.simulator.InMemorySimulator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChangeIntersectionActionTest {

    InMemorySimulator simulator;
    IntersectionManager intersections;

    @BeforeEach
    void beforeEach() {
        simulator = new InMemorySimulator();
        Intersection intersection = new Intersection(Map.of(
                "TrafficLightId", List.of(34802, 34806),
                "Control", List.of(
                        Map.of("StateName", "Red", "Color", "Red"),
                        Map.of("StateName", "GreenLeft", "Color", "Green", "Arrow", "Left"))), simulator);
        intersections = new IntersectionManager(List.of(intersection));
    }

    @Test
    void testChangesState() {
        ChangeIntersectionAction action = new ChangeIntersectionAction();
        action.configure(Map.of("Type", "ChangeIntersection",
                "Params", Map.of("TrafficLightId", 34806, "StateName", "GreenLeft")), simulator);
        assertTrue(action.update(intersections));
        assertEquals("GreenLeft", intersections.find(34802).get().getCurrentState());
        assertEquals("Green", simulator.getColor(34802));
        assertEquals("Left", simulator.getArrow(34806));
    }

    @Test
    void testUnknownTrafficLight() {
        ChangeIntersectionAction action = new ChangeIntersectionAction();
        action.configure(Map.of("Params", Map.of("TrafficLightId", 1, "StateName", "Red")), simulator);
        assertFalse(action.update(intersections));
        assertNull(simulator.getColor(34802));
    }

    @Test
    void testParamsRequired() {
        ChangeIntersectionAction action = new ChangeIntersectionAction();
        ScenarioException e = assertThrows(ScenarioException.class,
                () -> action.configure(Map.of("Params", Map.of("StateName", "Red")), simulator));
        assertEquals("Params: requires hash 'TrafficLightId'", e.getMessage());
    }

}
