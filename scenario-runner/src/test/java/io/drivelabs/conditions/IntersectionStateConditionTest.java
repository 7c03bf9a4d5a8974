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

import io.drivelabs.common.ScenarioException;
import io.drivelabs.intersection.Intersection;
import io.drivelabs.intersection.IntersectionManager;
import io.drivelabs.simulator.InMemorySimulator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntersectionStateConditionTest {

    @Test
    void testMatchesCurrentState() {
        InMemorySimulator simulator = new InMemorySimulator();
        Intersection intersection = new Intersection(Map.of(
                "TrafficLightId", List.of(10, 11),
                "Control", List.of(Map.of("StateName", "Red", "Color", "Red"))), simulator);
        IntersectionManager intersections = new IntersectionManager(List.of(intersection));
        IntersectionStateCondition condition = new IntersectionStateCondition();
        condition.configure(Map.of("Type", "IntersectionState", "TrafficLightId", 11, "StateName", "Red"), simulator);
        assertFalse(condition.update(intersections));
        intersection.changeTo("Red");
        assertTrue(condition.update(intersections));
        intersection.changeTo("Green");
        assertFalse(condition.update(intersections));
    }

    @Test
    void testUnknownTrafficLight() {
        IntersectionStateCondition condition = new IntersectionStateCondition();
        condition.configure(Map.of("TrafficLightId", 99, "StateName", "Red"), new InMemorySimulator());
        assertFalse(condition.update(IntersectionManager.empty()));
    }

    @Test
    void testMissingStateName() {
        IntersectionStateCondition condition = new IntersectionStateCondition();
        ScenarioException e = assertThrows(ScenarioException.class,
                () -> condition.configure(Map.of("TrafficLightId", 1), new InMemorySimulator()));
        assertEquals("IntersectionState: requires hash 'StateName'", e.getMessage());
        assertFalse(condition.isConfigured());
    }

}
