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
package io.drivelabs.intersection;

import io.drivelabs.common.Documents;
import io.drivelabs.common.SimulationStatus;
import io.drivelabs.simulator.Simulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every {@link Intersection} of a scenario and routes state change
 * requests to the one that controls a given traffic light.
 */
public class IntersectionManager {

    static final Logger logger = LoggerFactory.getLogger(IntersectionManager.class);

    private final List<Intersection> intersections;

    public IntersectionManager(List<Intersection> intersections) {
        this.intersections = List.copyOf(intersections);
    }

    public static IntersectionManager empty() {
        return new IntersectionManager(Collections.emptyList());
    }

    /**
     * Builds intersections from the scenario's {@code Intersection} sequence.
     * An absent node means the scenario has no intersections; anything else
     * that is not a sequence of mappings is logged and skipped.
     */
    public static IntersectionManager read(Object node, Simulator simulator, String path) {
        if (node == null) {
            return empty();
        }
        List<Object> list = Documents.asList(node);
        if (list == null) {
            logger.error("{}: expected a sequence but found {}", path, Documents.kindOf(node));
            return empty();
        }
        List<Intersection> result = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            String itemPath = Documents.index(path, i);
            Map<String, Object> map = Documents.asMap(list.get(i));
            if (map == null) {
                logger.error("{}: expected a mapping but found {}", itemPath, Documents.kindOf(list.get(i)));
                continue;
            }
            result.add(new Intersection(map, simulator, itemPath));
        }
        return new IntersectionManager(result);
    }

    public List<Intersection> getIntersections() {
        return intersections;
    }

    public Optional<Intersection> find(long trafficLightId) {
        for (Intersection intersection : intersections) {
            if (intersection.owns(trafficLightId)) {
                return Optional.of(intersection);
            }
        }
        return Optional.empty();
    }

    /**
     * @return false if no intersection owns the traffic light, otherwise the
     * result of {@link Intersection#changeTo(String)}
     */
    public boolean changeTo(long trafficLightId, String stateName) {
        Optional<Intersection> found = find(trafficLightId);
        if (found.isEmpty()) {
            logger.warn("no intersection owns traffic light {}", trafficLightId);
            return false;
        }
        return found.get().changeTo(stateName);
    }

    public SimulationStatus update(long tick) {
        SimulationStatus status = SimulationStatus.ONGOING;
        for (Intersection intersection : intersections) {
            status = status.and(intersection.update(tick));
        }
        return status;
    }

    public int size() {
        return intersections.size();
    }

}
