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
import io.drivelabs.common.ScenarioException;
import io.drivelabs.common.SimulationStatus;
import io.drivelabs.simulator.Simulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named-state controller for a fixed group of traffic lights.
 * <p>
 * Configured from one element of a scenario's {@code Intersection} list:
 * <pre>
 * TrafficLightId: [ 34802, 34836 ]
 * Control:
 *   - StateName: Red
 *     Color: Red
 *   - StateName: GreenLeft
 *     Color: Green
 *     Arrow: Left
 * </pre>
 * Missing or malformed fields are logged and skipped so that one broken
 * intersection does not stop the scenario from loading. There is no initial
 * state, {@link #getCurrentState()} is null until the first {@link #changeTo(String)}.
 */
public class Intersection {

    static final Logger logger = LoggerFactory.getLogger(Intersection.class);

    public static final String TRAFFIC_LIGHT_ID = "TrafficLightId";
    public static final String CONTROL = "Control";

    private final Simulator simulator;
    private final String path;
    private final Set<Long> ids = new LinkedHashSet<>();
    private final Map<String, Control> controls = new LinkedHashMap<>();

    private String currentState;

    public Intersection(Map<String, Object> script, Simulator simulator) {
        this(script, simulator, "Intersection");
    }

    public Intersection(Map<String, Object> script, Simulator simulator, String path) {
        this.simulator = simulator;
        this.path = path;
        readIds(script);
        readControls(script);
    }

    private void readIds(Map<String, Object> script) {
        Object node = script == null ? null : script.get(TRAFFIC_LIGHT_ID);
        List<Object> list = Documents.asList(node);
        if (list == null) {
            logger.error("{}: each element of node 'Intersection' requires sequence '{}', found {}",
                    path, TRAFFIC_LIGHT_ID, Documents.kindOf(node));
            return;
        }
        String idsPath = Documents.child(path, TRAFFIC_LIGHT_ID);
        for (int i = 0; i < list.size(); i++) {
            try {
                ids.add(Documents.toId(list.get(i), Documents.index(idsPath, i)));
            } catch (ScenarioException e) {
                logger.error("{}", e.getMessage());
            }
        }
        if (ids.isEmpty()) {
            logger.error("{}: no valid traffic light id", idsPath);
        }
        logger.info("{}: TrafficLightId {}", path, ids);
    }

    private void readControls(Map<String, Object> script) {
        Object node = script == null ? null : script.get(CONTROL);
        List<Object> list = Documents.asList(node);
        if (list == null) {
            logger.error("{}: each element of node 'Intersection' requires sequence '{}', found {}",
                    path, CONTROL, Documents.kindOf(node));
            return;
        }
        String controlPath = Documents.child(path, CONTROL);
        for (int i = 0; i < list.size(); i++) {
            String entryPath = Documents.index(controlPath, i);
            Map<String, Object> entry = Documents.asMap(list.get(i));
            if (entry == null) {
                logger.error("{}: expected a mapping but found {}", entryPath, Documents.kindOf(list.get(i)));
                continue;
            }
            try {
                Control control = Control.read(entry, entryPath);
                if (controls.put(control.getStateName(), control) != null) {
                    logger.warn("{}: duplicate StateName '{}', last one wins", entryPath, control.getStateName());
                }
                logger.info("{}: StateName {}", path, control);
            } catch (ScenarioException e) {
                logger.error("{}", e.getMessage());
            }
        }
    }

    /**
     * Applies the control registered under the given state name to every owned
     * traffic light. A name that was never declared is not an error: it falls
     * back to a {@code Blank} control, the one declared in the script if any,
     * otherwise blank color and arrow. The current state is updated either way.
     *
     * @return the success flag reported by the simulator
     */
    public boolean changeTo(String stateName) {
        currentState = stateName;
        Control control = controls.get(stateName);
        if (control == null) {
            control = controls.getOrDefault(Control.BLANK, Control.blank());
            logger.debug("{}: state '{}' not declared, applying {}", path, stateName, control);
        }
        boolean result = control.apply(simulator, ids);
        if (!result) {
            logger.warn("{}: simulator rejected state '{}' for {}", path, stateName, ids);
        }
        return result;
    }

    public Set<Long> ids() {
        return Collections.unmodifiableSet(ids);
    }

    public boolean owns(long trafficLightId) {
        return ids.contains(trafficLightId);
    }

    public String getCurrentState() {
        return currentState;
    }

    public Set<String> getStateNames() {
        return Collections.unmodifiableSet(controls.keySet());
    }

    public Control getControl(String stateName) {
        return controls.get(stateName);
    }

    public String getPath() {
        return path;
    }

    /**
     * Extension point for timed phase changes, nothing advances on its own yet.
     */
    public SimulationStatus update(long tick) {
        return SimulationStatus.ONGOING;
    }

    @Override
    public String toString() {
        return "Intersection" + ids + (currentState == null ? "" : " " + currentState);
    }

}
