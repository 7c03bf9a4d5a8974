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
import io.drivelabs.simulator.Simulator;

import java.util.Collection;
import java.util.Map;

/**
 * One named entry of an intersection's {@code Control} list: the color and
 * arrow every traffic light of the intersection shows in that state.
 */
public class Control {

    public static final String BLANK = "Blank";

    public static final String STATE_NAME = "StateName";
    public static final String COLOR = "Color";
    public static final String ARROW = "Arrow";

    private static final Control BLANK_CONTROL = new Control(BLANK, BLANK, BLANK);

    private final String stateName;
    private final String color;
    private final String arrow;

    public Control(String stateName, String color, String arrow) {
        this.stateName = stateName;
        this.color = color;
        this.arrow = arrow;
    }

    /**
     * The control used for any state name the intersection does not declare.
     */
    public static Control blank() {
        return BLANK_CONTROL;
    }

    static Control read(Map<String, Object> node, String path) {
        String stateName = Documents.readRequired(node, STATE_NAME, path);
        String color = Documents.readOptional(node, COLOR, BLANK);
        String arrow = Documents.readOptional(node, ARROW, BLANK);
        return new Control(stateName, color, arrow);
    }

    /**
     * Sends color and arrow to every id. All ids are actuated even if an
     * earlier request fails.
     *
     * @return true only if the simulator accepted every request
     */
    public boolean apply(Simulator simulator, Collection<Long> ids) {
        boolean result = true;
        for (long id : ids) {
            result &= simulator.setTrafficLightColor(id, color);
            result &= simulator.setTrafficLightArrow(id, arrow);
        }
        return result;
    }

    public String getStateName() {
        return stateName;
    }

    public String getColor() {
        return color;
    }

    public String getArrow() {
        return arrow;
    }

    @Override
    public String toString() {
        return stateName + " (" + color + ", " + arrow + ")";
    }

}
