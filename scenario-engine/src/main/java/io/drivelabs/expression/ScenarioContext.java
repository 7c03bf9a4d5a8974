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
package io.drivelabs.expression;

import io.drivelabs.intersection.IntersectionManager;
import io.drivelabs.plugin.Action;
import io.drivelabs.plugin.Condition;
import io.drivelabs.plugin.DefaultProcedureRegistry;
import io.drivelabs.plugin.ProcedureRegistry;
import io.drivelabs.simulator.Simulator;

import java.util.Objects;

/**
 * Everything a procedure call needs at load time and on each tick. Handed
 * explicitly to the {@link ExpressionReader}, which passes it on to every
 * procedure node it builds.
 */
public class ScenarioContext {

    private final Simulator simulator;
    private final IntersectionManager intersections;
    private final ProcedureRegistry<Condition> conditions;
    private final ProcedureRegistry<Action> actions;

    public ScenarioContext(Simulator simulator,
                           IntersectionManager intersections,
                           ProcedureRegistry<Condition> conditions,
                           ProcedureRegistry<Action> actions) {
        this.simulator = Objects.requireNonNull(simulator, "simulator");
        this.intersections = intersections == null ? IntersectionManager.empty() : intersections;
        this.conditions = conditions == null ? new DefaultProcedureRegistry<>("condition") : conditions;
        this.actions = actions == null ? new DefaultProcedureRegistry<>("action") : actions;
    }

    public Simulator getSimulator() {
        return simulator;
    }

    public IntersectionManager getIntersections() {
        return intersections;
    }

    public ProcedureRegistry<Condition> getConditions() {
        return conditions;
    }

    public ProcedureRegistry<Action> getActions() {
        return actions;
    }

}
