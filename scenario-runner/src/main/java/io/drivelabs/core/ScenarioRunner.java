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
package io.drivelabs.core;

import io.drivelabs.common.ScenarioException;
import io.drivelabs.common.SimulationStatus;
import io.drivelabs.expression.Expression;
import io.drivelabs.expression.ExpressionReader;
import io.drivelabs.expression.ScenarioContext;
import io.drivelabs.intersection.IntersectionManager;
import io.drivelabs.plugin.Action;
import io.drivelabs.plugin.Condition;
import io.drivelabs.plugin.ProcedureRegistry;
import io.drivelabs.simulator.Simulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Drives one scenario tick by tick. Every tick updates the intersections and
 * evaluates both end conditions in full; a failure outweighs a success and
 * once either holds the status no longer changes.
 * <pre>
 * ScenarioRunner runner = ScenarioRunner.builder()
 *         .document(ScenarioDocument.read(file))
 *         .simulator(simulator)
 *         .build();
 * ScenarioResult result = runner.run(1000);
 * </pre>
 */
public class ScenarioRunner {

    static final Logger logger = LoggerFactory.getLogger(ScenarioRunner.class);

    private final ScenarioDocument document;
    private final ScenarioContext context;
    private final Expression success;
    private final Expression failure;
    private final List<ScenarioHook> hooks;

    private SimulationStatus status = SimulationStatus.ONGOING;
    private long tick;

    private ScenarioRunner(Builder builder) {
        document = builder.document;
        Simulator simulator = builder.simulator;
        IntersectionManager intersections = IntersectionManager.read(
                document.getIntersections(), simulator, ScenarioDocument.INTERSECTION);
        context = new ScenarioContext(simulator, intersections, builder.conditions, builder.actions);
        ExpressionReader reader = new ExpressionReader(context);
        Object successNode = document.getSuccess();
        if (successNode == null) {
            throw new ScenarioException(ScenarioDocument.SUCCESS_PATH, "end condition is required");
        }
        success = reader.read(successNode, ScenarioDocument.SUCCESS_PATH);
        Object failureNode = document.getFailure();
        failure = failureNode == null ? Expression.or() : reader.read(failureNode, ScenarioDocument.FAILURE_PATH);
        hooks = builder.hooks;
        logger.info("scenario {} loaded, {} intersection(s)", document.getName(), intersections.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private ScenarioDocument document;
        private Simulator simulator;
        private ProcedureRegistry<Condition> conditions;
        private ProcedureRegistry<Action> actions;
        private final List<ScenarioHook> hooks = new ArrayList<>();

        Builder() {
        }

        public Builder document(ScenarioDocument document) {
            this.document = document;
            return this;
        }

        public Builder yaml(String text) {
            return document(ScenarioDocument.of(text));
        }

        public Builder simulator(Simulator simulator) {
            this.simulator = simulator;
            return this;
        }

        public Builder conditions(ProcedureRegistry<Condition> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder actions(ProcedureRegistry<Action> actions) {
            this.actions = actions;
            return this;
        }

        public Builder hook(ScenarioHook hook) {
            if (hook != null) {
                hooks.add(hook);
            }
            return this;
        }

        public Builder hooks(Collection<ScenarioHook> values) {
            if (values != null) {
                values.forEach(this::hook);
            }
            return this;
        }

        public ScenarioRunner build() {
            Objects.requireNonNull(document, "document");
            Objects.requireNonNull(simulator, "simulator");
            if (conditions == null) {
                conditions = Procedures.conditions();
            }
            if (actions == null) {
                actions = Procedures.actions();
            }
            return new ScenarioRunner(this);
        }

    }

    /**
     * Advances one tick and returns the status after it. Has no effect once
     * the scenario has concluded.
     */
    public SimulationStatus update() {
        if (status.isConcluded()) {
            return status;
        }
        tick++;
        SimulationStatus intersectionStatus = context.getIntersections().update(tick);
        boolean failed = failure.evaluate().isTruthy();
        boolean succeeded = success.evaluate().isTruthy();
        if (failed) {
            status = SimulationStatus.FAILED;
        } else if (succeeded) {
            status = SimulationStatus.SUCCEEDED;
        } else {
            status = intersectionStatus;
        }
        if (status.isConcluded()) {
            logger.info("scenario {} {} at tick {}", document.getName(), status, tick);
        } else if (logger.isTraceEnabled()) {
            logger.trace("tick {}: success {} failure {}", tick, success, failure);
        }
        return status;
    }

    /**
     * Ticks until the scenario concludes, a hook stops it or {@code maxTicks}
     * ticks have passed. A non-positive limit means no limit.
     */
    public ScenarioResult run(long maxTicks) {
        long startTime = System.currentTimeMillis();
        boolean stopped = false;
        while (!status.isConcluded() && (maxTicks <= 0 || tick < maxTicks)) {
            long next = tick + 1;
            if (!beforeTick(next)) {
                logger.info("scenario {} stopped by hook before tick {}", document.getName(), next);
                stopped = true;
                break;
            }
            SimulationStatus current = update();
            for (ScenarioHook hook : hooks) {
                hook.afterTick(this, tick, current);
            }
        }
        boolean timedOut = !stopped && !status.isConcluded();
        if (timedOut) {
            logger.warn("scenario {} did not conclude within {} ticks", document.getName(), maxTicks);
        }
        return new ScenarioResult(this, timedOut, startTime, System.currentTimeMillis());
    }

    private boolean beforeTick(long next) {
        for (ScenarioHook hook : hooks) {
            if (!hook.beforeTick(this, next)) {
                return false;
            }
        }
        return true;
    }

    public SimulationStatus getStatus() {
        return status;
    }

    public long getTick() {
        return tick;
    }

    public double currentMileage() {
        return context.getSimulator().getMoveDistance();
    }

    public ScenarioDocument getDocument() {
        return document;
    }

    public ScenarioContext getContext() {
        return context;
    }

    public Expression getSuccess() {
        return success;
    }

    public Expression getFailure() {
        return failure;
    }

}
