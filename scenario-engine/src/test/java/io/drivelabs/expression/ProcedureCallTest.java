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

import io.drivelabs.common.ScenarioException;
import io.drivelabs.intersection.IntersectionManager;
import io.drivelabs.plugin.Action;
import io.drivelabs.plugin.ActionBase;
import io.drivelabs.plugin.Condition;
import io.drivelabs.plugin.ConditionBase;
import io.drivelabs.plugin.DefaultProcedureRegistry;
import io.drivelabs.simulator.RecordingSimulator;
import io.drivelabs.simulator.Simulator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.drivelabs.common.TestUtils.list;
import static io.drivelabs.common.TestUtils.map;
import static org.junit.jupiter.api.Assertions.*;

class ProcedureCallTest {

    final List<String> events = new ArrayList<>();
    final RecordingSimulator simulator = new RecordingSimulator();
    final IntersectionManager intersections = IntersectionManager.empty();

    DefaultProcedureRegistry<Condition> conditions;
    DefaultProcedureRegistry<Action> actions;
    ExpressionReader reader;

    class TracingCondition extends ConditionBase {

        boolean value;
        Simulator seenSimulator;

        TracingCondition() {
            super("Tracing");
        }

        @Override
        protected void read(Map<String, Object> node) {
            value = Boolean.TRUE.equals(node.get("Value"));
            seenSimulator = simulator;
        }

        @Override
        public boolean update(IntersectionManager manager) {
            assertSame(intersections, manager);
            events.add(name);
            return value;
        }

    }

    class TracingAction extends ActionBase {

        TracingAction() {
            super("Tracing");
        }

        @Override
        protected void readParams(Map<String, Object> params) {
            if (!params.containsKey("Target")) {
                throw new ScenarioException(PARAMS, "requires hash 'Target'");
            }
        }

        @Override
        public boolean update(IntersectionManager manager) {
            events.add("action:" + params.get("Target"));
            return true;
        }

    }

    @BeforeEach
    void beforeEach() {
        conditions = new DefaultProcedureRegistry<Condition>("condition")
                .register("TracingCondition", TracingCondition::new)
                .register("RejectingCondition", () -> new ConditionBase("Rejecting") {
                    @Override
                    public boolean configure(Map<String, Object> node, Simulator simulator) {
                        return false;
                    }

                    @Override
                    public boolean update(IntersectionManager manager) {
                        events.add("rejecting");
                        return true;
                    }
                })
                .register("ExplodingCondition", () -> new ConditionBase("Exploding") {
                    @Override
                    public boolean update(IntersectionManager manager) {
                        events.add("exploding");
                        throw new IllegalStateException("sensor offline");
                    }
                })
                .register("BrokenFactoryCondition", () -> {
                    throw new IllegalStateException("cannot construct");
                });
        actions = new DefaultProcedureRegistry<Action>("action")
                .register("TracingAction", TracingAction::new);
        reader = new ExpressionReader(new ScenarioContext(simulator, intersections, conditions, actions));
    }

    @Test
    void testAllOperandsAreEvaluated() {
        Expression expression = reader.read(map("All", list(
                map("Type", "Tracing", "Name", "first", "Value", false),
                map("Type", "Tracing", "Name", "second", "Value", true),
                map("Type", "Tracing", "Params", map("Target", "lights")))));
        assertFalse(expression.evaluate().isTruthy());
        assertEquals(List.of("first", "second", "action:lights"), events);
        events.clear();
        Expression any = reader.read(map("Any", list(
                map("Type", "Tracing", "Name", "a", "Value", true),
                map("Type", "Tracing", "Name", "b", "Value", false))));
        assertTrue(any.evaluate().isTruthy());
        assertEquals(List.of("a", "b"), events);
    }

    @Test
    void testConfigureReceivesSimulator() {
        PredicateCall call = (PredicateCall) reader.read(map("Type", "Tracing")).getNode();
        TracingCondition condition = (TracingCondition) call.getImplementation();
        assertSame(simulator, condition.seenSimulator);
        assertTrue(condition.isConfigured());
    }

    @Test
    void testConfigurationIsCopied() {
        Map<String, Object> document = map("Type", "Tracing", "Value", true);
        PredicateCall call = (PredicateCall) reader.read(document).getNode();
        document.put("Value", false);
        document.put("Extra", 1);
        assertEquals(Map.of("Type", "Tracing", "Value", true), call.getConfiguration());
        assertThrows(UnsupportedOperationException.class, () -> call.getConfiguration().put("Extra", 1));
        assertTrue(call.evaluate().isTruthy());
    }

    @Test
    void testRejectedConfigurationDegradesToFalse() {
        Expression expression = reader.read(map("Type", "Rejecting"));
        assertFalse(((ProcedureCall<?>) expression.getNode()).isLoaded());
        assertFalse(expression.evaluate().isTruthy());
        assertTrue(events.isEmpty());
    }

    @Test
    void testConfigurationExceptionDegradesToFalse() {
        Expression expression = reader.read(map("Type", "Tracing", "Params", map()));
        assertEquals("(Action Tracing!)", expression.toString());
        assertFalse(expression.evaluate().isTruthy());
    }

    @Test
    void testFactoryExceptionDegradesToFalse() {
        Expression expression = reader.read(map("Type", "BrokenFactory"));
        assertEquals("(Predicate BrokenFactory!)", expression.toString());
        assertFalse(expression.evaluate().isTruthy());
    }

    @Test
    void testUpdateExceptionIsContained() {
        Expression expression = reader.read(map("Any", list(
                map("Type", "Exploding"),
                map("Type", "Tracing", "Name", "after", "Value", true))));
        assertTrue(expression.evaluate().isTruthy());
        assertEquals(List.of("exploding", "after"), events);
        ProcedureCall<?> exploding = (ProcedureCall<?>) ((LogicalNode) expression.getNode()).getOperands().get(0).getNode();
        assertTrue(exploding.isLoaded());
        assertFalse(exploding.isTruthy());
    }

    @Test
    void testTruthinessFollowsLastResult() {
        Expression expression = reader.read(map("Type", "Tracing", "Value", true));
        assertFalse(expression.isTruthy());
        expression.evaluate();
        assertTrue(expression.isTruthy());
    }

    @Test
    void testActionRegistryIsSeparate() {
        // a predicate of the same name does not satisfy an action call
        Expression expression = reader.read(map("Type", "Exploding", "Params", map()));
        assertEquals("(Action Exploding!)", expression.toString());
    }

}
