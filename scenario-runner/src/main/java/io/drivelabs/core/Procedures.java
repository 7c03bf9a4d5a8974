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

import io.drivelabs.actions.ChangeIntersectionAction;
import io.drivelabs.conditions.AlwaysFalseCondition;
import io.drivelabs.conditions.AlwaysTrueCondition;
import io.drivelabs.conditions.IntersectionStateCondition;
import io.drivelabs.conditions.MoveDistanceCondition;
import io.drivelabs.plugin.Action;
import io.drivelabs.plugin.Condition;
import io.drivelabs.plugin.DefaultProcedureRegistry;

/**
 * Registries pre-populated with the built-in conditions and actions. Each
 * call returns a new registry so callers may add their own entries.
 */
public class Procedures {

    private Procedures() {
        // only static methods
    }

    public static DefaultProcedureRegistry<Condition> conditions() {
        return new DefaultProcedureRegistry<Condition>("condition")
                .register("AlwaysTrueCondition", AlwaysTrueCondition::new)
                .register("AlwaysFalseCondition", AlwaysFalseCondition::new)
                .register("IntersectionStateCondition", IntersectionStateCondition::new)
                .register("MoveDistanceCondition", MoveDistanceCondition::new);
    }

    public static DefaultProcedureRegistry<Action> actions() {
        return new DefaultProcedureRegistry<Action>("action")
                .register("ChangeIntersectionAction", ChangeIntersectionAction::new);
    }

}
