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

import io.drivelabs.plugin.Action;

import java.util.Map;

public final class ActionCall extends ProcedureCall<Action> {

    public static final String SUFFIX = "Action";

    private ActionCall(String procedureType, Map<String, Object> configuration,
                       String path, ScenarioContext context, Action impl) {
        super(NodeType.ACTION, procedureType, configuration, path, context, impl);
    }

    static ActionCall load(String procedureType, Map<String, Object> configuration,
                           String path, ScenarioContext context) {
        Map<String, Object> owned = own(configuration);
        Action impl = loadImplementation(context.getActions(), procedureType + SUFFIX, path,
                action -> action.configure(owned, context.getSimulator()));
        return new ActionCall(procedureType, owned, path, context, impl);
    }

    @Override
    boolean update(Action impl) {
        return impl.update(context.getIntersections());
    }

    @Override
    String name() {
        return "Action";
    }

}
