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
package io.drivelabs.plugin;

import io.drivelabs.common.Documents;
import io.drivelabs.common.ScenarioException;

import java.util.Collections;
import java.util.Map;

/**
 * Base for actions, which receive their arguments under {@code Params}.
 */
public abstract class ActionBase extends ProcedureBase implements Action {

    public static final String PARAMS = "Params";

    protected Map<String, Object> params = Collections.emptyMap();

    protected ActionBase(String type) {
        super(type);
    }

    @Override
    protected void read(Map<String, Object> node) {
        Object value = node.get(PARAMS);
        if (value == null) {
            params = Collections.emptyMap();
        } else {
            params = Documents.asMap(value);
            if (params == null) {
                throw new ScenarioException(PARAMS, "expected a mapping but found " + Documents.kindOf(value));
            }
        }
        readParams(params);
    }

    protected void readParams(Map<String, Object> params) {

    }

}
