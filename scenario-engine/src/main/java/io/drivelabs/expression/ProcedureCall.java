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

import io.drivelabs.plugin.ProcedureRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * A call to an externally implemented procedure, selected by name.
 * <p>
 * Loading failures (unknown name, rejected or broken configuration) do not
 * abort the scenario: the node is still built, holds no implementation and
 * evaluates to false. The same applies to an implementation that throws while
 * updating, the failure is logged and the call counts as false for that tick.
 *
 * @param <T> the procedure role
 */
public abstract sealed class ProcedureCall<T> extends Node permits PredicateCall, ActionCall {

    static final Logger logger = LoggerFactory.getLogger(ProcedureCall.class);

    protected final String procedureType;
    protected final Map<String, Object> configuration;
    protected final String path;
    protected final ScenarioContext context;
    protected final T impl;

    private boolean lastResult;

    ProcedureCall(NodeType type, String procedureType, Map<String, Object> configuration,
                  String path, ScenarioContext context, T impl) {
        super(type);
        this.procedureType = procedureType;
        this.configuration = configuration;
        this.path = path;
        this.context = context;
        this.impl = impl;
    }

    /**
     * Unmodifiable copy of the referencing mapping. Both the node and its
     * implementation are handed this copy.
     */
    static Map<String, Object> own(Map<String, Object> configuration) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
    }

    static <T> T loadImplementation(ProcedureRegistry<T> registry, String name, String path, Predicate<T> configurer) {
        T instance;
        try {
            instance = registry.instantiate(name);
        } catch (Exception e) {
            logger.error("{}: failed to instantiate '{}': {}", path, name, e.getMessage());
            return null;
        }
        if (instance == null) {
            logger.error("{}: no implementation for '{}'", path, name);
            return null;
        }
        try {
            if (configurer.test(instance)) {
                logger.debug("{}: loaded '{}'", path, name);
                return instance;
            }
            logger.error("{}: '{}' rejected its configuration", path, name);
        } catch (Exception e) {
            logger.error("{}: failed to configure '{}': {}", path, name, e.getMessage());
        }
        return null;
    }

    abstract boolean update(T impl);

    abstract String name();

    @Override
    public Expression evaluate() {
        if (impl == null) {
            logger.debug("{}: {} has no implementation, evaluating to false", path, procedureType);
            lastResult = false;
        } else {
            try {
                lastResult = update(impl);
            } catch (Exception e) {
                logger.error("{}: {} failed during update: {}", path, procedureType, e.getMessage());
                lastResult = false;
            }
        }
        return Expression.bool(lastResult);
    }

    @Override
    public boolean isTruthy() {
        return lastResult;
    }

    public boolean isLoaded() {
        return impl != null;
    }

    public T getImplementation() {
        return impl;
    }

    public String getProcedureType() {
        return procedureType;
    }

    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    public String getPath() {
        return path;
    }

    @Override
    void render(StringBuilder sb) {
        sb.append('(').append(name()).append(' ').append(procedureType);
        if (impl == null) {
            sb.append('!');
        }
        sb.append(')');
    }

}
