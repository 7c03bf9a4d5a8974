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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Registry backed by an explicit name to factory table, filled in at start-up.
 * <pre>
 * DefaultProcedureRegistry&lt;Condition&gt; conditions = new DefaultProcedureRegistry&lt;Condition&gt;("condition")
 *     .register("AlwaysTrueCondition", AlwaysTrueCondition::new);
 * </pre>
 * Every call to {@link #instantiate(String)} yields a fresh instance so that
 * each reference in a scenario is configured independently.
 */
public class DefaultProcedureRegistry<T> implements ProcedureRegistry<T> {

    static final Logger logger = LoggerFactory.getLogger(DefaultProcedureRegistry.class);

    private final String kind;
    private final Map<String, Supplier<? extends T>> factories = new LinkedHashMap<>();

    public DefaultProcedureRegistry(String kind) {
        this.kind = kind;
    }

    public DefaultProcedureRegistry<T> register(String name, Supplier<? extends T> factory) {
        if (factories.put(name, factory) != null) {
            logger.warn("{} '{}' registered more than once, replacing", kind, name);
        }
        return this;
    }

    @Override
    public boolean has(String name) {
        return factories.containsKey(name);
    }

    @Override
    public T instantiate(String name) {
        Supplier<? extends T> factory = factories.get(name);
        if (factory == null) {
            logger.error("failed to load {} '{}', declared: {}", kind, name, factories.keySet());
            return null;
        }
        T instance = factory.get();
        if (instance == null) {
            logger.error("factory for {} '{}' returned null", kind, name);
        }
        return instance;
    }

    @Override
    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    public String getKind() {
        return kind;
    }

}
