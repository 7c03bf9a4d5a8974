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
import io.drivelabs.simulator.Simulator;

import java.util.Map;

/**
 * State shared by condition and action implementations: the type they were
 * registered under, an optional display {@code Name}, the mapping that
 * configured them and the simulator handle.
 */
public abstract class ProcedureBase {

    public static final String NAME = "Name";

    protected final String type;
    protected String name;
    protected Map<String, Object> node;
    protected Simulator simulator;
    protected boolean configured;

    protected ProcedureBase(String type) {
        this.type = type;
        this.name = type;
    }

    /**
     * Stores the common fields then hands over to {@link #read(Map)}. Any
     * exception thrown while reading leaves the procedure unconfigured and is
     * passed on to the caller.
     */
    public boolean configure(Map<String, Object> node, Simulator simulator) {
        configured = false;
        this.node = node;
        this.simulator = simulator;
        name = Documents.readOptional(node, NAME, type);
        read(node);
        configured = true;
        return true;
    }

    /**
     * Reads implementation specific fields. The default reads nothing.
     */
    protected void read(Map<String, Object> node) {

    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public boolean isConfigured() {
        return configured;
    }

    @Override
    public String toString() {
        return name.equals(type) ? type : type + "[" + name + "]";
    }

}
