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
package io.drivelabs.common;

/**
 * Outcome reported once per tick by anything that takes part in a scenario run.
 */
public enum SimulationStatus {

    ONGOING,
    SUCCEEDED,
    FAILED;

    public boolean isConcluded() {
        return this != ONGOING;
    }

    /**
     * Combines two statuses, a failure outweighs a success which outweighs ongoing.
     */
    public SimulationStatus and(SimulationStatus other) {
        if (this == FAILED || other == FAILED) {
            return FAILED;
        }
        if (this == SUCCEEDED || other == SUCCEEDED) {
            return SUCCEEDED;
        }
        return ONGOING;
    }

}
