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

import io.drivelabs.common.FormatUtils;
import io.drivelabs.common.SimulationStatus;

import java.util.LinkedHashMap;
import java.util.Map;

public class ScenarioResult {

    private final String name;
    private final SimulationStatus status;
    private final long ticks;
    private final boolean timedOut;
    private final long startTime;
    private final long endTime;
    private final double mileage;
    private final String success;
    private final String failure;

    ScenarioResult(ScenarioRunner runner, boolean timedOut, long startTime, long endTime) {
        name = runner.getDocument().getName();
        status = runner.getStatus();
        ticks = runner.getTick();
        this.timedOut = timedOut;
        this.startTime = startTime;
        this.endTime = endTime;
        mileage = runner.currentMileage();
        success = runner.getSuccess().toString();
        failure = runner.getFailure().toString();
    }

    public String getName() {
        return name;
    }

    public SimulationStatus getStatus() {
        return status;
    }

    public boolean isSucceeded() {
        return status == SimulationStatus.SUCCEEDED;
    }

    public long getTicks() {
        return ticks;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    public double getMileage() {
        return mileage;
    }

    public String getSuccess() {
        return success;
    }

    public String getFailure() {
        return failure;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("status", status.name());
        map.put("ticks", ticks);
        map.put("timedOut", timedOut);
        map.put("startTime", startTime);
        map.put("endTime", endTime);
        map.put("durationMillis", getDurationMillis());
        map.put("mileage", mileage);
        map.put("success", success);
        map.put("failure", failure);
        return map;
    }

    public String toJson() {
        return FormatUtils.toJson(toMap());
    }

    @Override
    public String toString() {
        return name + " " + status + " after " + ticks + " tick(s)" + (timedOut ? " (timed out)" : "");
    }

}
