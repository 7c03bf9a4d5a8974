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

import io.drivelabs.common.Documents;
import io.drivelabs.common.FileUtils;
import io.drivelabs.common.FormatUtils;
import io.drivelabs.common.ScenarioException;

import java.io.File;
import java.util.Map;

/**
 * A parsed scenario file.
 * <pre>
 * Intersection:
 *   - TrafficLightId: [34802, 34806]
 *     Control:
 *       - StateName: Red
 *         Color: Red
 * Story:
 *   EndCondition:
 *     Success: { Type: MoveDistance, Value: 100 }
 *     Failure: { Type: AlwaysFalse }
 * </pre>
 */
public class ScenarioDocument {

    public static final String INTERSECTION = "Intersection";
    public static final String STORY = "Story";
    public static final String END_CONDITION = "EndCondition";
    public static final String SUCCESS = "Success";
    public static final String FAILURE = "Failure";

    public static final String SUCCESS_PATH = STORY + "." + END_CONDITION + "." + SUCCESS;
    public static final String FAILURE_PATH = STORY + "." + END_CONDITION + "." + FAILURE;

    private final String name;
    private final Map<String, Object> root;

    private ScenarioDocument(String name, Map<String, Object> root) {
        this.name = name;
        this.root = root;
    }

    public static ScenarioDocument read(File file) {
        String text = FileUtils.toString(file);
        try {
            return of(file.getName(), text);
        } catch (ScenarioException e) {
            throw new ScenarioException(file.getPath(), e.getMessage(), e);
        }
    }

    public static ScenarioDocument of(String yaml) {
        return of("<inline>", yaml);
    }

    public static ScenarioDocument of(String name, String yaml) {
        Object parsed = FormatUtils.fromYaml(yaml);
        Map<String, Object> root = Documents.asMap(parsed);
        if (root == null) {
            throw new ScenarioException(null, "expected a mapping at the document root but found "
                    + Documents.kindOf(parsed));
        }
        return new ScenarioDocument(name, root);
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getRoot() {
        return root;
    }

    public Object getIntersections() {
        return root.get(INTERSECTION);
    }

    public Object getSuccess() {
        return Documents.at(root, STORY, END_CONDITION, SUCCESS);
    }

    public Object getFailure() {
        return Documents.at(root, STORY, END_CONDITION, FAILURE);
    }

}
