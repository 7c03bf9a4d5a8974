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

import io.drivelabs.common.Documents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a parsed configuration document into an {@link Expression} tree.
 * <pre>
 * Expression   = All | Any | Not | Predicate | Action
 * All          = { All: [ Expression* ] }
 * Any          = { Any: [ Expression* ] }
 * Not          = { Not: Expression }
 * Predicate    = { Type: name, ... }
 * Action       = { Type: name, Params: { ... }, ... }
 * </pre>
 * When a mapping carries more than one of the keys the first one in the order
 * above wins. Anything else (scalars, bare sequences, null, unknown keys) is
 * rejected with an {@link ExpressionException} that names the document path.
 * Procedure loading problems are not structural and never throw here, see
 * {@link ProcedureCall}. A mapping or sequence that contains itself (possible
 * with YAML anchors and aliases) is rejected as well.
 */
public class ExpressionReader {

    static final Logger logger = LoggerFactory.getLogger(ExpressionReader.class);

    public static final String ALL = "All";
    public static final String ANY = "Any";
    public static final String NOT = "Not";
    public static final String TYPE = "Type";
    public static final String PARAMS = "Params";

    private static final String ROOT = "<root>";
    private static final List<String> KEYWORDS = List.of(ALL, ANY, NOT, TYPE);

    private final ScenarioContext context;
    // mappings and sequences on the path currently being read
    private final Set<Object> visiting = Collections.newSetFromMap(new IdentityHashMap<>());

    public ExpressionReader(ScenarioContext context) {
        this.context = context;
    }

    public Expression read(Object document) {
        return read(document, "");
    }

    public Expression read(Object document, String path) {
        Expression expression = readExpression(document, path);
        if (logger.isDebugEnabled()) {
            logger.debug("{}: {}", path.isEmpty() ? ROOT : path, expression);
        }
        return expression;
    }

    private Expression readExpression(Object document, String path) {
        Map<String, Object> map = Documents.asMap(document);
        if (map == null) {
            throw new ExpressionException(path, "expected a mapping with one of "
                    + KEYWORDS + " but found " + Documents.kindOf(document));
        }
        enter(map, path);
        try {
            return readMapping(map, path);
        } finally {
            visiting.remove(map);
        }
    }

    private void enter(Object node, String path) {
        if (!visiting.add(node)) {
            throw new ExpressionException(path, "recursive reference");
        }
    }

    private Expression readMapping(Map<String, Object> map, String path) {
        if (map.containsKey(ALL)) {
            return Expression.and(readOperands(map.get(ALL), Documents.child(path, ALL)));
        }
        if (map.containsKey(ANY)) {
            return Expression.or(readOperands(map.get(ANY), Documents.child(path, ANY)));
        }
        if (map.containsKey(NOT)) {
            return Expression.not(readExpression(map.get(NOT), Documents.child(path, NOT)));
        }
        if (map.containsKey(TYPE)) {
            String type = readType(map.get(TYPE), Documents.child(path, TYPE));
            String where = path.isEmpty() ? ROOT : path;
            if (map.containsKey(PARAMS)) {
                return Expression.of(ActionCall.load(type, map, where, context));
            }
            return Expression.of(PredicateCall.load(type, map, where, context));
        }
        throw new ExpressionException(path, "unrecognized keys " + map.keySet()
                + ", expected one of " + KEYWORDS);
    }

    private List<Expression> readOperands(Object node, String path) {
        List<Object> list = Documents.asList(node);
        if (list == null) {
            throw new ExpressionException(path, "expected a sequence but found " + Documents.kindOf(node));
        }
        enter(list, path);
        try {
            List<Expression> operands = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                operands.add(readExpression(list.get(i), Documents.index(path, i)));
            }
            return operands;
        } finally {
            visiting.remove(list);
        }
    }

    private static String readType(Object node, String path) {
        if (!Documents.isScalar(node)) {
            throw new ExpressionException(path, "expected a procedure name but found " + Documents.kindOf(node));
        }
        String type = node.toString().trim();
        if (type.isEmpty()) {
            throw new ExpressionException(path, "procedure name must not be empty");
        }
        return type;
    }

    public ScenarioContext getContext() {
        return context;
    }

}
