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

import java.util.Arrays;
import java.util.List;

/**
 * Handle to one evaluated or unevaluated {@link Node}, the value passed around
 * by the engine.
 * <p>
 * Handles share their node: {@link #copy()} never clones, and since trees are
 * acyclic and fixed once built, any number of handles may point at the same
 * node. The node lives as long as one handle (or parent node) still refers to
 * it. A handle without a node is {@link #EMPTY}, which evaluates to itself, is
 * falsy and renders as {@code ()}.
 * <pre>
 * Expression e = Expression.and(Expression.bool(true), Expression.number(2));
 * e.evaluate().isTruthy(); // true
 * e.toString();            // (And true 2)
 * </pre>
 */
public final class Expression {

    public static final Expression EMPTY = new Expression(null);

    private final Node node;

    private Expression(Node node) {
        this.node = node;
    }

    public static Expression of(Node node) {
        return node == null ? EMPTY : new Expression(node);
    }

    public static Expression bool(boolean value) {
        return new Expression(Literal.of(value));
    }

    public static Expression number(double value) {
        return new Expression(Literal.of(value));
    }

    public static Expression and(List<Expression> operands) {
        return new Expression(new LogicalNode.And(operands));
    }

    public static Expression and(Expression... operands) {
        return and(Arrays.asList(operands));
    }

    public static Expression or(List<Expression> operands) {
        return new Expression(new LogicalNode.Or(operands));
    }

    public static Expression or(Expression... operands) {
        return or(Arrays.asList(operands));
    }

    public static Expression not(Expression operand) {
        return new Expression(new Not(operand));
    }

    /**
     * A new handle on the same node.
     */
    public Expression copy() {
        return node == null ? EMPTY : new Expression(node);
    }

    public boolean isEmpty() {
        return node == null;
    }

    public Node getNode() {
        return node;
    }

    public NodeType getType() {
        return node == null ? null : node.type;
    }

    public Expression evaluate() {
        if (node == null) {
            return EMPTY;
        }
        Expression result = node.evaluate();
        return result == null ? EMPTY : result;
    }

    public boolean isTruthy() {
        return node != null && node.isTruthy();
    }

    void render(StringBuilder sb) {
        if (node == null) {
            sb.append("()");
        } else {
            node.render(sb);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        render(sb);
        return sb.toString();
    }

    /**
     * Two handles are equal when they share the same node.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Expression)) {
            return false;
        }
        return node == ((Expression) other).node;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(node);
    }

}
