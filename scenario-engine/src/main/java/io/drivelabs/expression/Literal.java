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

/**
 * Boolean or number terminal. Immutable, evaluating it yields a handle to the
 * same node.
 */
public final class Literal extends Node {

    static final Literal TRUE = new Literal(true);
    static final Literal FALSE = new Literal(false);

    private final boolean bool;
    private final double number;

    private Literal(boolean value) {
        super(NodeType.BOOLEAN);
        bool = value;
        number = value ? 1 : 0;
    }

    private Literal(double value) {
        super(NodeType.NUMBER);
        bool = value != 0;
        number = value;
    }

    static Literal of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Literal of(double value) {
        return new Literal(value);
    }

    @Override
    public Expression evaluate() {
        return Expression.of(this);
    }

    @Override
    public boolean isTruthy() {
        return bool;
    }

    public boolean isNumber() {
        return type == NodeType.NUMBER;
    }

    public double getNumber() {
        return number;
    }

    @Override
    void render(StringBuilder sb) {
        if (type == NodeType.BOOLEAN) {
            sb.append(bool);
        } else if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
            sb.append((long) number);
        } else {
            sb.append(number);
        }
    }

}
