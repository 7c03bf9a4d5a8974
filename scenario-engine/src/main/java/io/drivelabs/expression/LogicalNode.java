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

import java.util.List;

/**
 * N-ary logical combinator over an ordered operand list.
 * <p>
 * Operands are evaluated left to right and every one of them is evaluated on
 * each call, there is no short-circuit: procedure side effects happen on every
 * tick whatever the values of their siblings.
 */
public abstract sealed class LogicalNode extends Node permits LogicalNode.And, LogicalNode.Or {

    private final List<Expression> operands;
    private boolean lastResult;

    LogicalNode(NodeType type, List<Expression> operands) {
        super(type);
        this.operands = List.copyOf(operands);
    }

    public List<Expression> getOperands() {
        return operands;
    }

    abstract boolean identity();

    abstract boolean combine(boolean lhs, boolean rhs);

    abstract String name();

    @Override
    public Expression evaluate() {
        boolean result = identity();
        for (Expression operand : operands) {
            result = combine(result, operand.evaluate().isTruthy());
        }
        lastResult = result;
        return Expression.bool(result);
    }

    @Override
    public boolean isTruthy() {
        return lastResult;
    }

    @Override
    void render(StringBuilder sb) {
        sb.append('(').append(name());
        for (Expression operand : operands) {
            sb.append(' ');
            operand.render(sb);
        }
        sb.append(')');
    }

    public static final class And extends LogicalNode {

        And(List<Expression> operands) {
            super(NodeType.AND, operands);
        }

        @Override
        boolean identity() {
            return true;
        }

        @Override
        boolean combine(boolean lhs, boolean rhs) {
            return lhs && rhs;
        }

        @Override
        String name() {
            return "And";
        }

    }

    public static final class Or extends LogicalNode {

        Or(List<Expression> operands) {
            super(NodeType.OR, operands);
        }

        @Override
        boolean identity() {
            return false;
        }

        @Override
        boolean combine(boolean lhs, boolean rhs) {
            return lhs || rhs;
        }

        @Override
        String name() {
            return "Or";
        }

    }

}
