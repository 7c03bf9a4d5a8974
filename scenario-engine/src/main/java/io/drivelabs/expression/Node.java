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
 * One constituent of an expression tree. The set of kinds is closed, see
 * {@link NodeType}.
 * <p>
 * Nodes are built bottom-up by the {@link ExpressionReader} and never change
 * shape afterwards. The only state that moves is the remembered outcome of the
 * latest evaluation, which is written by the single thread driving the ticks.
 */
public abstract sealed class Node permits Literal, LogicalNode, Not, ProcedureCall {

    public final NodeType type;

    protected Node(NodeType type) {
        this.type = type;
    }

    /**
     * Evaluates this node. Never returns null, "no result" is {@link Expression#EMPTY}.
     */
    public abstract Expression evaluate();

    /**
     * Truthiness as seen by the logical combinators. For literals this is the
     * payload, for every other kind it is the outcome of the most recent
     * evaluation (false before the first one).
     */
    public abstract boolean isTruthy();

    abstract void render(StringBuilder sb);

    public String render() {
        StringBuilder sb = new StringBuilder();
        render(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }

}
