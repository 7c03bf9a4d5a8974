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

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.drivelabs.expression.Expression.and;
import static io.drivelabs.expression.Expression.bool;
import static io.drivelabs.expression.Expression.not;
import static io.drivelabs.expression.Expression.number;
import static io.drivelabs.expression.Expression.or;
import static org.junit.jupiter.api.Assertions.*;

class LogicalNodeTest {

    static boolean eval(Expression expression) {
        return expression.evaluate().isTruthy();
    }

    @Test
    void testIdentities() {
        assertTrue(eval(and(List.of())));
        assertFalse(eval(or(List.of())));
        assertEquals("(And)", and().toString());
        assertEquals("(Or)", or().toString());
    }

    @Test
    void testAnd() {
        assertFalse(eval(and(bool(true), bool(true), bool(false))));
        assertTrue(eval(and(bool(true), bool(true), bool(true))));
        assertTrue(eval(and(number(1), bool(true))));
        assertFalse(eval(and(number(0), bool(true))));
    }

    @Test
    void testOr() {
        assertTrue(eval(or(bool(false), bool(false), bool(true))));
        assertFalse(eval(or(bool(false), number(0))));
    }

    @Test
    void testNot() {
        assertFalse(eval(not(bool(true))));
        assertTrue(eval(not(bool(false))));
        assertTrue(eval(not(and(bool(true), bool(false)))));
    }

    @Test
    void testNested() {
        Expression expression = and(or(bool(false), number(4)), not(bool(false)));
        assertTrue(eval(expression));
        assertEquals("(And (Or false 4) (Not false))", expression.toString());
    }

    @Test
    void testResultIsABooleanLiteral() {
        Expression result = and(number(2), number(3)).evaluate();
        assertEquals(NodeType.BOOLEAN, result.getType());
        assertEquals("true", result.toString());
    }

    @Test
    void testLastResultIsRemembered() {
        Expression expression = or(bool(true));
        assertFalse(expression.isTruthy());
        expression.evaluate();
        assertTrue(expression.isTruthy());
    }

    @Test
    void testOperandsAreImmutable() {
        LogicalNode node = (LogicalNode) and(bool(true)).getNode();
        assertThrows(UnsupportedOperationException.class, () -> node.getOperands().add(bool(false)));
    }

}
