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

import io.drivelabs.intersection.IntersectionManager;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultProcedureRegistryTest {

    static class SampleCondition extends ConditionBase {

        SampleCondition() {
            super("Sample");
        }

        @Override
        public boolean update(IntersectionManager intersections) {
            return true;
        }

    }

    @Test
    void testInstantiateReturnsFreshInstances() {
        DefaultProcedureRegistry<Condition> registry = new DefaultProcedureRegistry<Condition>("condition")
                .register("SampleCondition", SampleCondition::new);
        assertTrue(registry.has("SampleCondition"));
        Condition first = registry.instantiate("SampleCondition");
        Condition second = registry.instantiate("SampleCondition");
        assertNotNull(first);
        assertNotSame(first, second);
        assertEquals("Sample", first.getType());
        assertEquals(Set.of("SampleCondition"), registry.names());
    }

    @Test
    void testUnknownNameYieldsNull() {
        DefaultProcedureRegistry<Condition> registry = new DefaultProcedureRegistry<>("condition");
        assertFalse(registry.has("Sample"));
        assertNull(registry.instantiate("Sample"));
        assertEquals("condition", registry.getKind());
    }

    @Test
    void testRegisterReplaces() {
        DefaultProcedureRegistry<Condition> registry = new DefaultProcedureRegistry<Condition>("condition")
                .register("SampleCondition", () -> null)
                .register("SampleCondition", SampleCondition::new);
        assertNotNull(registry.instantiate("SampleCondition"));
        assertThrows(UnsupportedOperationException.class, () -> registry.names().add("Other"));
    }

    @Test
    void testNameDefaultsToType() {
        SampleCondition condition = new SampleCondition();
        assertFalse(condition.isConfigured());
        assertTrue(condition.configure(Map.of(), null));
        assertEquals("Sample", condition.getName());
        assertTrue(condition.isConfigured());
        assertEquals("Sample", condition.toString());
    }

}
