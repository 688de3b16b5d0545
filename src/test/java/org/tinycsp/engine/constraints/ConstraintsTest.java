/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.constraints;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.ConstraintType;
import org.tinycsp.engine.core.Value;

import static org.junit.jupiter.api.Assertions.*;
import static org.tinycsp.CSPFactory.*;

public class ConstraintsTest {

    private static Assignment xy(Value x, Value y) {
        return Assignment.of("x", x, "y", y);
    }

    @Test
    public void equalityAndDifference() {
        Equal e = eq("e", "x", "y");
        NotEqual d = neq("d", "x", "y");
        assertEquals(ConstraintType.EQUALITY, e.getType());
        assertEquals(ConstraintType.INEQUALITY, d.getType());

        assertTrue(e.isSatisfied(xy(Value.of("a"), Value.of("a"))));
        assertFalse(d.isSatisfied(xy(Value.of("a"), Value.of("a"))));
        assertTrue(d.isSatisfied(xy(Value.ofSet(1, 2), Value.ofSet(1))));
        assertTrue(e.isSatisfied(xy(Value.ofSet(1, 2), Value.ofSet(2, 1))));
    }

    @Test
    public void orderings() {
        Assignment a = xy(Value.of(1), Value.of(2.5));
        assertTrue(lt("c", "x", "y").isSatisfied(a));
        assertTrue(le("c", "x", "y").isSatisfied(a));
        assertFalse(gt("c", "x", "y").isSatisfied(a));
        assertFalse(ge("c", "x", "y").isSatisfied(a));
        assertTrue(ge("c", "x", "y").isSatisfied(xy(Value.of(2), Value.of(2))));
        assertEquals(ConstraintType.GREATER_EQUAL, ge("c", "x", "y").getType());
        assertThrows(IllegalArgumentException.class, () -> new Ordering("c", "x", Relation.EQ, "y"));
        assertThrows(IllegalStateException.class, () -> lt("c", "x", "y").isSatisfied(xy(Value.of(true), Value.of(false))));
    }

    @Test
    public void membership() {
        Membership in = inSet("in", "x", Value.of(1), Value.of(3));
        Membership out = notInSet("out", "x", Value.of(1), Value.of(3));
        assertEquals(1, in.arity());
        assertEquals(ConstraintType.NOT_IN_SET, out.getType());
        assertTrue(in.isSatisfied(Assignment.of("x", Value.of(3))));
        assertFalse(out.isSatisfied(Assignment.of("x", Value.of(3))));
        assertTrue(out.isSatisfied(Assignment.of("x", Value.of(2))));
    }

    @Test
    public void allDifferentConstraint() {
        AllDifferent c = allDifferent("ad", "a", "b", "c");
        assertEquals(3, c.arity());
        assertTrue(c.isSatisfied(Assignment.of("a", Value.of(1), "b", Value.of(2), "c", Value.of(3))));
        assertFalse(c.isSatisfied(Assignment.of("a", Value.of(1), "b", Value.of(2), "c", Value.of(1))));
    }

    @Test
    public void linearConstraint() {
        LinearSum sum = sumEquals("s", 6, "a", "b", "c");
        assertEquals(ConstraintType.SUM_EQUALS, sum.getType());
        assertTrue(sum.isSatisfied(Assignment.of("a", Value.of(1), "b", Value.of(2), "c", Value.of(3))));
        assertFalse(sum.isSatisfied(Assignment.of("a", Value.of(1), "b", Value.of(2), "c", Value.of(4))));

        LinearSum real = sumEquals("r", 0.3, "a", "b");
        assertTrue(real.isSatisfied(Assignment.of("a", Value.of(0.1), "b", Value.of(0.2))));

        LinearSum lin = linear("l", new double[]{2, -1}, new String[]{"a", "b"}, Relation.LE, 3);
        assertEquals(ConstraintType.LINEAR, lin.getType());
        assertTrue(lin.isSatisfied(Assignment.of("a", Value.of(2), "b", Value.of(1))));
        assertFalse(lin.isSatisfied(Assignment.of("a", Value.of(3), "b", Value.of(1))));

        assertThrows(IllegalArgumentException.class, () -> linear("l", new double[]{1}, new String[]{"a", "b"}, Relation.EQ, 0));
    }

    @Test
    public void customPredicate() {
        CustomConstraint even = custom("even", a -> a.getInt("x") % 2 == 0, "x");
        assertEquals(ConstraintType.CUSTOM, even.getType());
        assertTrue(even.isSatisfied(Assignment.of("x", Value.of(4))));
        assertFalse(even.isSatisfied(Assignment.of("x", Value.of(5))));
    }

    @Test
    public void scopeMustNotBeEmpty() {
        assertThrows(IllegalArgumentException.class, () -> allDifferent("ad"));
        assertThrows(IllegalArgumentException.class, () -> custom("c", a -> true));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.01, Double.NaN})
    public void weightOutOfRange(double weight) {
        assertThrows(IllegalArgumentException.class, () -> neq("d", "x", "y").setWeight(weight));
    }

    @Test
    public void weightAndPriority() {
        NotEqual d = neq("d", "x", "y");
        assertTrue(d.isHard());
        d.setWeight(0.0).setPriority(3).setDescription("prefer equal");
        assertFalse(d.isHard());
        assertEquals(3, d.getPriority());
        assertEquals("prefer equal", d.getDescription());
        assertTrue(neq("d", "x", "y").setWeight(1.0).isHard());
    }
}
