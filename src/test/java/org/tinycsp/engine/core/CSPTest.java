/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import org.junit.jupiter.api.Test;
import org.tinycsp.util.exception.InvalidCSPException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.tinycsp.CSPFactory.*;

public class CSPTest {

    @Test
    public void addConstraintUpdatesBackReferences() {
        CSP csp = makeCSP();
        Variable x = makeIntVar(csp, "x", 0, 2);
        Variable y = makeIntVar(csp, "y", 0, 2);
        Variable z = makeIntVar(csp, "z", 0, 2);
        addConstraint(csp, neq("c1", "x", "y"));
        addConstraint(csp, allDifferent("c2", "x", "y", "z"));
        addConstraint(csp, sumEquals("c3", 3, "x", "x"));

        assertEquals(List.of("c1", "c2", "c3"), x.getConstraints());
        assertEquals(List.of("c1", "c2"), y.getConstraints());
        assertEquals(List.of("c2"), z.getConstraints());
        assertEquals(3, x.degree());
        csp.validate();
    }

    @Test
    public void malformedProblemsAreRejected() {
        CSP csp = makeCSP();
        makeIntVar(csp, "x", 0, 2);
        assertThrows(InvalidCSPException.class, () -> makeIntVar(csp, "x", 0, 1));
        assertThrows(InvalidCSPException.class, () -> addConstraint(csp, neq("c", "x", "ghost")));
        // the rejected constraint left no trace
        assertEquals(0, csp.nConstraints());
        assertEquals(List.of(), csp.getVariable("x").getConstraints());

        addConstraint(csp, inSet("c", "x", Value.of(1)));
        assertThrows(InvalidCSPException.class, () -> addConstraint(csp, inSet("c", "x", Value.of(2))));
        assertThrows(InvalidCSPException.class, () -> csp.getVariable("ghost"));
        assertThrows(InvalidCSPException.class, () -> csp.getConstraint("ghost"));
    }

    @Test
    public void copyIsDeepOnDomains() {
        CSP csp = makeCSP();
        makeIntVar(csp, "x", 1, 3);
        makeIntVar(csp, "y", 1, 3);
        addConstraint(csp, lt("lt", "x", "y"));

        CSP copy = csp.copy();
        copy.getVariable("x").setDomain(List.of(Value.of(1)));

        assertEquals(3, csp.getVariable("x").domainSize());
        assertEquals(1, copy.getVariable("x").domainSize());
        assertEquals(List.of("lt"), copy.getVariable("x").getConstraints());
        assertSame(csp.getConstraint("lt"), copy.getConstraint("lt"));
        copy.validate();
    }

    @Test
    public void variablesKeepInsertionOrder() {
        CSP csp = makeCSP();
        makeIntVar(csp, "b", 0);
        makeIntVar(csp, "a", 0);
        makeIntVar(csp, "c", 0);
        assertEquals(List.of("b", "a", "c"), csp.getVariables().stream().map(Variable::getId).toList());
    }
}
