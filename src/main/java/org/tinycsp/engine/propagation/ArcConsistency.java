/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.propagation;

import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.Constraint;
import org.tinycsp.engine.core.ConstraintEvaluator;
import org.tinycsp.engine.core.ConstraintGraph;
import org.tinycsp.engine.core.Value;
import org.tinycsp.engine.core.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * AC-3 arc consistency over the binary hard constraints of a problem.
 * <p>
 * The worklist is seeded with both arcs of every binary constraint, in constraint order,
 * and processed first in first out. Revising the arc {@code (xi,xj)} removes from the domain
 * of {@code xi} every value with no support in the domain of {@code xj}, a support being a
 * value satisfying all the binary constraints between them. When the domain of {@code xi}
 * shrinks, the arcs {@code (xk,xi)} of all its neighbors are enqueued again.
 * The run stops at the fixed point, or as soon as a domain becomes empty.
 * <p>
 * Domains are reduced in place on the given problem, work on {@link CSP#copy()} to keep
 * the original ones. No value taking part in a solution is ever removed.
 * <p>
 * Constraints of arity other than two get no propagation, nor do soft constraints (a solution
 * may violate them). They are listed by {@link #skippedConstraints()} and the non-binary ones
 * are reported as a warning.
 */
public class ArcConsistency {

    private static final Logger LOGGER = Logger.getLogger(ArcConsistency.class.getName());

    private record Arc(String from, String to) {
    }

    private List<Constraint> skipped = Collections.emptyList();
    private DomainHistory history = new DomainHistory();

    /**
     * Runs AC-3 on the problem, reducing its domains.
     * An empty domain in the problem after the call means it is unsatisfiable;
     * the last record is then a wipe-out.
     *
     * @param csp the problem, validated first
     * @return the domain reductions, in the order they were made
     * @throws org.tinycsp.util.exception.InvalidCSPException if the problem is malformed
     */
    public List<ConstraintPropagation> apply(CSP csp) {
        csp.validate();
        history = new DomainHistory();
        skipped = new ArrayList<>();

        ArrayDeque<Arc> queue = new ArrayDeque<>();
        for (Constraint c : csp.getConstraints()) {
            if (!ConstraintGraph.isBinary(c)) {
                skipped.add(c);
                LOGGER.warning("constraint " + c.getId() + " of arity " + c.arity() + " is ignored by arc consistency");
            } else if (!c.isHard()) {
                skipped.add(c);
                LOGGER.fine("soft constraint " + c.getId() + " is ignored by arc consistency");
            } else {
                String x = c.getVariables().get(0);
                String y = c.getVariables().get(1);
                queue.add(new Arc(x, y));
                queue.add(new Arc(y, x));
            }
        }
        ConstraintGraph graph = ConstraintGraph.binary(csp, Constraint::isHard);

        List<ConstraintPropagation> propagations = new ArrayList<>();
        while (!queue.isEmpty()) {
            Arc arc = queue.poll();
            Variable xi = csp.getVariable(arc.from());
            List<Value> before = new ArrayList<>(xi.getDomain());
            List<Constraint> linking = graph.constraintsBetween(arc.from(), arc.to());
            List<Value> after = revise(xi, csp.getVariable(arc.to()), linking);
            if (after.size() == before.size())
                continue;

            xi.setDomain(after);
            int step = propagations.size() + 1;
            List<String> ids = linking.stream().map(Constraint::getId).collect(Collectors.toList());
            ConstraintPropagation p = new ConstraintPropagation(step, xi.getId(), before, after,
                    "Arc consistency with " + arc.to() + " on " + ids, arc.to(), ids);
            propagations.add(p);
            history.record(step, xi.getId(), before, after);
            if (LOGGER.isLoggable(Level.FINE))
                LOGGER.fine("step " + step + ": " + xi.getId() + " " + before + " -> " + after);

            if (after.isEmpty()) {
                LOGGER.fine("domain of " + xi.getId() + " is empty, the problem is unsatisfiable");
                break;
            }
            for (String xk : graph.neighbors(xi.getId())) {
                queue.add(new Arc(xk, xi.getId()));
            }
        }
        return propagations;
    }

    /**
     * Returns the values of {@code xi} having a support in the domain of {@code xj}.
     */
    private List<Value> revise(Variable xi, Variable xj, List<Constraint> linking) {
        List<Value> kept = new ArrayList<>();
        for (Value vi : xi.getDomain()) {
            Assignment partial = Assignment.empty().with(xi.getId(), vi);
            for (Value vj : xj.getDomain()) {
                if (supports(partial.with(xj.getId(), vj), linking)) {
                    kept.add(vi);
                    break;
                }
            }
        }
        return kept;
    }

    private static boolean supports(Assignment pair, List<Constraint> linking) {
        for (Constraint c : linking) {
            if (!ConstraintEvaluator.satisfiesConstraint(c, pair))
                return false;
        }
        return true;
    }

    /**
     * Constraints that took no part in the last run: non-binary and soft ones.
     */
    public List<Constraint> skippedConstraints() {
        return Collections.unmodifiableList(skipped);
    }

    /**
     * Versioned domains of the variables reduced during the last run.
     */
    public DomainHistory history() {
        return history;
    }

    /**
     * True if some variable of the problem has an empty domain.
     */
    public static boolean hasEmptyDomain(CSP csp) {
        for (Variable x : csp.getVariables()) {
            if (x.domainSize() == 0)
                return true;
        }
        return false;
    }
}
