/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.io;

import org.json.JSONArray;
import org.json.JSONObject;
import org.tinycsp.engine.analysis.Analysis;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.BoolValue;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.CategoryValue;
import org.tinycsp.engine.core.Constraint;
import org.tinycsp.engine.core.IntValue;
import org.tinycsp.engine.core.RealValue;
import org.tinycsp.engine.core.SetValue;
import org.tinycsp.engine.core.Value;
import org.tinycsp.engine.core.Variable;
import org.tinycsp.engine.propagation.ConstraintPropagation;
import org.tinycsp.search.Solution;

import java.util.Collection;
import java.util.List;

/**
 * JSON rendering of problems and results, for the layer presenting them to users.
 * Values are written as plain JSON: numbers, booleans, strings, and arrays for set values.
 * A non-finite real has no JSON form, {@code org.json} rejects it with a {@code JSONException}.
 */
public final class CSPJson {

    private CSPJson() {
    }

    public static Object toJson(Value v) {
        if (v instanceof IntValue)
            return ((IntValue) v).value();
        if (v instanceof RealValue)
            return ((RealValue) v).value();
        if (v instanceof BoolValue)
            return ((BoolValue) v).value();
        if (v instanceof CategoryValue)
            return ((CategoryValue) v).label();
        if (v instanceof SetValue)
            return new JSONArray(((SetValue) v).elements());
        throw new IllegalArgumentException("unknown value kind " + v.getClass().getName());
    }

    public static JSONArray domainToJson(Collection<Value> values) {
        JSONArray array = new JSONArray();
        for (Value v : values)
            array.put(toJson(v));
        return array;
    }

    public static JSONObject toJson(Assignment assignment) {
        JSONObject json = new JSONObject();
        assignment.values().forEach((x, v) -> json.put(x, toJson(v)));
        return json;
    }

    public static JSONObject toJson(CSP csp) {
        JSONArray variables = new JSONArray();
        for (Variable x : csp.getVariables()) {
            JSONObject jx = new JSONObject();
            jx.put("id", x.getId());
            jx.put("name", x.getName());
            jx.put("type", x.getType().name().toLowerCase());
            jx.put("domain", domainToJson(x.getDomain()));
            x.getCurrentValue().ifPresent(v -> jx.put("currentValue", toJson(v)));
            jx.put("constraints", new JSONArray(x.getConstraints()));
            variables.put(jx);
        }
        JSONArray constraints = new JSONArray();
        for (Constraint c : csp.getConstraints()) {
            JSONObject jc = new JSONObject();
            jc.put("id", c.getId());
            jc.put("type", c.getType().name().toLowerCase());
            jc.put("variables", new JSONArray(c.getVariables()));
            jc.put("description", c.getDescription());
            jc.put("weight", c.getWeight());
            jc.put("priority", c.getPriority());
            constraints.put(jc);
        }
        JSONObject json = new JSONObject();
        json.put("variables", variables);
        json.put("constraints", constraints);
        csp.getObjective().ifPresent(o -> json.put("objective",
                new JSONObject().put("type", o.type().name().toLowerCase()).put("expression", o.expression())));
        return json;
    }

    public static JSONObject toJson(Solution solution) {
        JSONObject json = new JSONObject();
        json.put("isSolution", solution.isSolution());
        json.put("method", solution.method());
        json.put("searchSteps", solution.searchSteps());
        json.put("failures", solution.statistics().numberOfFailures());
        json.put("completed", solution.statistics().isCompleted());
        json.put("timeElapsed", solution.timeElapsed().toMillis());
        json.put("assignment", toJson(solution.assignment()));
        json.put("isComplete", solution.status().isComplete());
        json.put("isConsistent", solution.status().isConsistent());
        json.put("violatedConstraints", new JSONArray(solution.status().violatedConstraints()));
        json.put("satisfiedConstraints", new JSONArray(solution.status().satisfiedConstraints()));
        solution.objectiveValue().ifPresent(v -> json.put("objectiveValue", v));
        return json;
    }

    public static JSONArray propagationsToJson(List<ConstraintPropagation> propagations) {
        JSONArray array = new JSONArray();
        for (ConstraintPropagation p : propagations) {
            JSONObject json = new JSONObject();
            json.put("step", p.step());
            json.put("variable", p.variable());
            json.put("originalDomain", domainToJson(p.originalDomain()));
            json.put("reducedDomain", domainToJson(p.reducedDomain()));
            json.put("reason", p.reason());
            json.put("neighbor", p.neighbor());
            json.put("constraintIds", new JSONArray(p.constraintIds()));
            array.put(json);
        }
        return array;
    }

    public static JSONObject toJson(Analysis analysis) {
        JSONObject json = new JSONObject();
        json.put("totalVariables", analysis.totalVariables());
        json.put("totalConstraints", analysis.totalConstraints());
        json.put("constraintDensity", analysis.constraintDensity());
        json.put("hardConstraints", analysis.hardConstraints());
        json.put("softConstraints", analysis.softConstraints());
        json.put("domainSizes", new JSONObject(analysis.domainSizes()));
        json.put("tightness", analysis.tightness());
        json.put("isSatisfiable", analysis.satisfiability().name().toLowerCase());
        json.put("estimatedComplexity", analysis.estimatedComplexity());
        return json;
    }
}
