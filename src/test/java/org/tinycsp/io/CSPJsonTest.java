/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.io;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.Value;
import org.tinycsp.search.Solution;

import static org.junit.jupiter.api.Assertions.*;
import static org.tinycsp.CSPFactory.*;

public class CSPJsonTest {

    private static CSP lessThan() {
        CSP csp = makeCSP();
        makeIntVar(csp, "X", 1, 3);
        makeIntVar(csp, "Y", 1, 3);
        addConstraint(csp, lt("lt", "X", "Y").setDescription("X before Y"));
        return csp;
    }

    @Test
    public void valuesArePlainJson() {
        assertEquals(3, CSPJson.toJson(Value.of(3)));
        assertEquals(2.5, CSPJson.toJson(Value.of(2.5)));
        assertEquals(true, CSPJson.toJson(Value.of(true)));
        assertEquals("red", CSPJson.toJson(Value.of("red")));
        JSONArray set = (JSONArray) CSPJson.toJson(Value.ofSet(1, 4));
        assertEquals(2, set.length());
        assertEquals(1, set.getInt(0));
        assertEquals(4, set.getInt(1));
    }

    @Test
    public void assignment() {
        JSONObject json = CSPJson.toJson(Assignment.of("x", Value.of(1), "c", Value.of("blue")));
        assertEquals(1, json.getInt("x"));
        assertEquals("blue", json.getString("c"));
        assertEquals(2, json.length());
    }

    @Test
    public void problem() {
        JSONObject json = CSPJson.toJson(lessThan());
        JSONArray variables = json.getJSONArray("variables");
        assertEquals(2, variables.length());
        JSONObject x = variables.getJSONObject(0);
        assertEquals("X", x.getString("id"));
        assertEquals("integer", x.getString("type"));
        assertEquals(3, x.getJSONArray("domain").length());
        assertEquals("lt", x.getJSONArray("constraints").getString(0));

        JSONObject c = json.getJSONArray("constraints").getJSONObject(0);
        assertEquals("less_than", c.getString("type"));
        assertEquals("X before Y", c.getString("description"));
        assertEquals(1.0, c.getDouble("weight"));
        assertFalse(json.has("objective"));
    }

    @Test
    public void solution() {
        Solution solution = solveBacktracking(lessThan());
        JSONObject json = CSPJson.toJson(solution);
        assertTrue(json.getBoolean("isSolution"));
        assertEquals("backtracking", json.getString("method"));
        assertEquals(solution.searchSteps(), json.getLong("searchSteps"));
        assertTrue(json.getBoolean("completed"));
        assertTrue(json.getBoolean("isComplete"));
        assertTrue(json.getBoolean("isConsistent"));
        assertEquals(0, json.getJSONArray("violatedConstraints").length());
        assertEquals("lt", json.getJSONArray("satisfiedConstraints").getString(0));
        JSONObject assignment = json.getJSONObject("assignment");
        assertTrue(assignment.getInt("X") < assignment.getInt("Y"));
        assertFalse(json.has("objectiveValue"));
    }

    @Test
    public void propagations() {
        CSP csp = lessThan();
        JSONArray json = CSPJson.propagationsToJson(applyAC3(csp));
        assertEquals(2, json.length());
        JSONObject first = json.getJSONObject(0);
        assertEquals(1, first.getInt("step"));
        assertEquals("X", first.getString("variable"));
        assertEquals("Y", first.getString("neighbor"));
        assertEquals(3, first.getJSONArray("originalDomain").length());
        assertEquals(2, first.getJSONArray("reducedDomain").length());
        assertEquals("lt", first.getJSONArray("constraintIds").getString(0));
    }

    @Test
    public void analysis() {
        JSONObject json = CSPJson.toJson(analyzeCSP(lessThan()));
        assertEquals(2, json.getInt("totalVariables"));
        assertEquals("unknown", json.getString("isSatisfiable"));
        assertEquals("O(3^2)", json.getString("estimatedComplexity"));
        assertEquals(3, json.getJSONObject("domainSizes").getInt("Y"));
    }
}
