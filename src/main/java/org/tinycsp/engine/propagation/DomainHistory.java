/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.propagation;

import org.tinycsp.engine.core.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of the successive domains of the variables,
 * each version tagged by the propagation step that produced it.
 * The domain of a variable before its first reduction is stored as version 0.
 */
public class DomainHistory {

    /**
     * A domain snapshot.
     *
     * @param step   the propagation step that produced it, 0 for the initial domain
     * @param domain the values at that step
     */
    public record Version(int step, List<Value> domain) {
        public Version {
            domain = List.copyOf(domain);
        }
    }

    private final LinkedHashMap<String, List<Version>> versions = new LinkedHashMap<>();
    private int lastStep = 0;

    void record(int step, String variable, List<Value> before, List<Value> after) {
        if (step <= lastStep)
            throw new IllegalArgumentException("step " + step + " is not after step " + lastStep);
        if (!versions.containsKey(variable)) {
            versions.put(variable, new ArrayList<>());
            versions.get(variable).add(new Version(0, before));
        }
        versions.get(variable).add(new Version(step, after));
        lastStep = step;
    }

    /**
     * Returns the versions recorded for a variable, oldest first;
     * empty if its domain was never reduced.
     */
    public List<Version> versions(String variable) {
        List<Version> v = versions.get(variable);
        return v == null ? Collections.emptyList() : Collections.unmodifiableList(v);
    }

    /**
     * Returns the domain a variable had right after the given step,
     * empty if its domain was never reduced.
     */
    public Optional<List<Value>> domainAt(String variable, int step) {
        Version found = null;
        for (Version v : versions(variable)) {
            if (v.step() <= step)
                found = v;
        }
        return found == null ? Optional.empty() : Optional.of(found.domain());
    }

    public int lastStep() {
        return lastStep;
    }

    public boolean isEmpty() {
        return versions.isEmpty();
    }
}
