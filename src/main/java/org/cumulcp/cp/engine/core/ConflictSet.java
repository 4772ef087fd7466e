/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A set of variable bounds, in insertion order, that together explain
 * a tightening or an infeasibility.
 */
public class ConflictSet {

    private final Map<Integer, EnumSet<BoundType>> bounds = new LinkedHashMap<>();

    public ConflictSet addLowerBound(int var) {
        return add(var, BoundType.LOWER);
    }

    public ConflictSet addUpperBound(int var) {
        return add(var, BoundType.UPPER);
    }

    public ConflictSet addBounds(int var) {
        add(var, BoundType.LOWER);
        return add(var, BoundType.UPPER);
    }

    public ConflictSet add(int var, BoundType type) {
        bounds.computeIfAbsent(var, k -> EnumSet.noneOf(BoundType.class)).add(type);
        return this;
    }

    public boolean contains(int var, BoundType type) {
        EnumSet<BoundType> s = bounds.get(var);
        return s != null && s.contains(type);
    }

    public boolean containsVar(int var) {
        return bounds.containsKey(var);
    }

    /**
     * @return the variables having at least one bound in this set, in insertion order
     */
    public Set<Integer> vars() {
        return Collections.unmodifiableSet(bounds.keySet());
    }

    /**
     * @return the number of bounds in this set
     */
    public int size() {
        int size = 0;
        for (EnumSet<BoundType> s : bounds.values()) {
            size += s.size();
        }
        return size;
    }

    public boolean isEmpty() {
        return bounds.isEmpty();
    }

    /**
     * Adds all the bounds of this set to a conflict under construction.
     */
    public void addTo(ConflictCollector collector) {
        for (Map.Entry<Integer, EnumSet<BoundType>> e : bounds.entrySet()) {
            if (e.getValue().contains(BoundType.LOWER)) {
                collector.addConflictingLowerBound(e.getKey());
            }
            if (e.getValue().contains(BoundType.UPPER)) {
                collector.addConflictingUpperBound(e.getKey());
            }
        }
    }

    /**
     * Hands this set to the collector as a complete conflict.
     */
    public void report(ConflictCollector collector) {
        collector.initiateConflictAnalysis();
        addTo(collector);
        collector.finalizeConflict();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConflictSet && ((ConflictSet) o).bounds.equals(bounds);
    }

    @Override
    public int hashCode() {
        return bounds.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("{");
        for (Map.Entry<Integer, EnumSet<BoundType>> e : bounds.entrySet()) {
            for (BoundType t : e.getValue()) {
                if (b.length() > 1) {
                    b.append(", ");
                }
                b.append('x').append(e.getKey()).append(t == BoundType.LOWER ? ".lb" : ".ub");
            }
        }
        return b.append('}').toString();
    }
}
