/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

/**
 * The filtering rules of the cumulative propagator, with the identifier
 * stored in the inference word of each bound change.
 */
public enum PropagationRule {

    INVALID(0),
    CORE_TIMES(1),
    CORE_TIME_HOLES(2),
    EDGE_FINDING(3),
    ENERGETIC_REASONING(4);

    private final int id;

    PropagationRule(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    /**
     * @param id a rule identifier
     * @return the rule with that identifier, {@link #INVALID} for unknown identifiers
     */
    public static PropagationRule fromId(int id) {
        for (PropagationRule r : values()) {
            if (r.id == id) {
                return r;
            }
        }
        return INVALID;
    }
}
