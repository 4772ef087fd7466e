/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.core;

/**
 * Outcome of a bound tightening request.
 */
public enum TightenResult {
    /** the new bound was not stronger than the current one */
    NO_CHANGE(false, false),
    /** the bound moved */
    TIGHTENED(true, false),
    /** the new bound would empty the domain, nothing was changed */
    INFEASIBLE(false, true);

    private final boolean tightened;
    private final boolean infeasible;

    TightenResult(boolean tightened, boolean infeasible) {
        this.tightened = tightened;
        this.infeasible = infeasible;
    }

    public boolean tightened() {
        return tightened;
    }

    public boolean infeasible() {
        return infeasible;
    }
}
