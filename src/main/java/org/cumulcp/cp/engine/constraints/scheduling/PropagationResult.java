/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

/**
 * What a propagation round did.
 */
public final class PropagationResult {

    public enum Outcome {
        /** the bounds admit no schedule, a conflict was reported to the host */
        CUTOFF,
        /** at least one bound was tightened */
        TIGHTENED,
        /** no bound could be tightened */
        NOTHING,
        /** every placement within the bounds respects the capacity */
        CONSTRAINT_REDUNDANT
    }

    private static final PropagationResult CUTOFF = new PropagationResult(Outcome.CUTOFF, 0);
    private static final PropagationResult NOTHING = new PropagationResult(Outcome.NOTHING, 0);
    private static final PropagationResult REDUNDANT = new PropagationResult(Outcome.CONSTRAINT_REDUNDANT, 0);

    private final Outcome outcome;
    private final int nTightenings;

    private PropagationResult(Outcome outcome, int nTightenings) {
        this.outcome = outcome;
        this.nTightenings = nTightenings;
    }

    public static PropagationResult cutoff() {
        return CUTOFF;
    }

    public static PropagationResult redundant() {
        return REDUNDANT;
    }

    /**
     * @param nTightenings number of bounds tightened, NOTHING if zero
     */
    public static PropagationResult tightened(int nTightenings) {
        return nTightenings == 0 ? NOTHING : new PropagationResult(Outcome.TIGHTENED, nTightenings);
    }

    public Outcome outcome() {
        return outcome;
    }

    public int nTightenings() {
        return nTightenings;
    }

    public boolean isCutoff() {
        return outcome == Outcome.CUTOFF;
    }

    @Override
    public String toString() {
        return outcome == Outcome.TIGHTENED ? "TIGHTENED(" + nTightenings + ")" : outcome.toString();
    }
}
