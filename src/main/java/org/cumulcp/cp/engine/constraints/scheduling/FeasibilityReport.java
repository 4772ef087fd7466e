/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

/**
 * Result of checking a complete assignment of the starts.
 * For an infeasible assignment it describes the first time the capacity is exceeded.
 */
public final class FeasibilityReport {

    private static final FeasibilityReport FEASIBLE = new FeasibilityReport(true, -1, 0, 0, new int[0]);

    private final boolean feasible;
    private final int violationTime;
    private final int required;
    private final int available;
    private final int[] runningJobs;

    private FeasibilityReport(boolean feasible, int violationTime, int required, int available, int[] runningJobs) {
        this.feasible = feasible;
        this.violationTime = violationTime;
        this.required = required;
        this.available = available;
        this.runningJobs = runningJobs;
    }

    public static FeasibilityReport feasible() {
        return FEASIBLE;
    }

    public static FeasibilityReport violation(int time, int required, int available, int[] runningJobs) {
        return new FeasibilityReport(false, time, required, available, runningJobs.clone());
    }

    public boolean isFeasible() {
        return feasible;
    }

    /**
     * @return the first time the capacity is exceeded, -1 if feasible
     */
    public int violationTime() {
        return violationTime;
    }

    /**
     * @return the total demand of the jobs running at the violation time
     */
    public int required() {
        return required;
    }

    /**
     * @return the capacity
     */
    public int available() {
        return available;
    }

    /**
     * @return the jobs running at the violation time
     */
    public int[] runningJobs() {
        return runningJobs.clone();
    }

    @Override
    public String toString() {
        if (feasible) {
            return "feasible";
        }
        return "capacity exceeded at " + violationTime + ": " + required + " required, " + available + " available";
    }
}
