/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.json.JSONObject;

/**
 * A job of a cumulative resource: a start-time variable of the host,
 * a fixed duration and a fixed demand on the resource.
 */
public final class Job {

    private final int startVar;
    private final int duration;
    private final int demand;

    public Job(int startVar, int duration, int demand) {
        if (duration < 0) {
            throw new IllegalArgumentException("negative duration " + duration + " for x" + startVar);
        }
        if (demand < 0) {
            throw new IllegalArgumentException("negative demand " + demand + " for x" + startVar);
        }
        this.startVar = startVar;
        this.duration = duration;
        this.demand = demand;
    }

    public int startVar() {
        return startVar;
    }

    public int duration() {
        return duration;
    }

    public int demand() {
        return demand;
    }

    /**
     * @return duration times demand
     */
    public int energy() {
        return duration * demand;
    }

    /**
     * A job that never consumes anything cannot be involved in a conflict.
     */
    public boolean isIrrelevant() {
        return duration == 0 || demand == 0;
    }

    JSONObject toJson() {
        return new JSONObject()
                .put("var", startVar)
                .put("duration", duration)
                .put("demand", demand);
    }

    @Override
    public String toString() {
        return "x" + startVar + "[" + duration + "," + demand + "]";
    }
}
