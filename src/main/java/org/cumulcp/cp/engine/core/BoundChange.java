/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.core;

/**
 * One bound tightening as recorded by the host.
 */
public final class BoundChange {

    private final int var;
    private final BoundType type;
    private final int oldBound;
    private final int newBound;
    private final int inferInfo;

    public BoundChange(int var, BoundType type, int oldBound, int newBound, int inferInfo) {
        this.var = var;
        this.type = type;
        this.oldBound = oldBound;
        this.newBound = newBound;
        this.inferInfo = inferInfo;
    }

    public int var() {
        return var;
    }

    public BoundType type() {
        return type;
    }

    public int oldBound() {
        return oldBound;
    }

    public int newBound() {
        return newBound;
    }

    public int inferInfo() {
        return inferInfo;
    }

    @Override
    public String toString() {
        return "x" + var + (type == BoundType.LOWER ? ".lb " : ".ub ") + oldBound + " -> " + newBound;
    }
}
