/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.core;

/**
 * Receives the bounds that explain an infeasibility.
 * Calls always come in the order
 * {@code initiateConflictAnalysis}, any number of {@code addConflicting*}, {@code finalizeConflict}.
 */
public interface ConflictCollector {

    void initiateConflictAnalysis();

    void addConflictingLowerBound(int var);

    void addConflictingUpperBound(int var);

    void finalizeConflict();
}
