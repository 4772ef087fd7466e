/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.core;

/**
 * Read access to the bounds of integer variables,
 * either the current ones or a snapshot taken at some point of the search.
 */
public interface BoundQuery {

    int getLowerBound(int var);

    int getUpperBound(int var);

    default boolean isFixed(int var) {
        return getLowerBound(var) == getUpperBound(var);
    }
}
