/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.core;

/**
 * Side of a start-time domain.
 */
public enum BoundType {
    LOWER, UPPER
}
