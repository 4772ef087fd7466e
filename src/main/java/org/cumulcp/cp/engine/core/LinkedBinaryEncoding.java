/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.core;

/**
 * Optional encoding of a start-time variable by 0/1 indicators:
 * indicator {@code pos} is 1 iff the start equals {@code offset + pos}.
 * Indicators are ordinary host variables with domain [0,1].
 */
public interface LinkedBinaryEncoding {

    boolean isLinked(int startVar);

    int offset(int startVar);

    int nIndicators(int startVar);

    int indicatorVar(int startVar, int position);
}
