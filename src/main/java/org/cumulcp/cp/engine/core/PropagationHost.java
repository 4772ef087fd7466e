/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.core;

/**
 * The solver side seen by a propagator: bound queries, bound tightenings
 * tagged with an opaque inference word, and conflict collection.
 * The host decides whether a requested bound is a no-op and keeps, for every change,
 * the inference word so that the change can be explained later.
 */
public interface PropagationHost extends BoundQuery, ConflictCollector {

    TightenResult tightenLowerBound(int var, int newLb, int inferInfo);

    TightenResult tightenUpperBound(int var, int newUb, int inferInfo);
}
