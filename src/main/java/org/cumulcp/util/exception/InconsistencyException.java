/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.util.exception;

/**
 * Raised by a propagation rule once it has proven that the current
 * bounds admit no schedule. The rule has already handed its explanation
 * to the host when this is thrown, so the exception carries no state
 * and a single shared instance is used.
 */
public class InconsistencyException extends RuntimeException {

    private static final long serialVersionUID = 1546076545219404541L;

    public static final InconsistencyException INCONSISTENCY = new InconsistencyException();

    private InconsistencyException() {
        super("inconsistency", null, false, false);
    }

    @Override
    public String toString() {
        return "inconsistency";
    }
}
