/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory bound store implementing the host side of propagation.
 * Every tightening is pushed on a trail so that the store can
 * go back to a saved state and rebuild the bounds as they were before any change.
 * Indicator variables created by {@link #linkIndicators} are plain [0,1] variables,
 * the store does not channel them with their start variable.
 */
public class IntDomainStore implements PropagationHost, LinkedBinaryEncoding {

    private static final Logger LOGGER = Logger.getLogger(IntDomainStore.class.getName());

    private int[] lb = new int[8];
    private int[] ub = new int[8];
    private int nVars = 0;

    private final List<BoundChange> trail = new ArrayList<>();
    private final List<ConflictSet> conflicts = new ArrayList<>();
    private ConflictSet current = null;

    // startVar -> {offset, first indicator var, number of indicators}
    private final Map<Integer, int[]> links = new HashMap<>();

    /**
     * Creates a new variable with domain [min,max]
     *
     * @return the identifier of the variable
     */
    public int makeVar(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("empty domain [" + min + "," + max + "]");
        }
        if (nVars == lb.length) {
            lb = Arrays.copyOf(lb, nVars * 2);
            ub = Arrays.copyOf(ub, nVars * 2);
        }
        lb[nVars] = min;
        ub[nVars] = max;
        return nVars++;
    }

    public int nVars() {
        return nVars;
    }

    /**
     * Creates the indicators of startVar, one per value in [offset, offset+count).
     *
     * @return the identifier of the first indicator, the others follow consecutively
     */
    public int linkIndicators(int startVar, int offset, int count) {
        checkVar(startVar);
        if (count <= 0) {
            throw new IllegalArgumentException("at least one indicator is needed");
        }
        int first = makeVar(0, 1);
        for (int i = 1; i < count; i++) {
            makeVar(0, 1);
        }
        links.put(startVar, new int[]{offset, first, count});
        return first;
    }

    @Override
    public boolean isLinked(int startVar) {
        return links.containsKey(startVar);
    }

    @Override
    public int offset(int startVar) {
        return link(startVar)[0];
    }

    @Override
    public int nIndicators(int startVar) {
        return link(startVar)[2];
    }

    @Override
    public int indicatorVar(int startVar, int position) {
        int[] l = link(startVar);
        if (position < 0 || position >= l[2]) {
            throw new IndexOutOfBoundsException("indicator " + position + " of x" + startVar);
        }
        return l[1] + position;
    }

    private int[] link(int startVar) {
        int[] l = links.get(startVar);
        if (l == null) {
            throw new IllegalArgumentException("x" + startVar + " has no indicators");
        }
        return l;
    }

    @Override
    public int getLowerBound(int var) {
        checkVar(var);
        return lb[var];
    }

    @Override
    public int getUpperBound(int var) {
        checkVar(var);
        return ub[var];
    }

    @Override
    public TightenResult tightenLowerBound(int var, int newLb, int inferInfo) {
        checkVar(var);
        if (newLb <= lb[var]) {
            return TightenResult.NO_CHANGE;
        }
        if (newLb > ub[var]) {
            return TightenResult.INFEASIBLE;
        }
        record(new BoundChange(var, BoundType.LOWER, lb[var], newLb, inferInfo));
        lb[var] = newLb;
        return TightenResult.TIGHTENED;
    }

    @Override
    public TightenResult tightenUpperBound(int var, int newUb, int inferInfo) {
        checkVar(var);
        if (newUb >= ub[var]) {
            return TightenResult.NO_CHANGE;
        }
        if (newUb < lb[var]) {
            return TightenResult.INFEASIBLE;
        }
        record(new BoundChange(var, BoundType.UPPER, ub[var], newUb, inferInfo));
        ub[var] = newUb;
        return TightenResult.TIGHTENED;
    }

    private void record(BoundChange change) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("bound change " + change);
        }
        trail.add(change);
    }

    /**
     * @return a mark to be given to {@link #restoreState(int)}
     */
    public int saveState() {
        return trail.size();
    }

    /**
     * Undoes all the bound changes performed since the mark was taken.
     */
    public void restoreState(int mark) {
        if (mark < 0 || mark > trail.size()) {
            throw new IllegalArgumentException("invalid mark " + mark);
        }
        while (trail.size() > mark) {
            undo(trail.remove(trail.size() - 1), lb, ub);
        }
    }

    private static void undo(BoundChange c, int[] lbs, int[] ubs) {
        if (c.type() == BoundType.LOWER) {
            lbs[c.var()] = c.oldBound();
        } else {
            ubs[c.var()] = c.oldBound();
        }
    }

    /**
     * @return the recorded bound changes, oldest first
     */
    public List<BoundChange> changes() {
        return Collections.unmodifiableList(trail);
    }

    /**
     * @param changeIndex index in {@link #changes()}
     * @return the bounds as they were just before that change was applied
     */
    public BoundQuery boundsBefore(int changeIndex) {
        if (changeIndex < 0 || changeIndex > trail.size()) {
            throw new IndexOutOfBoundsException("change " + changeIndex);
        }
        int[] lbs = Arrays.copyOf(lb, nVars);
        int[] ubs = Arrays.copyOf(ub, nVars);
        for (int i = trail.size() - 1; i >= changeIndex; i--) {
            undo(trail.get(i), lbs, ubs);
        }
        return new BoundQuery() {
            @Override
            public int getLowerBound(int var) {
                return lbs[var];
            }

            @Override
            public int getUpperBound(int var) {
                return ubs[var];
            }
        };
    }

    @Override
    public void initiateConflictAnalysis() {
        if (current != null) {
            throw new IllegalStateException("a conflict analysis is already in progress");
        }
        current = new ConflictSet();
    }

    @Override
    public void addConflictingLowerBound(int var) {
        checkConflict().addLowerBound(var);
    }

    @Override
    public void addConflictingUpperBound(int var) {
        checkConflict().addUpperBound(var);
    }

    @Override
    public void finalizeConflict() {
        conflicts.add(checkConflict());
        current = null;
    }

    private ConflictSet checkConflict() {
        if (current == null) {
            throw new IllegalStateException("no conflict analysis in progress");
        }
        return current;
    }

    /**
     * @return the conflicts finalized so far, oldest first
     */
    public List<ConflictSet> conflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    /**
     * @return the last finalized conflict or null if none
     */
    public ConflictSet lastConflict() {
        return conflicts.isEmpty() ? null : conflicts.get(conflicts.size() - 1);
    }

    private void checkVar(int var) {
        if (var < 0 || var >= nVars) {
            throw new IndexOutOfBoundsException("unknown variable " + var);
        }
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        for (int i = 0; i < nVars; i++) {
            b.append('x').append(i).append(": [").append(lb[i]).append(',').append(ub[i]).append("]\n");
        }
        return b.toString();
    }
}
