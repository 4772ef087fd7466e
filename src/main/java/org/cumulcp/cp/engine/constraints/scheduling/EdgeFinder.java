/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.cumulcp.cp.engine.core.ConflictSet;
import org.cumulcp.cp.engine.core.PropagationHost;
import org.cumulcp.cp.engine.core.TightenResult;
import org.cumulcp.util.Arrays;
import org.cumulcp.util.exception.InconsistencyException;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Energy based filtering with Theta and Theta-Lambda trees:
 * overload checking and cumulative edge-finding.
 * The backward direction runs the forward algorithm on the mirrored instance
 * where every time t becomes makespan - t.
 *
 * Edge-Finding for Cumulative Scheduling, Petr Vilim, CP 2009
 */
public class EdgeFinder {

    private static final Logger LOGGER = Logger.getLogger(EdgeFinder.class.getName());

    public enum Direction {
        /** pushes earliest starts to the right */
        FORWARD,
        /** pushes latest starts to the left */
        BACKWARD
    }

    private final CumulativeConstraint cons;
    private final PropagationHost host;
    private final ConflictExplainer explainer;

    public EdgeFinder(CumulativeConstraint cons, PropagationHost host, ConflictExplainer explainer) {
        this.cons = cons;
        this.host = host;
        this.explainer = explainer;
    }

    private int lb(int j) {
        return host.getLowerBound(cons.job(j).startVar());
    }

    private int ub(int j) {
        return host.getUpperBound(cons.job(j).startVar());
    }

    /**
     * Inserts the jobs by increasing lct and checks that the energy of the inserted
     * jobs fits before the current lct.
     *
     * @throws InconsistencyException if some set of jobs cannot fit in its window
     */
    public void checkOverload() {
        int n = cons.nJobs();
        int[] lct = new int[n];
        for (int j = 0; j < n; j++) {
            lct[j] = ub(j) + cons.job(j).duration();
        }
        ThetaTree tree = new ThetaTree(cons.capacity(), n);
        for (int j : Arrays.sortPerm(lct)) {
            tree.insert(tree.createLeaf(j, lb(j), cons.job(j).energy()));
            if (tree.envelope() > cons.capacity() * lct[j]) {
                int[] omega = tree.reportEnvelopeJobs();
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("overload before " + lct[j] + " by jobs " + java.util.Arrays.toString(omega));
                }
                fail(explainer.explainOverload(omega));
            }
        }
    }

    /**
     * Detects the jobs that must end after (start before) a set of jobs
     * and adjusts their bounds accordingly.
     *
     * @return the number of bounds tightened
     * @throws InconsistencyException if an adjusted bound empties a domain
     */
    public int detect(Direction dir) {
        int n = cons.nJobs();
        int c = cons.capacity();
        int[] est = new int[n];
        int[] lct = new int[n];
        int makespan = 0;
        if (dir == Direction.BACKWARD) {
            for (int j = 0; j < n; j++) {
                makespan = Math.max(makespan, ub(j) + cons.job(j).duration());
            }
        }
        for (int j = 0; j < n; j++) {
            int p = cons.job(j).duration();
            if (dir == Direction.FORWARD) {
                est[j] = lb(j);
                lct[j] = ub(j) + p;
            } else {
                est[j] = makespan - ub(j) - p;
                lct[j] = makespan - lb(j);
            }
        }
        ThetaLambdaTree tree = new ThetaLambdaTree(c, n);
        int[] leaves = new int[n];
        for (int j = 0; j < n; j++) {
            leaves[j] = tree.createLeaf(j, est[j], cons.job(j).energy());
            tree.insert(leaves[j]);
        }
        int nChanges = 0;
        int[] perm = Arrays.sortPerm(lct);
        for (int k = n - 1; k >= 0; k--) {
            int j = perm[k];
            while (tree.envelopeWithLambda() > c * lct[j]) {
                int leaf = tree.findResponsibleLeaf();
                if (leaf == EnvelopeTree.NIL) {
                    break;
                }
                int i = tree.job(leaf);
                if (est[i] + cons.job(i).duration() < lct[j]) {
                    // i ends after all the jobs of omega
                    nChanges += adjust(dir, i, tree.reportOmegaSet(), est, lct, makespan);
                }
                tree.deleteLeaf(leaf);
            }
            tree.transformLeafToLambda(leaves[j]);
        }
        return nChanges;
    }

    private int adjust(Direction dir, int i, int[] omega, int[] est, int[] lct, int makespan) {
        int c = cons.capacity();
        int d = cons.job(i).demand();
        int p = cons.job(i).duration();
        if (omega.length == 0) {
            return 0;
        }
        int estOmega = Integer.MAX_VALUE;
        int lctOmega = Integer.MIN_VALUE;
        int energy = 0;
        for (int o : omega) {
            estOmega = Math.min(estOmega, est[o]);
            lctOmega = Math.max(lctOmega, lct[o]);
            energy += cons.job(o).energy();
        }
        int delta = lctOmega - estOmega;
        int rest = energy - (c - d) * delta;
        if (rest <= 0 || energy + d * p <= c * delta) {
            return 0;
        }
        int newEst = estOmega + Arrays.ceilDiv(rest, d);
        if (newEst <= est[i]) {
            return 0;
        }
        int var = cons.job(i).startVar();
        int windowEst = dir == Direction.FORWARD ? estOmega : makespan - lctOmega;
        int windowLct = dir == Direction.FORWARD ? lctOmega : makespan - estOmega;
        if (!InferInfo.fits(windowEst, windowLct)) {
            LOGGER.fine(() -> "edge-finding window [" + windowEst + "," + windowLct + "] cannot be recorded, skipped");
            return 0;
        }
        int info = new InferInfo(PropagationRule.EDGE_FINDING, windowEst, windowLct).toInt();
        TightenResult res = dir == Direction.FORWARD
                ? host.tightenLowerBound(var, newEst, info)
                : host.tightenUpperBound(var, makespan - newEst - p, info);
        if (res.infeasible()) {
            fail(explainer.explainEdgeFindingConflict(host, i, windowEst, windowLct));
        }
        if (res.tightened() && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("edge-finding " + dir + " moved " + cons.job(i) + " after window ["
                    + windowEst + "," + windowLct + "]");
        }
        return res.tightened() ? 1 : 0;
    }

    private void fail(ConflictSet conflict) {
        LOGGER.fine(() -> "edge-finding conflict " + conflict);
        conflict.report(host);
        throw InconsistencyException.INCONSISTENCY;
    }
}
