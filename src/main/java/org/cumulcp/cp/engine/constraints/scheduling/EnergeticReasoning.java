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
 * Energetic reasoning on the windows [est,lct) whose bounds are start or end
 * bounds of the jobs. In a window, the energy a job must spend is its minimal
 * overlap with the window times its demand. When the other jobs leave too little
 * room for a job placed at its latest (earliest) start, the job must end early
 * (start late) enough to overlap the window less.
 *
 * Baptiste, Le Pape, Nuijten, Constraint-Based Scheduling, 2001, chapter 3
 */
public class EnergeticReasoning {

    private static final Logger LOGGER = Logger.getLogger(EnergeticReasoning.class.getName());

    private final CumulativeConstraint cons;
    private final PropagationHost host;
    private final ConflictExplainer explainer;

    public EnergeticReasoning(CumulativeConstraint cons, PropagationHost host, ConflictExplainer explainer) {
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
     * @return the number of bounds tightened
     * @throws InconsistencyException if a window is overloaded or a bound empties a domain
     */
    public int propagate() {
        int n = cons.nJobs();
        int[] starts = new int[2 * n];
        int[] ends = new int[2 * n];
        for (int j = 0; j < n; j++) {
            int p = cons.job(j).duration();
            starts[2 * j] = lb(j);
            starts[2 * j + 1] = ub(j);
            ends[2 * j] = lb(j) + p;
            ends[2 * j + 1] = ub(j) + p;
        }
        starts = Arrays.sortedDistinct(starts);
        ends = Arrays.sortedDistinct(ends);
        int nChanges = 0;
        for (int est : starts) {
            for (int k = ends.length - 1; k >= 0 && ends[k] > est; k--) {
                nChanges += propagateWindow(est, ends[k]);
            }
        }
        return nChanges;
    }

    /**
     * @return the energy job j spends in [est,lct) whatever its start
     */
    int requiredEnergy(int j, int est, int lct) {
        Job job = cons.job(j);
        int p = job.duration();
        int lb = lb(j);
        int ub = ub(j);
        int overlap = Math.min(Math.min(lct - est, p), Math.min(lb + p - est, lct - ub));
        return Math.max(0, overlap) * job.demand();
    }

    private int propagateWindow(int est, int lct) {
        int c = cons.capacity();
        int w = lct - est;
        int energy = 0;
        for (int j = 0; j < cons.nJobs(); j++) {
            energy += requiredEnergy(j, est, lct);
        }
        int nChanges = 0;

        // latest starts
        for (int j = 0; j < cons.nJobs(); j++) {
            Job job = cons.job(j);
            int p = job.duration();
            int d = job.demand();
            int lst = ub(j);
            if (lst >= lct || lst + p <= est) {
                continue;
            }
            int ej = requiredEnergy(j, est, lct);
            int others = energy - ej;
            // overlap when starting at lst
            int right = Math.max(0, Math.min(Math.min(w, lct - lst), Math.min(p, lst + p - est))) * d;
            if (others <= (c - d) * w || others + right <= c * w) {
                continue;
            }
            int newLst = lct - Arrays.ceilDiv(others - (c - d) * w, d) - p;
            if (newLst + p < est) {
                fail(explainer.explainEnergeticConflict(host, -1, est, lct));
            }
            if (tighten(j, false, newLst, est, lct)) {
                nChanges++;
                energy = others + requiredEnergy(j, est, lct);
            }
        }

        // earliest starts
        for (int j = 0; j < cons.nJobs(); j++) {
            Job job = cons.job(j);
            int p = job.duration();
            int d = job.demand();
            int lb = lb(j);
            if (lb + p <= est || lb >= lct) {
                continue;
            }
            int ej = requiredEnergy(j, est, lct);
            int others = energy - ej;
            // overlap when starting at lb
            int left = Math.max(0, Math.min(Math.min(w, lb + p - est), Math.min(p, lct - lb))) * d;
            if (others <= (c - d) * w || others + left <= c * w) {
                continue;
            }
            int newEst = est + Arrays.ceilDiv(others - (c - d) * w, d);
            if (newEst > lct) {
                fail(explainer.explainEnergeticConflict(host, -1, est, lct));
            }
            if (tighten(j, true, newEst, est, lct)) {
                nChanges++;
                energy = others + requiredEnergy(j, est, lct);
            }
        }
        return nChanges;
    }

    private boolean tighten(int j, boolean lower, int bound, int est, int lct) {
        if (!InferInfo.fits(est, lct)) {
            LOGGER.fine(() -> "energetic window [" + est + "," + lct + "] cannot be recorded, skipped");
            return false;
        }
        int var = cons.job(j).startVar();
        int info = new InferInfo(PropagationRule.ENERGETIC_REASONING, est, lct).toInt();
        TightenResult res = lower ? host.tightenLowerBound(var, bound, info) : host.tightenUpperBound(var, bound, info);
        if (res.infeasible()) {
            fail(explainer.explainEnergeticConflict(host, j, est, lct));
        }
        if (res.tightened() && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("energetic reasoning moved " + cons.job(j) + " in window [" + est + "," + lct + "]");
        }
        return res.tightened();
    }

    private void fail(ConflictSet conflict) {
        LOGGER.fine(() -> "energetic reasoning conflict " + conflict);
        conflict.report(host);
        throw InconsistencyException.INCONSISTENCY;
    }
}
