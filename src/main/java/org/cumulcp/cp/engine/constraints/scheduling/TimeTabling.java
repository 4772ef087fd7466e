/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.cumulcp.cp.engine.core.ConflictSet;
import org.cumulcp.cp.engine.core.LinkedBinaryEncoding;
import org.cumulcp.cp.engine.core.PropagationHost;
import org.cumulcp.cp.engine.core.TightenResult;
import org.cumulcp.util.exception.InconsistencyException;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Time-tabling filtering based on the compulsory parts (cores) of the jobs.
 * The cores are accumulated in a {@link ResourceProfile} and every job is pushed
 * to the earliest (latest) start at which it fits on top of the cores of the others.
 * With a binary encoding of the starts, the impossible starts strictly inside
 * the domains are removed as well.
 */
public class TimeTabling {

    private static final Logger LOGGER = Logger.getLogger(TimeTabling.class.getName());

    private final CumulativeConstraint cons;
    private final PropagationHost host;
    private final ConflictExplainer explainer;

    public TimeTabling(CumulativeConstraint cons, PropagationHost host, ConflictExplainer explainer) {
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
     * @return the profile with the cores of all the jobs
     * @throws InconsistencyException if the cores alone exceed the capacity
     */
    private ResourceProfile buildProfile() {
        ResourceProfile profile = new ResourceProfile(cons.capacity(), 2 * cons.nJobs() + 2);
        for (int j = 0; j < cons.nJobs(); j++) {
            Job job = cons.job(j);
            int lb = lb(j);
            int ub = ub(j);
            if (profile.insertCore(lb, ub, job.duration(), job.demand()) == ResourceProfile.CoreStatus.OVERLOAD) {
                LOGGER.fine(() -> "cores overload the resource at the core of " + job);
                fail(explainer.explainCoreWindow(host, j, ub, lb + job.duration()));
            }
        }
        return profile;
    }

    /**
     * Adjusts the start bounds to the cores until no bound moves anymore.
     *
     * @return the number of bounds tightened
     * @throws InconsistencyException if a job has no feasible start
     */
    public int propagateCores() {
        ResourceProfile profile = buildProfile();
        int info = new InferInfo(PropagationRule.CORE_TIMES, 0, 0).toInt();
        int nChanges = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int j = 0; j < cons.nJobs(); j++) {
                Job job = cons.job(j);
                int var = job.startVar();
                int p = job.duration();
                int d = job.demand();
                int lb = lb(j);
                int ub = ub(j);
                if (lb == ub) {
                    continue;
                }
                profile.deleteCore(lb, ub, p, d);

                int newLb = profile.earliestFeasibleStart(lb, ub, p, d);
                if (newLb > ub) {
                    fail(explainer.explainCoreWindow(host, j, lb, ub + p));
                }
                if (tighten(host.tightenLowerBound(var, newLb, info), j, lb, ub)) {
                    nChanges++;
                    changed = true;
                    lb = lb(j);
                }
                int newUb = profile.latestFeasibleStart(lb, ub, p, d);
                if (newUb < lb) {
                    fail(explainer.explainCoreWindow(host, j, lb, ub + p));
                }
                if (tighten(host.tightenUpperBound(var, newUb, info), j, lb, ub)) {
                    nChanges++;
                    changed = true;
                    ub = ub(j);
                }
                ResourceProfile.CoreStatus status = profile.insertCore(lb, ub, p, d);
                assert (status != ResourceProfile.CoreStatus.OVERLOAD);
            }
        }
        return nChanges;
    }

    private boolean tighten(TightenResult res, int j, int lb, int ub) {
        if (res.infeasible()) {
            fail(explainer.explainCoreWindow(host, j, lb, ub + cons.job(j).duration()));
        }
        if (res.tightened() && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("core times moved " + cons.job(j) + " to [" + lb(j) + "," + ub(j) + "]");
        }
        return res.tightened();
    }

    /**
     * Fixes to zero the indicators of the starts strictly inside the domains
     * that do not fit on top of the cores of the other jobs.
     *
     * @return the number of indicators fixed
     * @throws InconsistencyException if an indicator to fix is already one
     */
    public int propagateHoles(LinkedBinaryEncoding encoding) {
        ResourceProfile profile = buildProfile();
        int nChanges = 0;
        for (int j = 0; j < cons.nJobs(); j++) {
            Job job = cons.job(j);
            int var = job.startVar();
            if (!encoding.isLinked(var) || encoding.nIndicators(var) <= 1) {
                continue;
            }
            int p = job.duration();
            int d = job.demand();
            int lb = lb(j);
            int ub = ub(j);
            if (lb == ub) {
                continue;
            }
            int offset = encoding.offset(var);
            profile.deleteCore(lb, ub, p, d);
            for (int t = lb + 1; t < ub; t++) {
                int pos = profile.firstBlockingInterval(t, p, d);
                int position = t - offset;
                if (pos < 0 || position < 0 || position >= encoding.nIndicators(var)) {
                    continue;
                }
                int timepoint = profile.timepoint(pos);
                if (!InferInfo.fits(position, timepoint)) {
                    LOGGER.fine(() -> "hole of " + job + " at " + position + " cannot be recorded, skipped");
                    continue;
                }
                int info = new InferInfo(PropagationRule.CORE_TIME_HOLES, position, timepoint).toInt();
                TightenResult res = host.tightenUpperBound(encoding.indicatorVar(var, position), 0, info);
                if (res.infeasible()) {
                    fail(explainer.explainHole(host, j, timepoint));
                }
                if (res.tightened()) {
                    nChanges++;
                }
            }
            profile.insertCore(lb, ub, p, d);
        }
        return nChanges;
    }

    private void fail(ConflictSet conflict) {
        LOGGER.fine(() -> "core times conflict " + conflict);
        conflict.report(host);
        throw InconsistencyException.INCONSISTENCY;
    }
}
