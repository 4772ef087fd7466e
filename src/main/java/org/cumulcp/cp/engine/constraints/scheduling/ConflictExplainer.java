/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.cumulcp.cp.engine.core.BoundChange;
import org.cumulcp.cp.engine.core.BoundQuery;
import org.cumulcp.cp.engine.core.BoundType;
import org.cumulcp.cp.engine.core.ConflictSet;
import org.cumulcp.cp.engine.core.LinkedBinaryEncoding;
import org.cumulcp.util.Arrays;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds the set of bounds explaining a tightening or an infeasibility
 * detected by one of the cumulative rules.
 * All methods are pure functions of the constraint and of the bounds they are given:
 * to explain a past bound change, pass the bounds as they were when the change happened.
 */
public class ConflictExplainer {

    private final CumulativeConstraint cons;
    private final boolean shortEdgeFinding;

    /**
     * @param shortEdgeFinding whether edge-finding tightenings may be explained
     *                         by a subset of the jobs in the window
     */
    public ConflictExplainer(CumulativeConstraint cons, boolean shortEdgeFinding) {
        this.cons = cons;
        this.shortEdgeFinding = shortEdgeFinding;
    }

    /**
     * Explains a bound change recorded by the host.
     *
     * @param change the change, its inference word must have been produced by this propagator
     * @param bounds the bounds of all the variables just before the change
     * @throws IllegalArgumentException if the change was not inferred by a cumulative rule
     *                                  or does not concern a job of the constraint
     */
    public ConflictSet resolve(BoundChange change, BoundQuery bounds) {
        InferInfo info = InferInfo.fromInt(change.inferInfo());
        switch (info.rule()) {
            case CORE_TIMES:
                return explainCoreTimes(bounds, jobOf(change.var()), change.type(), change.oldBound(), change.newBound());
            case CORE_TIME_HOLES:
                return explainHole(bounds, jobOfIndicator(change.var(), info.est()), info.lct());
            case EDGE_FINDING:
                return explainEdgeFinding(bounds, jobOf(change.var()), change.type(), change.oldBound(), change.newBound(),
                        info.est(), info.lct());
            case ENERGETIC_REASONING:
                return explainEnergetic(bounds, jobOf(change.var()), change.type(), info.est(), info.lct());
            default:
                throw new IllegalArgumentException("cannot explain " + change + " inferred by " + info);
        }
    }

    private int jobOf(int var) {
        int job = cons.jobOf(var);
        if (job < 0) {
            throw new IllegalArgumentException("x" + var + " is not a start of " + cons);
        }
        return job;
    }

    private int jobOfIndicator(int indicator, int position) {
        LinkedBinaryEncoding enc = cons.encoding().orElseThrow(
                () -> new IllegalArgumentException("the constraint has no binary encoding"));
        for (int j = 0; j < cons.nJobs(); j++) {
            int var = cons.job(j).startVar();
            if (enc.isLinked(var) && position < enc.nIndicators(var) && enc.indicatorVar(var, position) == indicator) {
                return j;
            }
        }
        throw new IllegalArgumentException("x" + indicator + " is not an indicator of " + cons);
    }

    // ------------------------- core times -------------------------

    /**
     * A start bound moved because the cores of the other jobs leave no room:
     * for a lower bound the starts in [oldLb, newLb) were impossible,
     * for an upper bound the ends in (newUb+p, oldUb+p].
     */
    public ConflictSet explainCoreTimes(BoundQuery bounds, int job, BoundType type, int oldBound, int newBound) {
        int p = cons.job(job).duration();
        if (type == BoundType.LOWER) {
            return explainCoreWindow(bounds, job, oldBound, newBound);
        } else {
            return explainCoreWindow(bounds, job, newBound + p, oldBound + p);
        }
    }

    /**
     * Both bounds of job, plus the cores of the other jobs that overload [left,right)
     * once the demand of job is reserved.
     */
    public ConflictSet explainCoreWindow(BoundQuery bounds, int job, int left, int right) {
        ConflictSet out = new ConflictSet().addBounds(cons.job(job).startVar());
        addOverloadingCores(bounds, job, left, right, out);
        return out;
    }

    private void addOverloadingCores(BoundQuery bounds, int job, int left, int right, ConflictSet out) {
        int n = cons.nJobs();
        int[] ids = new int[n];
        int[] starts = new int[n];
        int[] ends = new int[n];
        int k = 0;
        for (int j = 0; j < n; j++) {
            if (j == job) {
                continue;
            }
            int var = cons.job(j).startVar();
            int lb = bounds.getLowerBound(var);
            int ub = bounds.getUpperBound(var);
            int end = lb + cons.job(j).duration();
            if (ub < end && ub < right && end > left) {
                ids[k] = j;
                starts[k] = ub;
                ends[k] = end;
                k++;
            }
        }
        ids = java.util.Arrays.copyOf(ids, k);
        int[] byStart = Arrays.sortPerm(java.util.Arrays.copyOf(starts, k));
        int[] byEnd = Arrays.sortPerm(java.util.Arrays.copyOf(ends, k));

        int free = cons.capacity() - cons.job(job).demand();
        Set<Integer> running = new LinkedHashSet<>();
        int e = 0;
        int s = 0;
        while (s < k) {
            int t = starts[byStart[s]];
            while (e < k && ends[byEnd[e]] <= t) {
                free += cons.job(ids[byEnd[e]]).demand();
                running.remove(ids[byEnd[e]]);
                e++;
            }
            while (s < k && starts[byStart[s]] == t) {
                free -= cons.job(ids[byStart[s]]).demand();
                running.add(ids[byStart[s]]);
                s++;
            }
            if (free < 0) {
                for (int j : running) {
                    out.addBounds(cons.job(j).startVar());
                }
                // already reported, only new starters matter from now on
                running.clear();
            }
        }
    }

    /**
     * Start t of job is impossible because the cores covering timepoint
     * leave less than its demand.
     */
    public ConflictSet explainHole(BoundQuery bounds, int job, int timepoint) {
        ConflictSet out = new ConflictSet().addBounds(cons.job(job).startVar());
        int n = cons.nJobs();
        int[] demands = new int[n];
        for (int j = 0; j < n; j++) {
            int var = cons.job(j).startVar();
            int lb = bounds.getLowerBound(var);
            int ub = bounds.getUpperBound(var);
            if (j != job && ub <= timepoint && timepoint < lb + cons.job(j).duration()) {
                demands[j] = cons.job(j).demand();
            }
        }
        int free = cons.capacity() - cons.job(job).demand();
        for (int j : Arrays.sortPermDecreasing(demands)) {
            if (free < 0 || demands[j] == 0) {
                break;
            }
            out.addBounds(cons.job(j).startVar());
            free -= demands[j];
        }
        return out;
    }

    // ------------------------- edge-finding -------------------------

    /**
     * A bound of job was moved by edge-finding on the window [est,lct].
     * When the old bound already lies in the window, only the most energetic
     * jobs of the window needed to reach the new bound are reported.
     */
    public ConflictSet explainEdgeFinding(BoundQuery bounds, int job, BoundType type, int oldBound, int newBound,
                                          int est, int lct) {
        Job jb = cons.job(job);
        ConflictSet out = new ConflictSet().add(jb.startVar(), type);
        int[] candidates = jobsInside(bounds, job, est, lct);
        int p = jb.duration();
        boolean inside = type == BoundType.LOWER ? oldBound >= est : oldBound + p <= lct;
        if (!shortEdgeFinding || !inside) {
            for (int j : candidates) {
                out.addBounds(cons.job(j).startVar());
            }
            return out;
        }
        int required = type == BoundType.LOWER ? newBound - est : lct - newBound - p;
        int[] energies = new int[candidates.length];
        for (int i = 0; i < candidates.length; i++) {
            energies[i] = cons.job(candidates[i]).energy();
        }
        int c = cons.capacity();
        int d = jb.demand();
        int delta = lct - est;
        int energy = 0;
        for (int i : Arrays.sortPermDecreasing(energies)) {
            energy += energies[i];
            out.addBounds(cons.job(candidates[i]).startVar());
            if (energy + d * p > c * delta && Arrays.ceilDiv(energy - (c - d) * delta, d) >= required) {
                break;
            }
        }
        return out;
    }

    /**
     * Edge-finding proved that job cannot be scheduled with the jobs of [est,lct].
     */
    public ConflictSet explainEdgeFindingConflict(BoundQuery bounds, int job, int est, int lct) {
        ConflictSet out = new ConflictSet().addBounds(cons.job(job).startVar());
        for (int j : jobsInside(bounds, job, est, lct)) {
            out.addBounds(cons.job(j).startVar());
        }
        return out;
    }

    private int[] jobsInside(BoundQuery bounds, int job, int est, int lct) {
        int[] res = new int[cons.nJobs()];
        int k = 0;
        for (int j = 0; j < cons.nJobs(); j++) {
            int var = cons.job(j).startVar();
            if (j != job && bounds.getLowerBound(var) >= est
                    && bounds.getUpperBound(var) + cons.job(j).duration() <= lct) {
                res[k++] = j;
            }
        }
        return java.util.Arrays.copyOf(res, k);
    }

    /**
     * The jobs of an overloaded set: their energy exceeds what the resource offers
     * between their smallest est and their largest lct.
     */
    public ConflictSet explainOverload(int[] jobs) {
        ConflictSet out = new ConflictSet();
        for (int j : jobs) {
            out.addBounds(cons.job(j).startVar());
        }
        return out;
    }

    // ------------------------- energetic reasoning -------------------------

    /**
     * A bound of job was moved by energetic reasoning on the window [est,lct].
     */
    public ConflictSet explainEnergetic(BoundQuery bounds, int job, BoundType type, int est, int lct) {
        ConflictSet out = new ConflictSet().add(cons.job(job).startVar(), type);
        addIntersecting(bounds, job, est, lct, out);
        return out;
    }

    /**
     * Energetic reasoning proved the window [est,lct] overloaded.
     *
     * @param job the job whose bounds crossed, -1 if the overload involves no job in particular
     */
    public ConflictSet explainEnergeticConflict(BoundQuery bounds, int job, int est, int lct) {
        ConflictSet out = new ConflictSet();
        if (job >= 0) {
            out.addBounds(cons.job(job).startVar());
        }
        addIntersecting(bounds, job, est, lct, out);
        return out;
    }

    private void addIntersecting(BoundQuery bounds, int job, int est, int lct, ConflictSet out) {
        for (int j = 0; j < cons.nJobs(); j++) {
            int var = cons.job(j).startVar();
            if (j != job && bounds.getLowerBound(var) < lct
                    && bounds.getUpperBound(var) + cons.job(j).duration() > est) {
                out.addBounds(var);
            }
        }
    }
}
