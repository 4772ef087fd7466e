/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.cumulcp.cp.engine.core.BoundChange;
import org.cumulcp.cp.engine.core.BoundQuery;
import org.cumulcp.cp.engine.core.ConflictSet;
import org.cumulcp.cp.engine.core.LinkedBinaryEncoding;
import org.cumulcp.cp.engine.core.PropagationHost;
import org.cumulcp.util.Arrays;
import org.cumulcp.util.exception.InconsistencyException;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Propagation of cumulative constraints on top of a {@link PropagationHost}.
 * A round runs the enabled rules in a fixed order and stops at the first infeasibility:
 * <pre>
 * REDUNDANT_CHECK -&gt; CORE_PROPAGATION -&gt; CORE_HOLES -&gt; EDGE_FINDING -&gt; ENERGETIC -&gt; DONE
 * </pre>
 * All the data structures are built per call, a propagator instance can be shared
 * by several constraints but must not be used by several threads at once.
 */
public class CumulativePropagator {

    private static final Logger LOGGER = Logger.getLogger(CumulativePropagator.class.getName());

    private static final int NO_OVERLOAD = Integer.MIN_VALUE;

    enum Stage {
        REDUNDANT_CHECK, CORE_PROPAGATION, CORE_HOLES, EDGE_FINDING, ENERGETIC, DONE
    }

    private final PropagationHost host;
    private final CumulativeSettings settings;

    public CumulativePropagator(PropagationHost host) {
        this(host, CumulativeSettings.defaults());
    }

    public CumulativePropagator(PropagationHost host, CumulativeSettings settings) {
        this.host = host;
        this.settings = settings;
    }

    public CumulativeSettings settings() {
        return settings;
    }

    /**
     * Runs one propagation round. On a cutoff the conflict has been reported to the host.
     *
     * @throws IllegalArgumentException if a start bound is negative
     */
    public PropagationResult propagate(CumulativeConstraint cons) {
        checkNonNegative(cons);
        ConflictExplainer explainer = new ConflictExplainer(cons, settings.useShortEdgeFindingExplanations());
        int nChanges = 0;
        Stage stage = Stage.REDUNDANT_CHECK;
        try {
            while (stage != Stage.DONE) {
                LOGGER.finer("stage " + stage);
                switch (stage) {
                    case REDUNDANT_CHECK:
                        if (isRedundant(cons)) {
                            LOGGER.fine(() -> "redundant " + cons);
                            return PropagationResult.redundant();
                        }
                        stage = Stage.CORE_PROPAGATION;
                        break;
                    case CORE_PROPAGATION:
                        if (settings.useCoreTimes()) {
                            nChanges += new TimeTabling(cons, host, explainer).propagateCores();
                        }
                        stage = Stage.CORE_HOLES;
                        break;
                    case CORE_HOLES:
                        Optional<LinkedBinaryEncoding> encoding = cons.encoding();
                        if (settings.useCoreTimeHoles() && encoding.isPresent()) {
                            nChanges += new TimeTabling(cons, host, explainer).propagateHoles(encoding.get());
                        }
                        stage = Stage.EDGE_FINDING;
                        break;
                    case EDGE_FINDING:
                        if (settings.useEdgeFinding()) {
                            EdgeFinder edgeFinder = new EdgeFinder(cons, host, explainer);
                            edgeFinder.checkOverload();
                            nChanges += edgeFinder.detect(EdgeFinder.Direction.FORWARD);
                            nChanges += edgeFinder.detect(EdgeFinder.Direction.BACKWARD);
                        }
                        stage = Stage.ENERGETIC;
                        break;
                    case ENERGETIC:
                        if (settings.useEnergeticReasoning()) {
                            nChanges += new EnergeticReasoning(cons, host, explainer).propagate();
                        }
                        stage = Stage.DONE;
                        break;
                    default:
                        throw new IllegalStateException("unexpected stage " + stage);
                }
            }
        } catch (InconsistencyException e) {
            LOGGER.fine(() -> "cutoff on " + cons);
            return PropagationResult.cutoff();
        }
        return PropagationResult.tightened(nChanges);
    }

    /**
     * A constraint is redundant when the jobs cannot exceed the capacity
     * even if every job runs over its whole window [lb, ub+duration).
     */
    public boolean isRedundant(CumulativeConstraint cons) {
        int n = cons.nJobs();
        int[] starts = new int[n];
        int[] ends = new int[n];
        for (int j = 0; j < n; j++) {
            int var = cons.job(j).startVar();
            starts[j] = host.getLowerBound(var);
            ends[j] = host.getUpperBound(var) + cons.job(j).duration();
        }
        return firstOverload(cons, starts, ends) == NO_OVERLOAD;
    }

    private void checkNonNegative(CumulativeConstraint cons) {
        for (int j = 0; j < cons.nJobs(); j++) {
            int var = cons.job(j).startVar();
            if (host.getLowerBound(var) < 0) {
                throw new IllegalArgumentException("negative start bound for " + cons.job(j));
            }
        }
    }

    /**
     * Sweeps the intervals [starts[j], ends[j]) by increasing time.
     *
     * @return the first time the demand exceeds the capacity, {@link #NO_OVERLOAD} if never
     */
    private static int firstOverload(CumulativeConstraint cons, int[] starts, int[] ends) {
        int n = cons.nJobs();
        int[] byStart = Arrays.sortPerm(starts);
        int[] byEnd = Arrays.sortPerm(ends);
        int free = cons.capacity();
        int e = 0;
        int s = 0;
        while (s < n) {
            int t = starts[byStart[s]];
            while (e < n && ends[byEnd[e]] <= t) {
                free += cons.job(byEnd[e]).demand();
                e++;
            }
            while (s < n && starts[byStart[s]] == t) {
                free -= cons.job(byStart[s]).demand();
                s++;
            }
            if (free < 0) {
                return t;
            }
        }
        return NO_OVERLOAD;
    }

    /**
     * Checks a complete assignment.
     * Start times may be negative.
     *
     * @param startTimes the start of every job of the constraint, indexed by job
     */
    public FeasibilityReport checkFeasibility(CumulativeConstraint cons, int[] startTimes) {
        int n = cons.nJobs();
        if (startTimes.length != n) {
            throw new IllegalArgumentException(n + " start times expected, got " + startTimes.length);
        }
        int[] ends = new int[n];
        for (int j = 0; j < n; j++) {
            ends[j] = startTimes[j] + cons.job(j).duration();
        }
        int t = firstOverload(cons, startTimes, ends);
        if (t == NO_OVERLOAD) {
            return FeasibilityReport.feasible();
        }
        int[] running = new int[n];
        int nRunning = 0;
        int required = 0;
        for (int j = 0; j < n; j++) {
            if (startTimes[j] <= t && t < ends[j]) {
                running[nRunning++] = j;
                required += cons.job(j).demand();
            }
        }
        FeasibilityReport report = FeasibilityReport.violation(t, required, cons.capacity(),
                java.util.Arrays.copyOf(running, nRunning));
        if (LOGGER.isLoggable(Level.INFO)) {
            StringBuilder jobs = new StringBuilder();
            for (int i = 0; i < nRunning; i++) {
                jobs.append(' ').append(cons.job(running[i])).append('@').append(startTimes[running[i]]);
            }
            LOGGER.info(cons + " violated: " + report + ", running:" + jobs);
        }
        return report;
    }

    /**
     * Explains a bound change this propagator made on one of the jobs of cons.
     *
     * @param bounds the bounds of the variables just before the change
     * @return the bounds implying the change
     */
    public ConflictSet resolvePropagation(CumulativeConstraint cons, BoundChange change, BoundQuery bounds) {
        ConflictSet reason = new ConflictExplainer(cons, settings.useShortEdgeFindingExplanations())
                .resolve(change, bounds);
        LOGGER.fine(() -> "reason of " + change + ": " + reason);
        return reason;
    }
}
