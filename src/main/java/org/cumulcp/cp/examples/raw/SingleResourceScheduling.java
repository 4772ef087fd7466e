/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.examples.raw;

import org.cumulcp.cp.engine.constraints.scheduling.CumulativeConstraint;
import org.cumulcp.cp.engine.constraints.scheduling.CumulativePropagator;
import org.cumulcp.cp.engine.constraints.scheduling.CumulativeSettings;
import org.cumulcp.cp.engine.constraints.scheduling.FeasibilityReport;
import org.cumulcp.cp.engine.constraints.scheduling.Job;
import org.cumulcp.cp.engine.constraints.scheduling.PropagationResult;
import org.cumulcp.cp.engine.core.IntDomainStore;

import java.io.File;
import java.io.FileNotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;

/**
 * Minimizes the makespan of jobs sharing a single cumulative resource.
 * The search fixes the job with the smallest earliest start either at that start
 * or strictly later, and restarts with a tighter horizon after every solution.
 */
public class SingleResourceScheduling {

    public static void main(String[] args) throws FileNotFoundException {
        Instance data = new Instance(args.length > 0 ? args[0] : "data/SINGLE_RESOURCE/j10.txt");

        int horizon = 0;
        for (int p : data.duration) {
            horizon += p;
        }
        int[] best = null;
        long nNodes = 0;
        while (true) {
            IntDomainStore store = new IntDomainStore();
            List<Job> jobs = new ArrayList<>();
            for (int i = 0; i < data.nbJob; i++) {
                int x = store.makeVar(0, horizon - data.duration[i]);
                jobs.add(new Job(x, data.duration[i], data.demand[i]));
            }
            CumulativeConstraint cumulative = new CumulativeConstraint(data.capacity, jobs);
            CumulativePropagator propagator = new CumulativePropagator(store, CumulativeSettings.load());
            Search search = new Search(store, propagator, cumulative);
            int[] sol = search.solve();
            nNodes += search.nNodes;
            if (sol == null) {
                break;
            }
            FeasibilityReport report = propagator.checkFeasibility(cumulative, sol);
            assert (report.isFeasible());
            best = sol;
            int makespan = 0;
            for (int i = 0; i < data.nbJob; i++) {
                makespan = Math.max(makespan, sol[i] + data.duration[i]);
            }
            System.out.println("makespan: " + makespan);
            horizon = makespan - 1;
        }
        System.out.println("nodes: " + nNodes);
        if (best != null) {
            System.out.println("starts: " + java.util.Arrays.toString(best));
        }
    }

    static class Search {

        final IntDomainStore store;
        final CumulativePropagator propagator;
        final CumulativeConstraint cumulative;
        long nNodes = 0;

        Search(IntDomainStore store, CumulativePropagator propagator, CumulativeConstraint cumulative) {
            this.store = store;
            this.propagator = propagator;
            this.cumulative = cumulative;
        }

        boolean fixPoint() {
            while (true) {
                PropagationResult res = propagator.propagate(cumulative);
                if (res.isCutoff()) {
                    return false;
                }
                if (res.outcome() != PropagationResult.Outcome.TIGHTENED) {
                    return true;
                }
            }
        }

        int[] solve() {
            if (!fixPoint()) {
                return null;
            }
            return dfs();
        }

        private int[] dfs() {
            nNodes++;
            int x = -1;
            for (int i = 0; i < cumulative.nJobs(); i++) {
                int v = cumulative.job(i).startVar();
                if (!store.isFixed(v) && (x < 0 || store.getLowerBound(v) < store.getLowerBound(x))) {
                    x = v;
                }
            }
            if (x < 0) {
                int[] sol = new int[cumulative.nJobs()];
                for (int i = 0; i < sol.length; i++) {
                    sol[i] = store.getLowerBound(cumulative.job(i).startVar());
                }
                return sol;
            }
            int lb = store.getLowerBound(x);
            int mark = store.saveState();
            store.tightenUpperBound(x, lb, 0);
            int[] sol = fixPoint() ? dfs() : null;
            store.restoreState(mark);
            if (sol != null) {
                return sol;
            }
            store.tightenLowerBound(x, lb + 1, 0);
            sol = fixPoint() ? dfs() : null;
            store.restoreState(mark);
            return sol;
        }
    }

    static class Instance {

        public String name;
        public int nbJob;
        public int capacity;
        public int[] duration;
        public int[] demand;

        public Instance(String filename) throws FileNotFoundException {
            name = filename;
            Scanner s = new Scanner(new File(filename)).useDelimiter("\\s+");
            nbJob = s.nextInt();
            capacity = s.nextInt();
            duration = new int[nbJob];
            demand = new int[nbJob];
            for (int i = 0; i < nbJob; i++) {
                duration[i] = s.nextInt();
                demand[i] = s.nextInt();
            }
            s.close();
        }
    }
}
