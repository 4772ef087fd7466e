/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.cumulcp.cp.engine.core.BoundChange;
import org.cumulcp.cp.engine.core.BoundQuery;
import org.cumulcp.cp.engine.core.BoundType;
import org.cumulcp.cp.engine.core.ConflictSet;
import org.cumulcp.cp.engine.core.IntDomainStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CumulativePropagatorTest {

    private static final int HORIZON = 6;

    @Test
    public void testOverloadCutoff() {
        IntDomainStore store = new IntDomainStore();
        int x0 = store.makeVar(0, 3);
        int x1 = store.makeVar(0, 3);
        int x2 = store.makeVar(0, 3);
        CumulativeConstraint cons = new CumulativeConstraint(2,
                List.of(new Job(x0, 2, 2), new Job(x1, 2, 2), new Job(x2, 2, 2)));
        CumulativePropagator propagator = new CumulativePropagator(store);

        PropagationResult res = propagator.propagate(cons);
        assertTrue(res.isCutoff());
        assertEquals(1, store.conflicts().size());
        ConflictSet conflict = store.lastConflict();
        assertTrue(conflict.containsVar(x0));
        assertTrue(conflict.containsVar(x1));
        assertTrue(conflict.containsVar(x2));
        assertNull(BruteForce.hullUnder(cons, store, conflict, 10));
    }

    @Test
    public void testOverloadUndetectedWithoutEnergyRules() {
        IntDomainStore store = new IntDomainStore();
        int x0 = store.makeVar(0, 3);
        int x1 = store.makeVar(0, 3);
        int x2 = store.makeVar(0, 3);
        CumulativeConstraint cons = new CumulativeConstraint(2,
                List.of(new Job(x0, 2, 2), new Job(x1, 2, 2), new Job(x2, 2, 2)));
        CumulativeSettings settings = CumulativeSettings.defaults()
                .withEdgeFinding(false)
                .withEnergeticReasoning(false);
        // no job has a core, time-tabling alone sees nothing
        PropagationResult res = new CumulativePropagator(store, settings).propagate(cons);
        assertEquals(PropagationResult.Outcome.NOTHING, res.outcome());
    }

    @Test
    public void testSingleJobIsRedundant() {
        IntDomainStore store = new IntDomainStore();
        int x = store.makeVar(0, 5);
        CumulativeConstraint cons = new CumulativeConstraint(1, List.of(new Job(x, 3, 1)));
        CumulativePropagator propagator = new CumulativePropagator(store);
        assertTrue(propagator.isRedundant(cons));
        assertEquals(PropagationResult.Outcome.CONSTRAINT_REDUNDANT, propagator.propagate(cons).outcome());
        assertTrue(store.changes().isEmpty());
    }

    @Test
    public void testDisjointWindowsAreRedundant() {
        IntDomainStore store = new IntDomainStore();
        int x0 = store.makeVar(0, 2);
        int x1 = store.makeVar(5, 8);
        CumulativeConstraint cons = new CumulativeConstraint(3, List.of(new Job(x0, 3, 3), new Job(x1, 2, 3)));
        CumulativePropagator propagator = new CumulativePropagator(store);
        assertTrue(propagator.isRedundant(cons));
        store.tightenLowerBound(x1, 4, 0);
        assertFalse(propagator.isRedundant(cons));
    }

    @Test
    public void testCorePushesOtherJob() {
        IntDomainStore store = new IntDomainStore();
        int a = store.makeVar(0, 0);
        int b = store.makeVar(0, 10);
        CumulativeConstraint cons = new CumulativeConstraint(4, List.of(new Job(a, 4, 3), new Job(b, 4, 3)));
        CumulativePropagator propagator = new CumulativePropagator(store);

        PropagationResult res = propagator.propagate(cons);
        assertEquals(PropagationResult.Outcome.TIGHTENED, res.outcome());
        assertEquals(1, res.nTightenings());
        assertEquals(4, store.getLowerBound(b));
        assertEquals(10, store.getUpperBound(b));
        assertEquals(0, store.getLowerBound(a));

        BoundChange change = store.changes().get(0);
        assertEquals(b, change.var());
        assertEquals(BoundType.LOWER, change.type());
        assertEquals(PropagationRule.CORE_TIMES, InferInfo.fromInt(change.inferInfo()).rule());
        ConflictSet reason = propagator.resolvePropagation(cons, change, store.boundsBefore(0));
        assertEquals(new ConflictSet().addBounds(b).addBounds(a), reason);

        // b now runs after a
        assertEquals(PropagationResult.Outcome.CONSTRAINT_REDUNDANT, propagator.propagate(cons).outcome());
    }

    @Test
    public void testCorePropagationChains() {
        // a pushes b, whose new core pushes c
        IntDomainStore store = new IntDomainStore();
        int c = store.makeVar(0, 9);
        int b = store.makeVar(0, 3);
        int a = store.makeVar(0, 0);
        CumulativeConstraint cons = new CumulativeConstraint(1,
                List.of(new Job(c, 2, 1), new Job(b, 2, 1), new Job(a, 2, 1)));
        CumulativeSettings settings = CumulativeSettings.defaults()
                .withEdgeFinding(false)
                .withEnergeticReasoning(false);
        PropagationResult res = new CumulativePropagator(store, settings).propagate(cons);
        assertEquals(PropagationResult.Outcome.TIGHTENED, res.outcome());
        assertEquals(2, store.getLowerBound(b));
        assertEquals(4, store.getLowerBound(c));
    }

    @Test
    public void testCoresOverload() {
        IntDomainStore store = new IntDomainStore();
        int a = store.makeVar(1, 1);
        int b = store.makeVar(0, 2);
        CumulativeConstraint cons = new CumulativeConstraint(3, List.of(new Job(a, 3, 2), new Job(b, 4, 2)));
        CumulativeSettings settings = CumulativeSettings.defaults()
                .withEdgeFinding(false)
                .withEnergeticReasoning(false);
        assertTrue(new CumulativePropagator(store, settings).propagate(cons).isCutoff());
        assertEquals(new ConflictSet().addBounds(a).addBounds(b), store.lastConflict());
    }

    @Test
    public void testHoles() {
        IntDomainStore store = new IntDomainStore();
        int a = store.makeVar(3, 3);
        int b = store.makeVar(0, 6);
        int first = store.linkIndicators(b, 0, 7);
        CumulativeConstraint cons = new CumulativeConstraint(2, List.of(new Job(a, 2, 2), new Job(b, 1, 1)), store);
        CumulativePropagator propagator = new CumulativePropagator(store, CumulativeSettings.defaults().withCoreTimeHoles(true));

        PropagationResult res = propagator.propagate(cons);
        assertEquals(PropagationResult.Outcome.TIGHTENED, res.outcome());
        assertEquals(2, res.nTightenings());
        assertEquals(0, store.getLowerBound(b));
        assertEquals(6, store.getUpperBound(b));
        for (int t = 0; t < 7; t++) {
            int expected = t == 3 || t == 4 ? 0 : 1;
            assertEquals(expected, store.getUpperBound(first + t), "indicator of " + t);
        }

        BoundChange change = store.changes().get(1);
        assertEquals(first + 4, change.var());
        InferInfo info = InferInfo.fromInt(change.inferInfo());
        assertEquals(PropagationRule.CORE_TIME_HOLES, info.rule());
        assertEquals(4, info.est());
        assertEquals(3, info.lct());
        ConflictSet reason = propagator.resolvePropagation(cons, change, store.boundsBefore(1));
        assertEquals(new ConflictSet().addBounds(b).addBounds(a), reason);
    }

    @Test
    public void testHolesIgnoredWithoutEncoding() {
        IntDomainStore store = new IntDomainStore();
        int a = store.makeVar(3, 3);
        int b = store.makeVar(0, 6);
        store.linkIndicators(b, 0, 7);
        CumulativeConstraint cons = new CumulativeConstraint(2, List.of(new Job(a, 2, 2), new Job(b, 1, 1)));
        CumulativePropagator propagator = new CumulativePropagator(store, CumulativeSettings.defaults().withCoreTimeHoles(true));
        assertEquals(PropagationResult.Outcome.NOTHING, propagator.propagate(cons).outcome());
    }

    @Test
    public void testCheckFeasibility() {
        IntDomainStore store = new IntDomainStore();
        int a = store.makeVar(0, 5);
        int b = store.makeVar(0, 5);
        int c = store.makeVar(0, 5);
        CumulativeConstraint cons = new CumulativeConstraint(2,
                List.of(new Job(a, 2, 2), new Job(b, 2, 1), new Job(c, 1, 1)));
        CumulativePropagator propagator = new CumulativePropagator(store);

        assertTrue(propagator.checkFeasibility(cons, new int[]{0, 2, 3}).isFeasible());
        assertTrue(propagator.checkFeasibility(cons, new int[]{2, 0, 0}).isFeasible());

        FeasibilityReport report = propagator.checkFeasibility(cons, new int[]{0, 1, 4});
        assertFalse(report.isFeasible());
        assertEquals(1, report.violationTime());
        assertEquals(3, report.required());
        assertEquals(2, report.available());
        assertArrayEquals(new int[]{0, 1}, report.runningJobs());

        assertThrows(IllegalArgumentException.class, () -> propagator.checkFeasibility(cons, new int[]{0, 1}));
    }

    @Test
    public void testCheckFeasibilityNegativeStarts() {
        IntDomainStore store = new IntDomainStore();
        int a = store.makeVar(0, 5);
        int b = store.makeVar(0, 5);
        CumulativeConstraint cons = new CumulativeConstraint(2, List.of(new Job(a, 2, 2), new Job(b, 2, 2)));
        CumulativePropagator propagator = new CumulativePropagator(store);

        FeasibilityReport report = propagator.checkFeasibility(cons, new int[]{-5, -5});
        assertFalse(report.isFeasible());
        assertEquals(-5, report.violationTime());
        assertEquals(4, report.required());
        assertArrayEquals(new int[]{0, 1}, report.runningJobs());

        assertTrue(propagator.checkFeasibility(cons, new int[]{-5, -3}).isFeasible());
    }

    @Test
    public void testNegativeBoundsRejected() {
        IntDomainStore store = new IntDomainStore();
        int a = store.makeVar(-5, -5);
        int b = store.makeVar(-5, -5);
        CumulativeConstraint cons = new CumulativeConstraint(2, List.of(new Job(a, 2, 2), new Job(b, 2, 2)));
        CumulativePropagator propagator = new CumulativePropagator(store);

        assertFalse(propagator.isRedundant(cons));
        assertThrows(IllegalArgumentException.class, () -> propagator.propagate(cons));
        assertTrue(store.changes().isEmpty());
        assertTrue(store.conflicts().isEmpty());
    }

    @Test
    public void testCheckFeasibilityAgreesWithBruteForce() {
        Random rand = new Random(42);
        for (int iter = 0; iter < 500; iter++) {
            IntDomainStore store = new IntDomainStore();
            CumulativeConstraint cons = BruteForce.randomInstance(rand, store, 1 + rand.nextInt(5), HORIZON, 1 + rand.nextInt(3));
            int[] starts = new int[cons.nJobs()];
            for (int j = 0; j < starts.length; j++) {
                starts[j] = rand.nextInt(HORIZON);
            }
            FeasibilityReport report = new CumulativePropagator(store).checkFeasibility(cons, starts);
            assertEquals(BruteForce.isFeasible(cons, starts), report.isFeasible());
            if (!report.isFeasible()) {
                assertTrue(report.required() > report.available());
            }
        }
    }

    static Stream<CumulativeSettings> settings() {
        CumulativeSettings d = CumulativeSettings.defaults();
        return Stream.of(d,
                d.withShortEdgeFindingExplanations(false),
                d.withEdgeFinding(false),
                d.withEnergeticReasoning(false),
                d.withCoreTimes(false));
    }

    static Stream<Object[]> instances() {
        return settings().flatMap(s -> IntStream.range(0, 150).mapToObj(seed -> new Object[]{s, seed}));
    }

    /**
     * Propagation never removes a solution, each tightening is implied by its explanation
     * and each conflict has no solution.
     */
    @ParameterizedTest
    @MethodSource("instances")
    public void testRandomSoundness(CumulativeSettings settings, int seed) {
        Random rand = new Random(seed);
        IntDomainStore store = new IntDomainStore();
        int n = 2 + rand.nextInt(3);
        CumulativeConstraint cons = BruteForce.randomInstance(rand, store, n, HORIZON, 1 + rand.nextInt(3));
        int[][] hull = BruteForce.hull(cons, store);
        CumulativePropagator propagator = new CumulativePropagator(store, settings);

        PropagationResult res = propagator.propagate(cons);
        if (res.isCutoff()) {
            assertNull(hull, "cutoff on a feasible instance " + cons.toJson());
            assertNull(BruteForce.hullUnder(cons, store, store.lastConflict(), HORIZON));
        } else if (hull != null) {
            for (int j = 0; j < cons.nJobs(); j++) {
                int x = cons.job(j).startVar();
                assertTrue(store.getLowerBound(x) <= hull[0][j]);
                assertTrue(store.getUpperBound(x) >= hull[1][j]);
            }
        }
        for (int i = 0; i < store.changes().size(); i++) {
            BoundChange change = store.changes().get(i);
            BoundQuery before = store.boundsBefore(i);
            ConflictSet reason = propagator.resolvePropagation(cons, change, before);
            int[][] implied = BruteForce.hullUnder(cons, before, reason, HORIZON);
            if (implied == null) {
                continue;
            }
            int j = cons.jobOf(change.var());
            if (change.type() == BoundType.LOWER) {
                assertTrue(implied[0][j] >= change.newBound(), change + " not implied by " + reason);
            } else {
                assertTrue(implied[1][j] <= change.newBound(), change + " not implied by " + reason);
            }
        }
    }

    /**
     * Once a round tightens nothing, another round on the same bounds tightens nothing either.
     */
    @ParameterizedTest
    @MethodSource("instances")
    public void testIdempotence(CumulativeSettings settings, int seed) {
        Random rand = new Random(seed);
        IntDomainStore store = new IntDomainStore();
        int n = 2 + rand.nextInt(4);
        CumulativeConstraint cons = BruteForce.randomInstance(rand, store, n, HORIZON, 1 + rand.nextInt(3));
        CumulativePropagator propagator = new CumulativePropagator(store, settings);

        PropagationResult res = propagator.propagate(cons);
        for (int round = 0; res.outcome() == PropagationResult.Outcome.TIGHTENED; round++) {
            assertTrue(round < 2 * n * HORIZON, "no fixpoint on " + cons.toJson());
            res = propagator.propagate(cons);
        }
        if (res.isCutoff()) {
            return;
        }
        int nChanges = store.changes().size();
        PropagationResult again = propagator.propagate(cons);
        assertEquals(nChanges, store.changes().size());
        assertTrue(again.outcome() == PropagationResult.Outcome.NOTHING
                || again.outcome() == PropagationResult.Outcome.CONSTRAINT_REDUNDANT, again.toString());
        assertEquals(res.outcome(), again.outcome());
    }
}
