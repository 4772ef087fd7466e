/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.cumulcp.cp.engine.core.BoundChange;
import org.cumulcp.cp.engine.core.ConflictSet;
import org.cumulcp.cp.engine.core.IntDomainStore;
import org.cumulcp.util.exception.InconsistencyException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EnergeticReasoningTest {

    @Test
    public void requiredEnergy() {
        IntDomainStore store = new IntDomainStore();
        int x0 = store.makeVar(0, 1);
        int x1 = store.makeVar(0, 4);
        CumulativeConstraint cons = new CumulativeConstraint(1, List.of(new Job(x0, 2, 1), new Job(x1, 2, 3)));
        EnergeticReasoning er = new EnergeticReasoning(cons, store, new ConflictExplainer(cons, true));
        assertEquals(2, er.requiredEnergy(0, 0, 3));
        assertEquals(1, er.requiredEnergy(0, 0, 2));
        assertEquals(1, er.requiredEnergy(0, 1, 2));
        assertEquals(0, er.requiredEnergy(1, 0, 3));
        assertEquals(6, er.requiredEnergy(1, 0, 6));
    }

    @Test
    public void testPushEarliestStart() {
        // job 0 always covers [1,2) and spends two units in [0,3)
        IntDomainStore store = new IntDomainStore();
        int x0 = store.makeVar(0, 1);
        int x1 = store.makeVar(0, 4);
        CumulativeConstraint cons = new CumulativeConstraint(1, List.of(new Job(x0, 2, 1), new Job(x1, 2, 1)));
        EnergeticReasoning er = new EnergeticReasoning(cons, store, new ConflictExplainer(cons, true));

        assertEquals(1, er.propagate());
        assertEquals(2, store.getLowerBound(x1));
        assertEquals(4, store.getUpperBound(x1));
        assertEquals(0, store.getLowerBound(x0));
        assertEquals(1, store.getUpperBound(x0));

        BoundChange change = store.changes().get(0);
        InferInfo info = InferInfo.fromInt(change.inferInfo());
        assertEquals(PropagationRule.ENERGETIC_REASONING, info.rule());
        assertEquals(0, info.est());
        assertEquals(3, info.lct());

        ConflictSet reason = new ConflictExplainer(cons, true).resolve(change, store.boundsBefore(0));
        assertEquals(new ConflictSet().addLowerBound(x1).addBounds(x0), reason);
    }

    @Test
    public void testWindowConflict() {
        IntDomainStore store = new IntDomainStore();
        int x0 = store.makeVar(0, 0);
        int x1 = store.makeVar(0, 1);
        int x2 = store.makeVar(5, 9); // outside the overloaded window
        CumulativeConstraint cons = new CumulativeConstraint(1,
                List.of(new Job(x0, 2, 1), new Job(x1, 2, 1), new Job(x2, 1, 1)));
        EnergeticReasoning er = new EnergeticReasoning(cons, store, new ConflictExplainer(cons, true));

        assertThrows(InconsistencyException.class, er::propagate);
        ConflictSet conflict = store.lastConflict();
        assertTrue(conflict.containsVar(x0));
        assertTrue(conflict.containsVar(x1));
        assertFalse(conflict.containsVar(x2));
        assertNull(BruteForce.hullUnder(cons, store, conflict, 10));
    }

    @Test
    public void testNothingToDoOnLooseInstance() {
        IntDomainStore store = new IntDomainStore();
        int x0 = store.makeVar(0, 10);
        int x1 = store.makeVar(0, 10);
        CumulativeConstraint cons = new CumulativeConstraint(2, List.of(new Job(x0, 3, 1), new Job(x1, 3, 2)));
        EnergeticReasoning er = new EnergeticReasoning(cons, store, new ConflictExplainer(cons, true));
        assertEquals(0, er.propagate());
        assertTrue(store.changes().isEmpty());
    }
}
