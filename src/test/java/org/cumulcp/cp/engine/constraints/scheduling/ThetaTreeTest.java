/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ThetaTreeTest {

    @Test
    public void simpleTest0() {
        // capacity 2, jobs (est, energy): 0:(0,2) 1:(3,6) 2:(4,4)
        ThetaTree tree = new ThetaTree(2, 3);
        assertEquals(0, tree.envelope());
        assertTrue(tree.isEmpty());
        tree.insert(tree.createLeaf(0, 0, 2));
        assertEquals(2, tree.envelope());
        tree.insert(tree.createLeaf(2, 4, 4));
        assertEquals(12, tree.envelope());
        tree.insert(tree.createLeaf(1, 3, 6));
        // 2*3 + 6 + 4
        assertEquals(16, tree.envelope());
        assertEquals(12, tree.energy());
        assertEquals(3, tree.size());
        assertArrayEquals(new int[]{1, 2}, tree.reportEnvelopeJobs());
        tree.checkInvariants();
    }

    @Test
    public void disjunctiveEct() {
        // capacity 1: the envelope is the earliest completion time, example from Vilim's thesis p38
        ThetaTree tree = new ThetaTree(1, 4);
        tree.insert(tree.createLeaf(0, 0, 5));
        assertEquals(5, tree.envelope());
        tree.insert(tree.createLeaf(1, 25, 6));
        assertEquals(31, tree.envelope());
        tree.insert(tree.createLeaf(2, 30, 4));
        assertEquals(35, tree.envelope());
        tree.insert(tree.createLeaf(3, 32, 10));
        assertEquals(45, tree.envelope());
        assertArrayEquals(new int[]{1, 2, 3}, tree.reportEnvelopeJobs());
    }

    @Test
    public void equalEstOrderedByJob() {
        ThetaTree tree = new ThetaTree(3, 3);
        tree.insert(tree.createLeaf(2, 5, 3));
        tree.insert(tree.createLeaf(0, 5, 3));
        tree.insert(tree.createLeaf(1, 5, 3));
        assertEquals(24, tree.envelope());
        assertArrayEquals(new int[]{0, 1, 2}, tree.reportEnvelopeJobs());
        tree.checkInvariants();
    }

    @Test
    public void doubleInsertRejected() {
        ThetaTree tree = new ThetaTree(1, 1);
        int leaf = tree.createLeaf(0, 0, 1);
        tree.insert(leaf);
        assertThrows(IllegalStateException.class, () -> tree.insert(leaf));
    }

    @Test
    public void arenaGrows() {
        ThetaTree tree = new ThetaTree(1, 1);
        int ect = 0;
        for (int i = 0; i < 50; i++) {
            tree.insert(tree.createLeaf(i, 2 * i, 1));
            ect = Math.max(ect + 1, 2 * i + 1);
        }
        assertEquals(ect, tree.envelope());
        tree.checkInvariants();
    }
}
