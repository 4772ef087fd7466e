/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

/**
 * Theta-Lambda tree for a cumulative resource.
 * Besides the Theta aggregates, every node maintains the largest energy and envelope
 * obtainable by adding at most one Lambda (gray) leaf of its subtree:
 * <pre>
 * energyL   = max(left.energyL + right.energy, left.energy + right.energyL)
 * envelopeL = max(left.envelopeL + right.energy, left.envelope + right.energyL, right.envelopeL)
 * </pre>
 * A subtree without Lambda leaf has both values at -infinity.
 *
 * Data Structure described in
 * Global Constraints in Scheduling, 2008 Petr Vilim, PhD thesis
 * See <a href="http://vilim.eu/petr/disertace.pdf">The thesis.</a>
 */
public class ThetaLambdaTree extends EnvelopeTree {

    private static final int ENVELOPE = 0;
    private static final int ENERGY_L = 1;
    private static final int ENVELOPE_L = 2;

    public ThetaLambdaTree(int capacity, int size) {
        super(capacity, size);
    }

    @Override
    protected void recompute(Node n) {
        super.recompute(n);
        Node l = nodes[n.left];
        Node r = nodes[n.right];
        n.energyL = Math.max(plus(l.energyL, r.energy), plus(l.energy, r.energyL));
        n.envelopeL = Math.max(Math.max(plus(l.envelopeL, r.energy), plus(l.envelope, r.energyL)), r.envelopeL);
    }

    /**
     * Removes a leaf from the tree, whether it is in Theta or in Lambda.
     */
    public void deleteLeaf(int leaf) {
        removeLeaf(leaf);
    }

    /**
     * Moves an inserted Theta leaf to Lambda.
     */
    public void transformLeafToLambda(int leaf) {
        Node n = nodes[leaf];
        if (!isInserted(leaf) || !n.inTheta) {
            throw new IllegalStateException("leaf " + leaf + " is not a Theta leaf of the tree");
        }
        n.energyL = n.energy;
        n.envelopeL = n.envelope;
        n.energy = 0;
        n.envelope = NEG_INF;
        n.inTheta = false;
        update(n.parent);
    }

    /**
     * @return the envelope of Theta extended with at most one Lambda leaf, -infinity without Lambda leaf
     */
    public int envelopeWithLambda() {
        return isEmpty() ? NEG_INF : nodes[root()].envelopeL;
    }

    /**
     * @return the Lambda leaf used by {@link #envelopeWithLambda()}, {@link #NIL} if there is none
     */
    public int findResponsibleLeaf() {
        if (isEmpty() || nodes[root()].envelopeL == NEG_INF) {
            return NIL;
        }
        int cur = root();
        boolean energyMode = false;
        while (!nodes[cur].isLeaf()) {
            Node n = nodes[cur];
            Node l = nodes[n.left];
            Node r = nodes[n.right];
            if (energyMode) {
                cur = n.energyL == plus(l.energyL, r.energy) ? n.left : n.right;
            } else if (n.envelopeL == plus(l.envelopeL, r.energy)) {
                cur = n.left;
            } else if (n.envelopeL == plus(l.envelope, r.energyL)) {
                // the gray leaf is the one of right.energyL
                energyMode = true;
                cur = n.right;
            } else {
                cur = n.right;
            }
        }
        return nodes[cur].inTheta ? NIL : cur;
    }

    /**
     * Backtraces {@link #envelopeWithLambda()} to the Theta leaves it is made of,
     * the responsible Lambda leaf excluded.
     *
     * @return the jobs of Omega sorted by est
     */
    public int[] reportOmegaSet() {
        if (envelopeWithLambda() == NEG_INF) {
            throw new IllegalStateException("no Lambda leaf contributes to the envelope");
        }
        LeafList out = new LeafList();
        int[] stack = new int[2 * (2 * size() + 1)];
        int top = 0;
        stack[top++] = root();
        stack[top++] = ENVELOPE_L;
        while (top > 0) {
            int mode = stack[--top];
            int cur = stack[--top];
            Node n = nodes[cur];
            if (mode == ENVELOPE) {
                collectEnvelope(cur, out);
                continue;
            }
            if (n.isLeaf()) {
                // the Lambda leaf itself
                continue;
            }
            Node l = nodes[n.left];
            Node r = nodes[n.right];
            if (mode == ENERGY_L) {
                if (n.energyL == plus(l.energyL, r.energy)) {
                    collectTheta(n.right, out);
                    stack[top++] = n.left;
                } else {
                    collectTheta(n.left, out);
                    stack[top++] = n.right;
                }
                stack[top++] = ENERGY_L;
            } else if (n.envelopeL == plus(l.envelopeL, r.energy)) {
                collectTheta(n.right, out);
                stack[top++] = n.left;
                stack[top++] = ENVELOPE_L;
            } else if (n.envelopeL == plus(l.envelope, r.energyL)) {
                stack[top++] = n.left;
                stack[top++] = ENVELOPE;
                stack[top++] = n.right;
                stack[top++] = ENERGY_L;
            } else {
                stack[top++] = n.right;
                stack[top++] = ENVELOPE_L;
            }
        }
        return out.sortedJobs();
    }
}
