/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import java.util.Arrays;

/**
 * Binary tree of jobs sorted by earliest start, grown by splitting leaves,
 * maintaining the energy and the energy envelope of every subtree.
 * Nodes live in an array and refer to each other by index, internal nodes freed by
 * deletions are recycled. Position 0 holds a super-root whose left child is the root,
 * so that the root can be replaced like any other child.
 * Each node stores the smallest key of its subtree, an insertion goes left
 * iff its key is smaller than the key of the right subtree.
 *
 * Data Structure described in
 * Global Constraints in Scheduling, 2008 Petr Vilim, PhD thesis
 * See <a href="http://vilim.eu/petr/disertace.pdf">The thesis.</a>
 */
public abstract class EnvelopeTree {

    public static final int NIL = -1;
    public static final int NEG_INF = Integer.MIN_VALUE;

    protected static final int SUPER_ROOT = 0;

    protected static class Node {

        int parent;
        int left;
        int right;
        long key;
        int job;
        int est;
        int energy;
        int envelope;
        int energyL;
        int envelopeL;
        boolean inTheta;

        Node() {
            reset();
        }

        void reset() {
            parent = NIL;
            left = NIL;
            right = NIL;
            key = Long.MAX_VALUE;
            job = NIL;
            est = 0;
            energy = 0;
            envelope = NEG_INF;
            energyL = NEG_INF;
            envelopeL = NEG_INF;
            inTheta = false;
        }

        boolean isLeaf() {
            return left == NIL;
        }
    }

    protected final int capacity;
    protected Node[] nodes;
    private int nNodes;
    private int[] free;
    private int nFree;
    private int nLeaves;
    // traversal stack of collectTheta, grown with the arena
    private int[] scratch = new int[0];

    /**
     * @param capacity the capacity of the resource, the envelope of a job is capacity*est+energy
     * @param expectedLeaves a hint on the number of leaves, the arena grows when needed
     */
    protected EnvelopeTree(int capacity, int expectedLeaves) {
        this.capacity = capacity;
        int n = 2 * Math.max(1, expectedLeaves) + 1;
        nodes = new Node[n];
        free = new int[n];
        allocate(); // super-root
    }

    private int allocate() {
        int idx;
        if (nFree > 0) {
            idx = free[--nFree];
        } else {
            if (nNodes == nodes.length) {
                nodes = Arrays.copyOf(nodes, nNodes * 2);
                free = Arrays.copyOf(free, nNodes * 2);
            }
            idx = nNodes++;
            nodes[idx] = new Node();
        }
        nodes[idx].reset();
        return idx;
    }

    private void release(int idx) {
        nodes[idx].reset();
        free[nFree++] = idx;
    }

    static long key(int est, int job) {
        return ((long) est << 32) + job;
    }

    /**
     * Saturating addition, -infinity absorbs everything
     */
    static int plus(int a, int b) {
        return (a == NEG_INF || b == NEG_INF) ? NEG_INF : a + b;
    }

    /**
     * Creates a detached Theta leaf.
     *
     * @param job a non negative job identifier, also used to break ties on est
     * @param est the earliest start of the job
     * @param energy duration times demand
     * @return the leaf identifier
     */
    public int createLeaf(int job, int est, int energy) {
        if (job < 0) {
            throw new IllegalArgumentException("negative job identifier " + job);
        }
        int idx = allocate();
        Node n = nodes[idx];
        n.key = key(est, job);
        n.job = job;
        n.est = est;
        n.energy = energy;
        n.envelope = capacity * est + energy;
        n.inTheta = true;
        return idx;
    }

    protected int root() {
        return nodes[SUPER_ROOT].left;
    }

    public boolean isEmpty() {
        return root() == NIL;
    }

    /**
     * @return the number of leaves currently in the tree
     */
    public int size() {
        return nLeaves;
    }

    public boolean isInserted(int leaf) {
        return nodes[leaf].parent != NIL;
    }

    public int job(int leaf) {
        return nodes[leaf].job;
    }

    public int est(int leaf) {
        return nodes[leaf].est;
    }

    public boolean inTheta(int leaf) {
        return nodes[leaf].inTheta;
    }

    /**
     * @return the envelope of the Theta leaves, 0 for an empty tree
     */
    public int envelope() {
        return isEmpty() ? 0 : nodes[root()].envelope;
    }

    /**
     * @return the energy of the Theta leaves
     */
    public int energy() {
        return isEmpty() ? 0 : nodes[root()].energy;
    }

    /**
     * Inserts a detached leaf at its position, splitting the leaf it lands on.
     */
    public void insert(int leaf) {
        Node l = nodes[leaf];
        if (!l.isLeaf() || l.job == NIL) {
            throw new IllegalArgumentException("node " + leaf + " is not a leaf");
        }
        if (isInserted(leaf)) {
            throw new IllegalStateException("leaf " + leaf + " is already in the tree");
        }
        nLeaves++;
        if (isEmpty()) {
            setChild(SUPER_ROOT, true, leaf);
            return;
        }
        int cur = root();
        while (!nodes[cur].isLeaf()) {
            Node c = nodes[cur];
            cur = l.key < nodes[c.right].key ? c.left : c.right;
        }
        assert (nodes[cur].key != l.key);
        int parent = nodes[cur].parent;
        boolean asLeft = nodes[parent].left == cur;
        int inner = allocate();
        setChild(parent, asLeft, inner);
        if (l.key < nodes[cur].key) {
            setChild(inner, true, leaf);
            setChild(inner, false, cur);
        } else {
            setChild(inner, true, cur);
            setChild(inner, false, leaf);
        }
        update(inner);
    }

    /**
     * Detaches a leaf, its sibling takes the place of their parent.
     */
    protected void removeLeaf(int leaf) {
        if (isEmpty()) {
            throw new IllegalStateException("deleting from an empty tree");
        }
        if (!isInserted(leaf) || !nodes[leaf].isLeaf()) {
            throw new IllegalStateException("node " + leaf + " is not a leaf of the tree");
        }
        int parent = nodes[leaf].parent;
        nodes[leaf].parent = NIL;
        nLeaves--;
        if (parent == SUPER_ROOT) {
            nodes[SUPER_ROOT].left = NIL;
            return;
        }
        Node p = nodes[parent];
        int sibling = p.left == leaf ? p.right : p.left;
        int grandParent = p.parent;
        setChild(grandParent, nodes[grandParent].left == parent, sibling);
        release(parent);
        update(grandParent);
    }

    private void setChild(int parent, boolean left, int child) {
        if (left) {
            nodes[parent].left = child;
        } else {
            nodes[parent].right = child;
        }
        nodes[child].parent = parent;
    }

    /**
     * Recomputes the aggregates from pos up to the root.
     */
    protected void update(int pos) {
        while (pos != SUPER_ROOT) {
            recompute(nodes[pos]);
            pos = nodes[pos].parent;
        }
    }

    /**
     * Recomputes the values of an internal node from its children.
     */
    protected void recompute(Node n) {
        Node l = nodes[n.left];
        Node r = nodes[n.right];
        n.key = Math.min(l.key, r.key);
        n.energy = l.energy + r.energy;
        n.envelope = Math.max(plus(l.envelope, r.energy), r.envelope);
    }

    /**
     * Adds the Theta leaves of the subtree rooted at node.
     */
    protected final void collectTheta(int node, LeafList out) {
        if (scratch.length < nNodes) {
            scratch = Arrays.copyOf(scratch, nodes.length);
        }
        int[] stack = scratch;
        int top = 0;
        stack[top++] = node;
        while (top > 0) {
            int idx = stack[--top];
            Node n = nodes[idx];
            if (n.isLeaf()) {
                if (n.inTheta) {
                    out.add(idx);
                }
            } else {
                stack[top++] = n.left;
                stack[top++] = n.right;
            }
        }
    }

    /**
     * Adds the Theta leaves responsible for the envelope of node:
     * the leaf setting the envelope and every Theta leaf on its right.
     */
    protected final void collectEnvelope(int node, LeafList out) {
        int cur = node;
        while (!nodes[cur].isLeaf()) {
            Node n = nodes[cur];
            if (n.envelope == plus(nodes[n.left].envelope, nodes[n.right].energy)) {
                collectTheta(n.right, out);
                cur = n.left;
            } else {
                cur = n.right;
            }
        }
        if (nodes[cur].inTheta) {
            out.add(cur);
        }
    }

    /**
     * Verifies the structure and the aggregates of the whole tree.
     *
     * @throws IllegalStateException at the first violated property
     */
    void checkInvariants() {
        if (nodes[SUPER_ROOT].right != NIL) {
            throw new IllegalStateException("super-root has a right child");
        }
        if (isEmpty()) {
            if (nLeaves != 0) {
                throw new IllegalStateException("empty tree with " + nLeaves + " leaves");
            }
            return;
        }
        int[] stack = new int[nNodes];
        int top = 0;
        int leaves = 0;
        long lastKey = Long.MIN_VALUE;
        int cur = root();
        // in-order traversal
        while (cur != NIL || top > 0) {
            while (cur != NIL) {
                stack[top++] = cur;
                Node n = nodes[cur];
                if (n.isLeaf() != (n.right == NIL)) {
                    throw new IllegalStateException("node " + cur + " has a single child");
                }
                if (!n.isLeaf()) {
                    if (nodes[n.left].parent != cur || nodes[n.right].parent != cur) {
                        throw new IllegalStateException("broken parent link below " + cur);
                    }
                    Node expected = new Node();
                    expected.left = n.left;
                    expected.right = n.right;
                    recompute(expected);
                    if (expected.key != n.key || expected.energy != n.energy || expected.envelope != n.envelope
                            || expected.energyL != n.energyL || expected.envelopeL != n.envelopeL) {
                        throw new IllegalStateException("stale aggregates at node " + cur);
                    }
                }
                cur = n.left;
            }
            cur = stack[--top];
            Node n = nodes[cur];
            if (n.isLeaf()) {
                if (n.key <= lastKey) {
                    throw new IllegalStateException("leaves out of order at " + cur);
                }
                lastKey = n.key;
                leaves++;
            }
            cur = n.right;
        }
        if (leaves != nLeaves) {
            throw new IllegalStateException(leaves + " leaves found, " + nLeaves + " expected");
        }
    }

    /**
     * Growable list of leaves that can be turned into job identifiers sorted by key.
     */
    protected final class LeafList {

        private int[] leaves = new int[8];
        private int size = 0;

        void add(int leaf) {
            if (size == leaves.length) {
                leaves = Arrays.copyOf(leaves, size * 2);
            }
            leaves[size++] = leaf;
        }

        int[] sortedJobs() {
            long[] keys = new long[size];
            for (int i = 0; i < size; i++) {
                keys[i] = nodes[leaves[i]].key;
            }
            Arrays.sort(keys);
            int[] jobs = new int[size];
            for (int i = 0; i < size; i++) {
                // the low 32 bits of a key hold the job
                jobs[i] = (int) (keys[i] & 0xFFFFFFFFL);
            }
            return jobs;
        }
    }
}
