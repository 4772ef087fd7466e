/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

/**
 * Theta-tree for a cumulative resource: jobs are only inserted and the tree maintains
 * Env(Theta) = max over subsets Omega of Theta of capacity*est(Omega) + e(Omega),
 * so that e(Omega) &gt; capacity*(lct(Omega)-est(Omega)) for some Omega
 * iff the envelope exceeds capacity*lct when the jobs are inserted by increasing lct.
 *
 * Data Structure described in
 * Global Constraints in Scheduling, 2008 Petr Vilim, PhD thesis
 * See <a href="http://vilim.eu/petr/disertace.pdf">The thesis.</a>
 */
public class ThetaTree extends EnvelopeTree {

    /**
     * Creates a theta-tree for a resource of the given capacity.
     *
     * @param capacity the capacity of the resource
     * @param size the number of jobs that will likely be inserted
     */
    public ThetaTree(int capacity, int size) {
        super(capacity, size);
    }

    /**
     * @return the jobs of the set Omega realizing the envelope, sorted by est
     */
    public int[] reportEnvelopeJobs() {
        LeafList out = new LeafList();
        if (!isEmpty()) {
            collectEnvelope(root(), out);
        }
        return out.sortedJobs();
    }
}
