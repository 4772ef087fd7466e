/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.cumulcp.cp.engine.core.LinkedBinaryEncoding;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The cumulative constraint: at any time t the sum of the demands of the jobs
 * running at t (start &lt;= t &lt; start + duration) must not exceed the capacity.
 * Jobs with a zero duration or a zero demand are dropped on construction,
 * the remaining ones are indexed 0..n-1 in the given order.
 */
public class CumulativeConstraint {

    private final int capacity;
    private final Job[] jobs;
    private final int nRemovedJobs;
    private final LinkedBinaryEncoding encoding;

    public CumulativeConstraint(int capacity, List<Job> jobs) {
        this(capacity, jobs, null);
    }

    /**
     * @param encoding the 0/1 encoding of the start variables, may be null
     */
    public CumulativeConstraint(int capacity, List<Job> jobs, LinkedBinaryEncoding encoding) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        List<Job> relevant = new ArrayList<>();
        for (Job j : jobs) {
            if (!j.isIrrelevant()) {
                relevant.add(j);
            }
        }
        this.capacity = capacity;
        this.jobs = relevant.toArray(new Job[0]);
        this.nRemovedJobs = jobs.size() - relevant.size();
        this.encoding = encoding;
    }

    public int capacity() {
        return capacity;
    }

    public int nJobs() {
        return jobs.length;
    }

    public Job job(int i) {
        return jobs[i];
    }

    public List<Job> jobs() {
        return Collections.unmodifiableList(java.util.Arrays.asList(jobs));
    }

    /**
     * @return how many of the given jobs had a zero duration or demand
     */
    public int nRemovedJobs() {
        return nRemovedJobs;
    }

    public Optional<LinkedBinaryEncoding> encoding() {
        return Optional.ofNullable(encoding);
    }

    /**
     * @return the index of the job whose start is var, -1 if none
     */
    public int jobOf(int var) {
        for (int i = 0; i < jobs.length; i++) {
            if (jobs[i].startVar() == var) {
                return i;
            }
        }
        return -1;
    }

    public JSONObject toJson() {
        JSONArray a = new JSONArray();
        for (Job j : jobs) {
            a.put(j.toJson());
        }
        return new JSONObject().put("capacity", capacity).put("jobs", a);
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("cumulative(");
        for (int i = 0; i < jobs.length; i++) {
            if (i > 0) {
                b.append(", ");
            }
            b.append(jobs[i]);
        }
        return b.append(")[").append(capacity).append(']').toString();
    }
}
