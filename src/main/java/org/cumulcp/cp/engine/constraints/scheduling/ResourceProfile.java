/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import java.util.Arrays;

/**
 * Free capacity of a resource as a step function of time.
 * The function is stored as a sorted sequence of timepoints; the free capacity
 * at timepoint i holds on [timepoint(i), timepoint(i+1)).
 * The first timepoint is 0 and the last one is a sentinel at {@link Integer#MAX_VALUE}
 * with no free capacity, so every job must end before it.
 * Timepoints are never merged back when a core is removed.
 */
public class ResourceProfile {

    /**
     * Result of inserting the core of a job
     */
    public enum CoreStatus {
        /** the job has no core, the profile is unchanged */
        NONE,
        /** the core was inserted and the capacity is respected */
        INSERTED,
        /** the core was inserted and the capacity is exceeded somewhere */
        OVERLOAD
    }

    private final int capacity;
    private int[] timepoints;
    private int[] freeCapacity;
    private int size;

    public ResourceProfile(int capacity) {
        this(capacity, 16);
    }

    /**
     * @param capacity the capacity of the resource
     * @param initialSize a hint on the number of timepoints, arrays grow when needed
     */
    public ResourceProfile(int capacity, int initialSize) {
        this.capacity = capacity;
        int n = Math.max(2, initialSize);
        timepoints = new int[n];
        freeCapacity = new int[n];
        timepoints[0] = 0;
        freeCapacity[0] = capacity;
        timepoints[1] = Integer.MAX_VALUE;
        freeCapacity[1] = 0;
        size = 2;
    }

    public int nTimepoints() {
        return size;
    }

    public int timepoint(int i) {
        return timepoints[i];
    }

    public int freeCapacity(int i) {
        return freeCapacity[i];
    }

    /**
     * @return the index of the interval containing t, i.e. of the largest timepoint &lt;= t
     */
    public int intervalOf(int t) {
        checkTime(t);
        int pos = Arrays.binarySearch(timepoints, 0, size, t);
        return pos >= 0 ? pos : -pos - 2;
    }

    public int freeCapacityAt(int t) {
        return freeCapacity[intervalOf(t)];
    }

    /**
     * Splits the interval containing t so that t becomes a timepoint.
     *
     * @return the index of t
     */
    public int insertTimepoint(int t) {
        checkTime(t);
        int pos = Arrays.binarySearch(timepoints, 0, size, t);
        if (pos >= 0) {
            return pos;
        }
        pos = -pos - 1;
        if (size == timepoints.length) {
            timepoints = Arrays.copyOf(timepoints, size * 2);
            freeCapacity = Arrays.copyOf(freeCapacity, size * 2);
        }
        System.arraycopy(timepoints, pos, timepoints, pos + 1, size - pos);
        System.arraycopy(freeCapacity, pos, freeCapacity, pos + 1, size - pos);
        timepoints[pos] = t;
        freeCapacity[pos] = freeCapacity[pos - 1];
        size++;
        return pos;
    }

    /**
     * Consumes demand on [start,end). A negative demand releases capacity.
     * The whole interval is always updated.
     *
     * @return true if the free capacity became negative somewhere in [start,end)
     */
    public boolean update(int start, int end, int demand) {
        if (start >= end) {
            return false;
        }
        int startPos = insertTimepoint(start);
        int endPos = insertTimepoint(end);
        boolean infeasible = false;
        for (int i = startPos; i < endPos; i++) {
            freeCapacity[i] -= demand;
            if (freeCapacity[i] < 0) {
                infeasible = true;
            }
        }
        return infeasible;
    }

    /**
     * Inserts the compulsory part [ub, lb+duration) of a job.
     */
    public CoreStatus insertCore(int lb, int ub, int duration, int demand) {
        if (!hasCore(lb, ub, duration) || demand == 0) {
            return CoreStatus.NONE;
        }
        return update(ub, lb + duration, demand) ? CoreStatus.OVERLOAD : CoreStatus.INSERTED;
    }

    /**
     * Removes a core previously inserted with the same arguments.
     *
     * @return false if the job has no core
     */
    public boolean deleteCore(int lb, int ub, int duration, int demand) {
        if (!hasCore(lb, ub, duration) || demand == 0) {
            return false;
        }
        update(ub, lb + duration, -demand);
        return true;
    }

    public static boolean hasCore(int lb, int ub, int duration) {
        return ub < lb + duration;
    }

    /**
     * @return the index of the first interval overlapping [t, t+duration)
     *         with less than demand free capacity, -1 if the job fits
     */
    public int firstBlockingInterval(int t, int duration, int demand) {
        if (duration == 0 || demand == 0) {
            return -1;
        }
        int startPos = intervalOf(t);
        int lastPos = intervalOf(t + duration - 1);
        for (int i = startPos; i <= lastPos; i++) {
            if (freeCapacity[i] < demand) {
                return i;
            }
        }
        return -1;
    }

    public boolean isFeasibleStart(int t, int duration, int demand) {
        return firstBlockingInterval(t, duration, demand) < 0;
    }

    /**
     * @return the smallest feasible start in [lb,ub], a value &gt; ub if there is none
     */
    public int earliestFeasibleStart(int lb, int ub, int duration, int demand) {
        int t = lb;
        while (t <= ub) {
            int pos = firstBlockingInterval(t, duration, demand);
            if (pos < 0) {
                return t;
            }
            if (pos + 1 >= size) {
                return Integer.MAX_VALUE;
            }
            // restart right after the blocking interval
            t = timepoints[pos + 1];
        }
        return t;
    }

    /**
     * @return the largest feasible start in [lb,ub], a value &lt; lb if there is none
     */
    public int latestFeasibleStart(int lb, int ub, int duration, int demand) {
        int t = ub;
        while (t >= lb) {
            int pos = firstBlockingInterval(t, duration, demand);
            if (pos < 0) {
                return t;
            }
            // end right where the blocking interval starts
            t = timepoints[pos] - duration;
        }
        return t;
    }

    private static void checkTime(int t) {
        if (t < 0) {
            throw new IllegalArgumentException("negative time " + t);
        }
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("profile(").append(capacity).append("):");
        for (int i = 0; i < size; i++) {
            b.append(' ').append(timepoints[i]).append(':').append(freeCapacity[i]);
        }
        return b.toString();
    }
}
