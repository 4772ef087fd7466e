/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.util;

import java.util.Comparator;

public class Arrays {

    private Arrays() {
    }

    /**
     * @param w the weights
     * @return the sorting permutation perm of w, i.e. w[perm[0]],w[perm[1]],...,w[perm[w.length-1]]
     *         is sorted increasingly, ties broken by increasing index
     */
    public static int [] sortPerm(final int [] w) {
        return sortPerm(w, Comparator.comparingInt((Integer i) -> w[i]));
    }

    /**
     * @param w the weights
     * @return the permutation sorting w decreasingly, ties broken by increasing index
     */
    public static int [] sortPermDecreasing(final int [] w) {
        return sortPerm(w, (Integer o1, Integer o2) -> Integer.compare(w[o2], w[o1]));
    }

    private static int [] sortPerm(int [] w, Comparator<Integer> cmp) {
        Integer [] perm = new Integer[w.length];
        for (int i = 0; i < perm.length; i++) {
            perm[i] = i;
        }
        // stable sort, equal weights keep their index order
        java.util.Arrays.sort(perm, cmp);
        int [] res = new int[w.length];
        for (int i = 0; i < perm.length; i++) {
            res[i] = perm[i];
        }
        return res;
    }

    /**
     * @param values any values
     * @return the distinct values sorted increasingly
     */
    public static int [] sortedDistinct(int [] values) {
        int [] res = java.util.Arrays.copyOf(values, values.length);
        java.util.Arrays.sort(res);
        int size = 0;
        for (int i = 0; i < res.length; i++) {
            if (size == 0 || res[size - 1] != res[i]) {
                res[size++] = res[i];
            }
        }
        return java.util.Arrays.copyOf(res, size);
    }

    /**
     * @param a the numerator
     * @param b a strictly positive denominator
     * @return the smallest integer greater or equal to a/b
     */
    public static int ceilDiv(int a, int b) {
        assert (b > 0);
        return -Math.floorDiv(-a, b);
    }
}
