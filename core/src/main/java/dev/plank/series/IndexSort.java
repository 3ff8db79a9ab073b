/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.series;

/**
 * Stable sorting of positions by the values they refer to, without boxing.
 */
final class IndexSort {

    /**
     * Compares the elements at two positions of a column.
     */
    @FunctionalInterface
    interface PositionComparator {
        int compare(int left, int right);
    }

    private IndexSort() {
    }

    /**
     * Returns the permutation of {@code [0, length)} that stable-sorts the referenced values
     * in ascending order, reversed as a whole if {@code descending} is set.
     * <p>
     * Reversing the ascending order means equal values end up in reverse insertion order,
     * which is not the same as a stable descending sort.
     * </p>
     */
    static int[] argsort(int length, PositionComparator comparator, boolean descending) {
        int[] order = new int[length];
        for (int i = 0; i < length; i++) {
            order[i] = i;
        }
        if (length > 1) {
            mergeSort(order, new int[length], 0, length, comparator);
        }
        if (descending) {
            reverse(order);
        }
        return order;
    }

    /**
     * Validates that the given array is a permutation of {@code [0, length)}.
     */
    static void checkPermutation(int[] permutation, int length) {
        if (permutation.length != length) {
            throw new IllegalArgumentException("Permutation of length " + permutation.length
                    + " does not match column length " + length);
        }
        boolean[] seen = new boolean[length];
        for (int position : permutation) {
            if (position < 0 || position >= length || seen[position]) {
                throw new IllegalArgumentException("Not a permutation of [0, " + length + "): " + position);
            }
            seen[position] = true;
        }
    }

    private static void mergeSort(int[] order, int[] scratch, int from, int to, PositionComparator comparator) {
        if (to - from < 2) {
            return;
        }
        int mid = (from + to) >>> 1;
        mergeSort(order, scratch, from, mid, comparator);
        mergeSort(order, scratch, mid, to, comparator);

        // Already in order
        if (comparator.compare(order[mid - 1], order[mid]) <= 0) {
            return;
        }

        System.arraycopy(order, from, scratch, from, to - from);
        int left = from;
        int right = mid;
        int out = from;
        while (left < mid && right < to) {
            // <= keeps the left run first on ties
            if (comparator.compare(scratch[left], scratch[right]) <= 0) {
                order[out++] = scratch[left++];
            }
            else {
                order[out++] = scratch[right++];
            }
        }
        while (left < mid) {
            order[out++] = scratch[left++];
        }
        while (right < to) {
            order[out++] = scratch[right++];
        }
    }

    private static void reverse(int[] order) {
        for (int i = 0, j = order.length - 1; i < j; i++, j--) {
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }
}
