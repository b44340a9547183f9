package com.stagewise.engine.evaluator.sequencer;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Lexicographic enumeration of k-subsets of {@code 0..n-1}.
 */
final class Combinations {

    private Combinations() {
    }

    /**
     * Binomial coefficient C(n, k).
     *
     * @throws ArithmeticException if the count overflows a long
     */
    static long count(int n, int k) {
        if (k < 0 || k > n) {
            return 0;
        }
        int r = Math.min(k, n - k);
        long result = 1;
        for (int i = 1; i <= r; i++) {
            result = Math.multiplyExact(result, n - r + i) / i;
        }
        return result;
    }

    /**
     * The {@code rank}-th k-subset in lexicographic order; {@code rank} is
     * taken modulo C(n, k).
     */
    static IntList unrank(int n, int k, long rank) {
        long total = count(n, k);
        long remaining = Math.floorMod(rank, total);
        IntList combination = new IntArrayList(k);
        int next = 0;
        for (int slot = 0; slot < k; slot++) {
            for (int candidate = next; candidate < n; candidate++) {
                long withCandidate = count(n - candidate - 1, k - slot - 1);
                if (remaining < withCandidate) {
                    combination.add(candidate);
                    next = candidate + 1;
                    break;
                }
                remaining -= withCandidate;
            }
        }
        return combination;
    }
}
