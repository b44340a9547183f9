package com.stagewise.engine.evaluator.sequencer;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Random;

/**
 * Integer-weight roulette selection: a uniform roll in {@code 1..sum} walked
 * along the cumulative weights.
 */
final class WeightedDraw {

    private WeightedDraw() {
    }

    /**
     * Index of the drawn entry. Weights below 1 count as 1.
     */
    static int select(IntList weights, Random random) {
        long total = 0;
        for (int i = 0; i < weights.size(); i++) {
            total += Math.max(1, weights.getInt(i));
        }
        long roll = (long) (random.nextDouble() * total) + 1;
        long cumulative = 0;
        for (int i = 0; i < weights.size(); i++) {
            cumulative += Math.max(1, weights.getInt(i));
            if (roll <= cumulative) {
                return i;
            }
        }
        return weights.size() - 1;
    }

    /**
     * Draws {@code count} distinct indices without replacement, in draw order.
     */
    static IntList drawWithoutReplacement(IntList weights, int count, Random random) {
        IntList remainingIndices = new IntArrayList(weights.size());
        IntList remainingWeights = new IntArrayList(weights);
        for (int i = 0; i < weights.size(); i++) {
            remainingIndices.add(i);
        }
        IntList drawn = new IntArrayList(count);
        while (drawn.size() < count && !remainingIndices.isEmpty()) {
            int pos = select(remainingWeights, random);
            drawn.add(remainingIndices.removeInt(pos));
            remainingWeights.removeInt(pos);
        }
        return drawn;
    }
}
