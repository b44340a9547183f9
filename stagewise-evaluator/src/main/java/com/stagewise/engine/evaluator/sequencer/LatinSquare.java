package com.stagewise.engine.evaluator.sequencer;

import java.util.List;

/**
 * Cyclic Latin square: row {@code i} is {@code [(i + j) mod n for j in 0..n)]}.
 * Every child appears in every position exactly once across the rows.
 */
final class LatinSquare {

    private LatinSquare() {
    }

    static int[] row(int size, int rowIndex) {
        int[] row = new int[size];
        for (int j = 0; j < size; j++) {
            row[j] = (rowIndex + j) % size;
        }
        return row;
    }

    /**
     * Row that produced {@code orderedIds} from {@code childIds}, or -1 if the
     * order is not a row of the square.
     */
    static int rowOf(List<String> childIds, List<String> orderedIds) {
        if (orderedIds.size() != childIds.size() || childIds.isEmpty()) {
            return -1;
        }
        int rowIndex = childIds.indexOf(orderedIds.get(0));
        if (rowIndex < 0) {
            return -1;
        }
        int[] row = row(childIds.size(), rowIndex);
        for (int j = 0; j < row.length; j++) {
            if (!childIds.get(row[j]).equals(orderedIds.get(j))) {
                return -1;
            }
        }
        return rowIndex;
    }
}
