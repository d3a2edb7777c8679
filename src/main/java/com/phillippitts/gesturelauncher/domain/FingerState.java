package com.phillippitts.gesturelauncher.domain;

import java.util.List;

/**
 * Extended-finger vector (thumb, index, middle, ring, pinky) and its sum.
 *
 * @param count  number of extended fingers, 0..5
 * @param vector five 0/1 flags in finger order
 */
public record FingerState(int count, List<Integer> vector) {

    public static final int FINGERS = 5;

    public FingerState {
        if (vector == null || vector.size() != FINGERS) {
            throw new IllegalArgumentException("vector must have exactly " + FINGERS + " entries");
        }
        vector = List.copyOf(vector);
        int sum = 0;
        for (Integer bit : vector) {
            if (bit != 0 && bit != 1) {
                throw new IllegalArgumentException("vector entries must be 0 or 1, got: " + bit);
            }
            sum += bit;
        }
        if (count != sum) {
            throw new IllegalArgumentException("count " + count + " does not match vector " + vector);
        }
    }

    public static FingerState of(List<Integer> vector) {
        return new FingerState(vector.stream().mapToInt(Integer::intValue).sum(), vector);
    }

    public boolean thumbExtended() {
        return vector.get(0) == 1;
    }
}
