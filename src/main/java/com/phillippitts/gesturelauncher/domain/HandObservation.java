package com.phillippitts.gesturelauncher.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single hand seen during one tick.
 *
 * <p>The tracker either sends the raw landmark points, or a finger vector it already reduced
 * (thumb, index, middle, ring, pinky). Exactly one of the two lists is non-empty in practice;
 * when both are present the landmarks win.
 *
 * <p>Landmark lists may contain {@code null} entries for points the tracker could not place.
 *
 * @param landmarks    landmark points indexed as in {@link HandLandmarkIndex}, possibly empty
 * @param fingerVector pre-reduced 0/1 finger flags, possibly empty
 * @param handedness   handedness label, never null
 */
public record HandObservation(List<Landmark> landmarks, List<Integer> fingerVector, Handedness handedness) {

    public HandObservation {
        landmarks = landmarks == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(landmarks));
        fingerVector = fingerVector == null ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(fingerVector));
        handedness = handedness == null ? Handedness.UNKNOWN : handedness;
    }

    public static HandObservation ofLandmarks(List<Landmark> landmarks, Handedness handedness) {
        Objects.requireNonNull(landmarks, "landmarks");
        return new HandObservation(landmarks, List.of(), handedness);
    }

    public static HandObservation ofFingerVector(List<Integer> fingerVector, Handedness handedness) {
        Objects.requireNonNull(fingerVector, "fingerVector");
        return new HandObservation(List.of(), fingerVector, handedness);
    }

    public boolean hasLandmarks() {
        return !landmarks.isEmpty();
    }
}
