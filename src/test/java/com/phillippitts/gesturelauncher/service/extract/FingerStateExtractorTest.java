package com.phillippitts.gesturelauncher.service.extract;

import com.phillippitts.gesturelauncher.domain.FingerState;
import com.phillippitts.gesturelauncher.domain.HandLandmarkIndex;
import com.phillippitts.gesturelauncher.domain.HandObservation;
import com.phillippitts.gesturelauncher.domain.Handedness;
import com.phillippitts.gesturelauncher.domain.Landmark;
import com.phillippitts.gesturelauncher.testutil.Hands;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FingerStateExtractorTest {

    private final FingerStateExtractor extractor = new FingerStateExtractor();

    @Test
    void closedFistIsZero() {
        FingerState s = extractor.extract(Hands.right(0, 0, 0, 0, 0));
        assertThat(s.count()).isZero();
        assertThat(s.vector()).containsExactly(0, 0, 0, 0, 0);
    }

    @Test
    void openHandIsFive() {
        FingerState s = extractor.extract(Hands.right(1, 1, 1, 1, 1));
        assertThat(s.count()).isEqualTo(5);
        assertThat(s.thumbExtended()).isTrue();
    }

    @Test
    void countsIndexAndMiddle() {
        FingerState s = extractor.extract(Hands.right(0, 1, 1, 0, 0));
        assertThat(s.count()).isEqualTo(2);
        assertThat(s.vector()).containsExactly(0, 1, 1, 0, 0);
    }

    @Test
    void countIsAlwaysSumOfVector() {
        for (int count = 0; count <= 5; count++) {
            FingerState s = extractor.extract(Hands.showing(count));
            assertThat(s.count()).isEqualTo(count);
            assertThat(s.vector().stream().mapToInt(Integer::intValue).sum()).isEqualTo(count);
        }
    }

    @Test
    void thumbRuleMirrorsForLeftHand() {
        // same mirrored pose reads as extended for the matching hand only
        List<Landmark> rightPose = Hands.landmarks(Handedness.RIGHT, 1, 0, 0, 0, 0);
        List<Landmark> leftPose = Hands.landmarks(Handedness.LEFT, 1, 0, 0, 0, 0);

        assertThat(extractor.extract(HandObservation.ofLandmarks(rightPose, Handedness.RIGHT)).thumbExtended()).isTrue();
        assertThat(extractor.extract(HandObservation.ofLandmarks(leftPose, Handedness.LEFT)).thumbExtended()).isTrue();
        assertThat(extractor.extract(HandObservation.ofLandmarks(rightPose, Handedness.LEFT)).thumbExtended()).isFalse();
        assertThat(extractor.extract(HandObservation.ofLandmarks(leftPose, Handedness.RIGHT)).thumbExtended()).isFalse();
    }

    @Test
    void unknownHandednessUsesRightHandRule() {
        List<Landmark> rightPose = Hands.landmarks(Handedness.RIGHT, 1, 0, 0, 0, 0);
        FingerState s = extractor.extract(HandObservation.ofLandmarks(rightPose, Handedness.UNKNOWN));
        assertThat(s.thumbExtended()).isTrue();
    }

    @Test
    void nullLandmarkOnlyAffectsItsFinger() {
        List<Landmark> pose = new ArrayList<>(Hands.landmarks(Handedness.RIGHT, 1, 1, 1, 1, 1));
        pose.set(HandLandmarkIndex.tipOf(2), null);

        FingerState s = extractor.extract(HandObservation.ofLandmarks(pose, Handedness.RIGHT));

        assertThat(s.vector()).containsExactly(1, 1, 0, 1, 1);
    }

    @Test
    void nanCoordinateCountsAsFolded() {
        List<Landmark> pose = new ArrayList<>(Hands.landmarks(Handedness.RIGHT, 0, 1, 0, 0, 0));
        pose.set(HandLandmarkIndex.tipOf(1), new Landmark(0.5, Double.NaN, 0.0));

        assertThat(extractor.extract(HandObservation.ofLandmarks(pose, Handedness.RIGHT)).count()).isZero();
    }

    @Test
    void truncatedLandmarkListNeverThrows() {
        List<Landmark> pose = Hands.landmarks(Handedness.RIGHT, 1, 1, 1, 1, 1).subList(0, 10);

        FingerState s = extractor.extract(HandObservation.ofLandmarks(pose, Handedness.RIGHT));

        // thumb and index survive, middle/ring/pinky tips are missing
        assertThat(s.vector()).containsExactly(1, 1, 0, 0, 0);
    }

    @Test
    void fingerVectorIsUsedDirectly() {
        HandObservation obs = HandObservation.ofFingerVector(List.of(1, 0, 1, 0, 1), Handedness.LEFT);
        assertThat(extractor.extract(obs).count()).isEqualTo(3);
    }

    @Test
    void fingerVectorTreatsAnythingButOneAsFolded() {
        HandObservation obs = HandObservation.ofFingerVector(Arrays.asList(2, -1, null, 1), Handedness.RIGHT);

        FingerState s = extractor.extract(obs);

        assertThat(s.vector()).containsExactly(0, 0, 0, 1, 0);
        assertThat(s.count()).isEqualTo(1);
    }

    @Test
    void nullObservationIsZero() {
        assertThat(extractor.extract(null).count()).isZero();
    }
}
