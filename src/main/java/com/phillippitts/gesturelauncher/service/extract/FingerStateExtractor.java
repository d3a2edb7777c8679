package com.phillippitts.gesturelauncher.service.extract;

import com.phillippitts.gesturelauncher.domain.FingerState;
import com.phillippitts.gesturelauncher.domain.HandLandmarkIndex;
import com.phillippitts.gesturelauncher.domain.HandObservation;
import com.phillippitts.gesturelauncher.domain.Handedness;
import com.phillippitts.gesturelauncher.domain.Landmark;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces a tracked hand to an extended-finger vector.
 *
 * <p>Rules, for a mirrored camera view:
 * <ul>
 *   <li>Thumb: for a right hand, extended when the tip is left of the IP joint (smaller x);
 *       reversed for a left hand; unknown handedness uses the right-hand rule.</li>
 *   <li>Other fingers: extended when the tip is above the PIP joint (smaller y).</li>
 * </ul>
 *
 * <p>Extraction is total: a missing, null or non-finite landmark marks only that finger as
 * folded. This class is stateless and thread-safe.
 */
@Component
public class FingerStateExtractor {

    public FingerState extract(HandObservation observation) {
        if (observation == null) {
            return FingerState.of(List.of(0, 0, 0, 0, 0));
        }
        if (observation.hasLandmarks()) {
            return fromLandmarks(observation.landmarks(), observation.handedness());
        }
        return fromVector(observation.fingerVector());
    }

    private FingerState fromLandmarks(List<Landmark> lm, Handedness handedness) {
        List<Integer> fingers = new ArrayList<>(FingerState.FINGERS);
        fingers.add(thumb(lm, handedness));
        for (int finger = 1; finger <= 4; finger++) {
            Landmark tipPt = at(lm, HandLandmarkIndex.tipOf(finger));
            Landmark pipPt = at(lm, HandLandmarkIndex.pipOf(finger));
            if (tipPt == null || pipPt == null) {
                fingers.add(0);
                continue;
            }
            fingers.add(tipPt.y() < pipPt.y() ? 1 : 0);
        }
        return FingerState.of(fingers);
    }

    private int thumb(List<Landmark> lm, Handedness handedness) {
        Landmark tip = at(lm, HandLandmarkIndex.THUMB_TIP);
        Landmark ip = at(lm, HandLandmarkIndex.THUMB_IP);
        if (tip == null || ip == null) {
            return 0;
        }
        if (handedness == Handedness.LEFT) {
            return tip.x() > ip.x() ? 1 : 0;
        }
        return tip.x() < ip.x() ? 1 : 0;
    }

    private static FingerState fromVector(List<Integer> vector) {
        List<Integer> fingers = new ArrayList<>(FingerState.FINGERS);
        for (int i = 0; i < FingerState.FINGERS; i++) {
            Integer bit = i < vector.size() ? vector.get(i) : null;
            fingers.add(bit != null && bit == 1 ? 1 : 0);
        }
        return FingerState.of(fingers);
    }

    // null when the point is absent or unusable
    private static Landmark at(List<Landmark> lm, int index) {
        if (index < 0 || index >= lm.size()) {
            return null;
        }
        Landmark p = lm.get(index);
        return p != null && p.isUsable() ? p : null;
    }
}
