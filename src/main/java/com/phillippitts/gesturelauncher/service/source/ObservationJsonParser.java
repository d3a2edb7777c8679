package com.phillippitts.gesturelauncher.service.source;

import com.phillippitts.gesturelauncher.domain.HandObservation;
import com.phillippitts.gesturelauncher.domain.Handedness;
import com.phillippitts.gesturelauncher.domain.Landmark;
import com.phillippitts.gesturelauncher.util.LogSanitizer;
import com.phillippitts.gesturelauncher.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses one line of the hand-tracker feed.
 *
 * <p>Accepted shapes:
 * <pre>
 * {"t": 12.5, "hand": "Right", "landmarks": [[0.51, 0.72, -0.01], ...]}
 * {"t": 12.5, "hand": "Left", "fingers": [1, 1, 0, 0, 0]}
 * {"t": 12.5}                      (no hand this frame)
 * </pre>
 * Landmarks may also be objects ({"x":..,"y":..,"z":..}); an unreadable point becomes
 * {@code null} and only affects its own finger. A line that is not a JSON object is logged and
 * treated as "no hand".
 */
@Component
public class ObservationJsonParser {

    private static final Logger LOG = LogManager.getLogger(ObservationJsonParser.class);

    public Tick parse(String line) {
        JSONObject json;
        try {
            json = new JSONObject(line);
        } catch (JSONException e) {
            LOG.warn("Ignoring malformed tracker line: {} ({})", LogSanitizer.truncate(line, 80), e.getMessage());
            return Tick.noHand();
        }
        Optional<Instant> timestamp = timestamp(json);
        Handedness handedness = Handedness.fromLabel(json.optString("hand", null));

        JSONArray landmarks = json.optJSONArray("landmarks");
        if (landmarks != null && !landmarks.isEmpty()) {
            return new Tick(Optional.of(HandObservation.ofLandmarks(landmarks(landmarks), handedness)), timestamp);
        }
        JSONArray fingers = json.optJSONArray("fingers");
        if (fingers != null && !fingers.isEmpty()) {
            return new Tick(Optional.of(HandObservation.ofFingerVector(fingers(fingers), handedness)), timestamp);
        }
        return new Tick(Optional.empty(), timestamp);
    }

    private static Optional<Instant> timestamp(JSONObject json) {
        double t = json.optDouble("t", Double.NaN);
        return Double.isFinite(t) ? Optional.of(TimeUtils.secondsToInstant(t)) : Optional.empty();
    }

    private static List<Landmark> landmarks(JSONArray arr) {
        List<Landmark> points = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            points.add(landmark(arr.opt(i)));
        }
        return points;
    }

    private static Landmark landmark(Object raw) {
        if (raw instanceof JSONArray a && a.length() >= 2) {
            return new Landmark(a.optDouble(0, Double.NaN), a.optDouble(1, Double.NaN), a.optDouble(2, 0.0));
        }
        if (raw instanceof JSONObject o && o.has("x") && o.has("y")) {
            return new Landmark(o.optDouble("x", Double.NaN), o.optDouble("y", Double.NaN), o.optDouble("z", 0.0));
        }
        return null;
    }

    private static List<Integer> fingers(JSONArray arr) {
        List<Integer> bits = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            bits.add(arr.optInt(i, 0));
        }
        return bits;
    }
}
