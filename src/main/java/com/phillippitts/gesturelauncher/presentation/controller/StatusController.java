package com.phillippitts.gesturelauncher.presentation.controller;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionMapping;
import com.phillippitts.gesturelauncher.service.gesture.GestureEventEmitter;
import com.phillippitts.gesturelauncher.service.gesture.StabilityTracker;
import com.phillippitts.gesturelauncher.service.gesture.TickOutcome;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the gesture pipeline: what the tracker currently sees and which action
 * each finger count is mapped to.
 */
@RestController
@RequestMapping("/api")
class StatusController {

    private final GestureEventEmitter emitter;
    private final StabilityTracker tracker;
    private final ActionMapping mapping;

    StatusController(GestureEventEmitter emitter, StabilityTracker tracker, ActionMapping mapping) {
        this.emitter = emitter;
        this.tracker = tracker;
        this.mapping = mapping;
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stableFrames", tracker.stableFrames());
        Optional<TickOutcome> snapshot = emitter.snapshot();
        if (snapshot.isEmpty()) {
            body.put("status", "waiting");
            body.put("tick", 0L);
            return ResponseEntity.ok(body);
        }
        TickOutcome o = snapshot.get();
        body.put("status", "tracking");
        body.put("tick", o.tick());
        body.put("at", o.at().toString());
        body.put("handPresent", o.fingerState().isPresent());
        o.fingerState().ifPresent(f -> {
            body.put("fingerCount", f.count());
            body.put("fingers", f.vector());
        });
        body.put("handedness", o.handedness().name());
        body.put("consecutiveTicks", o.stability().consecutiveTicks());
        body.put("stable", o.stability().stable());
        body.put("triggered", o.triggered());
        body.put("acted", o.acted());
        body.put("cooldownRemainingMs", o.cooldownRemaining().toMillis());
        emitter.lastTrigger().ifPresent(t -> body.put("lastTrigger", t.toString()));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/actions")
    ResponseEntity<Map<Integer, String>> actions() {
        Map<Integer, String> body = new LinkedHashMap<>();
        for (int count = ActionMapping.MIN_COUNT; count <= ActionMapping.MAX_COUNT; count++) {
            body.put(count, mapping.descriptorFor(count).toString());
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/actions/{count}")
    ResponseEntity<Map<String, Object>> action(@PathVariable("count") int count) {
        if (count < ActionMapping.MIN_COUNT || count > ActionMapping.MAX_COUNT) {
            throw new IllegalArgumentException("Finger count must be between " + ActionMapping.MIN_COUNT
                    + " and " + ActionMapping.MAX_COUNT + ", got: " + count);
        }
        ActionDescriptor d = mapping.descriptorFor(count);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", count);
        body.put("kind", d.kind().tag());
        d.parameter().ifPresent(p -> body.put("parameter", p));
        return ResponseEntity.ok(body);
    }
}
