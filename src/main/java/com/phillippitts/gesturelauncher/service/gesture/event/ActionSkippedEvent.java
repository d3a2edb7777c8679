package com.phillippitts.gesturelauncher.service.gesture.event;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;

import java.time.Instant;

/**
 * Published when a triggered gesture was not acted on (no-op, misconfigured or failed action).
 * The cooldown is left untouched so the next tick may retry.
 */
public record ActionSkippedEvent(int count, ActionDescriptor descriptor, Instant at) { }
