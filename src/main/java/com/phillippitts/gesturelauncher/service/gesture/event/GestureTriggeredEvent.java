package com.phillippitts.gesturelauncher.service.gesture.event;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;

import java.time.Instant;

/** Published when a stable gesture clears the cooldown and is handed to the dispatcher. */
public record GestureTriggeredEvent(int count, ActionDescriptor descriptor, Instant at) { }
