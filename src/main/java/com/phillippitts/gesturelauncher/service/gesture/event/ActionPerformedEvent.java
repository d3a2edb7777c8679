package com.phillippitts.gesturelauncher.service.gesture.event;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;

import java.time.Instant;

/** Published after the dispatcher reports an action as performed and the cooldown was recorded. */
public record ActionPerformedEvent(int count, ActionDescriptor descriptor, Instant at) { }
