package com.phillippitts.gesturelauncher.service.action.event;

import com.phillippitts.gesturelauncher.domain.ActionKind;

import java.time.Instant;

/** Published when an action could not be performed. Carries no URL or text (privacy). */
public record ActionFailedEvent(ActionKind kind, String reason, Instant at) { }
