package com.phillippitts.gesturelauncher.service.source.event;

import java.time.Instant;

/** Published when the tracker feed cannot be opened or breaks while reading. */
public record ObservationSourceFailedEvent(String source, String reason, Instant at) { }
