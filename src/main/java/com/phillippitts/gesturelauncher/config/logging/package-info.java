/**
 * Logging infrastructure: per-request ThreadContext values for the status API. The tick thread
 * sets its own {@code tick} key in {@code TickLoop}.
 */
package com.phillippitts.gesturelauncher.config.logging;
