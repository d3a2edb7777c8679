/**
 * Debouncing state machine: the {@link com.phillippitts.gesturelauncher.service.gesture.StabilityTracker}
 * requires a finger count to persist for a number of ticks, the
 * {@link com.phillippitts.gesturelauncher.service.gesture.CooldownGate} spaces performed actions,
 * and the {@link com.phillippitts.gesturelauncher.service.gesture.GestureEventEmitter} combines
 * both per tick.
 *
 * <p>All state here is owned by the tick thread.
 *
 * @since 1.0
 */
package com.phillippitts.gesturelauncher.service.gesture;
