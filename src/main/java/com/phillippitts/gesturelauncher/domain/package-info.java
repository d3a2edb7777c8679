/**
 * Domain models for gesture recognition and action mapping.
 *
 * <p>All types here are immutable and validate themselves on construction:
 * <ul>
 *   <li>{@link com.phillippitts.gesturelauncher.domain.HandObservation} - one tracked hand per tick</li>
 *   <li>{@link com.phillippitts.gesturelauncher.domain.FingerState} - extended-finger vector and count</li>
 *   <li>{@link com.phillippitts.gesturelauncher.domain.ActionDescriptor} - what a finger count does</li>
 *   <li>{@link com.phillippitts.gesturelauncher.domain.ActionMapping} - static count to action table</li>
 *   <li>{@link com.phillippitts.gesturelauncher.domain.GestureSettings} - debounce and cooldown thresholds</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.gesturelauncher.domain;
