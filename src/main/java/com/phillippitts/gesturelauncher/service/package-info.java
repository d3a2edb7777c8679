/**
 * Service layer for the gesture launcher.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.source} - hand-tracker feed and the tick loop</li>
 *   <li>{@code service.extract} - landmark to finger-state reduction</li>
 *   <li>{@code service.gesture} - stability tracking, cooldown and event emission</li>
 *   <li>{@code service.action} - action dispatch and program resolution</li>
 *   <li>{@code service.capability} - browser, process and speech seams over the desktop</li>
 *   <li>{@code service.feedback}, {@code service.events}, {@code service.health},
 *       {@code service.metrics} - advisory concerns that never affect the state machine</li>
 * </ul>
 *
 * <p>Services use constructor injection and throw domain exceptions, never HTTP exceptions.
 *
 * @since 1.0
 */
package com.phillippitts.gesturelauncher.service;
