/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.gesturelauncher.exception.GestureLauncherException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.gesturelauncher.exception.ActionDispatchException} - Thrown by a
 *       capability when an action cannot be carried out; caught at the dispatcher boundary</li>
 *   <li>{@link com.phillippitts.gesturelauncher.exception.ExecutableNotFoundException} - Thrown when
 *       a configured program resolves to no executable</li>
 *   <li>{@link com.phillippitts.gesturelauncher.exception.ObservationSourceException} - Thrown when
 *       the hand-tracker feed cannot be opened or read</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and carry a context field
 * for logging. REST-facing mapping lives in {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.gesturelauncher.exception.GestureLauncherException
 * @since 1.0
 */
package com.phillippitts.gesturelauncher.exception;
