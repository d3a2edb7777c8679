/**
 * Spring wiring for the gesture pipeline and startup validation of its properties.
 *
 * <p>Typed properties live in {@code config.properties}; {@link
 * com.phillippitts.gesturelauncher.config.GestureLauncherConfig} turns them into the domain
 * objects the services consume.
 *
 * @since 1.0
 */
package com.phillippitts.gesturelauncher.config;
