/**
 * HTTP surface: a read-only status API and its error mapping.
 *
 * <p>The gesture pipeline runs without it; these endpoints only read the latest tick snapshot
 * and the configured mapping.
 */
package com.phillippitts.gesturelauncher.presentation;
