/**
 * REST controllers.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code GET /api/status} - latest tick snapshot</li>
 *   <li>{@code GET /api/actions} - configured action for every finger count</li>
 *   <li>{@code GET /api/actions/{count}} - configured action for one finger count</li>
 * </ul>
 *
 * @see com.phillippitts.gesturelauncher.presentation.exception
 */
package com.phillippitts.gesturelauncher.presentation.controller;
