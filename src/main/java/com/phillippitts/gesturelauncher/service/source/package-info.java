/**
 * Hand-tracker input: the JSON-lines feed, its parser and the tick loop that drives the
 * gesture pipeline.
 */
package com.phillippitts.gesturelauncher.service.source;
