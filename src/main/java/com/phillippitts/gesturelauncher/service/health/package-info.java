/** Actuator health contributions. */
package com.phillippitts.gesturelauncher.service.health;
