/** Optional spoken confirmations after performed actions. */
package com.phillippitts.gesturelauncher.service.feedback;
