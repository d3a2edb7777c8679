/**
 * Action dispatch. One {@code ActionHandler} per action kind; the dispatcher turns every
 * handler failure into "not performed".
 */
package com.phillippitts.gesturelauncher.service.action;
