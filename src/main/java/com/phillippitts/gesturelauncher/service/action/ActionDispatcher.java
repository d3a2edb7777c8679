package com.phillippitts.gesturelauncher.service.action;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;

/**
 * Invokes the external capability behind an action descriptor.
 */
public interface ActionDispatcher {
    /**
     * Performs the described action. Implementations never throw: capability faults are
     * logged and reported as {@code false}.
     *
     * @param descriptor action to perform
     * @return true if the action was actually performed, false for no-op, misconfiguration
     *         or capability failure
     */
    boolean dispatch(ActionDescriptor descriptor);
}
