package com.phillippitts.gesturelauncher.service.action;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionKind;

/** Strategy for carrying out one kind of action. */
interface ActionHandler {
    /** Kind this handler serves. */
    ActionKind kind();

    /**
     * Perform the action.
     *
     * @return true if performed; false only for actions that are never considered performed
     * @throws Exception when the action cannot be carried out; the dispatcher converts it to false
     */
    boolean handle(ActionDescriptor descriptor) throws Exception;
}
