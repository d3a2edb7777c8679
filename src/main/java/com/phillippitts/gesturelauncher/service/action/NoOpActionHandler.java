package com.phillippitts.gesturelauncher.service.action;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import org.springframework.stereotype.Component;

/** No-op: never performed, so it never starts a cooldown. */
@Component
class NoOpActionHandler implements ActionHandler {

    @Override
    public ActionKind kind() {
        return ActionKind.NO_OP;
    }

    @Override
    public boolean handle(ActionDescriptor descriptor) {
        return false;
    }
}
