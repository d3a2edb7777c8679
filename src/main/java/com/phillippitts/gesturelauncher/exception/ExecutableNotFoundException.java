package com.phillippitts.gesturelauncher.exception;

import com.phillippitts.gesturelauncher.domain.ActionKind;

/**
 * Thrown when no resolution strategy finds an executable for a configured program.
 */
public class ExecutableNotFoundException extends ActionDispatchException {

    private final String programName;

    public ExecutableNotFoundException(String programName) {
        super(ActionKind.OPEN_PROGRAM, "no executable found for '" + programName + "'");
        this.programName = programName;
    }

    public String getProgramName() {
        return programName;
    }
}
