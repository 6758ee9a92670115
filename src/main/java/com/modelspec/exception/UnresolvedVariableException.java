package com.modelspec.exception;

/**
 * Exception for an identifier that is neither configured manually
 * nor present in the uploaded data.
 */
public class UnresolvedVariableException extends ModelSpecException {

    public UnresolvedVariableException(String variable) {
        this(Stage.RESOLUTION, variable);
    }

    public UnresolvedVariableException(Stage stage, String variable) {
        super(stage, variable, "Variable '" + variable
                + "' is not configured and not present in the uploaded data");
    }
}
