package com.modelspec.exception;

/**
 * Exception thrown when a random slope is requested for a factor variable.
 */
public class UnsupportedRandomSlopeException extends ModelSpecException {

    public UnsupportedRandomSlopeException(String variable, String group) {
        super(Stage.RANDOM_EFFECTS, variable, "Random slope '" + variable + "' for group '" + group
                + "' must be continuous or binary; factor random slopes are not supported");
    }
}
