package com.modelspec.exception;

/**
 * Exception thrown when an otherwise resolved model violates a global invariant.
 */
public class ModelValidationException extends ModelSpecException {

    public ModelValidationException(String subject, String message) {
        super(Stage.VALIDATION, subject, message);
    }
}
