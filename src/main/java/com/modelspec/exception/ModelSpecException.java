package com.modelspec.exception;

/**
 * Base exception for the model specification engine.
 * Carries the pipeline stage and the offending identifier or substring
 * so that callers can render an inline message.
 */
public class ModelSpecException extends RuntimeException {

    private final Stage stage;
    private final String subject;

    public ModelSpecException(Stage stage, String subject, String message) {
        super(message);
        this.stage = stage;
        this.subject = subject;
    }

    public ModelSpecException(Stage stage, String subject, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.subject = subject;
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * Offending identifier or formula substring (may be null).
     */
    public String getSubject() {
        return subject;
    }
}
