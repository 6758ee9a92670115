package com.modelspec.exception;

/**
 * Exception thrown when a formula is syntactically malformed.
 * Fatal to producing any model specification for that input.
 */
public class FormulaParseException extends ModelSpecException {

    private final int position;

    public FormulaParseException(String message, String subject, int position) {
        super(Stage.PARSE, subject, message);
        this.position = position;
    }

    /**
     * Zero-based character offset of the offending substring.
     */
    public int getPosition() {
        return position;
    }
}
