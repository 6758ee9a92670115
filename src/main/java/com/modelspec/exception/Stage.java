package com.modelspec.exception;

/**
 * Pipeline stage that produced a failure.
 */
public enum Stage {
    CONFIGURATION,
    PARSE,
    RESOLUTION,
    EXPANSION,
    RANDOM_EFFECTS,
    VALIDATION
}
