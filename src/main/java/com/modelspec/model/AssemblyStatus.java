package com.modelspec.model;

/**
 * Outcome of one assembly run.
 */
public enum AssemblyStatus {
    /**
     * No formula entered yet.
     */
    EMPTY,

    /**
     * A complete model specification was produced.
     */
    SUCCESS,

    /**
     * A stage failed; the first error is reported.
     */
    FAILED,

    /**
     * The request was superseded before it started.
     */
    CANCELLED
}
