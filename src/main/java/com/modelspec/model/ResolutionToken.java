package com.modelspec.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation token carried by one resolution request.
 * A newer request invalidates the token of the request it supersedes.
 */
public final class ResolutionToken {

    private final long sequence;
    private final AtomicBoolean valid = new AtomicBoolean(true);

    public ResolutionToken(long sequence) {
        this.sequence = sequence;
    }

    public boolean isValid() {
        return valid.get();
    }

    public void invalidate() {
        valid.set(false);
    }

    @Override
    public String toString() {
        return "ResolutionToken{" + sequence + (isValid() ? "" : ", invalidated") + '}';
    }
}
