package com.modelspec.exception;

/**
 * Exception thrown when a factor has fewer or more levels than supported.
 */
public class FactorLevelRangeException extends ModelSpecException {

    private final int levelCount;

    public FactorLevelRangeException(String variable, int levelCount, int min, int max) {
        super(Stage.RESOLUTION, variable, "Factor '" + variable + "' has " + levelCount
                + " levels; factors must have between " + min + " and " + max + " levels");
        this.levelCount = levelCount;
    }

    public int getLevelCount() {
        return levelCount;
    }
}
