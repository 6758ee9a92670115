package com.modelspec.model;

/**
 * Order-independent key for a pair of correlated predictors, rendered "a,b"
 * with the names in alphabetical order.
 */
public record CorrelationKey(String first, String second) {

    public CorrelationKey {
        if (first == null || second == null) {
            throw new IllegalArgumentException("Correlation key needs two variable names");
        }
        if (first.equals(second)) {
            throw new IllegalArgumentException("A variable cannot be correlated with itself: " + first);
        }
        if (first.compareTo(second) > 0) {
            String swap = first;
            first = second;
            second = swap;
        }
    }

    public static CorrelationKey of(String a, String b) {
        return new CorrelationKey(a, b);
    }

    public boolean involves(String variable) {
        return first.equals(variable) || second.equals(variable);
    }

    @Override
    public String toString() {
        return first + "," + second;
    }
}
