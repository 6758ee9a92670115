package com.modelspec.variable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Formatting and ordering of factor level labels.
 * Labels sort numerically when every label is a number, lexicographically otherwise.
 */
public final class LevelLabels {

    private LevelLabels() {
    }

    /**
     * Render an observed value as a level label. Integral numbers drop the
     * fractional part, so 4.0 becomes "4".
     */
    public static String label(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    public static boolean isNumeric(String label) {
        if (label == null || label.isBlank()) {
            return false;
        }
        try {
            new BigDecimal(label.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public static boolean allNumeric(Collection<String> labels) {
        return !labels.isEmpty() && labels.stream().allMatch(LevelLabels::isNumeric);
    }

    /**
     * Sort labels: numeric order when every label is numeric, lexicographic otherwise.
     */
    public static List<String> sorted(Collection<String> labels) {
        List<String> result = new ArrayList<>(labels);
        if (allNumeric(result)) {
            result.sort(Comparator.comparing(label -> new BigDecimal(label.trim())));
        } else {
            result.sort(Comparator.naturalOrder());
        }
        return result;
    }

    /**
     * Integer labels "1".."n" used when a factor has no named levels.
     */
    public static List<String> numbered(int levelCount) {
        List<String> labels = new ArrayList<>(levelCount);
        for (int i = 1; i <= levelCount; i++) {
            labels.add(Integer.toString(i));
        }
        return labels;
    }
}
