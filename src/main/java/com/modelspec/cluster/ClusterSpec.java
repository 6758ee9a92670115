package com.modelspec.cluster;

/**
 * Random-effect grouping level.
 *
 * @param groupName      Grouping variable name
 * @param parentGroup    Enclosing group for nested clusters (null for a top-level cluster)
 * @param hasRandomSlope Whether the cluster carries a random slope
 * @param slopeVariable  Random slope variable (null without a slope)
 */
public record ClusterSpec(
        String groupName,
        String parentGroup,
        boolean hasRandomSlope,
        String slopeVariable
) {
    /**
     * Create a top-level random-intercept cluster.
     */
    public static ClusterSpec root(String groupName) {
        return new ClusterSpec(groupName, null, false, null);
    }

    /**
     * Create a top-level cluster with a random slope.
     */
    public static ClusterSpec root(String groupName, String slopeVariable) {
        return new ClusterSpec(groupName, null, slopeVariable != null, slopeVariable);
    }

    /**
     * Create a cluster nested in a parent group.
     */
    public static ClusterSpec child(String groupName, String parentGroup) {
        return new ClusterSpec(groupName, parentGroup, false, null);
    }

    /**
     * Create a nested cluster with a random slope.
     */
    public static ClusterSpec child(String groupName, String parentGroup, String slopeVariable) {
        return new ClusterSpec(groupName, parentGroup, slopeVariable != null, slopeVariable);
    }

    /**
     * Check if this is a top-level cluster (no parent).
     */
    public boolean isRoot() {
        return parentGroup == null || parentGroup.isEmpty();
    }
}
