package com.modelspec.exception;

/**
 * Exception for an invalid random-effect cluster hierarchy:
 * unresolved parent, cycle, or conflicting redeclaration.
 */
public class ClusterHierarchyException extends ModelSpecException {

    public ClusterHierarchyException(String group, String message) {
        super(Stage.RANDOM_EFFECTS, group, message);
    }
}
