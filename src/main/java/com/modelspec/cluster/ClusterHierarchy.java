package com.modelspec.cluster;

import com.modelspec.exception.ClusterHierarchyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Validated parent-child structure of random-effect clusters.
 * Every parent must be declared before its children and the structure must be acyclic.
 */
public class ClusterHierarchy {

    private static final Logger log = LoggerFactory.getLogger(ClusterHierarchy.class);

    private final List<ClusterSpec> clusters;
    private final Map<String, ClusterSpec> byName;
    private final Map<String, List<String>> children; // parent -> children

    public ClusterHierarchy(List<ClusterSpec> specs) {
        List<ClusterSpec> declared = specs == null ? List.of() : List.copyOf(specs);
        this.byName = new LinkedHashMap<>();
        this.children = new HashMap<>();

        // Build cluster map
        for (ClusterSpec spec : declared) {
            if (spec.groupName() == null || spec.groupName().isEmpty()) {
                throw new ClusterHierarchyException(spec.groupName(), "Cluster group name cannot be null or empty");
            }
            if (byName.containsKey(spec.groupName())) {
                throw new ClusterHierarchyException(spec.groupName(),
                        "Duplicate cluster group: " + spec.groupName());
            }
            byName.put(spec.groupName(), spec);
        }

        // Validate parents exist and build children map
        for (ClusterSpec spec : declared) {
            if (spec.isRoot()) {
                continue;
            }
            if (!byName.containsKey(spec.parentGroup())) {
                throw new ClusterHierarchyException(spec.groupName(),
                        "Cluster '" + spec.groupName() + "' references unknown parent '" + spec.parentGroup() + "'");
            }
            children.computeIfAbsent(spec.parentGroup(), k -> new ArrayList<>()).add(spec.groupName());
        }

        validateNoCycles();
        validateDeclarationOrder(declared);

        this.clusters = declared;
        log.debug("ClusterHierarchy initialized with {} clusters ({} top-level)", clusters.size(), getRoots().size());
    }

    public static ClusterHierarchy empty() {
        return new ClusterHierarchy(List.of());
    }

    /**
     * Clusters in declaration order (parents before children).
     */
    public List<ClusterSpec> getClusters() {
        return clusters;
    }

    public boolean isEmpty() {
        return clusters.isEmpty();
    }

    public boolean contains(String groupName) {
        return byName.containsKey(groupName);
    }

    /**
     * Get cluster spec by group name.
     */
    public ClusterSpec getCluster(String groupName) {
        return byName.get(groupName);
    }

    /**
     * Get parent group of a cluster, or null for top-level clusters.
     */
    public String getParent(String groupName) {
        ClusterSpec spec = byName.get(groupName);
        return spec != null ? spec.parentGroup() : null;
    }

    /**
     * Get groups directly nested in a cluster.
     */
    public List<String> getChildren(String groupName) {
        return children.getOrDefault(groupName, Collections.emptyList());
    }

    /**
     * Get top-level clusters.
     */
    public List<ClusterSpec> getRoots() {
        return clusters.stream().filter(ClusterSpec::isRoot).toList();
    }

    /**
     * Get cluster chain from a group up to its top-level ancestor (inclusive).
     * Order: [group, parent, grandparent, ...]
     */
    public List<String> getChain(String groupName) {
        List<String> chain = new ArrayList<>();
        String current = groupName;

        while (current != null) {
            ClusterSpec spec = byName.get(current);
            if (spec == null) {
                throw new IllegalArgumentException("Unknown cluster: " + current);
            }
            chain.add(current);
            current = spec.parentGroup();
        }

        return chain;
    }

    /**
     * Get nesting depth of a cluster (top-level = 0).
     */
    public int getDepth(String groupName) {
        return getChain(groupName).size() - 1;
    }

    private void validateNoCycles() {
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();

        for (String name : byName.keySet()) {
            if (!visited.contains(name) && hasCycle(name, visited, inStack)) {
                throw new ClusterHierarchyException(name, "Circular nesting detected in cluster hierarchy at '" + name + "'");
            }
        }
    }

    private boolean hasCycle(String name, Set<String> visited, Set<String> inStack) {
        visited.add(name);
        inStack.add(name);

        for (String child : children.getOrDefault(name, Collections.emptyList())) {
            if (!visited.contains(child)) {
                if (hasCycle(child, visited, inStack)) {
                    return true;
                }
            } else if (inStack.contains(child)) {
                return true;
            }
        }

        inStack.remove(name);
        return false;
    }

    private void validateDeclarationOrder(List<ClusterSpec> declared) {
        Set<String> seen = new HashSet<>();
        for (ClusterSpec spec : declared) {
            if (!spec.isRoot() && !seen.contains(spec.parentGroup())) {
                throw new ClusterHierarchyException(spec.groupName(), "Cluster '" + spec.groupName()
                        + "' is declared before its parent '" + spec.parentGroup() + "'");
            }
            seen.add(spec.groupName());
        }
    }
}
