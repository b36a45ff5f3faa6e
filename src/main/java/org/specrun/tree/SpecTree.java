package org.specrun.tree;

/**
 * Node of the immutable spec hierarchy: either a {@link SpecGroup} or a {@link SpecExample}.
 */
public interface SpecTree {
    /**
     * Group label or example requirement.
     */
    String description();
}
