package org.specrun.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Labelled group of examples and nested groups with its hooks.
 */
public final class SpecGroup implements SpecTree {
    private final String label;
    private final Hooks hooks;
    private final List<SpecTree> children;

    public SpecGroup(String label, Hooks hooks, List<SpecTree> children) {
        this.label = Objects.requireNonNull(label, "label");
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        Objects.requireNonNull(children, "children");
        this.children = List.copyOf(new ArrayList<>(children));
    }

    public String label() {
        return label;
    }

    public Hooks hooks() {
        return hooks;
    }

    public List<SpecTree> children() {
        return children;
    }

    /**
     * Same label and hooks, different children.
     */
    public SpecGroup withChildren(List<SpecTree> newChildren) {
        return new SpecGroup(label, hooks, newChildren);
    }

    @Override
    public String description() {
        return label;
    }

    @Override
    public String toString() {
        return "SpecGroup{" + label + ", " + children + "}";
    }
}
