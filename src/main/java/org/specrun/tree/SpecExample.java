package org.specrun.tree;

import java.util.Objects;
import java.util.Optional;
import org.specrun.result.SourceLocation;

/**
 * Leaf of the spec hierarchy.
 */
public final class SpecExample implements SpecTree {
    private final String requirement;
    private final Evaluable action;
    private final SourceLocation location;

    public SpecExample(String requirement, Evaluable action, SourceLocation location) {
        this.requirement = Objects.requireNonNull(requirement, "requirement");
        this.action = Objects.requireNonNull(action, "action");
        this.location = location;
    }

    public String requirement() {
        return requirement;
    }

    public Evaluable action() {
        return action;
    }

    public Optional<SourceLocation> location() {
        return Optional.ofNullable(location);
    }

    @Override
    public String description() {
        return requirement;
    }

    @Override
    public String toString() {
        return "SpecExample{" + requirement + "}";
    }
}
