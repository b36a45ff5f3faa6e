package org.specrun.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Group labels plus requirement text identifying one example. Not guaranteed unique within a run.
 */
public record SpecPath(List<String> groups, String requirement) {
    /**
     * Requirement text of the pseudo-example that stands for a failing {@code afterAll} hook.
     */
    public static final String AFTER_ALL_REQUIREMENT = "afterAll-hook";

    public SpecPath {
        groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
        requirement = Objects.requireNonNull(requirement, "requirement");
    }

    public static SpecPath of(String requirement, String... groups) {
        return new SpecPath(List.of(groups), requirement);
    }

    public static SpecPath afterAllHook(List<String> groups) {
        return new SpecPath(groups, AFTER_ALL_REQUIREMENT);
    }

    public boolean isAfterAllHook() {
        return AFTER_ALL_REQUIREMENT.equals(requirement) && !groups.isEmpty();
    }

    /**
     * True when this path lies inside the group identified by {@code labels}.
     */
    public boolean isWithin(List<String> labels) {
        return groups.size() >= labels.size() && groups.subList(0, labels.size()).equals(labels);
    }

    /**
     * Labels and requirement joined with {@code /}.
     */
    public String render() {
        List<String> parts = new ArrayList<>(groups);
        parts.add(requirement);
        return String.join("/", parts);
    }

    @Override
    public String toString() {
        return render();
    }
}
