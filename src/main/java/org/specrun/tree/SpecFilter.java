package org.specrun.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Prunes a spec forest by a path predicate. Groups left without children are dropped.
 */
public final class SpecFilter {
    private SpecFilter() {
    }

    public static List<SpecTree> filter(List<SpecTree> forest, Predicate<SpecPath> predicate) {
        Objects.requireNonNull(forest, "forest");
        Objects.requireNonNull(predicate, "predicate");
        return filterLevel(List.of(), forest, predicate);
    }

    /**
     * Either predicate matching is enough.
     */
    public static Predicate<SpecPath> or(Predicate<SpecPath> first, Predicate<SpecPath> second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.or(second);
    }

    private static List<SpecTree> filterLevel(
        List<String> groups,
        List<SpecTree> trees,
        Predicate<SpecPath> predicate
    ) {
        List<SpecTree> kept = new ArrayList<>(trees.size());
        for (SpecTree tree : trees) {
            if (tree instanceof SpecExample example) {
                if (predicate.test(new SpecPath(groups, example.requirement()))) {
                    kept.add(example);
                }
            } else if (tree instanceof SpecGroup group) {
                List<String> nested = new ArrayList<>(groups);
                nested.add(group.label());
                List<SpecTree> children = filterLevel(nested, group.children(), predicate);
                if (!children.isEmpty()) {
                    kept.add(children.equals(group.children()) ? group : group.withChildren(children));
                }
            } else {
                throw new IllegalArgumentException("unsupported spec tree node: " + tree);
            }
        }
        return List.copyOf(kept);
    }
}
