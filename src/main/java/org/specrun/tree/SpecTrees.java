package org.specrun.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only traversals over a spec forest.
 */
public final class SpecTrees {
    private SpecTrees() {
    }

    public static int countExamples(List<SpecTree> forest) {
        Objects.requireNonNull(forest, "forest");
        int count = 0;
        for (SpecTree tree : forest) {
            if (tree instanceof SpecGroup group) {
                count += countExamples(group.children());
            } else {
                count++;
            }
        }
        return count;
    }

    /**
     * Paths of all examples in depth-first order.
     */
    public static List<SpecPath> paths(List<SpecTree> forest) {
        Objects.requireNonNull(forest, "forest");
        List<SpecPath> paths = new ArrayList<>();
        collect(List.of(), forest, paths);
        return List.copyOf(paths);
    }

    private static void collect(List<String> groups, List<SpecTree> trees, List<SpecPath> sink) {
        for (SpecTree tree : trees) {
            if (tree instanceof SpecGroup group) {
                List<String> nested = new ArrayList<>(groups);
                nested.add(group.label());
                collect(nested, group.children(), sink);
            } else if (tree instanceof SpecExample example) {
                sink.add(new SpecPath(groups, example.requirement()));
            }
        }
    }
}
