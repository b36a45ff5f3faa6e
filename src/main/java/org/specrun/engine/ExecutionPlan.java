package org.specrun.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.specrun.tree.SpecExample;
import org.specrun.tree.SpecGroup;
import org.specrun.tree.SpecPath;
import org.specrun.tree.SpecTree;
import org.specrun.tree.SpecTrees;

/**
 * Mirror of the spec forest carrying per-run state: a scope per group, and a start signal plus a pending
 * outcome per example.
 */
final class ExecutionPlan {
    interface Node {
    }

    record PlannedGroup(GroupScope scope, List<Node> children) implements Node {
        PlannedGroup {
            Objects.requireNonNull(scope, "scope");
            children = List.copyOf(children);
        }
    }

    /**
     * @param started completes with {@code true} when a worker begins evaluating the example, or
     *     {@code false} when fail-fast skips it
     */
    record PlannedExample(
        SpecExample example,
        SpecPath path,
        List<GroupScope> scopes,
        CompletableFuture<Boolean> started,
        CompletableFuture<ExampleOutcome> outcome
    ) implements Node {
        PlannedExample {
            Objects.requireNonNull(example, "example");
            Objects.requireNonNull(path, "path");
            scopes = List.copyOf(scopes);
            Objects.requireNonNull(started, "started");
            Objects.requireNonNull(outcome, "outcome");
        }
    }

    private final List<Node> roots;
    private final List<PlannedExample> examples;

    private ExecutionPlan(List<Node> roots, List<PlannedExample> examples) {
        this.roots = List.copyOf(roots);
        this.examples = List.copyOf(examples);
    }

    static ExecutionPlan of(List<SpecTree> forest) {
        Objects.requireNonNull(forest, "forest");
        List<PlannedExample> examples = new ArrayList<>();
        List<Node> roots = plan(forest, List.of(), List.of(), examples);
        return new ExecutionPlan(roots, examples);
    }

    List<Node> roots() {
        return roots;
    }

    /**
     * Examples in traversal order.
     */
    List<PlannedExample> examples() {
        return examples;
    }

    private static List<Node> plan(
        List<SpecTree> trees,
        List<String> labels,
        List<GroupScope> scopes,
        List<PlannedExample> sink
    ) {
        List<Node> nodes = new ArrayList<>(trees.size());
        for (SpecTree tree : trees) {
            if (tree instanceof SpecExample example) {
                PlannedExample planned = new PlannedExample(
                    example,
                    new SpecPath(labels, example.requirement()),
                    scopes,
                    new CompletableFuture<>(),
                    new CompletableFuture<>());
                sink.add(planned);
                nodes.add(planned);
            } else if (tree instanceof SpecGroup group) {
                List<String> nestedLabels = new ArrayList<>(labels);
                nestedLabels.add(group.label());
                GroupScope scope = new GroupScope(group, nestedLabels, SpecTrees.countExamples(group.children()));
                List<GroupScope> nestedScopes = new ArrayList<>(scopes);
                nestedScopes.add(scope);
                nodes.add(new PlannedGroup(scope, plan(group.children(), nestedLabels, nestedScopes, sink)));
            } else {
                throw new IllegalArgumentException("unsupported spec tree node: " + tree);
            }
        }
        return nodes;
    }
}
