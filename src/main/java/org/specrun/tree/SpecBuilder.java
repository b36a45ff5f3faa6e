package org.specrun.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.specrun.result.Result;
import org.specrun.result.SourceLocation;

/**
 * Accumulates a spec forest.
 *
 * <pre>
 * List&lt;SpecTree&gt; specs = SpecBuilder.specs(spec -&gt;
 *     spec.describe("Stack", stack -&gt; {
 *         stack.beforeEach(() -&gt; fixture.reset());
 *         stack.it("pops what was pushed", () -&gt; ...);
 *     }));
 * </pre>
 */
public final class SpecBuilder {
    private static final String PACKAGE_PREFIX = "org.specrun.tree.";

    private final boolean insideGroup;
    private final List<SpecTree> children = new ArrayList<>();
    private Hooks hooks = Hooks.NONE;

    public SpecBuilder() {
        this(false);
    }

    private SpecBuilder(boolean insideGroup) {
        this.insideGroup = insideGroup;
    }

    public static List<SpecTree> specs(Consumer<SpecBuilder> body) {
        SpecBuilder builder = new SpecBuilder();
        Objects.requireNonNull(body, "body").accept(builder);
        return builder.build();
    }

    public SpecBuilder describe(String label, Consumer<SpecBuilder> body) {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(body, "body");
        SpecBuilder nested = new SpecBuilder(true);
        body.accept(nested);
        children.add(new SpecGroup(label, nested.hooks, nested.children));
        return this;
    }

    public SpecBuilder context(String label, Consumer<SpecBuilder> body) {
        return describe(label, body);
    }

    public SpecBuilder it(String requirement, HookAction body) {
        Objects.requireNonNull(body, "body");
        return example(requirement, Evaluable.of(body));
    }

    public SpecBuilder example(String requirement, Evaluable action) {
        children.add(new SpecExample(requirement, action, SourceLocation.callerOutside(PACKAGE_PREFIX)));
        return this;
    }

    public SpecBuilder pending(String requirement, String reason) {
        children.add(new SpecExample(
            requirement,
            params -> Result.pending(reason),
            SourceLocation.callerOutside(PACKAGE_PREFIX)));
        return this;
    }

    public SpecBuilder add(SpecTree tree) {
        children.add(Objects.requireNonNull(tree, "tree"));
        return this;
    }

    public SpecBuilder beforeAll(HookAction action) {
        hooks = requireGroup().withBeforeAll(action);
        return this;
    }

    public SpecBuilder afterAll(HookAction action) {
        hooks = requireGroup().withAfterAll(action);
        return this;
    }

    public SpecBuilder beforeEach(HookAction action) {
        hooks = requireGroup().withBeforeEach(action);
        return this;
    }

    public SpecBuilder afterEach(HookAction action) {
        hooks = requireGroup().withAfterEach(action);
        return this;
    }

    public SpecBuilder around(AroundHook hook) {
        hooks = requireGroup().withAround(hook);
        return this;
    }

    public List<SpecTree> build() {
        return List.copyOf(children);
    }

    private Hooks requireGroup() {
        if (!insideGroup) {
            throw new IllegalStateException("hooks must be declared inside describe/context");
        }
        return hooks;
    }
}
