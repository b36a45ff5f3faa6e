package org.specrun.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.specrun.result.Result;

class SpecBuilderTest {
    @Test
    void buildsNestedGroupsWithHooksAndLocations() throws Exception {
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("Stack", stack -> {
            stack.beforeEach(() -> { });
            stack.afterAll(() -> { });
            stack.context("when empty", empty -> empty.it("has size zero", () -> { }));
            stack.pending("supports peek", "not implemented");
        }));

        assertEquals(1, forest.size());
        SpecGroup stack = (SpecGroup) forest.get(0);
        assertEquals("Stack", stack.label());
        assertEquals(1, stack.hooks().beforeEach().size());
        assertTrue(stack.hooks().hasGroupScope());
        assertEquals(
            List.of(SpecPath.of("has size zero", "Stack", "when empty"), SpecPath.of("supports peek", "Stack")),
            SpecTrees.paths(forest));

        SpecExample pending = (SpecExample) stack.children().get(1);
        Result result = pending.action().evaluate(ExampleParams.withSeed(1L));
        assertEquals("not implemented", result.pendingReason().orElseThrow());
    }

    @Test
    void rejectsHooksOutsideGroups() {
        IllegalStateException error = assertThrows(
            IllegalStateException.class,
            () -> SpecBuilder.specs(spec -> spec.beforeEach(() -> { })));
        assertTrue(error.getMessage().contains("inside describe"));
    }

    @Test
    void renderJoinsLabelsAndRequirement() {
        assertEquals("A/B/works", SpecPath.of("works", "A", "B").render());
        assertEquals("works", SpecPath.of("works").render());
    }
}
