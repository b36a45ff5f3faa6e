package org.specrun.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class SpecFilterTest {
    private static final List<SpecTree> FOREST = SpecBuilder.specs(spec -> {
        spec.describe("A", a -> {
            a.it("one", () -> { });
            a.describe("B", b -> b.it("two", () -> { }));
        });
        spec.describe("C", c -> c.it("three", () -> { }));
        spec.it("top", () -> { });
    });

    @Test
    void acceptAllKeepsEveryExample() {
        List<SpecTree> filtered = SpecFilter.filter(FOREST, path -> true);

        assertEquals(SpecTrees.paths(FOREST), SpecTrees.paths(filtered));
        assertSame(FOREST.get(0), filtered.get(0));
    }

    @Test
    void rejectAllLeavesNothing() {
        assertTrue(SpecFilter.filter(FOREST, path -> false).isEmpty());
    }

    @Test
    void dropsGroupsWithoutSurvivingChildren() {
        List<SpecTree> filtered = SpecFilter.filter(FOREST, path -> path.requirement().equals("two"));

        assertEquals(List.of(SpecPath.of("two", "A", "B")), SpecTrees.paths(filtered));
        assertEquals(1, filtered.size());
        SpecGroup a = (SpecGroup) filtered.get(0);
        assertEquals(1, a.children().size());
    }

    @Test
    void filteringIsIdempotent() {
        List<SpecTree> once = SpecFilter.filter(FOREST, path -> path.groups().contains("A"));
        List<SpecTree> twice = SpecFilter.filter(once, path -> path.groups().contains("A"));

        assertEquals(SpecTrees.paths(once), SpecTrees.paths(twice));
        assertEquals(2, SpecTrees.countExamples(twice));
    }

    @Test
    void orMatchesEitherPredicate() {
        List<SpecTree> filtered = SpecFilter.filter(
            FOREST,
            SpecFilter.or(path -> path.requirement().equals("top"), path -> path.groups().contains("C")));

        assertEquals(List.of(SpecPath.of("three", "C"), SpecPath.of("top")), SpecTrees.paths(filtered));
    }
}
