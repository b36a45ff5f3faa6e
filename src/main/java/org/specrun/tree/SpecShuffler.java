package org.specrun.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Seeded reordering of siblings at every level of a spec forest.
 */
public final class SpecShuffler {
    private SpecShuffler() {
    }

    public static List<SpecTree> shuffle(List<SpecTree> forest, long seed) {
        Objects.requireNonNull(forest, "forest");
        return shuffleLevel(forest, new Random(seed));
    }

    // pre-order: a level is shuffled before its groups are descended into
    private static List<SpecTree> shuffleLevel(List<SpecTree> trees, Random random) {
        List<SpecTree> ordered = new ArrayList<>(trees);
        for (int index = ordered.size() - 1; index > 0; index--) {
            int swapIndex = random.nextInt(index + 1);
            SpecTree current = ordered.get(index);
            ordered.set(index, ordered.get(swapIndex));
            ordered.set(swapIndex, current);
        }
        for (int index = 0; index < ordered.size(); index++) {
            if (ordered.get(index) instanceof SpecGroup group) {
                ordered.set(index, group.withChildren(shuffleLevel(group.children(), random)));
            }
        }
        return List.copyOf(ordered);
    }
}
