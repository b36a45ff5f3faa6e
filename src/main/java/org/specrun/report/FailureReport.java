package org.specrun.report;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.specrun.tree.ExampleParams;
import org.specrun.tree.SpecPath;

/**
 * Failing paths of the last meaningful run plus the parameters needed to reproduce it.
 */
public final class FailureReport {
    private static final FailureReport EMPTY = new FailureReport(null, List.of());

    private final ExampleParams params;
    private final List<FailureRecord> records;

    public FailureReport(ExampleParams params, List<FailureRecord> records) {
        this.params = params;
        Objects.requireNonNull(records, "records");
        this.records = List.copyOf(new ArrayList<>(records));
    }

    public static FailureReport empty() {
        return EMPTY;
    }

    public Optional<ExampleParams> params() {
        return Optional.ofNullable(params);
    }

    public List<FailureRecord> records() {
        return records;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Set<SpecPath> paths() {
        Set<SpecPath> paths = new LinkedHashSet<>();
        for (FailureRecord record : records) {
            paths.add(record.path());
        }
        return Set.copyOf(paths);
    }

    /**
     * Membership predicate over the failing paths, or empty when there is nothing to re-run. A failed
     * {@code afterAll} hook selects every example of its group, since the hook only runs with them.
     */
    public Optional<Predicate<SpecPath>> rerunPredicate() {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        Set<SpecPath> paths = paths();
        List<List<String>> hookGroups = new ArrayList<>();
        for (SpecPath path : paths) {
            if (path.isAfterAllHook()) {
                hookGroups.add(path.groups());
            }
        }
        return Optional.of(path -> paths.contains(path) || hookGroups.stream().anyMatch(path::isWithin));
    }
}
