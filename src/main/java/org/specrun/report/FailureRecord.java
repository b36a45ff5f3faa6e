package org.specrun.report;

import java.util.Objects;
import java.util.Optional;
import org.specrun.tree.SpecPath;

/**
 * One failing example as persisted in the failure report.
 */
public final class FailureRecord {
    private final SpecPath path;
    private final String detail;

    public FailureRecord(SpecPath path, String detail) {
        this.path = Objects.requireNonNull(path, "path");
        this.detail = detail == null || detail.isBlank() ? null : detail.trim();
    }

    public SpecPath path() {
        return path;
    }

    public Optional<String> detail() {
        return Optional.ofNullable(detail);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FailureRecord that)) {
            return false;
        }
        return path.equals(that.path) && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, detail);
    }

    @Override
    public String toString() {
        return detail == null ? path.render() : path.render() + " (" + detail + ")";
    }
}
