package org.specrun.report;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.specrun.obs.CorrelationContext;
import org.specrun.obs.JsonLinesLogger;
import org.specrun.tree.ExampleParams;
import org.specrun.tree.SpecPath;

/**
 * Reads and writes the failure report file.
 *
 * <p>Reading never fails: a missing, unreadable or malformed file is reported as an empty report so a
 * re-run degrades to running everything.
 */
public final class FailureReportStore {
    static final int FORMAT_VERSION = 1;

    private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
            .outputMode(JsonMode.RELAXED)
            .indent(true)
            .build();

    private final Path location;
    private final JsonLinesLogger logger;
    private final CorrelationContext correlation;

    public FailureReportStore(final Path location) {
        this(location, JsonLinesLogger.noop(), CorrelationContext.of("standalone", "failureReport"));
    }

    public FailureReportStore(final Path location, final JsonLinesLogger logger, final CorrelationContext correlation) {
        this.location = Objects.requireNonNull(location, "location").normalize();
        this.logger = Objects.requireNonNull(logger, "logger");
        this.correlation = Objects.requireNonNull(correlation, "correlation").withPhase("failureReport");
    }

    public Path location() {
        return location;
    }

    public void write(final FailureReport report) {
        Objects.requireNonNull(report, "report");
        final String json = toDocument(report).toJson(JSON_SETTINGS);
        try {
            final Path parent = location.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            final Path temp = location.resolveSibling(location.getFileName() + ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            Files.move(temp, location, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException e) {
            throw new UncheckedIOException("failed to write failure report " + location, e);
        }
        logger.info(
                "failureReport.write",
                correlation,
                Map.of("location", location.toString(), "failures", report.records().size()));
    }

    public FailureReport read() {
        final String content;
        try {
            content = Files.readString(location, StandardCharsets.UTF_8);
        } catch (final NoSuchFileException e) {
            return FailureReport.empty();
        } catch (final IOException | UncheckedIOException e) {
            degraded("unreadable", e);
            return FailureReport.empty();
        }
        try {
            final FailureReport report = fromDocument(Document.parse(content));
            logger.info(
                    "failureReport.read",
                    correlation,
                    Map.of("location", location.toString(), "failures", report.records().size()));
            return report;
        } catch (final RuntimeException e) {
            // any decoding problem, including non-object JSON rejected by the codec
            degraded("malformed", e);
            return FailureReport.empty();
        }
    }

    static Document toDocument(final FailureReport report) {
        final Document root = new Document("version", FORMAT_VERSION);
        report.params().ifPresent(params -> root
                .append("seed", params.seed())
                .append("maxSuccess", params.maxSuccess())
                .append("maxSize", params.maxSize())
                .append("maxDiscardRatio", params.maxDiscardRatio()));
        final List<Document> paths = new ArrayList<>(report.records().size());
        for (final FailureRecord record : report.records()) {
            final Document item = new Document("groups", record.path().groups())
                    .append("requirement", record.path().requirement());
            record.detail().ifPresent(detail -> item.append("detail", detail));
            paths.add(item);
        }
        root.append("paths", paths);
        return root;
    }

    static FailureReport fromDocument(final Document root) {
        final Object version = root.get("version");
        if (!(version instanceof Number number) || number.intValue() != FORMAT_VERSION) {
            throw new IllegalArgumentException("unsupported failure report version: " + version);
        }
        final ExampleParams params = root.containsKey("seed")
                ? new ExampleParams(
                        readLong(root, "seed"),
                        readInt(root, "maxSuccess"),
                        readInt(root, "maxSize"),
                        readInt(root, "maxDiscardRatio"))
                : null;
        final List<Document> items = root.getList("paths", Document.class);
        if (items == null) {
            throw new IllegalArgumentException("paths is required");
        }
        final List<FailureRecord> records = new ArrayList<>(items.size());
        for (final Document item : items) {
            final List<String> groups = item.getList("groups", String.class);
            final String requirement = item.getString("requirement");
            if (groups == null || requirement == null) {
                throw new IllegalArgumentException("path entries need groups and requirement");
            }
            records.add(new FailureRecord(new SpecPath(groups, requirement), item.getString("detail")));
        }
        return new FailureReport(params, records);
    }

    private static long readLong(final Document document, final String key) {
        final Object value = document.get(key);
        if (!(value instanceof Integer) && !(value instanceof Long)) {
            throw new IllegalArgumentException(key + " must be an integer");
        }
        return ((Number) value).longValue();
    }

    private static int readInt(final Document document, final String key) {
        final long value = readLong(document, key);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " is out of range: " + value);
        }
        return (int) value;
    }

    private void degraded(final String cause, final Exception error) {
        logger.warn(
                "failureReport.degraded",
                correlation,
                Map.of(
                        "location", location.toString(),
                        "cause", cause,
                        "error", error.getClass().getSimpleName() + ": " + error.getMessage()));
    }
}
