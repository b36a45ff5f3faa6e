package org.specrun.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * JSON-lines logger for run diagnostics. Keys are written in sorted order.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .build();

    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.closed = false;
    }

    /**
     * Appends to the given file, creating parent directories as needed.
     */
    public static StructuredJsonLinesLogger appendingTo(Path file) {
        Objects.requireNonNull(file, "file");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Writer writer = Files.newBufferedWriter(
                file,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND);
            return new StructuredJsonLinesLogger(writer, Clock.systemUTC(), true);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open diagnostics log " + file, e);
        }
    }

    @Override
    public synchronized void log(
        String level,
        String message,
        CorrelationContext correlationContext,
        Map<String, ?> fields
    ) {
        ensureOpen();
        CorrelationContext safeCorrelation = Objects.requireNonNull(correlationContext, "correlationContext");
        Map<String, ?> safeFields = fields == null ? Map.of() : fields;

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", normalizeLevel(level));
        event.put("message", message == null ? "" : message);
        event.putAll(safeCorrelation.asFields());
        for (Map.Entry<String, ?> entry : safeFields.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank() || event.containsKey(key)) {
                continue;
            }
            event.put(key, entry.getValue());
        }

        writeLine(new Document(toDocumentValues(event)).toJson(JSON_SETTINGS));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return "INFO";
        }
        return level.trim().toUpperCase();
    }

    private static Map<String, Object> toDocumentValues(Map<?, ?> source) {
        Map<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            sorted.put(String.valueOf(entry.getKey()), toDocumentValue(entry.getValue()));
        }
        return sorted;
    }

    private static Object toDocumentValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
            || value instanceof Integer || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Number number) {
            return number.toString();
        }
        if (value instanceof Map<?, ?> map) {
            return new Document(toDocumentValues(map));
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(toDocumentValue(item));
            }
            return items;
        }
        return String.valueOf(value);
    }
}
