package org.specrun.engine;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import org.specrun.clock.MonotonicClock;
import org.specrun.config.ColorMode;
import org.specrun.config.ConfigurationException;
import org.specrun.config.RunnerConfig;
import org.specrun.format.FailedExample;
import org.specrun.format.FormatOutput;
import org.specrun.format.Formatter;
import org.specrun.format.Formatters;
import org.specrun.format.RunProgress;
import org.specrun.obs.CorrelationContext;
import org.specrun.obs.JsonLinesLogger;
import org.specrun.obs.StructuredJsonLinesLogger;
import org.specrun.report.FailureRecord;
import org.specrun.report.FailureReport;
import org.specrun.report.FailureReportStore;
import org.specrun.result.Summary;
import org.specrun.tree.ExampleParams;
import org.specrun.tree.SpecFilter;
import org.specrun.tree.SpecPath;
import org.specrun.tree.SpecShuffler;
import org.specrun.tree.SpecTree;
import org.specrun.tree.SpecTrees;

/**
 * Entry point: applies re-run selection, filtering and ordering to a spec forest, runs it and persists
 * the failure report.
 */
public final class SpecRunner {
    private final Appendable sink;
    private final MonotonicClock clock;
    private final JsonLinesLogger logger;

    public SpecRunner() {
        this(System.out, MonotonicClock.system(), null);
    }

    /**
     * @param logger diagnostics logger owned by the caller, or {@code null} to derive one from
     *     {@link RunnerConfig#diagnosticsLog()}
     */
    public SpecRunner(final Appendable sink, final MonotonicClock clock, final JsonLinesLogger logger) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = logger;
    }

    /**
     * Runs the forest and exits the JVM with the run's exit status.
     */
    public static void runAndExit(final RunnerConfig config, final List<SpecTree> forest) {
        int status;
        try {
            status = new SpecRunner().run(config, forest).exitStatus().code();
        } catch (final ConfigurationException | SpecRunException exception) {
            System.out.flush();
            System.err.println("specrun: " + exception.getMessage());
            status = ExitStatus.FATAL.code();
        }
        System.exit(status);
    }

    public RunReport run(final RunnerConfig config, final List<SpecTree> forest) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(forest, "forest");
        config.validateEnvironment();
        final Formatter formatter = Formatters.byName(config.formatter());

        final boolean ownsLogger = logger == null && config.diagnosticsLog() != null;
        final JsonLinesLogger runLogger;
        try {
            runLogger = logger != null
                    ? logger
                    : ownsLogger ? StructuredJsonLinesLogger.appendingTo(config.diagnosticsLog()) : JsonLinesLogger.noop();
        } catch (final UncheckedIOException exception) {
            throw new SpecRunException("failed to open diagnostics log " + config.diagnosticsLog(), exception);
        }
        try {
            return run(config, forest, formatter, runLogger);
        } catch (final UncheckedIOException exception) {
            throw new SpecRunException("failed to write run output: " + exception.getMessage(), exception);
        } finally {
            if (ownsLogger) {
                runLogger.close();
            }
        }
    }

    private RunReport run(
            final RunnerConfig config,
            final List<SpecTree> forest,
            final Formatter formatter,
            final JsonLinesLogger runLogger) {
        final CorrelationContext baseCorrelation = CorrelationContext.of(UUID.randomUUID().toString(), "setup");
        final FailureReportStore store = new FailureReportStore(config.failureReportPath(), runLogger, baseCorrelation);

        RunnerConfig effective = config;
        Long rerunSeed = null;
        if (config.rerun()) {
            final FailureReport previous = store.read();
            final Optional<Predicate<SpecPath>> rerunPredicate = previous.rerunPredicate();
            if (rerunPredicate.isPresent()) {
                effective = effective.addFilter(rerunPredicate.get());
                rerunSeed = previous.params().map(ExampleParams::seed).orElse(null);
            }
        }

        List<SpecTree> selected = effective.filterOption()
                .map(predicate -> SpecFilter.filter(forest, predicate))
                .orElse(List.copyOf(forest));
        final Long reusedSeed = rerunSeed;
        final long seed = config.seedOption()
                .orElseGet(() -> reusedSeed != null ? reusedSeed : generateSeed());
        if (config.seed() != null || config.randomize()) {
            selected = SpecShuffler.shuffle(selected, seed);
        }

        final ExampleParams params = config.exampleParams(seed);
        final CorrelationContext correlation = CorrelationContext.builder(baseCorrelation.runId(), "run")
                .seed(seed)
                .build();
        final RunProgress progress = new RunProgress();
        final FormatOutput out =
                new FormatOutput(sink, useColor(config.colorMode()), config.diff(), clock, seed, progress);

        final Map<String, Object> startFields = new LinkedHashMap<>();
        startFields.put("examples", SpecTrees.countExamples(selected));
        startFields.put("concurrency", config.concurrency());
        startFields.put("formatter", formatter.name());
        startFields.put("rerun", config.rerun());
        startFields.put("dryRun", config.dryRun());
        runLogger.info("run.start", correlation, startFields);

        final ExecutionEngine engine = new ExecutionEngine(
                config.concurrency(),
                config.fastFail(),
                config.dryRun(),
                config.timeout(),
                params,
                formatter,
                out,
                progress,
                clock,
                runLogger,
                correlation);
        final Summary summary = engine.execute(selected);
        final List<FailedExample> failures = progress.failures();

        if (config.writeFailureReport()) {
            writeFailureReport(store, params, summary, failures, config.dryRun(), runLogger, correlation);
        }

        runLogger.info(
                "run.complete",
                correlation,
                Map.of(
                        "examples", summary.examples(),
                        "failures", summary.failures(),
                        "elapsedMs", out.elapsed().toMillis()));
        return new RunReport(summary, seed, progress.counts(), failures);
    }

    private static void writeFailureReport(
            final FailureReportStore store,
            final ExampleParams params,
            final Summary summary,
            final List<FailedExample> failures,
            final boolean dryRun,
            final JsonLinesLogger runLogger,
            final CorrelationContext correlation) {
        if (dryRun || summary.examples() == 0) {
            runLogger.info(
                    "failureReport.write.skipped",
                    correlation,
                    Map.of("reason", dryRun ? "dry-run" : "no examples evaluated"));
            return;
        }
        final List<FailureRecord> records = new ArrayList<>(failures.size());
        for (final FailedExample failure : failures) {
            records.add(new FailureRecord(failure.path(), failure.result().toString()));
        }
        try {
            store.write(new FailureReport(params, records));
        } catch (final UncheckedIOException exception) {
            throw new SpecRunException("failed to write failure report " + store.location(), exception);
        }
    }

    private boolean useColor(final ColorMode mode) {
        return switch (mode) {
            case ALWAYS -> true;
            case NEVER -> false;
            case AUTO -> sink == System.out && System.console() != null;
        };
    }

    private static long generateSeed() {
        return ThreadLocalRandom.current().nextLong(0, Integer.MAX_VALUE);
    }
}
