package org.specrun.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import org.specrun.tree.ExampleParams;
import org.specrun.tree.SpecFilter;
import org.specrun.tree.SpecPath;

/**
 * Options consumed by the runner. Produced by {@link RunnerConfigLoader} or by whatever parses the
 * command line.
 */
public record RunnerConfig(
        int concurrency,
        Long seed,
        boolean randomize,
        Duration timeout,
        ColorMode colorMode,
        boolean fastFail,
        Predicate<SpecPath> filter,
        boolean rerun,
        String formatter,
        Path failureReportPath,
        boolean writeFailureReport,
        boolean dryRun,
        boolean diff,
        int maxSuccess,
        int maxSize,
        int maxDiscardRatio,
        Path diagnosticsLog) {
    public static final String DEFAULT_FORMATTER = "specdoc";
    public static final Path DEFAULT_FAILURE_REPORT = Path.of(".specrun-failures");

    public RunnerConfig {
        if (concurrency < 1) {
            throw new ConfigurationException("concurrency must be >= 1");
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new ConfigurationException("timeout must be > 0");
        }
        colorMode = Objects.requireNonNull(colorMode, "colorMode");
        formatter = requireText(formatter, "formatter");
        failureReportPath = Objects.requireNonNull(failureReportPath, "failureReportPath").normalize();
        if (maxSuccess <= 0 || maxSize <= 0 || maxDiscardRatio <= 0) {
            throw new ConfigurationException("max-success, max-size and max-discard-ratio must be > 0");
        }
        if (diagnosticsLog != null) {
            diagnosticsLog = diagnosticsLog.normalize();
        }
    }

    public static RunnerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public Optional<Long> seedOption() {
        return Optional.ofNullable(seed);
    }

    public Optional<Duration> timeoutOption() {
        return Optional.ofNullable(timeout);
    }

    public Optional<Predicate<SpecPath>> filterOption() {
        return Optional.ofNullable(filter);
    }

    /**
     * Adds a predicate; an example runs when it matches this or any previously configured predicate.
     */
    public RunnerConfig addFilter(Predicate<SpecPath> predicate) {
        return toBuilder().filter(SpecFilter.or(Objects.requireNonNull(predicate, "predicate"), filter)).build();
    }

    public ExampleParams exampleParams(long runSeed) {
        return new ExampleParams(runSeed, maxSuccess, maxSize, maxDiscardRatio);
    }

    /**
     * Checks constraints that depend on the file system. Fatal when violated.
     */
    public void validateEnvironment() {
        if (Files.isDirectory(failureReportPath)) {
            throw new ConfigurationException("failure report path is a directory: " + failureReportPath);
        }
        if (diagnosticsLog != null && Files.isDirectory(diagnosticsLog)) {
            throw new ConfigurationException("diagnostics log path is a directory: " + diagnosticsLog);
        }
        if (rerun && dryRun) {
            throw new ConfigurationException("rerun and dry-run cannot be combined");
        }
    }

    private static String requireText(String value, String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException(fieldName + " must not be blank");
        }
        return value.trim();
    }

    public static final class Builder {
        private int concurrency = 1;
        private Long seed;
        private boolean randomize;
        private Duration timeout;
        private ColorMode colorMode = ColorMode.AUTO;
        private boolean fastFail;
        private Predicate<SpecPath> filter;
        private boolean rerun;
        private String formatter = DEFAULT_FORMATTER;
        private Path failureReportPath = DEFAULT_FAILURE_REPORT;
        private boolean writeFailureReport = true;
        private boolean dryRun;
        private boolean diff = true;
        private int maxSuccess = ExampleParams.DEFAULT_MAX_SUCCESS;
        private int maxSize = ExampleParams.DEFAULT_MAX_SIZE;
        private int maxDiscardRatio = ExampleParams.DEFAULT_MAX_DISCARD_RATIO;
        private Path diagnosticsLog;

        private Builder() {
        }

        private Builder(RunnerConfig config) {
            this.concurrency = config.concurrency;
            this.seed = config.seed;
            this.randomize = config.randomize;
            this.timeout = config.timeout;
            this.colorMode = config.colorMode;
            this.fastFail = config.fastFail;
            this.filter = config.filter;
            this.rerun = config.rerun;
            this.formatter = config.formatter;
            this.failureReportPath = config.failureReportPath;
            this.writeFailureReport = config.writeFailureReport;
            this.dryRun = config.dryRun;
            this.diff = config.diff;
            this.maxSuccess = config.maxSuccess;
            this.maxSize = config.maxSize;
            this.maxDiscardRatio = config.maxDiscardRatio;
            this.diagnosticsLog = config.diagnosticsLog;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder randomize(boolean randomize) {
            this.randomize = randomize;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder colorMode(ColorMode colorMode) {
            this.colorMode = colorMode;
            return this;
        }

        public Builder fastFail(boolean fastFail) {
            this.fastFail = fastFail;
            return this;
        }

        public Builder filter(Predicate<SpecPath> filter) {
            this.filter = filter;
            return this;
        }

        public Builder rerun(boolean rerun) {
            this.rerun = rerun;
            return this;
        }

        public Builder formatter(String formatter) {
            this.formatter = formatter;
            return this;
        }

        public Builder failureReportPath(Path failureReportPath) {
            this.failureReportPath = failureReportPath;
            return this;
        }

        public Builder writeFailureReport(boolean writeFailureReport) {
            this.writeFailureReport = writeFailureReport;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder diff(boolean diff) {
            this.diff = diff;
            return this;
        }

        public Builder maxSuccess(int maxSuccess) {
            this.maxSuccess = maxSuccess;
            return this;
        }

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder maxDiscardRatio(int maxDiscardRatio) {
            this.maxDiscardRatio = maxDiscardRatio;
            return this;
        }

        public Builder diagnosticsLog(Path diagnosticsLog) {
            this.diagnosticsLog = diagnosticsLog;
            return this;
        }

        public RunnerConfig build() {
            return new RunnerConfig(
                concurrency,
                seed,
                randomize,
                timeout,
                colorMode,
                fastFail,
                filter,
                rerun,
                formatter,
                failureReportPath,
                writeFailureReport,
                dryRun,
                diff,
                maxSuccess,
                maxSize,
                maxDiscardRatio,
                diagnosticsLog);
        }
    }
}
