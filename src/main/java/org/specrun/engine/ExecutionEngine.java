package org.specrun.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import org.specrun.clock.MonotonicClock;
import org.specrun.format.FailedExample;
import org.specrun.format.FormatOutput;
import org.specrun.format.Formatter;
import org.specrun.format.RunProgress;
import org.specrun.obs.CorrelationContext;
import org.specrun.obs.JsonLinesLogger;
import org.specrun.result.FailureReason;
import org.specrun.result.Result;
import org.specrun.result.Summary;
import org.specrun.tree.ExampleParams;
import org.specrun.tree.HookAction;
import org.specrun.tree.SpecPath;
import org.specrun.tree.SpecTree;

/**
 * Runs an already filtered and ordered forest.
 *
 * <p>Examples are dispatched eagerly, in traversal order, onto a pool of {@code concurrency} workers.
 * A single reporting loop on the calling thread walks the plan in the same order. It announces an example
 * as soon as a worker picks it up and then waits for its outcome, so formatter events always follow tree
 * order regardless of which worker finishes first.
 */
final class ExecutionEngine {
    private final int concurrency;
    private final boolean fastFail;
    private final boolean dryRun;
    private final Duration timeout;
    private final ExampleParams params;
    private final Formatter formatter;
    private final FormatOutput out;
    private final RunProgress progress;
    private final MonotonicClock clock;
    private final JsonLinesLogger logger;
    private final CorrelationContext correlation;
    private final SummaryAccumulator summary = new SummaryAccumulator();
    private final AtomicBoolean failureObserved = new AtomicBoolean(false);

    ExecutionEngine(
        int concurrency,
        boolean fastFail,
        boolean dryRun,
        Duration timeout,
        ExampleParams params,
        Formatter formatter,
        FormatOutput out,
        RunProgress progress,
        MonotonicClock clock,
        JsonLinesLogger logger,
        CorrelationContext correlation
    ) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        this.concurrency = concurrency;
        this.fastFail = fastFail;
        this.dryRun = dryRun;
        this.timeout = timeout;
        this.params = Objects.requireNonNull(params, "params");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.out = Objects.requireNonNull(out, "out");
        this.progress = Objects.requireNonNull(progress, "progress");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.correlation = Objects.requireNonNull(correlation, "correlation").withPhase("execute");
    }

    Summary execute(List<SpecTree> forest) {
        ExecutionPlan plan = ExecutionPlan.of(forest);
        ExecutorService workers = Executors.newFixedThreadPool(concurrency, new DaemonThreadFactory("specrun-worker"));
        ExecutorService timedExecutor = timeout == null
            ? null
            : Executors.newCachedThreadPool(new DaemonThreadFactory("specrun-timed"));
        try {
            ExampleEvaluator evaluator =
                new ExampleEvaluator(params, timeout, dryRun, clock, timedExecutor, logger, correlation);
            formatter.runStarted(out);
            for (ExecutionPlan.PlannedExample planned : plan.examples()) {
                workers.execute(() -> dispatch(evaluator, planned));
            }
            report(plan.roots(), new ArrayList<>());
            Summary result = summary.summary();
            formatter.runDone(out, result);
            return result;
        } finally {
            workers.shutdownNow();
            if (timedExecutor != null) {
                timedExecutor.shutdownNow();
            }
        }
    }

    private void dispatch(ExampleEvaluator evaluator, ExecutionPlan.PlannedExample planned) {
        ExampleOutcome outcome;
        try {
            if (fastFail && failureObserved.get()) {
                planned.started().complete(false);
                outcome = ExampleOutcome.skipped(planned.path());
            } else {
                planned.started().complete(true);
                outcome = evaluator.evaluate(planned);
                record(outcome.result());
            }
        } catch (Throwable thrown) {
            // surfaces on the reporting thread
            planned.started().complete(true);
            planned.outcome().completeExceptionally(thrown);
            return;
        }
        planned.outcome().complete(outcome);
        List<GroupScope> scopes = planned.scopes();
        for (int index = scopes.size() - 1; index >= 0; index--) {
            GroupScope scope = scopes.get(index);
            if (scope.completeOne()) {
                runAfterAll(scope);
            }
        }
    }

    private void runAfterAll(GroupScope scope) {
        if (dryRun || !scope.isReady()) {
            scope.afterAllResult().complete(Optional.empty());
            return;
        }
        Result failure = null;
        for (HookAction hook : scope.group().hooks().afterAll()) {
            try {
                hook.run();
            } catch (Throwable thrown) {
                if (thrown instanceof VirtualMachineError) {
                    scope.afterAllResult().completeExceptionally(thrown);
                    return;
                }
                if (failure != null) {
                    failure = failure.withSecondaryFault(thrown);
                    continue;
                }
                Result mapped = Result.fromThrowable(thrown);
                failure = mapped.isFailure() ? mapped : Result.failure(FailureReason.fault(thrown));
            }
        }
        if (failure != null) {
            record(failure);
            logger.error(
                "example.fault.afterAll",
                correlation.withPath(scope.afterAllPath().render()),
                Map.of("reason", failure.failureReason().map(FailureReason::describe).orElse("")));
        }
        scope.afterAllResult().complete(Optional.ofNullable(failure));
    }

    private void record(Result result) {
        summary.add(result);
        if (result.isFailure()) {
            failureObserved.set(true);
        }
    }

    private void report(List<ExecutionPlan.Node> nodes, List<GroupFrame> frames) {
        for (ExecutionPlan.Node node : nodes) {
            if (node instanceof ExecutionPlan.PlannedExample planned) {
                if (await(planned.started())) {
                    openFrames(frames);
                    formatter.exampleStarted(out, planned.path());
                    ExampleOutcome outcome = await(planned.outcome());
                    emitOutcome(outcome.path(), outcome.result(), outcome.duration());
                } else {
                    await(planned.outcome());
                }
            } else if (node instanceof ExecutionPlan.PlannedGroup group) {
                GroupFrame frame = new GroupFrame(labelsOf(frames), group.scope().group().label());
                frames.add(frame);
                report(group.children(), frames);
                Optional<Result> afterAll = await(group.scope().afterAllResult());
                if (afterAll.isPresent()) {
                    openFrames(frames);
                    formatter.exampleStarted(out, group.scope().afterAllPath());
                    emitOutcome(group.scope().afterAllPath(), afterAll.get(), Duration.ZERO);
                }
                frames.remove(frames.size() - 1);
                if (frame.opened) {
                    formatter.groupDone(out);
                }
            }
        }
    }

    private void emitOutcome(SpecPath path, Result result, Duration duration) {
        switch (result.status()) {
            case SUCCESS -> {
                progress.recordSuccess();
                formatter.exampleSucceeded(out, path, duration);
            }
            case PENDING -> {
                progress.recordPending();
                formatter.examplePending(out, path, result.pendingReason());
            }
            case FAILURE -> {
                FailedExample failed = progress.recordFailure(path, result);
                formatter.exampleFailed(out, failed, duration);
            }
        }
    }

    // groups are announced only once something inside them is reported
    private void openFrames(List<GroupFrame> frames) {
        for (GroupFrame frame : frames) {
            if (!frame.opened) {
                formatter.groupStarted(out, frame.parentLabels, frame.label);
                frame.opened = true;
            }
        }
    }

    private static List<String> labelsOf(List<GroupFrame> frames) {
        List<String> labels = new ArrayList<>(frames.size());
        for (GroupFrame frame : frames) {
            labels.add(frame.label);
        }
        return List.copyOf(labels);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SpecRunException("interrupted while waiting for examples", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            throw new SpecRunException("example execution failed", cause);
        }
    }

    private static final class GroupFrame {
        private final List<String> parentLabels;
        private final String label;
        private boolean opened;

        private GroupFrame(List<String> parentLabels, String label) {
            this.parentLabels = parentLabels;
            this.label = label;
        }
    }
}
