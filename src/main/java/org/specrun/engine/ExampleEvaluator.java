package org.specrun.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.specrun.clock.MonotonicClock;
import org.specrun.clock.MonotonicInstant;
import org.specrun.obs.CorrelationContext;
import org.specrun.obs.JsonLinesLogger;
import org.specrun.result.FailureReason;
import org.specrun.result.Result;
import org.specrun.tree.AroundHook;
import org.specrun.tree.ExampleParams;
import org.specrun.tree.HookAction;
import org.specrun.tree.Hooks;
import org.specrun.tree.SpecExample;

/**
 * Evaluates one example: group initialization, then the hook chain around the action, optionally raced
 * against a timeout.
 */
final class ExampleEvaluator {
    static final String AROUND_SKIPPED_MESSAGE = "around hook did not run the example";

    @FunctionalInterface
    private interface Step {
        Result run();
    }

    private final ExampleParams params;
    private final Duration timeout;
    private final boolean dryRun;
    private final MonotonicClock clock;
    private final ExecutorService timedExecutor;
    private final JsonLinesLogger logger;
    private final CorrelationContext correlation;

    ExampleEvaluator(
        ExampleParams params,
        Duration timeout,
        boolean dryRun,
        MonotonicClock clock,
        ExecutorService timedExecutor,
        JsonLinesLogger logger,
        CorrelationContext correlation
    ) {
        this.params = Objects.requireNonNull(params, "params");
        this.timeout = timeout;
        this.dryRun = dryRun;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timedExecutor = timeout == null ? timedExecutor : Objects.requireNonNull(timedExecutor, "timedExecutor");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.correlation = Objects.requireNonNull(correlation, "correlation");
    }

    ExampleOutcome evaluate(ExecutionPlan.PlannedExample planned) {
        MonotonicInstant startedAt = clock.now();
        if (dryRun) {
            return ExampleOutcome.evaluated(planned.path(), Result.success(), Duration.ZERO);
        }
        Result result = initializeScopes(planned.scopes()).orElseGet(() -> timeout == null
            ? chain(planned).run()
            : race(planned));
        return ExampleOutcome.evaluated(planned.path(), result, startedAt.durationUntil(clock.now()));
    }

    private static Optional<Result> initializeScopes(List<GroupScope> scopes) {
        for (GroupScope scope : scopes) {
            Optional<Throwable> failure = scope.initialize();
            if (failure.isPresent()) {
                return Optional.of(Result.failure(FailureReason.fault(failure.get())));
            }
        }
        return Optional.empty();
    }

    // a timed-out computation is interrupted and left behind; its result is discarded
    private Result race(ExecutionPlan.PlannedExample planned) {
        Step step = chain(planned);
        Future<Result> future = timedExecutor.submit(step::run);
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn(
                "example.timeout",
                correlation.withPath(planned.path().render()),
                Map.of("timeoutMs", timeout.toMillis()));
            return Result.failure(FailureReason.timeoutExceeded(timeout));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            Faults.rethrowIfFatal(cause);
            return Result.fromThrowable(cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Result.fromThrowable(e);
        }
    }

    private Step chain(ExecutionPlan.PlannedExample planned) {
        SpecExample example = planned.example();
        Step step = () -> runAction(example);
        List<GroupScope> scopes = planned.scopes();
        for (int index = scopes.size() - 1; index >= 0; index--) {
            step = wrap(scopes.get(index).group().hooks(), step);
        }
        return step;
    }

    private Result runAction(SpecExample example) {
        Result result;
        try {
            result = example.action().evaluate(params);
            if (result == null) {
                result = Result.success();
            }
        } catch (Throwable thrown) {
            Faults.rethrowIfFatal(thrown);
            result = Result.fromThrowable(thrown);
        }
        return result.withLocationIfAbsent(example.location().orElse(null));
    }

    private static Step wrap(Hooks hooks, Step inner) {
        if (hooks.beforeEach().isEmpty() && hooks.afterEach().isEmpty() && hooks.around().isEmpty()) {
            return inner;
        }
        Step step = () -> eachHooks(hooks, inner);
        List<AroundHook> around = hooks.around();
        for (int index = around.size() - 1; index >= 0; index--) {
            step = aroundHook(around.get(index), step);
        }
        return step;
    }

    private static Result eachHooks(Hooks hooks, Step inner) {
        Result result;
        try {
            for (HookAction hook : hooks.beforeEach()) {
                hook.run();
            }
            result = inner.run();
        } catch (Throwable thrown) {
            Faults.rethrowIfFatal(thrown);
            result = Result.fromThrowable(thrown);
        }
        for (HookAction hook : hooks.afterEach()) {
            try {
                hook.run();
            } catch (Throwable thrown) {
                Faults.rethrowIfFatal(thrown);
                result = result.withSecondaryFault(thrown);
            }
        }
        return result;
    }

    private static Step aroundHook(AroundHook hook, Step inner) {
        return () -> {
            List<Result> runs = new ArrayList<>();
            Throwable hookFault = null;
            try {
                hook.around(() -> runs.add(inner.run()));
            } catch (Throwable thrown) {
                Faults.rethrowIfFatal(thrown);
                hookFault = thrown;
            }
            Result result = null;
            for (Result run : runs) {
                result = result == null ? run : result.worse(run);
            }
            if (result == null) {
                return hookFault == null ? Result.failure(AROUND_SKIPPED_MESSAGE) : Result.fromThrowable(hookFault);
            }
            return hookFault == null ? result : result.withSecondaryFault(hookFault);
        };
    }
}
