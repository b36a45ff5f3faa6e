package org.specrun.engine;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.specrun.result.Result;
import org.specrun.tree.HookAction;
import org.specrun.tree.SpecGroup;
import org.specrun.tree.SpecPath;

/**
 * Run-time state of one group: its beforeAll initializer and the countdown that triggers afterAll.
 */
final class GroupScope {

    private enum State {
        NEW,
        READY,
        FAILED
    }

    private final SpecGroup group;
    private final List<String> labels;
    private final AtomicInteger remaining;
    private final CompletableFuture<Optional<Result>> afterAllResult = new CompletableFuture<>();
    private State state = State.NEW;
    private Throwable initializationFailure;

    GroupScope(SpecGroup group, List<String> labels, int exampleCount) {
        this.group = Objects.requireNonNull(group, "group");
        this.labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
        if (exampleCount < 0) {
            throw new IllegalArgumentException("exampleCount must be >= 0");
        }
        this.remaining = new AtomicInteger(exampleCount);
        if (exampleCount == 0) {
            afterAllResult.complete(Optional.empty());
        }
    }

    SpecGroup group() {
        return group;
    }

    /**
     * Labels from the outermost group down to and including this one.
     */
    List<String> labels() {
        return labels;
    }

    SpecPath afterAllPath() {
        return SpecPath.afterAllHook(labels);
    }

    /**
     * Runs beforeAll hooks on first use; later callers block until they finish and then see the same
     * outcome.
     */
    synchronized Optional<Throwable> initialize() {
        if (state == State.NEW) {
            for (HookAction hook : group.hooks().beforeAll()) {
                try {
                    hook.run();
                } catch (Throwable thrown) {
                    Faults.rethrowIfFatal(thrown);
                    initializationFailure = thrown;
                    state = State.FAILED;
                    return Optional.of(thrown);
                }
            }
            state = State.READY;
        }
        return Optional.ofNullable(initializationFailure);
    }

    synchronized boolean isReady() {
        return state == State.READY;
    }

    /**
     * Returns true for the call that accounts for the last example of the group.
     */
    boolean completeOne() {
        return remaining.decrementAndGet() == 0;
    }

    CompletableFuture<Optional<Result>> afterAllResult() {
        return afterAllResult;
    }
}
