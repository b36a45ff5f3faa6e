package org.specrun.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.specrun.clock.MonotonicClock;
import org.specrun.format.AbstractFormatter;
import org.specrun.format.FailedExample;
import org.specrun.format.FormatOutput;
import org.specrun.format.RunProgress;
import org.specrun.obs.CorrelationContext;
import org.specrun.obs.JsonLinesLogger;
import org.specrun.result.ExampleFailedException;
import org.specrun.result.FailureKind;
import org.specrun.result.FailureReason;
import org.specrun.result.PendingException;
import org.specrun.result.Summary;
import org.specrun.tree.ExampleParams;
import org.specrun.tree.SpecBuilder;
import org.specrun.tree.SpecPath;
import org.specrun.tree.SpecTree;
import org.specrun.tree.SpecTrees;

class ExecutionEngineTest {
    @Test
    void reportsPassAndFailInTreeOrder() {
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("A", a -> {
            a.it("passes", () -> { });
            a.it("fails", () -> {
                throw new ExampleFailedException("nope");
            });
        }));
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).formatter(formatter).execute();

        assertEquals(new Summary(2, 1), summary);
        assertEquals(
            List.of(
                "runStarted",
                "groupStarted [] A",
                "exampleStarted A/passes",
                "succeeded A/passes",
                "exampleStarted A/fails",
                "failed#1 A/fails",
                "groupDone",
                "runDone Summary{examples=2, failures=1}"),
            formatter.events);
        FailedExample failure = formatter.failures.get(0);
        assertEquals("nope", failure.result().failureReason().orElseThrow().message().orElseThrow());
        assertEquals("ExecutionEngineTest.java", failure.result().location().orElseThrow().file());
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void timeoutFailsSlowExampleWithoutWaitingForIt() {
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.it("slow", () -> Thread.sleep(1_000L)));
        RecordingFormatter formatter = new RecordingFormatter();
        long startedAt = System.nanoTime();

        Summary summary = new EngineRun(forest).timeout(Duration.ofMillis(10)).formatter(formatter).execute();

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        assertEquals(new Summary(1, 1), summary);
        FailureReason reason = formatter.failures.get(0).result().failureReason().orElseThrow();
        assertEquals(FailureKind.TIMEOUT_EXCEEDED, reason.kind());
        assertEquals(Duration.ofMillis(10), reason.timeout().orElseThrow());
        assertTrue(elapsedMillis < 900, "run took " + elapsedMillis + "ms");
    }

    @Test
    void examplesWithinTimeoutPass() {
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.it("fast", () -> { }));

        assertEquals(new Summary(1, 0), new EngineRun(forest).timeout(Duration.ofSeconds(5)).execute());
    }

    @Test
    void eachHooksWrapEveryExampleInNestingOrder() {
        List<String> trace = Collections.synchronizedList(new ArrayList<>());
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("outer", outer -> {
            outer.around(next -> {
                trace.add("outer around in");
                next.run();
                trace.add("outer around out");
            });
            outer.beforeEach(() -> trace.add("outer before"));
            outer.afterEach(() -> trace.add("outer after"));
            outer.describe("inner", inner -> {
                inner.beforeEach(() -> trace.add("inner before"));
                inner.afterEach(() -> trace.add("inner after"));
                inner.it("body", () -> trace.add("body"));
            });
        }));

        new EngineRun(forest).execute();

        assertEquals(
            List.of(
                "outer around in",
                "outer before",
                "inner before",
                "body",
                "inner after",
                "outer after",
                "outer around out"),
            trace);
    }

    @Test
    void eachHooksRunOncePerExample() {
        AtomicInteger before = new AtomicInteger();
        AtomicInteger after = new AtomicInteger();
        AtomicInteger around = new AtomicInteger();
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("G", group -> {
            group.beforeEach(before::incrementAndGet);
            group.afterEach(after::incrementAndGet);
            group.around(next -> {
                around.incrementAndGet();
                next.run();
            });
            group.it("one", () -> { });
            group.it("two", () -> {
                throw new IllegalStateException("boom");
            });
            group.it("three", () -> { });
        }));

        Summary summary = new EngineRun(forest).execute();

        assertEquals(new Summary(3, 1), summary);
        assertEquals(3, before.get());
        assertEquals(3, after.get());
        assertEquals(3, around.get());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void beforeAllAndAfterAllRunExactlyOnceUnderConcurrency() {
        AtomicInteger beforeAll = new AtomicInteger();
        AtomicInteger afterAll = new AtomicInteger();
        AtomicInteger finished = new AtomicInteger();
        AtomicInteger finishedWhenAfterAllRan = new AtomicInteger(-1);
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("shared", group -> {
            group.beforeAll(() -> {
                Thread.sleep(20L);
                beforeAll.incrementAndGet();
            });
            group.afterAll(() -> {
                afterAll.incrementAndGet();
                finishedWhenAfterAllRan.set(finished.get());
            });
            for (int index = 0; index < 20; index++) {
                group.it("example " + index, () -> {
                    assertEquals(1, beforeAll.get());
                    Thread.sleep(ThreadLocalRandom.current().nextInt(5));
                    finished.incrementAndGet();
                });
            }
        }));

        Summary summary = new EngineRun(forest).concurrency(4).execute();

        assertEquals(new Summary(20, 0), summary);
        assertEquals(1, beforeAll.get());
        assertEquals(1, afterAll.get());
        assertEquals(20, finishedWhenAfterAllRan.get());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void concurrentRunKeepsTreeOrderAndExactCounts() {
        List<SpecTree> forest = SpecBuilder.specs(spec -> {
            for (int group = 0; group < 5; group++) {
                int groupIndex = group;
                spec.describe("group " + group, builder -> {
                    for (int example = 0; example < 20; example++) {
                        int exampleIndex = example;
                        builder.it("example " + example, () -> {
                            Thread.sleep(ThreadLocalRandom.current().nextInt(3));
                            if ((groupIndex * 20 + exampleIndex) % 3 == 0) {
                                throw new ExampleFailedException("divisible by three");
                            }
                        });
                    }
                });
            }
        });
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).concurrency(8).formatter(formatter).execute();

        assertEquals(new Summary(100, 34), summary);
        assertEquals(SpecTrees.paths(forest), formatter.startedPaths);
    }

    @Test
    void aroundHookThatSkipsTheExampleFails() {
        AtomicInteger body = new AtomicInteger();
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("G", group -> {
            group.around(next -> { });
            group.it("never runs", body::incrementAndGet);
        }));
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).formatter(formatter).execute();

        assertEquals(new Summary(1, 1), summary);
        assertEquals(0, body.get());
        assertEquals(
            ExampleEvaluator.AROUND_SKIPPED_MESSAGE,
            formatter.failures.get(0).result().failureReason().orElseThrow().message().orElseThrow());
    }

    @Test
    void aroundHookRunningTheExampleTwiceStillCountsOnce() {
        AtomicInteger body = new AtomicInteger();
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("G", group -> {
            group.around(next -> {
                next.run();
                next.run();
            });
            group.it("twice", () -> {
                if (body.incrementAndGet() == 2) {
                    throw new ExampleFailedException("second run failed");
                }
            });
        }));

        Summary summary = new EngineRun(forest).execute();

        assertEquals(2, body.get());
        assertEquals(new Summary(1, 1), summary);
    }

    @Test
    void beforeEachFaultStillRunsAfterEachAndStaysPrimary() {
        AtomicInteger body = new AtomicInteger();
        AtomicInteger afterEach = new AtomicInteger();
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("G", group -> {
            group.beforeEach(() -> {
                throw new IllegalStateException("fixture missing");
            });
            group.afterEach(() -> {
                afterEach.incrementAndGet();
                throw new IllegalArgumentException("nothing to release");
            });
            group.it("uses fixture", body::incrementAndGet);
        }));
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).formatter(formatter).execute();

        assertEquals(new Summary(1, 1), summary);
        assertEquals(0, body.get());
        assertEquals(1, afterEach.get());
        FailedExample failure = formatter.failures.get(0);
        FailureReason reason = failure.result().failureReason().orElseThrow();
        assertEquals(FailureKind.FAULT, reason.kind());
        assertEquals("fixture missing", reason.fault().orElseThrow().getMessage());
        assertEquals(1, failure.result().secondaryFaults().size());
        assertEquals("nothing to release", failure.result().secondaryFaults().get(0).getMessage());
    }

    @Test
    void aroundHookFaultAfterTheExampleRanIsAppended() {
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("G", group -> {
            group.around(next -> {
                next.run();
                throw new IllegalStateException("transaction rollback failed");
            });
            group.it("fails", () -> {
                throw new ExampleFailedException("primary");
            });
            group.it("passes", () -> { });
        }));
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).formatter(formatter).execute();

        assertEquals(new Summary(2, 2), summary);
        FailedExample primary = formatter.failures.get(0);
        assertEquals("primary", primary.result().failureReason().orElseThrow().message().orElseThrow());
        assertEquals("transaction rollback failed", primary.result().secondaryFaults().get(0).getMessage());
        FailedExample hookOnly = formatter.failures.get(1);
        assertEquals(FailureKind.FAULT, hookOnly.result().failureReason().orElseThrow().kind());
        assertEquals(
            "transaction rollback failed",
            hookOnly.result().failureReason().orElseThrow().fault().orElseThrow().getMessage());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void exampleStartedIsReportedWhileTheExampleIsRunning() {
        CountDownLatch announced = new CountDownLatch(1);
        AtomicBoolean announcedBeforeBodyFinished = new AtomicBoolean();
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.it("slow", () ->
            announcedBeforeBodyFinished.set(announced.await(5, TimeUnit.SECONDS))));
        AbstractFormatter formatter = new AbstractFormatter() {
            @Override
            public String name() {
                return "announcing";
            }

            @Override
            public void exampleStarted(FormatOutput out, SpecPath path) {
                announced.countDown();
            }
        };

        Summary summary = new EngineRun(forest).concurrency(1).formatter(formatter).execute();

        assertEquals(new Summary(1, 0), summary);
        assertTrue(announcedBeforeBodyFinished.get());
    }

    @Test
    void afterEachFaultIsAppendedToTheOriginalFailure() {
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("G", group -> {
            group.afterEach(() -> {
                throw new IllegalStateException("cleanup failed");
            });
            group.it("fails", () -> {
                throw new ExampleFailedException("primary");
            });
            group.it("passes", () -> { });
        }));
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).formatter(formatter).execute();

        assertEquals(new Summary(2, 2), summary);
        FailedExample primary = formatter.failures.get(0);
        assertEquals("primary", primary.result().failureReason().orElseThrow().message().orElseThrow());
        assertEquals("cleanup failed", primary.result().secondaryFaults().get(0).getMessage());
        FailedExample cleanupOnly = formatter.failures.get(1);
        assertEquals(FailureKind.FAULT, cleanupOnly.result().failureReason().orElseThrow().kind());
    }

    @Test
    void beforeAllFailureIsReplayedToEveryExampleAndSkipsAfterAll() {
        IllegalStateException setupError = new IllegalStateException("no database");
        AtomicInteger beforeAll = new AtomicInteger();
        AtomicInteger afterAll = new AtomicInteger();
        AtomicInteger body = new AtomicInteger();
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("db", group -> {
            group.beforeAll(() -> {
                beforeAll.incrementAndGet();
                throw setupError;
            });
            group.afterAll(afterAll::incrementAndGet);
            group.it("reads", body::incrementAndGet);
            group.it("writes", body::incrementAndGet);
        }));
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).concurrency(2).formatter(formatter).execute();

        assertEquals(new Summary(2, 2), summary);
        assertEquals(1, beforeAll.get());
        assertEquals(0, afterAll.get());
        assertEquals(0, body.get());
        for (FailedExample failure : formatter.failures) {
            assertSame(setupError, failure.result().failureReason().orElseThrow().fault().orElseThrow());
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void slowFailingBeforeAllIsSharedByConcurrentWaiters() {
        AtomicInteger beforeAll = new AtomicInteger();
        AtomicInteger afterAll = new AtomicInteger();
        AtomicInteger body = new AtomicInteger();
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("slow setup", group -> {
            group.beforeAll(() -> {
                beforeAll.incrementAndGet();
                Thread.sleep(100L);
                throw new IllegalStateException("database unavailable");
            });
            group.afterAll(afterAll::incrementAndGet);
            for (int index = 0; index < 8; index++) {
                group.it("query " + index, body::incrementAndGet);
            }
        }));
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).concurrency(4).formatter(formatter).execute();

        assertEquals(new Summary(8, 8), summary);
        assertEquals(1, beforeAll.get());
        assertEquals(0, afterAll.get());
        assertEquals(0, body.get());
        Throwable shared = formatter.failures.get(0).result().failureReason().orElseThrow().fault().orElseThrow();
        assertEquals("database unavailable", shared.getMessage());
        for (FailedExample failure : formatter.failures) {
            assertSame(shared, failure.result().failureReason().orElseThrow().fault().orElseThrow());
        }
    }

    @Test
    void afterAllFailureIsReportedAsPseudoExample() {
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("G", group -> {
            group.afterAll(() -> {
                throw new IllegalStateException("teardown failed");
            });
            group.it("works", () -> { });
        }));
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).formatter(formatter).execute();

        assertEquals(new Summary(2, 1), summary);
        assertEquals(
            List.of(
                "runStarted",
                "groupStarted [] G",
                "exampleStarted G/works",
                "succeeded G/works",
                "exampleStarted G/afterAll-hook",
                "failed#1 G/afterAll-hook",
                "groupDone",
                "runDone Summary{examples=2, failures=1}"),
            formatter.events);
    }

    @Test
    void fastFailStopsDispatchAfterFirstFailure() {
        AtomicInteger later = new AtomicInteger();
        List<SpecTree> forest = SpecBuilder.specs(spec -> {
            spec.describe("A", a -> a.it("fails", () -> {
                throw new ExampleFailedException("stop here");
            }));
            spec.describe("B", b -> {
                b.it("one", later::incrementAndGet);
                b.it("two", later::incrementAndGet);
            });
        });
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).fastFail(true).formatter(formatter).execute();

        assertEquals(new Summary(1, 1), summary);
        assertEquals(0, later.get());
        assertTrue(formatter.events.stream().noneMatch(event -> event.contains("B")), formatter.events.toString());
    }

    @Test
    void dryRunReportsSuccessWithoutRunningAnything() {
        AtomicInteger calls = new AtomicInteger();
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("G", group -> {
            group.beforeAll(calls::incrementAndGet);
            group.beforeEach(calls::incrementAndGet);
            group.afterAll(calls::incrementAndGet);
            group.it("would fail", () -> {
                throw new ExampleFailedException("not evaluated");
            });
            group.it("would count", calls::incrementAndGet);
        }));

        Summary summary = new EngineRun(forest).dryRun(true).execute();

        assertEquals(new Summary(2, 0), summary);
        assertEquals(0, calls.get());
    }

    @Test
    void pendingIsCountedButNotFailed() {
        List<SpecTree> forest = SpecBuilder.specs(spec -> {
            spec.it("thrown pending", () -> {
                throw new PendingException("needs fixture");
            });
            spec.pending("declared pending", "later");
        });
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).formatter(formatter).execute();

        assertEquals(new Summary(2, 0), summary);
        assertTrue(formatter.events.contains("pending thrown pending: needs fixture"), formatter.events.toString());
        assertTrue(formatter.events.contains("pending declared pending: later"), formatter.events.toString());
    }

    @Test
    void emptyGroupsEmitNothing() {
        List<SpecTree> forest = SpecBuilder.specs(spec -> spec.describe("empty", group -> { }));
        RecordingFormatter formatter = new RecordingFormatter();

        Summary summary = new EngineRun(forest).formatter(formatter).execute();

        assertEquals(Summary.EMPTY, summary);
        assertEquals(List.of("runStarted", "runDone Summary{examples=0, failures=0}"), formatter.events);
    }

    private static final class EngineRun {
        private final List<SpecTree> forest;
        private int concurrency = 1;
        private boolean fastFail;
        private boolean dryRun;
        private Duration timeout;
        private AbstractFormatter formatter = new RecordingFormatter();

        private EngineRun(List<SpecTree> forest) {
            this.forest = forest;
        }

        EngineRun concurrency(int value) {
            concurrency = value;
            return this;
        }

        EngineRun fastFail(boolean value) {
            fastFail = value;
            return this;
        }

        EngineRun dryRun(boolean value) {
            dryRun = value;
            return this;
        }

        EngineRun timeout(Duration value) {
            timeout = value;
            return this;
        }

        EngineRun formatter(AbstractFormatter value) {
            formatter = value;
            return this;
        }

        Summary execute() {
            RunProgress progress = new RunProgress();
            FormatOutput out = new FormatOutput(new StringBuilder(), false, false, MonotonicClock.system(), 1L, progress);
            return new ExecutionEngine(
                concurrency,
                fastFail,
                dryRun,
                timeout,
                ExampleParams.withSeed(1L),
                formatter,
                out,
                progress,
                MonotonicClock.system(),
                JsonLinesLogger.noop(),
                CorrelationContext.of("test-run", "run")).execute(forest);
        }
    }

    private static final class RecordingFormatter extends AbstractFormatter {
        private final List<String> events = new ArrayList<>();
        private final List<SpecPath> startedPaths = new ArrayList<>();
        private final List<FailedExample> failures = new ArrayList<>();

        @Override
        public String name() {
            return "recording";
        }

        @Override
        public void runStarted(FormatOutput out) {
            events.add("runStarted");
        }

        @Override
        public void groupStarted(FormatOutput out, List<String> parentLabels, String label) {
            events.add("groupStarted " + parentLabels + " " + label);
        }

        @Override
        public void groupDone(FormatOutput out) {
            events.add("groupDone");
        }

        @Override
        public void exampleStarted(FormatOutput out, SpecPath path) {
            startedPaths.add(path);
            events.add("exampleStarted " + path.render());
        }

        @Override
        public void exampleSucceeded(FormatOutput out, SpecPath path, Duration duration) {
            events.add("succeeded " + path.render());
        }

        @Override
        public void exampleFailed(FormatOutput out, FailedExample failure, Duration duration) {
            failures.add(failure);
            events.add("failed#" + failure.number() + " " + failure.path().render());
        }

        @Override
        public void examplePending(FormatOutput out, SpecPath path, Optional<String> reason) {
            events.add("pending " + path.requirement() + ": " + reason.orElse(""));
        }

        @Override
        public void runDone(FormatOutput out, Summary summary) {
            events.add("runDone " + summary);
        }
    }
}
