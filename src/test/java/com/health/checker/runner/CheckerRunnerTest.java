package com.health.checker.runner;

import com.health.checker.config.CheckerEngineConfig;
import com.health.checker.core.model.CheckResult;
import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerOverride;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.RegisteredChecker;
import com.health.checker.core.model.RunStatus;
import com.health.checker.core.model.Severity;
import com.health.checker.lock.LocalRunLock;
import com.health.checker.lock.LockAcquisitionException;
import com.health.checker.lock.LockConfig;
import com.health.checker.lock.RunLock;
import com.health.checker.metrics.NoOpCheckerMetrics;
import com.health.checker.notification.NotificationEscalator;
import com.health.checker.notification.NotificationSettings;
import com.health.checker.notification.RecordingTransport;
import com.health.checker.override.OverrideMatcher;
import com.health.checker.store.InMemoryCheckerStore;
import com.health.checker.transition.StatusTransitionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("CheckerRunner Tests")
class CheckerRunnerTest {

    private static final String ADMIN = "admins@example.com";

    private InMemoryCheckerStore store;
    private RecordingTransport transport;

    @BeforeEach
    void setUp() {
        store = spy(new InMemoryCheckerStore());
        transport = new RecordingTransport();
    }

    private CheckerRunner runner(RunLock lock) {
        Clock clock = Clock.systemUTC();
        NotificationEscalator escalator = new NotificationEscalator(store, transport,
                NotificationSettings.builder().adminEmails(List.of(ADMIN)).pagingEmail("oncall@example.com").build());
        return new CheckerRunner(store, new OverrideMatcher(store), new StatusTransitionEngine(store, clock),
                escalator, lock, new NoOpCheckerMetrics(), CheckerEngineConfig.defaults(), clock);
    }

    private CheckerRunner runner() {
        return runner(new LocalRunLock());
    }

    private static RegisteredChecker failingChecker(String name) {
        return RegisteredChecker.builder(name, () -> CheckResult.failures(CheckerFailure.of("Something is off")))
                .build();
    }

    private Checker stored(String name) {
        return store.findChecker(name).orElseThrow();
    }

    @Nested
    @DisplayName("Status and notifications")
    class StatusAndNotifications {

        @Test
        @DisplayName("Repeated failing runs notify once and keep FAILING")
        void basicCheckerScenario() {
            CheckerRunner runner = runner();
            RegisteredChecker basic = failingChecker("basic_checker");

            CheckerRun first = runner.run(basic);

            assertEquals(RunStatus.FAILED, first.status());
            assertNotNull(first.completionDate());
            assertEquals(CheckerStatus.FAILING, stored("basic_checker").getStatus());
            assertEquals(1, transport.emails().size());
            assertEquals(1, store.findFailures(first.id()).size());

            runner.run(basic);

            assertEquals(CheckerStatus.FAILING, stored("basic_checker").getStatus());
            assertEquals(1, transport.emails().size());
            assertEquals(1, transport.chats().size());
            assertEquals(2, store.findRuns(stored("basic_checker").getId()).size());
            assertEquals(1, store.findTransitions(stored("basic_checker").getId()).size());
        }

        @Test
        @DisplayName("Recovery after failing sends a recovery mail")
        void recoveryNotifies() {
            CheckerRunner runner = runner();
            AtomicBoolean healthy = new AtomicBoolean(false);
            RegisteredChecker checker = RegisteredChecker.builder("flappy", () -> healthy.get()
                    ? CheckResult.success()
                    : CheckResult.failures(CheckerFailure.of("Down"))).build();

            runner.run(checker);
            healthy.set(true);
            runner.run(checker);

            assertEquals(CheckerStatus.SUCCEEDING, stored("flappy").getStatus());
            assertEquals("flappy is now succeeding", transport.emails().get(1).subject());
        }

        @Test
        @DisplayName("Ignored checkers record runs but never change or notify")
        void ignoredCheckerIsSticky() {
            CheckerRunner runner = runner();
            Checker checker = store.getOrCreateChecker("ignored_one", "");
            checker.setStatus(CheckerStatus.IGNORED);
            store.updateChecker(checker);

            CheckerRun run = runner.run(failingChecker("ignored_one"));

            assertEquals(RunStatus.FAILED, run.status());
            assertEquals(CheckerStatus.IGNORED, stored("ignored_one").getStatus());
            assertTrue(store.findTransitions(checker.getId()).isEmpty());
            assertEquals(0, transport.total());
        }
    }

    @Nested
    @DisplayName("Operator changes during a run")
    class OperatorChanges {

        private void operatorUpdate(String name, Consumer<Checker> change) {
            Checker current = store.findChecker(name).orElseThrow();
            change.accept(current);
            store.updateChecker(current);
        }

        @Test
        @DisplayName("Ignoring a checker while it runs is kept and silences the outcome")
        void ignoreDuringRunIsKept() {
            CheckerRunner runner = runner();
            AtomicBoolean recovered = new AtomicBoolean(false);
            RegisteredChecker checker = RegisteredChecker.builder("flaky_feed", () -> {
                if (!recovered.get()) {
                    return CheckResult.failures(CheckerFailure.of("Feed is stale"));
                }
                operatorUpdate("flaky_feed", c -> c.setStatus(CheckerStatus.IGNORED));
                return CheckResult.success();
            }).build();
            runner.run(checker);
            assertEquals(CheckerStatus.FAILING, stored("flaky_feed").getStatus());
            int sentBefore = transport.total();

            recovered.set(true);
            runner.run(checker);

            assertEquals(CheckerStatus.IGNORED, stored("flaky_feed").getStatus());
            assertEquals(1, store.findTransitions(stored("flaky_feed").getId()).size());
            assertEquals(sentBefore, transport.total());
        }

        @Test
        @DisplayName("An owner assigned while the checker runs is kept and receives the error mail")
        void ownerAssignedDuringRunIsKept() {
            RegisteredChecker checker = RegisteredChecker.builder("owned_later", () -> {
                operatorUpdate("owned_later", c -> c.setOwner("owner@example.com"));
                throw new IllegalStateException("boom");
            }).build();

            runner().run(checker);

            assertEquals("owner@example.com", stored("owned_later").getOwner());
            assertEquals(1, transport.emailsTo("owner@example.com").size());
        }
    }

    @Nested
    @DisplayName("Retry loop")
    class RetryLoop {

        @Test
        @DisplayName("Transient failures that clear on retry end as SUCCEEDED")
        void transientFailureRetried() {
            AtomicInteger calls = new AtomicInteger();
            RegisteredChecker checker = RegisteredChecker.builder("transient", () -> calls.incrementAndGet() < 3
                    ? CheckResult.failures(CheckerFailure.of("Not yet"))
                    : CheckResult.success()).tries(3).build();

            CheckerRun run = runner().run(checker);

            assertEquals(RunStatus.SUCCEEDED, run.status());
            assertEquals(3, calls.get());
            assertTrue(store.findFailures(run.id()).isEmpty());
            verify(store, never()).bulkCreateFailures(anyString(), any());
        }

        @Test
        @DisplayName("Only the last attempt's failures are persisted")
        void lastAttemptWins() {
            AtomicInteger calls = new AtomicInteger();
            RegisteredChecker checker = RegisteredChecker.builder("persistent", () -> {
                int attempt = calls.incrementAndGet();
                return CheckResult.failures(IntStream.range(0, attempt)
                        .mapToObj(i -> CheckerFailure.of("attempt " + attempt + " failure " + i)));
            }).tries(3).build();

            CheckerRun run = runner().run(checker);

            assertEquals(RunStatus.FAILED, run.status());
            assertEquals(3, calls.get());
            List<CheckerFailure> failures = store.findFailures(run.id());
            assertEquals(3, failures.size());
            assertTrue(failures.stream().allMatch(f -> f.text().startsWith("attempt 3")));
        }

        @Test
        @DisplayName("Success on the first attempt does not retry")
        void successStopsImmediately() {
            AtomicInteger calls = new AtomicInteger();
            RegisteredChecker checker = RegisteredChecker.builder("healthy", () -> {
                calls.incrementAndGet();
                return CheckResult.success();
            }).tries(5).build();

            assertEquals(RunStatus.SUCCEEDED, runner().run(checker).status());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("A null result counts as success")
        void nullIsSuccess() {
            RegisteredChecker checker = RegisteredChecker.builder("returns_null", () -> null).build();

            assertEquals(RunStatus.SUCCEEDED, runner().run(checker).status());
        }

        @Test
        @DisplayName("An empty failure stream counts as success")
        void emptyStreamIsSuccess() {
            RegisteredChecker checker = RegisteredChecker.builder("empty", () -> CheckResult.failures(Stream.empty()))
                    .build();

            CheckerRun run = runner().run(checker);

            assertEquals(RunStatus.SUCCEEDED, run.status());
            assertEquals(CheckerStatus.SUCCEEDING, stored("empty").getStatus());
        }
    }

    @Nested
    @DisplayName("Failure collection")
    class FailureCollection {

        @Test
        @DisplayName("An infinite failure stream is capped at 100 and closed")
        void infiniteStreamCapped() {
            AtomicBoolean closed = new AtomicBoolean(false);
            AtomicInteger sequence = new AtomicInteger();
            RegisteredChecker checker = RegisteredChecker.builder("endless", () -> CheckResult.failures(
                    Stream.generate(() -> CheckerFailure.of("failure " + sequence.incrementAndGet()))
                            .onClose(() -> closed.set(true)))).build();

            CheckerRun run = runner().run(checker);

            assertEquals(RunStatus.FAILED, run.status());
            assertEquals(100, store.findFailures(run.id()).size());
            assertEquals("failure 1", store.findFailures(run.id()).get(0).text());
            assertTrue(closed.get());
        }

        @Test
        @DisplayName("Suppressed failures are skipped and do not count toward the cap")
        void suppressedFailuresSkipped() {
            store.saveOverride(CheckerOverride.global(Map.of("parity", "even"), "known noise", "ops"));
            AtomicInteger sequence = new AtomicInteger();
            RegisteredChecker checker = RegisteredChecker.builder("mixed", () -> CheckResult.failures(
                    Stream.generate(() -> {
                        int n = sequence.incrementAndGet();
                        return CheckerFailure.of("failure " + n, "",
                                Map.of("n", n, "parity", n % 2 == 0 ? "even" : "odd"));
                    }))).build();

            CheckerRun run = runner().run(checker);

            List<CheckerFailure> failures = store.findFailures(run.id());
            assertEquals(100, failures.size());
            assertTrue(failures.stream().allMatch(f -> "odd".equals(f.data().get("parity"))));
        }

        @Test
        @DisplayName("A run whose failures are all suppressed succeeds")
        void allSuppressedSucceeds() {
            Checker existing = store.getOrCreateChecker("known_issue", "");
            store.saveOverride(CheckerOverride.forChecker(existing.getId(), Map.of("id", 42), "", "ops"));
            RegisteredChecker checker = RegisteredChecker.builder("known_issue", () -> CheckResult.failures(
                    CheckerFailure.of("Record 42 is odd", "", Map.of("id", 42, "table", "orders")))).build();

            CheckerRun run = runner().run(checker);

            assertEquals(RunStatus.SUCCEEDED, run.status());
            assertTrue(store.findFailures(run.id()).isEmpty());
        }

        @Test
        @DisplayName("Failures without data are always kept")
        void failuresWithoutDataKept() {
            store.saveOverride(CheckerOverride.global(Map.of(), "overly broad", "ops"));

            CheckerRun run = runner().run(failingChecker("no_data"));

            assertEquals(RunStatus.FAILED, run.status());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("An exception ends the run as ERRORED without retrying")
        void exceptionErrorsRun() {
            AtomicInteger calls = new AtomicInteger();
            RegisteredChecker checker = RegisteredChecker.builder("broken", () -> {
                calls.incrementAndGet();
                throw new IllegalStateException("database unreachable");
            }).tries(3).severity(Severity.HIGH).build();

            CheckerRun run = assertDoesNotThrow(() -> runner().run(checker));

            assertEquals(RunStatus.ERRORED, run.status());
            assertEquals(1, calls.get());
            assertNotNull(run.completionDate());
            assertTrue(run.exceptionTrace().contains("IllegalStateException: database unreachable"));
            assertTrue(run.exceptionTrace().contains("at "));
            assertEquals(CheckerStatus.ERRORED, stored("broken").getStatus());
            assertEquals(1, transport.emailsTo("oncall@example.com").size());
        }

        @Test
        @DisplayName("A stack overflow in the check ends the run as ERRORED")
        void stackOverflowErrorsRun() {
            RegisteredChecker checker = RegisteredChecker.builder("deep_recursion", () -> {
                throw new StackOverflowError("recursion");
            }).build();

            CheckerRun run = assertDoesNotThrow(() -> runner().run(checker));

            assertEquals(RunStatus.ERRORED, run.status());
            assertTrue(run.exceptionTrace().contains("StackOverflowError: recursion"));
            assertEquals(RunStatus.ERRORED, store.findRun(run.id()).orElseThrow().status());
            assertEquals(CheckerStatus.ERRORED, stored("deep_recursion").getStatus());
        }

        @Test
        @DisplayName("Assertion and linkage errors in the check end the run as ERRORED")
        void assertionAndLinkageErrorsRun() {
            RegisteredChecker asserting = RegisteredChecker.builder("asserting", () -> {
                throw new AssertionError("invariant broken");
            }).build();
            RegisteredChecker unlinked = RegisteredChecker.builder("unlinked", () -> {
                throw new NoClassDefFoundError("com/example/Missing");
            }).build();

            assertEquals(RunStatus.ERRORED, runner().run(asserting).status());
            assertEquals(RunStatus.ERRORED, runner().run(unlinked).status());
            assertEquals(CheckerStatus.ERRORED, stored("unlinked").getStatus());
        }

        @Test
        @DisplayName("An exception while streaming failures also errors the run")
        void exceptionMidStream() {
            RegisteredChecker checker = RegisteredChecker.builder("breaks_midway", () -> CheckResult.failures(
                    Stream.of("a", "b").map(s -> {
                        if (s.equals("b")) {
                            throw new IllegalArgumentException("bad row");
                        }
                        return CheckerFailure.of(s);
                    }))).build();

            CheckerRun run = runner().run(checker);

            assertEquals(RunStatus.ERRORED, run.status());
            assertTrue(store.findFailures(run.id()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Dry run")
    class DryRun {

        @Test
        @DisplayName("Computes the status without writing anything")
        void dryRunWritesNothing() {
            CheckerRun run = runner().run(failingChecker("preview_me"), true);

            assertEquals(RunStatus.FAILED, run.status());
            assertTrue(run.isTransient());
            verify(store, never()).getOrCreateChecker(anyString(), anyString());
            verify(store, never()).updateChecker(any());
            verify(store, never()).createRun(any());
            verify(store, never()).updateRun(any());
            verify(store, never()).bulkCreateFailures(anyString(), any());
            verify(store, never()).appendTransition(any());
            assertTrue(store.findChecker("preview_me").isEmpty());
            assertEquals(0, transport.total());
        }

        @Test
        @DisplayName("Uses the stored checker's scoped overrides")
        void dryRunUsesOverrides() {
            Checker existing = store.getOrCreateChecker("known_issue", "");
            store.saveOverride(CheckerOverride.forChecker(existing.getId(), Map.of("id", 42), "", "ops"));
            RegisteredChecker checker = RegisteredChecker.builder("known_issue", () -> CheckResult.failures(
                    CheckerFailure.of("Record 42 is odd", "", Map.of("id", 42)))).build();

            assertEquals(RunStatus.SUCCEEDED, runner().run(checker, true).status());
        }

        @Test
        @DisplayName("Reports errors as ERRORED")
        void dryRunError() {
            RegisteredChecker checker = RegisteredChecker.builder("broken", () -> {
                throw new IllegalStateException("nope");
            }).build();

            assertEquals(RunStatus.ERRORED, runner().run(checker, true).status());
        }
    }

    @Nested
    @DisplayName("Metadata")
    class Metadata {

        @Test
        @DisplayName("Copies trimmed description, severity and cadence to the checker")
        void synchronizesMetadata() {
            RegisteredChecker checker = RegisteredChecker.builder("described", CheckResult::success)
                    .description("\n   Finds orders without customers.  \n")
                    .severity(Severity.HIGH)
                    .build();

            runner().run(checker);

            Checker stored = stored("described");
            assertEquals("Finds orders without customers.", stored.getDescription());
            assertEquals(Severity.HIGH, stored.getSeverity());
        }

        @Test
        @DisplayName("Writes the checker for metadata only when something changed")
        void writesOnlyOnChange() {
            CheckerRunner runner = runner();
            RegisteredChecker checker = RegisteredChecker.builder("plain", CheckResult::success).build();

            runner.run(checker);
            // Defaults already match, so the only write is the status transition.
            verify(store, times(1)).updateChecker(any());

            clearInvocations(store);
            runner.run(checker);
            verify(store, times(1)).updateChecker(any());
        }
    }

    @Nested
    @DisplayName("Locking")
    class Locking {

        @Test
        @DisplayName("A held lock fails the run before anything is written")
        void lockHeldElsewhere() throws Exception {
            LocalRunLock lock = new LocalRunLock(new LockConfig(Duration.ofMillis(50)));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                lock.lock("contended");
                held.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock("contended");
                }
            });
            holder.start();
            assertTrue(held.await(5, TimeUnit.SECONDS));

            try {
                assertThrows(LockAcquisitionException.class, () -> runner(lock).run(failingChecker("contended")));
                verify(store, never()).createRun(any());
                assertTrue(store.findChecker("contended").isEmpty());
            } finally {
                release.countDown();
                holder.join(5000);
            }
        }

        @Test
        @DisplayName("Overlapping runs of one checker execute one at a time")
        void overlappingRunsSerialized() throws Exception {
            CheckerRunner runner = runner(new LocalRunLock(new LockConfig(Duration.ofSeconds(10))));
            AtomicInteger active = new AtomicInteger();
            AtomicInteger maxActive = new AtomicInteger();
            RegisteredChecker slow = RegisteredChecker.builder("slow", () -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                Thread.sleep(50);
                active.decrementAndGet();
                return CheckResult.success();
            }).build();

            ExecutorService pool = Executors.newFixedThreadPool(3);
            try {
                List<Future<CheckerRun>> futures = List.of(
                        pool.submit(() -> runner.run(slow)),
                        pool.submit(() -> runner.run(slow)),
                        pool.submit(() -> runner.run(slow)));
                for (Future<CheckerRun> future : futures) {
                    assertEquals(RunStatus.SUCCEEDED, future.get(10, TimeUnit.SECONDS).status());
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(1, maxActive.get());
            assertEquals(3, store.findRuns(stored("slow").getId()).size());
        }

        @Test
        @DisplayName("Dry runs do not take the lock")
        void dryRunSkipsLock() {
            RunLock lock = mock(RunLock.class);

            runner(lock).run(failingChecker("preview_me"), true);

            verifyNoInteractions(lock);
        }
    }
}
