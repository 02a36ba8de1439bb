package com.health.checker.notification;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.RunStatus;
import com.health.checker.core.model.Severity;
import com.health.checker.store.InMemoryCheckerStore;
import com.health.checker.transition.TransitionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("NotificationEscalator Tests")
class NotificationEscalatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final String ADMIN = "admins@example.com";
    private static final String PAGER = "oncall@example.com";

    private InMemoryCheckerStore store;
    private RecordingTransport transport;
    private NotificationEscalator escalator;
    private NotificationSettings settings;
    private Checker checker;

    @BeforeEach
    void setUp() {
        store = new InMemoryCheckerStore();
        transport = new RecordingTransport();
        settings = NotificationSettings.builder()
                .adminEmails(List.of(ADMIN))
                .pagingEmail(PAGER)
                .siteUrl("https://ops.example.com/")
                .build();
        escalator = new NotificationEscalator(store, transport, settings);
        checker = store.getOrCreateChecker("no_orphans", "db");
    }

    private static TransitionResult changedTo(CheckerStatus status) {
        return new TransitionResult(CheckerStatus.NEW, status, true);
    }

    private CheckerRun failedRun(CheckerFailure... failures) {
        CheckerRun run = store.createRun(CheckerRun.start(checker.getId(), NOW));
        CheckerRun done = run.complete(RunStatus.FAILED, NOW, null);
        store.updateRun(done);
        store.bulkCreateFailures(done.id(), List.of(failures));
        return done;
    }

    private CheckerRun erroredRun() {
        CheckerRun run = store.createRun(CheckerRun.start(checker.getId(), NOW));
        return run.complete(RunStatus.ERRORED, NOW, Map.of(CheckerRun.EXCEPTION_KEY, "java.lang.IllegalStateException: boom"));
    }

    @Nested
    @DisplayName("FAILING")
    class Failing {

        @Test
        @DisplayName("Low severity sends a chat alert and one admin mail for the first failure")
        void lowSeverity() {
            CheckerRun run = failedRun(
                    CheckerFailure.of("Order 7 has no customer", "Created by import", Map.of("order_id", 7)),
                    CheckerFailure.of("Order 8 has no customer"));

            int sent = escalator.escalate(checker, run, changedTo(CheckerStatus.FAILING));

            assertEquals(2, sent);
            assertEquals(1, transport.chats().size());
            assertEquals("#alerts", transport.chats().get(0).channel());
            assertTrue(transport.chats().get(0).message().startsWith("Order 7 has no customer"));

            RecordingTransport.Email mail = transport.emails().get(0);
            assertEquals(1, transport.emails().size());
            assertEquals("Order 7 has no customer", mail.subject());
            assertEquals(List.of(ADMIN), mail.recipients());
            assertTrue(mail.body().contains("Created by import"));
            assertTrue(mail.body().contains("\"order_id\" : 7"));
            assertTrue(mail.body().contains("https://ops.example.com/checkers/no_orphans/runs/" + run.id()));
            assertTrue(transport.emailsTo(PAGER).isEmpty());
        }

        @Test
        @DisplayName("High severity also pages with the same failure")
        void highSeverity() {
            checker.setSeverity(Severity.HIGH);
            CheckerRun run = failedRun(CheckerFailure.of("Order 7 has no customer"));

            int sent = escalator.escalate(checker, run, changedTo(CheckerStatus.FAILING));

            assertEquals(3, sent);
            List<RecordingTransport.Email> pages = transport.emailsTo(PAGER);
            assertEquals(1, pages.size());
            assertEquals("Order 7 has no customer", pages.get(0).subject());
        }
    }

    @Nested
    @DisplayName("ERRORED")
    class Errored {

        @Test
        @DisplayName("Mails the owner and admins with the stack trace")
        void mailsOwnerAndAdmins() {
            checker.setOwner("owner@example.com");

            int sent = escalator.escalate(checker, erroredRun(), changedTo(CheckerStatus.ERRORED));

            assertEquals(2, sent);
            RecordingTransport.Email ownerMail = transport.emailsTo("owner@example.com").get(0);
            assertEquals("Error while running no_orphans", ownerMail.subject());
            assertTrue(ownerMail.body().contains("IllegalStateException: boom"));
            assertEquals(1, transport.emailsTo(ADMIN).size());
        }

        @Test
        @DisplayName("Without owner only admins are mailed; high severity pages")
        void highSeverityWithoutOwner() {
            checker.setSeverity(Severity.HIGH);

            int sent = escalator.escalate(checker, erroredRun(), changedTo(CheckerStatus.ERRORED));

            assertEquals(2, sent);
            assertEquals(1, transport.emailsTo(ADMIN).size());
            assertEquals(1, transport.emailsTo(PAGER).size());
        }
    }

    @Test
    @DisplayName("Recovery mails admins even for high severity, without paging")
    void recovery() {
        checker.setSeverity(Severity.HIGH);
        CheckerRun run = store.createRun(CheckerRun.start(checker.getId(), NOW)).complete(RunStatus.SUCCEEDED, NOW, null);

        int sent = escalator.escalate(checker, run,
                new TransitionResult(CheckerStatus.FAILING, CheckerStatus.SUCCEEDING, true));

        assertEquals(1, sent);
        assertEquals("no_orphans is now succeeding", transport.emails().get(0).subject());
        assertTrue(transport.emailsTo(PAGER).isEmpty());
    }

    @Test
    @DisplayName("Mails are sent from the configured server address")
    void senderAddress() {
        NotificationEscalator fromServer = new NotificationEscalator(store, transport,
                NotificationSettings.builder().serverEmail("checker@example.com").adminEmails(List.of(ADMIN)).build());
        CheckerRun run = store.createRun(CheckerRun.start(checker.getId(), NOW)).complete(RunStatus.SUCCEEDED, NOW, null);

        fromServer.escalate(checker, run, new TransitionResult(CheckerStatus.FAILING, CheckerStatus.SUCCEEDING, true));

        assertEquals("checker@example.com", transport.emails().get(0).sender());
    }

    @Test
    @DisplayName("Unchanged transitions send nothing")
    void unchangedSendsNothing() {
        CheckerRun run = failedRun(CheckerFailure.of("Order 7 has no customer"));

        assertEquals(0, escalator.escalate(checker, run, TransitionResult.unchanged(CheckerStatus.FAILING)));
        assertEquals(0, transport.total());
    }

    @Test
    @DisplayName("A failing delivery is logged and the others still go out")
    void deliveryFailureDoesNotStopOthers() {
        NotificationTransport flaky = mock(NotificationTransport.class);
        doThrow(new IllegalStateException("chat down")).when(flaky).notify(anyString(), anyString());
        NotificationEscalator withFlaky = new NotificationEscalator(store, flaky, settings);
        CheckerRun run = failedRun(CheckerFailure.of("Order 7 has no customer"));

        int sent = withFlaky.escalate(checker, run, changedTo(CheckerStatus.FAILING));

        assertEquals(1, sent);
        verify(flaky).sendEmail(anyString(), eq("Order 7 has no customer"), anyString(), anyList());
    }

    @Test
    @DisplayName("Missing paging address skips the page")
    void noPagingAddress() {
        NotificationEscalator noPager = new NotificationEscalator(store, transport,
                NotificationSettings.builder().adminEmails(List.of(ADMIN)).build());
        checker.setSeverity(Severity.HIGH);

        int sent = noPager.escalate(checker, erroredRun(), changedTo(CheckerStatus.ERRORED));

        assertEquals(1, sent);
    }
}
