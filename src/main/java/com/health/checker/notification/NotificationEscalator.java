package com.health.checker.notification;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.Severity;
import com.health.checker.metrics.CheckerMetrics;
import com.health.checker.metrics.NoOpCheckerMetrics;
import com.health.checker.store.CheckerStore;
import com.health.checker.transition.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a checker status change into outbound messages.
 *
 * <table>
 *   <caption>Escalation policy</caption>
 *   <tr><th>New status</th><th>Every checker</th><th>HIGH severity adds</th></tr>
 *   <tr><td>ERRORED</td><td>mail to owner and admins with the stack trace</td><td>mail to the paging address</td></tr>
 *   <tr><td>FAILING</td><td>chat alert and admin mail for the first failure of the run</td><td>mail to the paging address</td></tr>
 *   <tr><td>SUCCEEDING</td><td>recovery mail to admins</td><td>nothing</td></tr>
 * </table>
 *
 * <p>Only transitions are escalated, never individual runs, so a checker that keeps failing
 * produces one alert. A delivery that throws is logged and the remaining deliveries still
 * happen.</p>
 */
public class NotificationEscalator {
    private static final Logger log = LoggerFactory.getLogger(NotificationEscalator.class);

    private final CheckerStore store;
    private final NotificationTransport transport;
    private final NotificationSettings settings;
    private final NotificationRenderer renderer;
    private final CheckerMetrics metrics;

    public NotificationEscalator(CheckerStore store, NotificationTransport transport, NotificationSettings settings) {
        this(store, transport, settings, new NoOpCheckerMetrics());
    }

    public NotificationEscalator(CheckerStore store, NotificationTransport transport,
                                 NotificationSettings settings, CheckerMetrics metrics) {
        this.store = store;
        this.transport = transport;
        this.settings = settings;
        this.renderer = new NotificationRenderer(settings);
        this.metrics = metrics;
    }

    /**
     * Sends the messages for a transition caused by the given run.
     *
     * @return the number of messages accepted by the transport
     */
    public int escalate(Checker checker, CheckerRun run, TransitionResult transition) {
        if (!transition.changed()) {
            return 0;
        }
        boolean high = checker.getSeverity() == Severity.HIGH;
        CheckerStatus status = transition.newStatus();
        return switch (status) {
            case ERRORED -> escalateError(checker, run, high);
            case FAILING -> escalateFailure(checker, run, high);
            case SUCCEEDING -> escalateRecovery(checker);
            case NEW, IGNORED -> 0;
        };
    }

    private int escalateError(Checker checker, CheckerRun run, boolean high) {
        String subject = renderer.errorSubject(checker);
        String body = renderer.errorBody(run);
        int sent = 0;
        if (checker.getOwner() != null && !checker.getOwner().isBlank()) {
            sent += email(checker, "owner", subject, body, List.of(checker.getOwner()));
        }
        sent += email(checker, "admins", subject, body, settings.adminEmails());
        if (high) {
            sent += page(checker, subject, body);
        }
        return sent;
    }

    private int escalateFailure(Checker checker, CheckerRun run, boolean high) {
        List<CheckerFailure> failures = store.findFailures(run.id());
        if (failures.isEmpty()) {
            log.warn("notification.no_failure checker={} runId={}", checker.getName(), run.id());
            return 0;
        }
        CheckerFailure first = failures.get(0);
        String subject = renderer.failureSubject(first);
        String body = renderer.failureBody(checker, first);
        int sent = chat(checker, first);
        sent += email(checker, "admins", subject, body, settings.adminEmails());
        if (high) {
            sent += page(checker, subject, body);
        }
        return sent;
    }

    private int escalateRecovery(Checker checker) {
        return email(checker, "admins", renderer.successSubject(checker),
                renderer.successBody(checker), settings.adminEmails());
    }

    private int page(Checker checker, String subject, String body) {
        if (!settings.hasPagingEmail()) {
            log.warn("notification.paging_skipped checker={} reason=no_paging_address", checker.getName());
            return 0;
        }
        return email(checker, "paging", subject, body, List.of(settings.pagingEmail()));
    }

    private int email(Checker checker, String kind, String subject, String body, List<String> recipients) {
        if (recipients.isEmpty()) {
            log.debug("notification.skipped checker={} kind={} reason=no_recipients", checker.getName(), kind);
            return 0;
        }
        try {
            transport.sendEmail(settings.serverEmail(), subject, body, recipients);
            metrics.incrementNotification(kind);
            log.info("notification.sent checker={} kind={} recipients={}", checker.getName(), kind, recipients.size());
            return 1;
        } catch (RuntimeException e) {
            log.warn("notification.failed checker={} kind={}: {}", checker.getName(), kind, e.getMessage(), e);
            return 0;
        }
    }

    private int chat(Checker checker, CheckerFailure failure) {
        String message = failure.text() + (failure.subtext().isEmpty() ? "" : "\n" + failure.subtext());
        try {
            transport.notify(message, settings.alertChannel());
            metrics.incrementNotification("chat");
            log.info("notification.sent checker={} kind=chat channel={}", checker.getName(), settings.alertChannel());
            return 1;
        } catch (RuntimeException e) {
            log.warn("notification.failed checker={} kind=chat: {}", checker.getName(), e.getMessage(), e);
            return 0;
        }
    }
}
