package com.health.checker.cdi;

import com.health.checker.admin.CheckerAdminService;
import com.health.checker.api.CheckerEngine;
import com.health.checker.config.CheckerEngineConfig;
import com.health.checker.notification.NotificationSettings;
import com.health.checker.registry.CheckerRegistry;
import com.health.checker.report.CheckerReportService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires the checker engine from MicroProfile Config properties.
 *
 * <p>Checkers are discovered through {@link com.health.checker.registry.CheckerProvider}
 * service registrations on the application class path.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * checker:
 *   disable-all: false
 *   disabled: slow_report_check,legacy_check
 *   scheduler:
 *     enabled: true
 *     daily-time: "09:30"
 *     zone: UTC
 *   notification:
 *     admin-emails: ops@example.com
 *     paging-email: oncall@example.com
 * </pre>
 */
@ApplicationScoped
public class CheckerEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(CheckerEngineProducer.class);

    // ── Dispatch ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "checker.disable-all", defaultValue = "false")
    boolean disableAll;

    @Inject
    @ConfigProperty(name = "checker.disabled")
    Optional<List<String>> disabledCheckers;

    // ── Runs ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "checker.max-failures-per-run", defaultValue = "100")
    int maxFailuresPerRun;

    @Inject
    @ConfigProperty(name = "checker.run-timeout-seconds", defaultValue = "3600")
    long runTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "checker.lock-timeout-millis", defaultValue = "5000")
    long lockTimeoutMillis;

    // ── Queues ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "checker.queue.short.size", defaultValue = "2")
    int shortPoolSize;

    @Inject
    @ConfigProperty(name = "checker.queue.medium.size", defaultValue = "2")
    int mediumPoolSize;

    @Inject
    @ConfigProperty(name = "checker.queue.long.size", defaultValue = "1")
    int longPoolSize;

    // ── Scheduler ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "checker.scheduler.enabled", defaultValue = "true")
    boolean schedulerEnabled;

    @Inject
    @ConfigProperty(name = "checker.scheduler.daily-time", defaultValue = "09:30")
    String dailyTime;

    @Inject
    @ConfigProperty(name = "checker.scheduler.zone", defaultValue = "UTC")
    String zone;

    // ── Notifications ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "checker.notification.server-email", defaultValue = "checker@localhost")
    String serverEmail;

    @Inject
    @ConfigProperty(name = "checker.notification.admin-emails")
    Optional<List<String>> adminEmails;

    @Inject
    @ConfigProperty(name = "checker.notification.paging-email")
    Optional<String> pagingEmail;

    @Inject
    @ConfigProperty(name = "checker.notification.alert-channel", defaultValue = "#alerts")
    String alertChannel;

    @Inject
    @ConfigProperty(name = "checker.notification.site-url", defaultValue = "http://localhost:8080")
    String siteUrl;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public CheckerRegistry checkerRegistry() {
        return CheckerRegistry.fromServiceLoader(Thread.currentThread().getContextClassLoader());
    }

    @Produces
    @ApplicationScoped
    public CheckerEngine checkerEngine(CheckerRegistry registry) {
        CheckerEngineConfig config = engineConfig();
        log.info("Producing CheckerEngine: checkers={} disableAll={} disabled={} scheduler={}",
                registry.size(), config.isDisableAll(), config.getDisabledCheckers(), config.isSchedulerEnabled());
        return CheckerEngine.builder()
                .registry(registry)
                .config(config)
                .notificationSettings(notificationSettings())
                .build();
    }

    public void closeEngine(@Disposes CheckerEngine engine) {
        log.info("Closing CheckerEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public CheckerAdminService checkerAdminService(CheckerEngine engine) {
        return engine.admin();
    }

    @Produces
    @ApplicationScoped
    public CheckerReportService checkerReportService(CheckerEngine engine) {
        return engine.reports();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    CheckerEngineConfig engineConfig() {
        return CheckerEngineConfig.builder()
                .disableAll(disableAll)
                .disabledCheckers(disabledCheckers.orElse(List.of()))
                .maxFailuresPerRun(maxFailuresPerRun)
                .runTimeout(Duration.ofSeconds(runTimeoutSeconds))
                .lockTimeout(Duration.ofMillis(lockTimeoutMillis))
                .shortPoolSize(shortPoolSize)
                .mediumPoolSize(mediumPoolSize)
                .longPoolSize(longPoolSize)
                .schedulerEnabled(schedulerEnabled)
                .dailyRunTime(LocalTime.parse(dailyTime))
                .zone(ZoneId.of(zone))
                .build();
    }

    NotificationSettings notificationSettings() {
        return NotificationSettings.builder()
                .serverEmail(serverEmail)
                .adminEmails(adminEmails.orElse(List.of()))
                .pagingEmail(pagingEmail.orElse(null))
                .alertChannel(alertChannel)
                .siteUrl(siteUrl)
                .build();
    }
}
