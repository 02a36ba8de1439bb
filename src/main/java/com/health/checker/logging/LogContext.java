package com.health.checker.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper adding checker context to every log line emitted inside it.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun("no_orphaned_records")) {
 *     log.info("checker.started");
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String checkerName) {
        LogContext ctx = new LogContext();
        ctx.put("checkerName", checkerName);
        ctx.put("operation", "run");
        return ctx;
    }

    public static LogContext forPreview(String checkerName) {
        LogContext ctx = new LogContext();
        ctx.put("checkerName", checkerName);
        ctx.put("operation", "preview");
        return ctx;
    }

    public static LogContext forDispatch(String cadence) {
        LogContext ctx = new LogContext();
        ctx.put("cadence", cadence);
        ctx.put("operation", "dispatch");
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
