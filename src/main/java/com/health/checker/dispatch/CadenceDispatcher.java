package com.health.checker.dispatch;

import com.health.checker.config.CheckerEngineConfig;
import com.health.checker.core.model.Cadence;
import com.health.checker.core.model.RegisteredChecker;
import com.health.checker.logging.LogContext;
import com.health.checker.metrics.CheckerMetrics;
import com.health.checker.registry.CheckerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans out "run every checker of cadence C" into one queued run per registered checker.
 *
 * <p>The global kill switch suppresses the whole dispatch; names on the disabled list are
 * left out. Both are read at dispatch time.</p>
 */
public class CadenceDispatcher {
    private static final Logger log = LoggerFactory.getLogger(CadenceDispatcher.class);

    private final CheckerRegistry registry;
    private final CheckerQueue queue;
    private final CheckerEngineConfig config;
    private final CheckerMetrics metrics;

    public CadenceDispatcher(CheckerRegistry registry, CheckerQueue queue,
                             CheckerEngineConfig config, CheckerMetrics metrics) {
        this.registry = registry;
        this.queue = queue;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Enqueues every enabled checker of the cadence.
     *
     * @return the names of the checkers enqueued, in registration order
     */
    public List<String> dispatch(Cadence cadence) {
        try (LogContext ignored = LogContext.forDispatch(cadence.name())) {
            if (config.isDisableAll()) {
                metrics.incrementSkipped("disabled_all");
                log.info("checker.dispatch_disabled cadence={}", cadence);
                return List.of();
            }
            LatencyClass latencyClass = LatencyClass.forCadence(cadence);
            List<String> enqueued = new ArrayList<>();
            for (RegisteredChecker checker : registry.forCadence(cadence)) {
                if (config.isDisabled(checker.name())) {
                    metrics.incrementSkipped("disabled");
                    log.debug("checker.skipped name={} reason=disabled", checker.name());
                    continue;
                }
                queue.enqueue(latencyClass, checker);
                metrics.incrementDispatched(cadence);
                enqueued.add(checker.name());
            }
            log.info("checker.dispatched cadence={} queue={} count={}", cadence, latencyClass, enqueued.size());
            return enqueued;
        }
    }
}
