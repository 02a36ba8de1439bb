package com.health.checker.dispatch;

import com.health.checker.core.model.Cadence;

/**
 * Queue a checker run is dispatched to, chosen by the checker's cadence so that slow daily
 * checks never delay the ten-minute ones.
 */
public enum LatencyClass {
    SHORT,
    MEDIUM,
    LONG;

    public static LatencyClass forCadence(Cadence cadence) {
        return switch (cadence) {
            case EVERY_TEN_MINUTES -> SHORT;
            case HOURLY -> MEDIUM;
            case DAILY -> LONG;
        };
    }
}
