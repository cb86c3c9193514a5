/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.health;

import java.time.Duration;

public record CircuitBreakerPolicy(
        int windowSize,
        double failureRateThreshold,
        int consecutiveFailures,
        int latencyWindowSize,
        Duration coolDown,
        double backoffMultiplier,
        Duration maxCoolDown
) {
    public CircuitBreakerPolicy {
        if (windowSize < 1) throw new IllegalArgumentException("windowSize must be >= 1");
        if (consecutiveFailures < 1) throw new IllegalArgumentException("consecutiveFailures must be >= 1");
        if (latencyWindowSize < 1) throw new IllegalArgumentException("latencyWindowSize must be >= 1");
        if (backoffMultiplier < 1.0) throw new IllegalArgumentException("backoffMultiplier must be >= 1");
    }

    public static CircuitBreakerPolicy defaults() {
        return new CircuitBreakerPolicy(5, 0.5, 3, 20, Duration.ofSeconds(30), 2.0, Duration.ofMinutes(5));
    }

    /**
     * Cool-down after the given number of consecutive trips (1-based), capped at maxCoolDown.
     */
    public Duration coolDownFor(int trips) {
        int step = Math.max(0, trips - 1);
        double millis = coolDown.toMillis() * Math.pow(backoffMultiplier, step);
        long cap = maxCoolDown.toMillis();
        if (Double.isInfinite(millis) || millis > cap) {
            return maxCoolDown;
        }
        return Duration.ofMillis((long) millis);
    }
}
