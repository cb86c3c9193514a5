/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.health;

import com.cascada.domain.model.CircuitState;

import java.time.Instant;

public record HealthRecord(
        String providerId,
        CircuitState circuitState,
        double successRate,
        int sampleCount,
        double averageLatencyMs,
        long p50LatencyMs,
        long p95LatencyMs,
        int latencySamples,
        int consecutiveFailures,
        int tripCount,
        Instant openUntil,
        Instant lastProbeAt,
        Instant lastTransitionAt,
        Instant updatedAt
) {
    public boolean isOpen() {
        return circuitState == CircuitState.OPEN;
    }

    public boolean hasLatency() {
        return latencySamples > 0;
    }
}
