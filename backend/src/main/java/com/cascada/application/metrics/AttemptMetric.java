/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.metrics;

import com.cascada.domain.model.AttemptOutcome;
import com.cascada.domain.model.CallKind;

import java.time.Instant;

/**
 * One adapter call as seen by the execution client. Probes included.
 */
public record AttemptMetric(
        String providerId,
        CallKind kind,
        AttemptOutcome outcome,
        long latencyMs,
        long promptTokens,
        long completionTokens,
        double cost,
        Instant recordedAt
) {
    public boolean success() {
        return outcome != null && outcome.isSuccess();
    }

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
