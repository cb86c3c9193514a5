/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.execution;

import com.cascada.domain.model.AttemptOutcome;
import com.cascada.domain.model.CallKind;
import com.cascada.infrastructure.provider.TokenUsage;

import java.time.Instant;

public record ExecutionAttempt(
        int sequence,
        String providerId,
        CallKind kind,
        Instant startedAt,
        Instant finishedAt,
        long latencyMs,
        AttemptOutcome outcome,
        String output,
        TokenUsage usage,
        double cost,
        String errorMessage
) {
    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }
}
