/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.escalation;

import com.cascada.application.verification.ConfidenceResult;
import com.cascada.application.verification.VerificationResult;
import com.cascada.domain.model.Intent;
import com.cascada.domain.model.RequestState;

import java.util.List;

/**
 * Terminal result of one routing request. {@code finalAnswer} is always null for REJECTED and
 * may be null for EXHAUSTED when no attempt produced a verified answer.
 */
public record RoutingOutcome(
        String requestId,
        RequestState terminalState,
        String reasonCode,
        String finalAnswer,
        Intent intent,
        List<AttemptReport> attempts,
        boolean escalated,
        String originalProvider,
        String finalProvider,
        VerificationResult verification,
        ConfidenceResult confidence,
        boolean bestEffort,
        long totalLatencyMs,
        double totalCost
) {
    public RoutingOutcome {
        attempts = List.copyOf(attempts);
    }

    public boolean hasAnswer() {
        return finalAnswer != null;
    }
}
