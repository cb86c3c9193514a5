/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.escalation;

import com.cascada.application.execution.ExecutionAttempt;
import com.cascada.application.verification.ConfidenceResult;
import com.cascada.application.verification.Verdict;
import com.cascada.application.verification.VerificationResult;
import com.cascada.domain.model.AttemptOutcome;

/**
 * What happened on one rung of the ladder. Carries no model output.
 */
public record AttemptReport(
        int sequence,
        String providerId,
        AttemptOutcome outcome,
        long latencyMs,
        double cost,
        VerificationResult verification,
        ConfidenceResult confidence,
        Boolean safe
) {
    static AttemptReport failed(ExecutionAttempt attempt) {
        return new AttemptReport(attempt.sequence(), attempt.providerId(), attempt.outcome(),
                attempt.latencyMs(), attempt.cost(), null, null, null);
    }

    static AttemptReport judged(ExecutionAttempt attempt, Verdict verdict) {
        return new AttemptReport(attempt.sequence(), attempt.providerId(), attempt.outcome(),
                attempt.latencyMs(), attempt.cost(), verdict.verification(), verdict.confidence(), verdict.safe());
    }
}
