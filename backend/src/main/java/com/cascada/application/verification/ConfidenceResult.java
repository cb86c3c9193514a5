/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.verification;

import com.cascada.domain.model.RecommendedAction;

public record ConfidenceResult(
        double score,
        String reasoning,
        RecommendedAction action,
        boolean judgeFailed,
        boolean skipped
) {
    public ConfidenceResult {
        reasoning = reasoning == null ? "" : reasoning;
    }

    public static ConfidenceResult judgeFailure(String reason) {
        return new ConfidenceResult(0.0, "Scoring failed: " + reason, RecommendedAction.REJECT, true, false);
    }

    public static ConfidenceResult skippedResult() {
        return new ConfidenceResult(1.0, "Confidence scoring skipped", RecommendedAction.ACCEPT, false, true);
    }
}
