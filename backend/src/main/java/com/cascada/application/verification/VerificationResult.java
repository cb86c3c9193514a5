/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.verification;

import java.util.List;

/**
 * Safety judge verdict for one answer. {@code safe} is what the judge said; use
 * {@link VerificationThresholds#isSafe(VerificationResult)} for the routing decision.
 */
public record VerificationResult(
        double safetyScore,
        boolean safe,
        List<String> issues,
        String explanation,
        boolean judgeFailed,
        boolean skipped
) {
    public static final String VERIFICATION_ERROR = "verification_error";

    public VerificationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        explanation = explanation == null ? "" : explanation;
    }

    public static VerificationResult of(double safetyScore, boolean safe, List<String> issues, String explanation) {
        return new VerificationResult(safetyScore, safe, issues, explanation, false, false);
    }

    public static VerificationResult judgeFailure(String reason) {
        return new VerificationResult(0.0, false, List.of(VERIFICATION_ERROR), "Verification failed: " + reason, true, false);
    }

    public static VerificationResult skippedResult() {
        return new VerificationResult(1.0, true, List.of(), "Verification skipped", false, true);
    }
}
