/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.verification;

import com.cascada.config.CascadaProperties;
import com.cascada.domain.model.RecommendedAction;

import java.util.List;
import java.util.Set;

public record VerificationThresholds(
        double safetyMinScore,
        double confidenceCritical,
        double confidenceAccept,
        Set<String> criticalIssues
) {
    public VerificationThresholds {
        if (confidenceCritical > confidenceAccept) {
            throw new IllegalArgumentException("confidenceCritical must not exceed confidenceAccept");
        }
        criticalIssues = criticalIssues == null ? Set.of() : Set.copyOf(criticalIssues);
    }

    public static VerificationThresholds defaults() {
        return new VerificationThresholds(0.7, 0.4, 0.65, Set.of("harmful_content", "hallucination"));
    }

    public static VerificationThresholds from(CascadaProperties.Verification v) {
        List<String> issues = v.criticalIssues();
        return new VerificationThresholds(v.safetyMinScore(), v.confidenceCritical(), v.confidenceAccept(), Set.copyOf(issues));
    }

    public boolean isSafe(VerificationResult result) {
        if (!result.safe()) return false;
        if (result.safetyScore() < safetyMinScore) return false;
        return result.issues().stream().noneMatch(criticalIssues::contains);
    }

    public RecommendedAction actionFor(double confidence) {
        if (confidence < confidenceCritical) return RecommendedAction.REJECT;
        if (confidence < confidenceAccept) return RecommendedAction.ESCALATE;
        return RecommendedAction.ACCEPT;
    }
}
