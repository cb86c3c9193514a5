/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.verification;

import com.cascada.domain.model.RecommendedAction;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VerificationThresholdsTest {
    private final VerificationThresholds thresholds = VerificationThresholds.defaults();

    @Test
    void actionBands() {
        assertEquals(RecommendedAction.REJECT, thresholds.actionFor(0.39));
        assertEquals(RecommendedAction.ESCALATE, thresholds.actionFor(0.4));
        assertEquals(RecommendedAction.ESCALATE, thresholds.actionFor(0.64));
        assertEquals(RecommendedAction.ACCEPT, thresholds.actionFor(0.65));
    }

    @Test
    void safetyNeedsFlagScoreAndNoCriticalIssue() {
        assertTrue(thresholds.isSafe(VerificationResult.of(0.9, true, List.of("bias"), "")));
        assertFalse(thresholds.isSafe(VerificationResult.of(0.9, false, List.of(), "")));
        assertFalse(thresholds.isSafe(VerificationResult.of(0.5, true, List.of(), "")));
        assertFalse(thresholds.isSafe(VerificationResult.of(0.9, true, List.of("harmful_content"), "")));
        assertFalse(thresholds.isSafe(VerificationResult.judgeFailure("TIMEOUT")));
        assertTrue(thresholds.isSafe(VerificationResult.skippedResult()));
    }

    @Test
    void criticalAboveAcceptIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new VerificationThresholds(0.7, 0.8, 0.6, Set.of()));
    }
}
