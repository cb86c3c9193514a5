/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.verification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Safety first, then confidence, one after the other for every successful answer.
 */
public class VerificationPipeline {
    private static final Logger log = LoggerFactory.getLogger(VerificationPipeline.class);

    private final SafetyVerifier safetyVerifier;
    private final ConfidenceScorer confidenceScorer;
    private final VerificationThresholds thresholds;
    private final boolean allowRequestOptOut;

    public VerificationPipeline(
            SafetyVerifier safetyVerifier,
            ConfidenceScorer confidenceScorer,
            VerificationThresholds thresholds,
            boolean allowRequestOptOut
    ) {
        this.safetyVerifier = safetyVerifier;
        this.confidenceScorer = confidenceScorer;
        this.thresholds = thresholds;
        this.allowRequestOptOut = allowRequestOptOut;
    }

    public Verdict evaluate(String prompt, String output, String providerId, int sequence, boolean safetyRequested, boolean confidenceRequested) {
        boolean runSafety = effective(safetyRequested, "safety");
        boolean runConfidence = effective(confidenceRequested, "confidence");

        VerificationResult verification = runSafety
                ? safetyVerifier.verify(prompt, output, sequence)
                : VerificationResult.skippedResult();
        ConfidenceResult confidence = runConfidence
                ? confidenceScorer.score(prompt, output, providerId, sequence)
                : ConfidenceResult.skippedResult();

        boolean safe = thresholds.isSafe(verification);
        log.info("Verdict provider={} seq={} safe={} safetyScore={} issues={} confidence={} action={}",
                providerId, sequence, safe, verification.safetyScore(), verification.issues(),
                confidence.score(), confidence.action());
        return new Verdict(verification, confidence, safe);
    }

    public VerificationThresholds thresholds() {
        return thresholds;
    }

    private boolean effective(boolean requested, String judge) {
        if (requested) return true;
        if (allowRequestOptOut) return false;
        log.info("Ignoring request to skip {} judge, opt-out not allowed", judge);
        return true;
    }
}
