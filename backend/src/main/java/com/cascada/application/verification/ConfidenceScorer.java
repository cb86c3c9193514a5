/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.verification;

import com.cascada.application.execution.ExecutionAttempt;
import com.cascada.application.execution.ExecutionClient;
import com.cascada.application.registry.ProviderDescriptor;
import com.cascada.domain.model.CallKind;
import com.cascada.infrastructure.provider.CompletionParameters;
import com.cascada.infrastructure.provider.CompletionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConfidenceScorer {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceScorer.class);

    private final ExecutionClient executionClient;
    private final ProviderDescriptor judge;
    private final JudgeResponseParser parser;
    private final JudgeCallSettings settings;
    private final VerificationThresholds thresholds;

    public ConfidenceScorer(
            ExecutionClient executionClient,
            ProviderDescriptor judge,
            JudgeResponseParser parser,
            JudgeCallSettings settings,
            VerificationThresholds thresholds
    ) {
        this.executionClient = executionClient;
        this.judge = judge;
        this.parser = parser;
        this.settings = settings;
        this.thresholds = thresholds;
    }

    public ConfidenceResult score(String prompt, String output, String answeringProviderId, int sequence) {
        CompletionRequest request = CompletionRequest.of(
                JudgePrompts.confidence(prompt, output, answeringProviderId),
                CompletionParameters.deterministic(settings.maxTokens()),
                settings.timeout()
        );
        ExecutionAttempt attempt = executionClient.execute(judge, request, settings.timeout(), CallKind.JUDGE, sequence);
        if (!attempt.isSuccess()) {
            log.warn("Confidence judge failed judge={} seq={} outcome={}", judge.id(), sequence, attempt.outcome());
            return ConfidenceResult.judgeFailure(attempt.outcome().name());
        }
        JudgeResponseParser.ScoredText scored = parser.parseConfidence(attempt.output());
        return new ConfidenceResult(scored.score(), scored.reasoning(), thresholds.actionFor(scored.score()), false, false);
    }

    public String judgeId() {
        return judge.id();
    }
}
