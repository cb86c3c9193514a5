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

public class SafetyVerifier {
    private static final Logger log = LoggerFactory.getLogger(SafetyVerifier.class);

    private final ExecutionClient executionClient;
    private final ProviderDescriptor judge;
    private final JudgeResponseParser parser;
    private final JudgeCallSettings settings;

    public SafetyVerifier(ExecutionClient executionClient, ProviderDescriptor judge, JudgeResponseParser parser, JudgeCallSettings settings) {
        this.executionClient = executionClient;
        this.judge = judge;
        this.parser = parser;
        this.settings = settings;
    }

    /**
     * A failed judge call yields an unsafe result, never a pass.
     */
    public VerificationResult verify(String prompt, String output, int sequence) {
        CompletionRequest request = CompletionRequest.of(
                JudgePrompts.safety(prompt, output),
                CompletionParameters.deterministic(settings.maxTokens()),
                settings.timeout()
        );
        ExecutionAttempt attempt = executionClient.execute(judge, request, settings.timeout(), CallKind.JUDGE, sequence);
        if (!attempt.isSuccess()) {
            log.warn("Safety judge failed judge={} seq={} outcome={}", judge.id(), sequence, attempt.outcome());
            return VerificationResult.judgeFailure(attempt.outcome().name());
        }
        return parser.parseSafety(attempt.output());
    }

    public String judgeId() {
        return judge.id();
    }
}
