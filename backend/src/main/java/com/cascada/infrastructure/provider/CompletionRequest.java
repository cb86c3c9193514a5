/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

import java.time.Duration;

public record CompletionRequest(
        String systemPrompt,
        String prompt,
        CompletionParameters parameters,
        Duration timeout
) {
    public static CompletionRequest of(String prompt, CompletionParameters parameters, Duration timeout) {
        return new CompletionRequest(null, prompt, parameters, timeout);
    }

    public CompletionRequest withTimeout(Duration newTimeout) {
        return new CompletionRequest(systemPrompt, prompt, parameters, newTimeout);
    }
}
