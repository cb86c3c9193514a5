/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

public record CompletionParameters(
        double temperature,
        double topP,
        int maxTokens
) {
    public static CompletionParameters defaults() {
        return new CompletionParameters(0.2, 0.95, 512);
    }

    /**
     * Deterministic settings used for judge and probe calls.
     */
    public static CompletionParameters deterministic(int maxTokens) {
        return new CompletionParameters(0.0, 0.9, maxTokens);
    }
}
