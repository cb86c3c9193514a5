/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

public record TokenUsage(
        long promptTokens,
        long completionTokens
) {
    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
