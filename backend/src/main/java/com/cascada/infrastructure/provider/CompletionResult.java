/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

public record CompletionResult(
        String text,
        TokenUsage usage
) {
    public static CompletionResult of(String text) {
        return new CompletionResult(text, null);
    }
}
