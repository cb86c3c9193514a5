/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

/**
 * Canned-reply backend for local runs without a model server.
 */
public class DemoAdapter implements ModelAdapter {
    private static final String DEFAULT_REPLY = "Demo mode active. No model server configured.";

    private final String providerId;
    private final String reply;

    public DemoAdapter(String providerId, String reply) {
        this.providerId = providerId;
        this.reply = (reply == null || reply.isBlank()) ? DEFAULT_REPLY : reply;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public CompletionResult complete(CompletionRequest request) {
        long promptTokens = estimateTokens(request.systemPrompt()) + estimateTokens(request.prompt());
        return new CompletionResult(reply, new TokenUsage(promptTokens, estimateTokens(reply)));
    }

    // ~4 characters per token for English text
    private static long estimateTokens(String text) {
        if (text == null) return 0;
        return text.length() / 4;
    }
}
