/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.metrics;

public record ProviderUsage(
        String providerId,
        long calls,
        long failures,
        long answerCalls,
        long judgeCalls,
        long probeCalls,
        double averageLatencyMs,
        long totalTokens,
        double totalCost
) {
    public static ProviderUsage empty(String providerId) {
        return new ProviderUsage(providerId, 0, 0, 0, 0, 0, 0.0, 0, 0.0);
    }

    public double failureRate() {
        return calls == 0 ? 0.0 : (double) failures / (double) calls;
    }
}
