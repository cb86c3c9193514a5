/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.escalation;

import com.cascada.domain.model.Intent;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

public record RoutingRequest(
        String requestId,
        String prompt,
        Intent intent,
        String modelOverride,
        RoutingOptions options,
        Instant createdAt
) {
    public RoutingRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(prompt, "prompt");
        options = options == null ? RoutingOptions.defaults() : options;
        modelOverride = (modelOverride == null || modelOverride.isBlank()) ? null : modelOverride.trim();
    }

    public static RoutingRequest of(String requestId, String prompt, Clock clock) {
        return new RoutingRequest(requestId, prompt, null, null, RoutingOptions.defaults(), clock.instant());
    }
}
