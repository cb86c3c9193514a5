/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.escalation;

/**
 * Per-request switches. Turning a judge off only takes effect where the deployment allows it.
 */
public record RoutingOptions(
        boolean enableVerification,
        boolean enableConfidenceScoring,
        boolean autoEscalate
) {
    public static RoutingOptions defaults() {
        return new RoutingOptions(true, true, true);
    }
}
