/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.verification;

import com.cascada.application.registry.ProviderDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * The two judge backends. They are not part of the escalation ladder.
 */
public record JudgeBackends(ProviderDescriptor safety, ProviderDescriptor confidence) {
    public JudgeBackends {
        Objects.requireNonNull(safety, "safety judge");
        Objects.requireNonNull(confidence, "confidence judge");
    }

    public List<ProviderDescriptor> distinct() {
        if (safety.id().equals(confidence.id())) {
            return List.of(safety);
        }
        return List.of(safety, confidence);
    }
}
