/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.escalation;

import com.cascada.config.CascadaProperties;

import java.time.Duration;

public record EscalationSettings(int maxEscalations, Duration answerTimeout) {
    public EscalationSettings {
        if (maxEscalations < 0) throw new IllegalArgumentException("maxEscalations must be >= 0");
    }

    public static EscalationSettings from(CascadaProperties.Escalation e) {
        return new EscalationSettings(e.maxEscalations(), e.answerTimeout());
    }
}
