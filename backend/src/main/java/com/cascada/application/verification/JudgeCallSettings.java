/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.verification;

import com.cascada.config.CascadaProperties;

import java.time.Duration;

public record JudgeCallSettings(Duration timeout, int maxTokens) {
    public static JudgeCallSettings from(CascadaProperties.Verification v) {
        return new JudgeCallSettings(v.judgeTimeout(), v.judgeMaxTokens());
    }
}
