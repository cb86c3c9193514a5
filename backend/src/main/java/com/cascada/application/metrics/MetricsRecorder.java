/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.metrics;

public interface MetricsRecorder {
    void record(AttemptMetric metric);

    static MetricsRecorder noop() {
        return metric -> {
        };
    }
}
