/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.domain.model;

public enum AttemptOutcome {
    SUCCESS,
    TIMEOUT,
    AUTH_ERROR,
    RATE_LIMITED,
    TRANSPORT_ERROR,
    MALFORMED_RESPONSE,
    /** The caller went away before the call finished. */
    CANCELLED,
    /** The call never started because the local worker pool was saturated. */
    REJECTED;

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /**
     * Local outcomes say nothing about the backend and must not move its circuit.
     */
    public boolean countsTowardHealth() {
        return this != CANCELLED && this != REJECTED;
    }
}
