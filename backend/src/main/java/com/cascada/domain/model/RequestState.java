/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.domain.model;

public enum RequestState {
    RUNNING,
    ACCEPTED,
    REJECTED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
