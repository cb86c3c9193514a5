/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.domain.model;

public enum ProviderRole {
    PRIMARY,
    UNSET,
    FALLBACK;

    /**
     * Sort rank used by the registry: primary first, fallback always last.
     */
    public int rank() {
        return switch (this) {
            case PRIMARY -> 0;
            case UNSET -> 1;
            case FALLBACK -> 2;
        };
    }

    public static ProviderRole fromNullable(ProviderRole role) {
        return role == null ? UNSET : role;
    }
}
