/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.registry;

import com.cascada.domain.model.Intent;

public record RoutingConstraints(
        String modelOverride,
        Intent intent
) {
    public static RoutingConstraints none() {
        return new RoutingConstraints(null, null);
    }

    public boolean hasOverride() {
        return modelOverride != null && !modelOverride.isBlank();
    }
}
