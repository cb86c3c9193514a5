/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.registry;

import com.cascada.domain.model.Intent;
import com.cascada.domain.model.ProviderRole;

import java.util.Set;

public record ProviderDescriptor(
        String id,
        String displayName,
        int tier,
        double costPerUnit,
        int priority,
        ProviderRole role,
        boolean active,
        Set<Intent> intents
) {
    public ProviderDescriptor {
        role = ProviderRole.fromNullable(role);
        intents = intents == null ? Set.of() : Set.copyOf(intents);
    }

    public boolean supports(Intent intent) {
        return intent == null || intents.isEmpty() || intents.contains(intent);
    }
}
