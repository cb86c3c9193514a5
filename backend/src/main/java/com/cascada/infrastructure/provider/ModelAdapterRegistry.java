/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the adapter bound to a backend id.
 */
public class ModelAdapterRegistry {

    private final Map<String, ModelAdapter> adaptersById;

    public ModelAdapterRegistry(List<ModelAdapter> adapters) {
        this.adaptersById = Collections.unmodifiableMap(buildRegistry(adapters == null ? List.of() : adapters));
    }

    public ModelAdapter getRequired(String providerId) {
        ModelAdapter adapter = adaptersById.get(providerId);
        if (adapter == null) {
            throw new IllegalArgumentException("No ModelAdapter registered for provider=" + providerId);
        }
        return adapter;
    }

    public Optional<ModelAdapter> find(String providerId) {
        return Optional.ofNullable(adaptersById.get(providerId));
    }

    public Set<String> registeredProviders() {
        return adaptersById.keySet();
    }

    private static Map<String, ModelAdapter> buildRegistry(List<ModelAdapter> adapters) {
        Map<String, ModelAdapter> registry = new LinkedHashMap<>();
        for (ModelAdapter adapter : adapters) {
            if (adapter == null) {
                throw new IllegalStateException("ModelAdapter list contains null");
            }

            String providerId = adapter.providerId();
            if (providerId == null || providerId.isBlank()) {
                throw new IllegalStateException(
                        "ModelAdapter " + adapter.getClass().getName() + " returned a blank provider id"
                );
            }

            ModelAdapter existing = registry.putIfAbsent(providerId, adapter);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate adapter for provider=" + providerId
                                + ". Existing=" + existing.getClass().getName()
                                + ", new=" + adapter.getClass().getName()
                );
            }
        }
        return registry;
    }
}
