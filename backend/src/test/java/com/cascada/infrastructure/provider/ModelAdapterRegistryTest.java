/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelAdapterRegistryTest {
    @Test
    void resolvesAdapterById() {
        DemoAdapter gemma = new DemoAdapter("gemma", "hi");
        ModelAdapterRegistry registry = new ModelAdapterRegistry(List.of(gemma, new DemoAdapter("phi3", null)));

        assertSame(gemma, registry.getRequired("gemma"));
        assertEquals(Set.of("gemma", "phi3"), registry.registeredProviders());
        assertTrue(registry.find("qwen").isEmpty());
    }

    @Test
    void missingAdapterFailsFast() {
        ModelAdapterRegistry registry = new ModelAdapterRegistry(List.of());

        assertThrows(IllegalArgumentException.class, () -> registry.getRequired("gemma"));
    }

    @Test
    void duplicateIdsAreRejected() {
        List<ModelAdapter> adapters = List.of(new DemoAdapter("gemma", "a"), new DemoAdapter("gemma", "b"));

        assertThrows(IllegalStateException.class, () -> new ModelAdapterRegistry(adapters));
    }

    @Test
    void demoAdapterEstimatesUsage() {
        DemoAdapter demo = new DemoAdapter("gemma", "12345678");

        CompletionResult result = demo.complete(CompletionRequest.of("abcdefghijkl", null, null));

        assertEquals("12345678", result.text());
        assertEquals(3, result.usage().promptTokens());
        assertEquals(2, result.usage().completionTokens());
    }
}
