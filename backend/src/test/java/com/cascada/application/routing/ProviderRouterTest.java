/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.routing;

import com.cascada.application.health.HealthRecord;
import com.cascada.application.health.ProviderHealthReader;
import com.cascada.application.registry.ProviderDescriptor;
import com.cascada.application.registry.ProviderRegistry;
import com.cascada.application.registry.RoutingConstraints;
import com.cascada.domain.model.CircuitState;
import com.cascada.domain.model.Intent;
import com.cascada.domain.model.ProviderRole;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderRouterTest {
    private final Map<String, HealthRecord> health = new HashMap<>();
    private final ProviderHealthReader reader = id -> health.getOrDefault(id, record(id, CircuitState.CLOSED, 0));

    @Test
    void primaryWinsWhenHealthy() {
        ProviderRouter router = router(ladder());

        assertEquals("gemma", router.selectInitial(RoutingConstraints.none()).id());
    }

    @Test
    void openPrimaryFallsThroughToNextCandidate() {
        health.put("gemma", record("gemma", CircuitState.OPEN, 0));
        ProviderRouter router = router(ladder());

        assertEquals("phi3", router.selectInitial(RoutingConstraints.none()).id());
    }

    @Test
    void halfOpenProviderRemainsEligible() {
        health.put("gemma", record("gemma", CircuitState.HALF_OPEN, 0));
        ProviderRouter router = router(ladder());

        assertEquals("gemma", router.selectInitial(RoutingConstraints.none()).id());
    }

    @Test
    void allOpenRaisesNoProviderAvailable() {
        for (ProviderDescriptor d : ladder()) {
            health.put(d.id(), record(d.id(), CircuitState.OPEN, 0));
        }
        ProviderRouter router = router(ladder());

        assertThrows(NoProviderAvailableException.class, () -> router.selectInitial(RoutingConstraints.none()));
    }

    @Test
    void unknownOverrideRaisesNoProviderAvailable() {
        ProviderRouter router = router(ladder());

        NoProviderAvailableException e = assertThrows(NoProviderAvailableException.class,
                () -> router.selectInitial(new RoutingConstraints("gpt-9", null)));
        assertTrue(e.getMessage().contains("gpt-9"));
    }

    @Test
    void overridePinsProvider() {
        ProviderRouter router = router(ladder());

        assertEquals("qwen", router.selectInitial(new RoutingConstraints("QWEN", null)).id());
    }

    @Test
    void intentFiltersCandidates() {
        List<ProviderDescriptor> providers = List.of(
                provider("gemma", 10, ProviderRole.PRIMARY, Set.of(Intent.CHAT)),
                provider("phi3", 9, null, Set.of(Intent.CODE_GEN)),
                provider("mistral", 1, ProviderRole.FALLBACK, Set.of())
        );
        ProviderRouter router = router(providers);

        assertEquals("phi3", router.selectInitial(new RoutingConstraints(null, Intent.CODE_GEN)).id());
        assertEquals("gemma", router.selectInitial(new RoutingConstraints(null, Intent.CHAT)).id());
    }

    @Test
    void fastestMeasuredProviderWinsWithinLeadingGroup() {
        List<ProviderDescriptor> providers = List.of(
                provider("alpha", 5, null, Set.of()),
                provider("beta", 5, null, Set.of()),
                provider("gamma", 5, null, Set.of())
        );
        health.put("beta", record("beta", CircuitState.CLOSED, 300));
        health.put("gamma", record("gamma", CircuitState.CLOSED, 120));
        ProviderRouter router = router(providers);

        assertEquals("gamma", router.selectInitial(RoutingConstraints.none()).id());
    }

    @Test
    void unmeasuredGroupFallsBackToId() {
        List<ProviderDescriptor> providers = List.of(
                provider("zeta", 5, null, Set.of()),
                provider("eta", 5, null, Set.of())
        );
        ProviderRouter router = router(providers);

        assertEquals("eta", router.selectInitial(RoutingConstraints.none()).id());
    }

    @Test
    void selectNextFollowsChainAndStopsAtOpenCircuit() {
        ProviderRouter router = router(ladder());

        assertEquals("phi3", router.selectNext("gemma").orElseThrow().id());
        assertTrue(router.selectNext("mistral").isEmpty());

        health.put("qwen", record("qwen", CircuitState.OPEN, 0));
        assertTrue(router.selectNext("phi3").isEmpty());
    }

    @Test
    void selectNextStopsAtInactiveTarget() {
        List<ProviderDescriptor> providers = List.of(
                provider("gemma", 10, ProviderRole.PRIMARY, Set.of()),
                new ProviderDescriptor("phi3", "phi3", 2, 0.0, 9, null, false, Set.of()),
                provider("qwen", 8, null, Set.of())
        );
        ProviderRouter router = new ProviderRouter(new ProviderRegistry(providers), reader,
                EscalationChain.ladder(List.of("gemma", "phi3", "qwen")));

        assertTrue(router.selectNext("gemma").isEmpty());
    }

    private ProviderRouter router(List<ProviderDescriptor> providers) {
        List<String> ids = providers.stream().map(ProviderDescriptor::id).toList();
        return new ProviderRouter(new ProviderRegistry(providers), reader, EscalationChain.ladder(ids));
    }

    private static List<ProviderDescriptor> ladder() {
        return List.of(
                provider("gemma", 10, ProviderRole.PRIMARY, Set.of()),
                provider("phi3", 9, null, Set.of()),
                provider("qwen", 8, null, Set.of()),
                provider("mistral", 7, ProviderRole.FALLBACK, Set.of())
        );
    }

    private static ProviderDescriptor provider(String id, int priority, ProviderRole role, Set<Intent> intents) {
        return new ProviderDescriptor(id, id, 1, 0.001, priority, role, true, intents);
    }

    private static HealthRecord record(String id, CircuitState state, long avgLatency) {
        int samples = avgLatency > 0 ? 5 : 0;
        return new HealthRecord(id, state, 1.0, samples, avgLatency, avgLatency, avgLatency, samples,
                0, 0, null, null, null, Instant.now());
    }
}
