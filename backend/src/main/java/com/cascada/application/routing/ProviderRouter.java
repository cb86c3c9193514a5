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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ProviderRouter {
    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);

    private final ProviderRegistry registry;
    private final ProviderHealthReader healthReader;
    private final EscalationChain chain;

    public ProviderRouter(ProviderRegistry registry, ProviderHealthReader healthReader, EscalationChain chain) {
        this.registry = registry;
        this.healthReader = healthReader;
        this.chain = chain;
    }

    /**
     * First provider for a new request: registry order with OPEN circuits removed. Inside the
     * leading group (same role and priority) the lowest observed average latency wins.
     *
     * @throws NoProviderAvailableException when every candidate is filtered out
     */
    public ProviderDescriptor selectInitial(RoutingConstraints constraints) {
        List<ProviderDescriptor> candidates = registry.listCandidates(constraints);
        if (candidates.isEmpty()) {
            throw new NoProviderAvailableException(constraints.hasOverride()
                    ? "No active provider matches model override " + constraints.modelOverride()
                    : "No active provider registered");
        }

        Map<String, HealthRecord> snapshots = new HashMap<>();
        for (ProviderDescriptor provider : candidates) {
            snapshots.put(provider.id(), healthReader.getSnapshot(provider.id()));
        }

        List<ProviderDescriptor> eligible = candidates.stream()
                .filter(p -> snapshots.get(p.id()).circuitState() != CircuitState.OPEN)
                .toList();
        if (eligible.isEmpty()) {
            throw new NoProviderAvailableException("All candidate providers have open circuits");
        }

        ProviderDescriptor head = eligible.get(0);
        ProviderDescriptor chosen = eligible.stream()
                .filter(p -> p.role().rank() == head.role().rank() && p.priority() == head.priority())
                .min(latencyOrder(snapshots))
                .orElse(head);

        log.debug("Initial provider chosen={} candidates={} eligible={}", chosen.id(), candidates.size(), eligible.size());
        return chosen;
    }

    /**
     * Next rung of the ladder. Empty when the ladder ends, the next provider is unknown or
     * inactive, or its circuit is OPEN. Never skips ahead.
     */
    public Optional<ProviderDescriptor> selectNext(String currentProviderId) {
        Optional<String> nextId = chain.nextOf(currentProviderId);
        if (nextId.isEmpty()) {
            return Optional.empty();
        }
        Optional<ProviderDescriptor> next = registry.find(nextId.get()).filter(ProviderDescriptor::active);
        if (next.isEmpty()) {
            log.warn("Escalation target not available current={} next={}", currentProviderId, nextId.get());
            return Optional.empty();
        }
        if (healthReader.getSnapshot(next.get().id()).circuitState() == CircuitState.OPEN) {
            log.info("Escalation target circuit open current={} next={}", currentProviderId, nextId.get());
            return Optional.empty();
        }
        return next;
    }

    private static Comparator<ProviderDescriptor> latencyOrder(Map<String, HealthRecord> snapshots) {
        Comparator<ProviderDescriptor> measuredFirst = Comparator.comparing(p -> !snapshots.get(p.id()).hasLatency());
        return measuredFirst
                .thenComparingDouble((ProviderDescriptor p) -> snapshots.get(p.id()).averageLatencyMs())
                .thenComparing(ProviderDescriptor::id);
    }
}
