/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application;

import com.cascada.application.health.HealthProber;
import com.cascada.application.health.HealthRecord;
import com.cascada.application.health.ProviderHealthService;
import com.cascada.application.metrics.MetricsAggregator;
import com.cascada.application.metrics.ProviderUsage;
import com.cascada.application.registry.ProviderDescriptor;
import com.cascada.application.registry.ProviderRegistry;
import com.cascada.application.verification.JudgeBackends;
import com.cascada.domain.model.CircuitState;
import com.cascada.infrastructure.provider.ModelAdapterRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ProviderStatusService {
    private final ProviderRegistry registry;
    private final JudgeBackends judges;
    private final ModelAdapterRegistry adapters;
    private final ProviderHealthService healthService;
    private final MetricsAggregator metrics;
    private final HealthProber prober;

    public ProviderStatusService(
            ProviderRegistry registry,
            JudgeBackends judges,
            ModelAdapterRegistry adapters,
            ProviderHealthService healthService,
            MetricsAggregator metrics,
            HealthProber prober
    ) {
        this.registry = registry;
        this.judges = judges;
        this.adapters = adapters;
        this.healthService = healthService;
        this.metrics = metrics;
        this.prober = prober;
    }

    public List<ProviderStatus> list() {
        List<ProviderStatus> statuses = new ArrayList<>();
        for (Map.Entry<String, Entry> e : known().entrySet()) {
            statuses.add(resolve(e.getValue()));
        }
        return statuses;
    }

    public Optional<HealthRecord> health(String providerId) {
        if (!known().containsKey(providerId)) return Optional.empty();
        return Optional.of(healthService.getProviderStatus(providerId));
    }

    public Optional<HealthRecord> probeNow(String providerId) {
        if (!known().containsKey(providerId)) return Optional.empty();
        return Optional.of(prober.probeNow(providerId));
    }

    private ProviderStatus resolve(Entry entry) {
        ProviderDescriptor d = entry.descriptor();
        HealthRecord health = healthService.getProviderStatus(d.id());
        ProviderUsage usage = metrics.usage(d.id());
        boolean hasAdapter = adapters.find(d.id()).isPresent();

        String reason;
        if (!hasAdapter) reason = "NO_ADAPTER";
        else if (!d.active()) reason = "INACTIVE";
        else if (health.circuitState() == CircuitState.OPEN) reason = "CIRCUIT_OPEN";
        else reason = "OK";

        return new ProviderStatus(d, entry.kind(), "OK".equals(reason), reason, health, usage);
    }

    private Map<String, Entry> known() {
        Map<String, Entry> known = new LinkedHashMap<>();
        registry.all().forEach(d -> known.put(d.id(), new Entry(d, "ROUTING")));
        known.putIfAbsent(judges.safety().id(), new Entry(judges.safety(), "SAFETY_JUDGE"));
        known.putIfAbsent(judges.confidence().id(), new Entry(judges.confidence(), "CONFIDENCE_JUDGE"));
        return known;
    }

    private record Entry(ProviderDescriptor descriptor, String kind) {}

    public record ProviderStatus(
            ProviderDescriptor provider,
            String kind,
            boolean available,
            String reason,
            HealthRecord health,
            ProviderUsage usage
    ) {}
}
