/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.health;

import com.cascada.application.execution.ExecutionAttempt;
import com.cascada.application.execution.ExecutionClient;
import com.cascada.application.registry.ProviderDescriptor;
import com.cascada.application.registry.ProviderRegistry;
import com.cascada.application.verification.JudgeBackends;
import com.cascada.config.CascadaProperties;
import com.cascada.domain.model.CallKind;
import com.cascada.infrastructure.provider.CompletionParameters;
import com.cascada.infrastructure.provider.CompletionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic out-of-band probing, one recurring job per backend. Probe outcomes reach the circuit
 * breaker through the execution client's metrics path.
 */
public class HealthProber implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(HealthProber.class);
    private static final int PROBE_MAX_TOKENS = 8;

    private final ProviderRegistry registry;
    private final JudgeBackends judges;
    private final ExecutionClient executionClient;
    private final ProviderHealthService healthService;
    private final CascadaProperties.Probe settings;
    private final ThreadPoolTaskScheduler scheduler;
    private final Clock clock;
    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();
    private volatile boolean running;

    public HealthProber(
            ProviderRegistry registry,
            JudgeBackends judges,
            ExecutionClient executionClient,
            ProviderHealthService healthService,
            CascadaProperties.Probe settings,
            ThreadPoolTaskScheduler scheduler,
            Clock clock
    ) {
        this.registry = registry;
        this.judges = judges;
        this.executionClient = executionClient;
        this.healthService = healthService;
        this.settings = settings;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        if (!settings.enabled()) {
            log.info("Health probing disabled");
            return;
        }
        running = true;
        schedule();
    }

    @Override
    public synchronized void stop() {
        running = false;
        jobs.values().forEach(job -> job.cancel(false));
        jobs.clear();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void schedule() {
        for (ProviderDescriptor provider : targets().values()) {
            jobs.computeIfAbsent(provider.id(), id -> scheduler.scheduleWithFixedDelay(
                    () -> tick(id),
                    clock.instant().plus(settings.initialDelay()),
                    settings.interval()
            ));
        }
        log.info("Health probing scheduled providers={} interval={}", jobs.keySet(), settings.interval());
    }

    /**
     * Runs one probe immediately, ignoring the schedule but not the cool-down.
     */
    public HealthRecord probeNow(String providerId) {
        ProviderDescriptor provider = Optional.ofNullable(targets().get(providerId))
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider " + providerId));
        probe(provider);
        return healthService.getProviderStatus(providerId);
    }

    void tick(String providerId) {
        ProviderDescriptor provider = targets().get(providerId);
        if (provider == null) {
            return;
        }
        try {
            probe(provider);
        } catch (RuntimeException e) {
            // a throwing task would silently stop the fixed-delay schedule
            log.warn("Probe tick failed provider={}", providerId, e);
        }
    }

    private void probe(ProviderDescriptor provider) {
        if (!healthService.admitProbe(provider.id())) {
            log.debug("Probe skipped, circuit cooling down provider={}", provider.id());
            return;
        }
        CompletionRequest request = CompletionRequest.of(
                settings.prompt(),
                CompletionParameters.deterministic(PROBE_MAX_TOKENS),
                settings.timeout()
        );
        ExecutionAttempt attempt = executionClient.execute(provider, request, settings.timeout(), CallKind.PROBE, 0);
        if (attempt.isSuccess()) {
            log.debug("Probe ok provider={} latencyMs={}", provider.id(), attempt.latencyMs());
        } else {
            log.warn("Probe failed provider={} outcome={} latencyMs={}", provider.id(), attempt.outcome(), attempt.latencyMs());
        }
    }

    private Map<String, ProviderDescriptor> targets() {
        Map<String, ProviderDescriptor> targets = new LinkedHashMap<>();
        for (ProviderDescriptor provider : registry.all()) {
            if (provider.active()) {
                targets.put(provider.id(), provider);
            }
        }
        for (ProviderDescriptor judge : judges.distinct()) {
            targets.putIfAbsent(judge.id(), judge);
        }
        return targets;
    }
}
