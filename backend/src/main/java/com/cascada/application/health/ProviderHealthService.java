/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.health;

import com.cascada.config.CascadaProperties;
import com.cascada.domain.model.CallKind;
import com.cascada.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Circuit breaker and rolling statistics per provider.
 *
 * <p>With probing enabled the prober owns the OPEN to HALF_OPEN step, so an OPEN provider stays
 * unselectable until a trial probe has run. Without a prober, readers promote an elapsed OPEN
 * circuit to HALF_OPEN themselves and the next real call becomes the trial.
 */
@Service
public class ProviderHealthService implements ProviderHealthReader {
    private static final Logger log = LoggerFactory.getLogger(ProviderHealthService.class);

    private final Map<String, ProviderHealth> healthByProvider = new ConcurrentHashMap<>();
    private final CircuitBreakerPolicy policy;
    private final Clock clock;
    private final boolean promoteOnRead;

    @Autowired
    public ProviderHealthService(CascadaProperties properties, Clock clock) {
        this(policyFrom(properties.circuitBreaker()), clock, !properties.probe().enabled());
    }

    public ProviderHealthService(CircuitBreakerPolicy policy, Clock clock, boolean promoteOnRead) {
        this.policy = policy;
        this.clock = clock;
        this.promoteOnRead = promoteOnRead;
    }

    @Override
    public HealthRecord getSnapshot(String providerId) {
        return health(providerId).snapshot(clock.instant(), promoteOnRead);
    }

    public HealthRecord getProviderStatus(String providerId) {
        return getSnapshot(providerId);
    }

    public List<HealthRecord> getSnapshots(Collection<String> providerIds) {
        return providerIds.stream().map(this::getSnapshot).toList();
    }

    public boolean isOpen(String providerId) {
        return getSnapshot(providerId).circuitState() == CircuitState.OPEN;
    }

    public void recordOutcome(String providerId, boolean success, long latencyMs, CallKind kind) {
        ProviderHealth.Transition t = health(providerId)
                .record(success, latencyMs, kind == CallKind.PROBE, clock.instant(), promoteOnRead);
        if (t.changed()) {
            logTransition(providerId, t.from(), t.to(), kind);
        }
    }

    /**
     * @return false while the circuit is OPEN and cooling down
     */
    public boolean admitProbe(String providerId) {
        ProviderHealth health = health(providerId);
        CircuitState before = health.snapshot(clock.instant(), false).circuitState();
        boolean admitted = health.admitProbe(clock.instant());
        if (admitted && before == CircuitState.OPEN) {
            logTransition(providerId, CircuitState.OPEN, CircuitState.HALF_OPEN, CallKind.PROBE);
        }
        return admitted;
    }

    public CircuitBreakerPolicy policy() {
        return policy;
    }

    private ProviderHealth health(String providerId) {
        return healthByProvider.computeIfAbsent(providerId, id -> new ProviderHealth(id, policy));
    }

    private static void logTransition(String providerId, CircuitState from, CircuitState to, CallKind kind) {
        if (to == CircuitState.OPEN) {
            log.warn("Circuit opened provider={} from={} via={}", providerId, from, kind);
        } else {
            log.info("Circuit transition provider={} {} -> {} via={}", providerId, from, to, kind);
        }
    }

    static CircuitBreakerPolicy policyFrom(CascadaProperties.CircuitBreaker cb) {
        return new CircuitBreakerPolicy(
                cb.windowSize(),
                cb.failureRateThreshold(),
                cb.consecutiveFailures(),
                cb.latencyWindowSize(),
                cb.coolDown(),
                cb.backoffMultiplier(),
                cb.maxCoolDown()
        );
    }
}
