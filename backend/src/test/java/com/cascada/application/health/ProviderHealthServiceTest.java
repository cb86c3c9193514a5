/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.health;

import com.cascada.domain.model.CallKind;
import com.cascada.domain.model.CircuitState;
import com.cascada.testsupport.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderHealthServiceTest {
    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(START);

    @Test
    void unknownProviderStartsClosedWithoutSamples() {
        ProviderHealthService health = new ProviderHealthService(CircuitBreakerPolicy.defaults(), clock, false);

        HealthRecord record = health.getSnapshot("gemma");

        assertEquals(CircuitState.CLOSED, record.circuitState());
        assertEquals(1.0, record.successRate(), 1e-9);
        assertEquals(0, record.sampleCount());
        assertFalse(record.hasLatency());
    }

    @Test
    void consecutiveFailuresOpenCircuit() {
        ProviderHealthService health = new ProviderHealthService(CircuitBreakerPolicy.defaults(), clock, false);

        fail(health, "gemma", 2);
        assertEquals(CircuitState.CLOSED, health.getSnapshot("gemma").circuitState());

        fail(health, "gemma", 1);
        HealthRecord record = health.getSnapshot("gemma");
        assertEquals(CircuitState.OPEN, record.circuitState());
        assertEquals(1, record.tripCount());
        assertEquals(START.plusSeconds(30), record.openUntil());
        assertTrue(health.isOpen("gemma"));
    }

    @Test
    void failureRateOverFullWindowOpensCircuit() {
        ProviderHealthService health = new ProviderHealthService(CircuitBreakerPolicy.defaults(), clock, false);

        health.recordOutcome("phi3", true, 100, CallKind.ANSWER);
        health.recordOutcome("phi3", false, 100, CallKind.ANSWER);
        health.recordOutcome("phi3", true, 100, CallKind.ANSWER);
        health.recordOutcome("phi3", false, 100, CallKind.ANSWER);
        assertEquals(CircuitState.CLOSED, health.getSnapshot("phi3").circuitState());

        health.recordOutcome("phi3", false, 100, CallKind.ANSWER);

        assertEquals(CircuitState.OPEN, health.getSnapshot("phi3").circuitState());
    }

    @Test
    void failureRateAtThresholdKeepsCircuitClosed() {
        CircuitBreakerPolicy policy = new CircuitBreakerPolicy(4, 0.5, 3, 20, Duration.ofSeconds(30), 2.0, Duration.ofMinutes(5));
        ProviderHealthService health = new ProviderHealthService(policy, clock, false);

        health.recordOutcome("phi3", false, 100, CallKind.ANSWER);
        health.recordOutcome("phi3", true, 100, CallKind.ANSWER);
        health.recordOutcome("phi3", false, 100, CallKind.ANSWER);
        health.recordOutcome("phi3", true, 100, CallKind.ANSWER);

        HealthRecord record = health.getSnapshot("phi3");
        assertEquals(CircuitState.CLOSED, record.circuitState());
        assertEquals(0.5, record.successRate(), 1e-9);
    }

    @Test
    void readersDoNotPromoteWhenProberOwnsHalfOpen() {
        ProviderHealthService health = new ProviderHealthService(CircuitBreakerPolicy.defaults(), clock, false);
        fail(health, "gemma", 3);

        clock.advance(Duration.ofSeconds(31));
        assertEquals(CircuitState.OPEN, health.getSnapshot("gemma").circuitState());

        assertTrue(health.admitProbe("gemma"));
        assertEquals(CircuitState.HALF_OPEN, health.getSnapshot("gemma").circuitState());
    }

    @Test
    void probeIsNotAdmittedWhileCoolingDown() {
        ProviderHealthService health = new ProviderHealthService(CircuitBreakerPolicy.defaults(), clock, false);
        fail(health, "gemma", 3);

        clock.advance(Duration.ofSeconds(10));

        assertFalse(health.admitProbe("gemma"));
        assertEquals(CircuitState.OPEN, health.getSnapshot("gemma").circuitState());
    }

    @Test
    void halfOpenSuccessClosesAndResetsBackoff() {
        ProviderHealthService health = new ProviderHealthService(CircuitBreakerPolicy.defaults(), clock, true);
        fail(health, "gemma", 3);

        clock.advance(Duration.ofSeconds(30));
        assertEquals(CircuitState.HALF_OPEN, health.getSnapshot("gemma").circuitState());

        health.recordOutcome("gemma", true, 120, CallKind.ANSWER);

        HealthRecord record = health.getSnapshot("gemma");
        assertEquals(CircuitState.CLOSED, record.circuitState());
        assertEquals(0, record.tripCount());
        assertEquals(0, record.consecutiveFailures());
        assertEquals(1, record.sampleCount());
    }

    @Test
    void halfOpenFailureReopensWithLongerCoolDown() {
        ProviderHealthService health = new ProviderHealthService(CircuitBreakerPolicy.defaults(), clock, true);
        fail(health, "gemma", 3);

        clock.advance(Duration.ofSeconds(30));
        health.recordOutcome("gemma", false, 0, CallKind.ANSWER);

        HealthRecord record = health.getSnapshot("gemma");
        assertEquals(CircuitState.OPEN, record.circuitState());
        assertEquals(2, record.tripCount());
        assertEquals(clock.instant().plusSeconds(60), record.openUntil());
    }

    @Test
    void coolDownBackoffIsCapped() {
        CircuitBreakerPolicy policy = CircuitBreakerPolicy.defaults();

        assertEquals(Duration.ofSeconds(30), policy.coolDownFor(1));
        assertEquals(Duration.ofSeconds(120), policy.coolDownFor(3));
        assertEquals(Duration.ofMinutes(5), policy.coolDownFor(6));
        assertEquals(Duration.ofMinutes(5), policy.coolDownFor(500));
    }

    @Test
    void latencyStatisticsCoverSuccessesOnly() {
        ProviderHealthService health = new ProviderHealthService(CircuitBreakerPolicy.defaults(), clock, false);
        for (int i = 1; i <= 10; i++) {
            health.recordOutcome("qwen", true, i * 10L, CallKind.ANSWER);
        }
        health.recordOutcome("qwen", false, 9_000, CallKind.ANSWER);

        HealthRecord record = health.getSnapshot("qwen");
        assertEquals(10, record.latencySamples());
        assertEquals(55.0, record.averageLatencyMs(), 1e-9);
        assertEquals(50, record.p50LatencyMs());
        assertEquals(100, record.p95LatencyMs());
    }

    @Test
    void probeOutcomesStampLastProbe() {
        ProviderHealthService health = new ProviderHealthService(CircuitBreakerPolicy.defaults(), clock, false);

        health.recordOutcome("mistral", true, 40, CallKind.PROBE);

        assertEquals(START, health.getSnapshot("mistral").lastProbeAt());
    }

    private static void fail(ProviderHealthService health, String providerId, int times) {
        for (int i = 0; i < times; i++) {
            health.recordOutcome(providerId, false, 0, CallKind.ANSWER);
        }
    }
}
