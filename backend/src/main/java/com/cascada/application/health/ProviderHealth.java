/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.health;

import com.cascada.domain.model.CircuitState;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Rolling health of a single provider. All mutation happens under the write lock so readers
 * always get a complete {@link HealthRecord}.
 */
final class ProviderHealth {
    private final String providerId;
    private final CircuitBreakerPolicy policy;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Deque<Boolean> outcomes = new ArrayDeque<>();
    private final Deque<Long> latencies = new ArrayDeque<>();
    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int trips;
    private Instant openUntil;
    private Instant lastProbeAt;
    private Instant lastTransitionAt;
    private Instant updatedAt;

    ProviderHealth(String providerId, CircuitBreakerPolicy policy) {
        this.providerId = providerId;
        this.policy = policy;
    }

    HealthRecord snapshot(Instant now, boolean promoteOnRead) {
        lock.readLock().lock();
        try {
            CircuitState effective = promoteOnRead ? effectiveState(now) : state;
            return toRecord(effective);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Decides whether a probe may run now. An OPEN circuit whose cool-down has elapsed moves to
     * HALF_OPEN and the probe becomes its trial.
     */
    boolean admitProbe(Instant now) {
        lock.writeLock().lock();
        try {
            if (state != CircuitState.OPEN) {
                return true;
            }
            if (effectiveState(now) == CircuitState.HALF_OPEN) {
                transition(CircuitState.HALF_OPEN, now);
                return true;
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    Transition record(boolean success, long latencyMs, boolean probe, Instant now, boolean promoteOnRead) {
        lock.writeLock().lock();
        try {
            CircuitState before = state;
            if (promoteOnRead && effectiveState(now) == CircuitState.HALF_OPEN && state == CircuitState.OPEN) {
                transition(CircuitState.HALF_OPEN, now);
            }
            if (probe) {
                lastProbeAt = now;
            }
            updatedAt = now;
            if (success && latencyMs >= 0) {
                latencies.addLast(latencyMs);
                while (latencies.size() > policy.latencyWindowSize()) latencies.removeFirst();
            }

            switch (state) {
                case HALF_OPEN -> {
                    if (success) {
                        outcomes.clear();
                        outcomes.addLast(Boolean.TRUE);
                        consecutiveFailures = 0;
                        trips = 0;
                        openUntil = null;
                        transition(CircuitState.CLOSED, now);
                    } else {
                        addOutcome(false);
                        trip(now);
                    }
                }
                case OPEN -> addOutcome(success);
                case CLOSED -> {
                    addOutcome(success);
                    if (shouldTrip()) {
                        trip(now);
                    }
                }
            }
            return new Transition(before, state);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void addOutcome(boolean success) {
        outcomes.addLast(success);
        while (outcomes.size() > policy.windowSize()) outcomes.removeFirst();
        consecutiveFailures = success ? 0 : consecutiveFailures + 1;
    }

    private boolean shouldTrip() {
        if (consecutiveFailures >= policy.consecutiveFailures()) {
            return true;
        }
        if (outcomes.size() < policy.windowSize()) {
            return false;
        }
        return failureRate() > policy.failureRateThreshold();
    }

    private void trip(Instant now) {
        trips++;
        openUntil = now.plus(policy.coolDownFor(trips));
        transition(CircuitState.OPEN, now);
    }

    private void transition(CircuitState next, Instant now) {
        if (state != next) {
            state = next;
            lastTransitionAt = now;
        }
    }

    private CircuitState effectiveState(Instant now) {
        if (state != CircuitState.OPEN) return state;
        if (openUntil == null) return CircuitState.OPEN;
        return now.isBefore(openUntil) ? CircuitState.OPEN : CircuitState.HALF_OPEN;
    }

    private double failureRate() {
        if (outcomes.isEmpty()) return 0.0;
        long failures = outcomes.stream().filter(ok -> !ok).count();
        return (double) failures / (double) outcomes.size();
    }

    private HealthRecord toRecord(CircuitState effective) {
        int samples = outcomes.size();
        double successRate = samples == 0 ? 1.0 : 1.0 - failureRate();

        List<Long> sorted = new ArrayList<>(latencies);
        Collections.sort(sorted);
        double avg = sorted.isEmpty() ? 0.0 : sorted.stream().mapToLong(Long::longValue).average().orElse(0.0);

        return new HealthRecord(
                providerId,
                effective,
                successRate,
                samples,
                avg,
                percentile(sorted, 0.50),
                percentile(sorted, 0.95),
                sorted.size(),
                consecutiveFailures,
                trips,
                openUntil,
                lastProbeAt,
                lastTransitionAt,
                updatedAt
        );
    }

    private static long percentile(List<Long> sorted, double p) {
        if (sorted.isEmpty()) return 0;
        int index = (int) Math.ceil(p * sorted.size()) - 1;
        if (index < 0) index = 0;
        if (index >= sorted.size()) index = sorted.size() - 1;
        return sorted.get(index);
    }

    record Transition(CircuitState from, CircuitState to) {
        boolean changed() {
            return from != to;
        }
    }
}
