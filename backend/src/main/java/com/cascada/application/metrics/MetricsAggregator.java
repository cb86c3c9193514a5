/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.metrics;

import com.cascada.application.health.ProviderHealthService;
import com.cascada.config.CascadaProperties;
import com.cascada.infrastructure.persistence.entity.ProviderMetricEntity;
import com.cascada.infrastructure.persistence.repository.ProviderMetricRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Sink for every adapter call. Keeps running totals, stores the raw row and feeds the circuit
 * breaker.
 */
@Service
public class MetricsAggregator implements MetricsRecorder {
    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    private final ProviderHealthService healthService;
    private final ProviderMetricRepository repository;
    private final boolean persist;
    private final Map<String, Totals> totals = new ConcurrentHashMap<>();

    public MetricsAggregator(ProviderHealthService healthService, ProviderMetricRepository repository, CascadaProperties properties) {
        this.healthService = healthService;
        this.repository = repository;
        this.persist = properties.metrics().persist();
    }

    @Override
    public void record(AttemptMetric metric) {
        totals.computeIfAbsent(metric.providerId(), id -> new Totals()).add(metric);
        if (metric.outcome().countsTowardHealth()) {
            healthService.recordOutcome(metric.providerId(), metric.success(), metric.latencyMs(), metric.kind());
        }
        if (persist) {
            persist(metric);
        }
    }

    public ProviderUsage usage(String providerId) {
        Totals t = totals.get(providerId);
        return t == null ? ProviderUsage.empty(providerId) : t.snapshot(providerId);
    }

    public List<ProviderUsage> usage(List<String> providerIds) {
        return providerIds.stream().map(this::usage).toList();
    }

    private void persist(AttemptMetric metric) {
        ProviderMetricEntity e = new ProviderMetricEntity();
        e.setProviderId(metric.providerId());
        e.setCallKind(metric.kind());
        e.setOutcome(metric.outcome());
        e.setLatencyMs(metric.latencyMs());
        e.setPromptTokens(metric.promptTokens());
        e.setCompletionTokens(metric.completionTokens());
        e.setCost(metric.cost());
        e.setCreatedAt(metric.recordedAt());
        try {
            repository.save(e);
        } catch (DataAccessException ex) {
            log.warn("Failed to persist provider metric provider={} kind={} outcome={}",
                    metric.providerId(), metric.kind(), metric.outcome(), ex);
        }
    }

    private static final class Totals {
        private final LongAdder calls = new LongAdder();
        private final LongAdder failures = new LongAdder();
        private final LongAdder answers = new LongAdder();
        private final LongAdder judges = new LongAdder();
        private final LongAdder probes = new LongAdder();
        private final LongAdder latencySum = new LongAdder();
        private final LongAdder tokens = new LongAdder();
        private final DoubleAdder cost = new DoubleAdder();

        void add(AttemptMetric m) {
            calls.increment();
            if (!m.success()) failures.increment();
            switch (m.kind()) {
                case ANSWER -> answers.increment();
                case JUDGE -> judges.increment();
                case PROBE -> probes.increment();
            }
            latencySum.add(m.latencyMs());
            tokens.add(m.totalTokens());
            cost.add(m.cost());
        }

        ProviderUsage snapshot(String providerId) {
            long n = calls.sum();
            return new ProviderUsage(
                    providerId,
                    n,
                    failures.sum(),
                    answers.sum(),
                    judges.sum(),
                    probes.sum(),
                    n == 0 ? 0.0 : (double) latencySum.sum() / (double) n,
                    tokens.sum(),
                    cost.sum()
            );
        }
    }
}
