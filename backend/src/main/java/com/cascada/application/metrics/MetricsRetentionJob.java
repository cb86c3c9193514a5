/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.metrics;

import com.cascada.config.CascadaProperties;
import com.cascada.infrastructure.persistence.repository.ProviderMetricRepository;
import com.cascada.infrastructure.persistence.repository.RoutingRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Deletes metric and routing rows older than the retention window.
 */
public class MetricsRetentionJob implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(MetricsRetentionJob.class);

    private final ProviderMetricRepository metricRepository;
    private final RoutingRequestRepository routingRequestRepository;
    private final CascadaProperties.Metrics settings;
    private final ThreadPoolTaskScheduler scheduler;
    private final Clock clock;
    private ScheduledFuture<?> job;

    public MetricsRetentionJob(
            ProviderMetricRepository metricRepository,
            RoutingRequestRepository routingRequestRepository,
            CascadaProperties.Metrics settings,
            ThreadPoolTaskScheduler scheduler,
            Clock clock
    ) {
        this.metricRepository = metricRepository;
        this.routingRequestRepository = routingRequestRepository;
        this.settings = settings;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (job != null) return;
        job = scheduler.scheduleWithFixedDelay(this::runSafely,
                clock.instant().plus(settings.cleanupInterval()), settings.cleanupInterval());
        log.info("Metrics retention scheduled retention={} interval={}", settings.retention(), settings.cleanupInterval());
    }

    @Override
    public synchronized void stop() {
        if (job != null) {
            job.cancel(false);
            job = null;
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return job != null;
    }

    public CleanupResult runCleanup() {
        Instant cutoff = clock.instant().minus(settings.retention());
        int metrics = metricRepository.deleteOlderThan(cutoff);
        int requests = routingRequestRepository.deleteOlderThan(cutoff);
        log.info("Retention cleanup cutoff={} metricsDeleted={} requestsDeleted={}", cutoff, metrics, requests);
        return new CleanupResult(cutoff, metrics, requests);
    }

    private void runSafely() {
        try {
            runCleanup();
        } catch (DataAccessException e) {
            log.warn("Retention cleanup failed", e);
        }
    }

    public record CleanupResult(Instant cutoff, int metricsDeleted, int requestsDeleted) {}
}
