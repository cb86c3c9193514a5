/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.config;

import com.cascada.application.escalation.EscalationController;
import com.cascada.application.escalation.EscalationSettings;
import com.cascada.application.escalation.RoutingRequestLogService;
import com.cascada.application.execution.ExecutionClient;
import com.cascada.application.health.HealthProber;
import com.cascada.application.health.ProviderHealthService;
import com.cascada.application.intent.IntentDetector;
import com.cascada.application.metrics.MetricsAggregator;
import com.cascada.application.metrics.MetricsRetentionJob;
import com.cascada.application.registry.ProviderDescriptor;
import com.cascada.application.registry.ProviderRegistry;
import com.cascada.application.routing.EscalationChain;
import com.cascada.application.routing.ProviderRouter;
import com.cascada.application.verification.ConfidenceScorer;
import com.cascada.application.verification.JudgeBackends;
import com.cascada.application.verification.JudgeCallSettings;
import com.cascada.application.verification.JudgeResponseParser;
import com.cascada.application.verification.SafetyVerifier;
import com.cascada.application.verification.VerificationPipeline;
import com.cascada.application.verification.VerificationThresholds;
import com.cascada.infrastructure.persistence.repository.ProviderMetricRepository;
import com.cascada.infrastructure.persistence.repository.RoutingRequestRepository;
import com.cascada.infrastructure.provider.DemoAdapter;
import com.cascada.infrastructure.provider.ModelAdapter;
import com.cascada.infrastructure.provider.ModelAdapterRegistry;
import com.cascada.infrastructure.provider.OllamaChatAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class CoreConfig {
    private static final Logger log = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderRegistry providerRegistry(CascadaProperties properties) {
        List<ProviderDescriptor> descriptors = properties.providers().stream().map(CoreConfig::toDescriptor).toList();
        if (descriptors.isEmpty()) {
            log.warn("No providers configured under cascada.providers; every request will fail with NO_PROVIDER_AVAILABLE");
        }
        return new ProviderRegistry(descriptors);
    }

    @Bean
    public JudgeBackends judgeBackends(CascadaProperties properties) {
        CascadaProperties.Judges judges = properties.judges();
        if (judges.safety() == null || judges.confidence() == null) {
            throw new IllegalStateException("cascada.judges.safety and cascada.judges.confidence must both be configured");
        }
        return new JudgeBackends(toDescriptor(judges.safety()), toDescriptor(judges.confidence()));
    }

    /**
     * Uses the configured map when present, otherwise orders the active providers by tier.
     */
    @Bean
    public EscalationChain escalationChain(CascadaProperties properties, ProviderRegistry registry) {
        Map<String, String> configured = properties.escalation().chain();
        EscalationChain chain;
        if (!configured.isEmpty()) {
            chain = EscalationChain.of(configured);
        } else {
            List<String> ladder = registry.all().stream()
                    .filter(ProviderDescriptor::active)
                    .sorted(Comparator.comparingInt(ProviderDescriptor::tier).thenComparing(ProviderDescriptor::id))
                    .map(ProviderDescriptor::id)
                    .toList();
            chain = EscalationChain.ladder(ladder);
        }
        for (String id : chain.asMap().keySet()) {
            if (registry.find(id).isEmpty()) {
                log.warn("Escalation chain references unknown provider={}", id);
            }
        }
        log.info("Escalation chain {}", chain.asMap());
        return chain;
    }

    @Bean
    public ModelAdapterRegistry modelAdapterRegistry(CascadaProperties properties, @Qualifier("modelWebClient") WebClient modelWebClient) {
        List<CascadaProperties.Provider> all = new ArrayList<>(properties.providers());
        if (properties.judges().safety() != null) all.add(properties.judges().safety());
        if (properties.judges().confidence() != null) all.add(properties.judges().confidence());

        Set<String> seen = new LinkedHashSet<>();
        List<ModelAdapter> adapters = new ArrayList<>();
        for (CascadaProperties.Provider p : all) {
            // a judge may reuse a ladder backend under the same id
            if (!seen.add(p.id())) continue;
            adapters.add(switch (p.adapter()) {
                case DEMO -> new DemoAdapter(p.id(), p.demoReply());
                case OLLAMA -> new OllamaChatAdapter(
                        p.id(),
                        p.model(),
                        p.baseUrl() == null ? properties.ollama().baseUrl() : p.baseUrl(),
                        p.apiKey(),
                        modelWebClient
                );
            });
        }
        return new ModelAdapterRegistry(adapters);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService trafficExecutor(CascadaProperties properties) {
        return boundedPool(properties.execution().trafficThreads(), properties.execution().queueCapacity(), "cascada-call-");
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService probeExecutor(CascadaProperties properties) {
        return boundedPool(properties.execution().probeThreads(), properties.execution().queueCapacity(), "cascada-probe-");
    }

    // a full queue rejects the submit; ExecutionClient reports that as REJECTED
    static ThreadPoolExecutor boundedPool(int threads, int queueCapacity, String prefix) {
        return new ThreadPoolExecutor(
                threads,
                threads,
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new CustomizableThreadFactory(prefix),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public ThreadPoolTaskScheduler cascadaTaskScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("cascada-sched-");
        s.setRemoveOnCancelPolicy(true);
        return s;
    }

    @Bean
    public ExecutionClient executionClient(
            ModelAdapterRegistry adapters,
            @Qualifier("trafficExecutor") ExecutorService trafficExecutor,
            @Qualifier("probeExecutor") ExecutorService probeExecutor,
            MetricsAggregator metricsAggregator,
            Clock clock
    ) {
        return new ExecutionClient(adapters, trafficExecutor, probeExecutor, metricsAggregator, clock);
    }

    @Bean
    public ProviderRouter providerRouter(ProviderRegistry registry, ProviderHealthService healthService, EscalationChain chain) {
        return new ProviderRouter(registry, healthService, chain);
    }

    @Bean
    public JudgeResponseParser judgeResponseParser(ObjectMapper objectMapper) {
        return new JudgeResponseParser(objectMapper);
    }

    @Bean
    public VerificationPipeline verificationPipeline(
            CascadaProperties properties,
            ExecutionClient executionClient,
            JudgeBackends judges,
            JudgeResponseParser parser
    ) {
        VerificationThresholds thresholds = VerificationThresholds.from(properties.verification());
        JudgeCallSettings callSettings = JudgeCallSettings.from(properties.verification());
        return new VerificationPipeline(
                new SafetyVerifier(executionClient, judges.safety(), parser, callSettings),
                new ConfidenceScorer(executionClient, judges.confidence(), parser, callSettings, thresholds),
                thresholds,
                properties.verification().allowRequestOptOut()
        );
    }

    @Bean
    public IntentDetector intentDetector() {
        return new IntentDetector();
    }

    @Bean
    public EscalationController escalationController(
            CascadaProperties properties,
            ProviderRouter router,
            ExecutionClient executionClient,
            VerificationPipeline pipeline,
            IntentDetector intentDetector,
            RoutingRequestLogService requestLog
    ) {
        return new EscalationController(router, executionClient, pipeline, intentDetector, requestLog,
                EscalationSettings.from(properties.escalation()));
    }

    @Bean
    public HealthProber healthProber(
            CascadaProperties properties,
            ProviderRegistry registry,
            JudgeBackends judges,
            ExecutionClient executionClient,
            ProviderHealthService healthService,
            ThreadPoolTaskScheduler cascadaTaskScheduler,
            Clock clock
    ) {
        return new HealthProber(registry, judges, executionClient, healthService, properties.probe(), cascadaTaskScheduler, clock);
    }

    @Bean
    public MetricsRetentionJob metricsRetentionJob(
            CascadaProperties properties,
            ProviderMetricRepository metricRepository,
            RoutingRequestRepository routingRequestRepository,
            ThreadPoolTaskScheduler cascadaTaskScheduler,
            Clock clock
    ) {
        return new MetricsRetentionJob(metricRepository, routingRequestRepository, properties.metrics(), cascadaTaskScheduler, clock);
    }

    static ProviderDescriptor toDescriptor(CascadaProperties.Provider p) {
        return new ProviderDescriptor(
                p.id(),
                p.displayName(),
                p.tier(),
                p.costPerUnit(),
                p.priority(),
                p.role(),
                p.active(),
                Set.copyOf(p.intents())
        );
    }
}
