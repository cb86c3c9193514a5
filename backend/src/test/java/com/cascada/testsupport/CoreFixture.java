/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.testsupport;

import com.cascada.application.escalation.EscalationController;
import com.cascada.application.escalation.EscalationSettings;
import com.cascada.application.escalation.RoutingRequestLogService;
import com.cascada.application.execution.ExecutionClient;
import com.cascada.application.health.CircuitBreakerPolicy;
import com.cascada.application.health.ProviderHealthService;
import com.cascada.application.intent.IntentDetector;
import com.cascada.application.metrics.AttemptMetric;
import com.cascada.application.metrics.MetricsAggregator;
import com.cascada.application.metrics.MetricsRecorder;
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
import com.cascada.config.CascadaProperties;
import com.cascada.domain.model.ProviderRole;
import com.cascada.infrastructure.persistence.repository.ProviderMetricRepository;
import com.cascada.infrastructure.provider.ModelAdapter;
import com.cascada.infrastructure.provider.ModelAdapterRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.mockito.Mockito.mock;

/**
 * The routing core wired by hand: ladder gemma, phi3, qwen, mistral plus two judges, all
 * backed by scripted adapters.
 */
public final class CoreFixture implements AutoCloseable {
    public static final String SAFE_JSON = "{\"is_safe\": true, \"safety_score\": 0.95, \"issues\": [], \"explanation\": \"ok\"}";
    public static final List<String> LADDER = List.of("gemma", "phi3", "qwen", "mistral");

    public final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    public final Map<String, ScriptedAdapter> adapters = new LinkedHashMap<>();
    public final ScriptedAdapter safetyJudge = new ScriptedAdapter("safety-judge", SAFE_JSON);
    public final ScriptedAdapter confidenceJudge = new ScriptedAdapter("confidence-judge", confidenceJson(0.9));
    public final List<AttemptMetric> metrics = new CopyOnWriteArrayList<>();
    public final ProviderRegistry registry;
    public final JudgeBackends judges;
    public final ProviderHealthService health;
    public final MetricsAggregator aggregator;
    public final ExecutionClient execution;
    public final ProviderRouter router;
    public final VerificationPipeline pipeline;
    public final RoutingRequestLogService requestLog = mock(RoutingRequestLogService.class);
    public final EscalationController controller;

    private final ExecutorService traffic = Executors.newCachedThreadPool(new CustomizableThreadFactory("test-call-"));
    private final ExecutorService probes = Executors.newCachedThreadPool(new CustomizableThreadFactory("test-probe-"));

    private CoreFixture(Builder b) {
        List<ProviderDescriptor> descriptors = new ArrayList<>();
        for (int i = 0; i < LADDER.size(); i++) {
            String id = LADDER.get(i);
            ProviderRole role = i == 0 ? ProviderRole.PRIMARY : (i == LADDER.size() - 1 ? ProviderRole.FALLBACK : null);
            descriptors.add(new ProviderDescriptor(id, id, i + 1, 0.001, 10 - i, role, true, Set.of()));
            adapters.put(id, new ScriptedAdapter(id, "answer from " + id));
        }
        registry = new ProviderRegistry(descriptors);
        judges = new JudgeBackends(
                new ProviderDescriptor("safety-judge", "safety", 0, 0.0, 0, null, true, Set.of()),
                new ProviderDescriptor("confidence-judge", "confidence", 0, 0.0, 0, null, true, Set.of())
        );

        List<ModelAdapter> all = new ArrayList<>();
        adapters.forEach((id, adapter) -> {
            if (!b.unbound.contains(id)) all.add(adapter);
        });
        all.add(safetyJudge);
        all.add(confidenceJudge);

        health = new ProviderHealthService(CircuitBreakerPolicy.defaults(), clock, b.promoteOnRead);
        CascadaProperties props = new CascadaProperties(null, null, null, null, null, null,
                new CascadaProperties.Metrics(false, null, null), null, null);
        aggregator = new MetricsAggregator(health, mock(ProviderMetricRepository.class), props);
        MetricsRecorder recorder = metric -> {
            metrics.add(metric);
            aggregator.record(metric);
        };

        execution = new ExecutionClient(new ModelAdapterRegistry(all), traffic, probes, recorder, clock);
        router = new ProviderRouter(registry, health, EscalationChain.ladder(LADDER));

        JudgeResponseParser parser = new JudgeResponseParser(new ObjectMapper());
        JudgeCallSettings judgeCalls = new JudgeCallSettings(b.judgeTimeout, 256);
        pipeline = new VerificationPipeline(
                new SafetyVerifier(execution, judges.safety(), parser, judgeCalls),
                new ConfidenceScorer(execution, judges.confidence(), parser, judgeCalls, b.thresholds),
                b.thresholds,
                b.allowOptOut
        );
        controller = new EscalationController(router, execution, pipeline, new IntentDetector(), requestLog,
                new EscalationSettings(b.maxEscalations, b.answerTimeout));
    }

    public static CoreFixture create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static String confidenceJson(double score) {
        return "{\"confidence_score\": " + score + ", \"reasoning\": \"scripted\"}";
    }

    public ScriptedAdapter adapter(String id) {
        return adapters.get(id);
    }

    public CoreFixture confidenceScores(double... scores) {
        for (double s : scores) {
            confidenceJudge.thenReply(confidenceJson(s));
        }
        return this;
    }

    public List<String> answerProviders() {
        return metrics.stream()
                .filter(m -> m.kind() == com.cascada.domain.model.CallKind.ANSWER)
                .map(AttemptMetric::providerId)
                .toList();
    }

    @Override
    public void close() {
        traffic.shutdownNow();
        probes.shutdownNow();
    }

    public static final class Builder {
        private VerificationThresholds thresholds = VerificationThresholds.defaults();
        private int maxEscalations = 2;
        private boolean allowOptOut;
        private boolean promoteOnRead;
        private Duration answerTimeout = Duration.ofSeconds(5);
        private Duration judgeTimeout = Duration.ofSeconds(5);
        private final Set<String> unbound = new HashSet<>();

        public Builder thresholds(VerificationThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder maxEscalations(int maxEscalations) {
            this.maxEscalations = maxEscalations;
            return this;
        }

        public Builder allowOptOut(boolean allowOptOut) {
            this.allowOptOut = allowOptOut;
            return this;
        }

        public Builder promoteOnRead(boolean promoteOnRead) {
            this.promoteOnRead = promoteOnRead;
            return this;
        }

        public Builder answerTimeout(Duration answerTimeout) {
            this.answerTimeout = answerTimeout;
            return this;
        }

        public Builder judgeTimeout(Duration judgeTimeout) {
            this.judgeTimeout = judgeTimeout;
            return this;
        }

        /** Keeps the provider in the catalogue but registers no adapter for it. */
        public Builder withoutAdapter(String providerId) {
            this.unbound.add(providerId);
            return this;
        }

        public CoreFixture build() {
            return new CoreFixture(this);
        }
    }
}
