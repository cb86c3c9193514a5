/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.config;

import com.cascada.domain.model.Intent;
import com.cascada.domain.model.ProviderRole;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "cascada")
public record CascadaProperties(
        List<Provider> providers,
        Judges judges,
        Escalation escalation,
        Verification verification,
        CircuitBreaker circuitBreaker,
        Probe probe,
        Metrics metrics,
        Execution execution,
        Ollama ollama
) {
    public CascadaProperties {
        providers = providers == null ? List.of() : List.copyOf(providers);
        judges = judges == null ? new Judges(null, null) : judges;
        escalation = escalation == null ? new Escalation(null, null, null) : escalation;
        verification = verification == null ? new Verification(null, null, null, null, null, null, null) : verification;
        circuitBreaker = circuitBreaker == null ? new CircuitBreaker(null, null, null, null, null, null, null) : circuitBreaker;
        probe = probe == null ? new Probe(null, null, null, null, null) : probe;
        metrics = metrics == null ? new Metrics(null, null, null) : metrics;
        execution = execution == null ? new Execution(null, null, null) : execution;
        ollama = ollama == null ? new Ollama(null, null) : ollama;
    }

    public enum AdapterKind {
        OLLAMA,
        DEMO
    }

    public record Provider(
            String id,
            String displayName,
            Integer tier,
            Double costPerUnit,
            Integer priority,
            ProviderRole role,
            Boolean active,
            AdapterKind adapter,
            String model,
            String baseUrl,
            String apiKey,
            String demoReply,
            List<Intent> intents
    ) {
        public Provider {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("cascada provider id is required");
            }
            displayName = (displayName == null || displayName.isBlank()) ? id : displayName;
            tier = tier == null ? 0 : tier;
            costPerUnit = costPerUnit == null ? 0.0 : costPerUnit;
            priority = priority == null ? 0 : priority;
            role = ProviderRole.fromNullable(role);
            active = active == null ? Boolean.TRUE : active;
            adapter = adapter == null ? AdapterKind.OLLAMA : adapter;
            model = (model == null || model.isBlank()) ? id : model;
            intents = intents == null ? List.of() : List.copyOf(intents);
        }
    }

    public record Judges(Provider safety, Provider confidence) {}

    public record Escalation(
            Integer maxEscalations,
            Duration answerTimeout,
            Map<String, String> chain
    ) {
        public Escalation {
            maxEscalations = maxEscalations == null ? 2 : maxEscalations;
            answerTimeout = answerTimeout == null ? Duration.ofSeconds(60) : answerTimeout;
            chain = chain == null ? Map.of() : new LinkedHashMap<>(chain);
        }
    }

    public record Verification(
            Double safetyMinScore,
            Double confidenceCritical,
            Double confidenceAccept,
            List<String> criticalIssues,
            Boolean allowRequestOptOut,
            Duration judgeTimeout,
            Integer judgeMaxTokens
    ) {
        public Verification {
            safetyMinScore = safetyMinScore == null ? 0.7 : safetyMinScore;
            confidenceCritical = confidenceCritical == null ? 0.4 : confidenceCritical;
            confidenceAccept = confidenceAccept == null ? 0.65 : confidenceAccept;
            criticalIssues = criticalIssues == null ? List.of("harmful_content", "hallucination") : List.copyOf(criticalIssues);
            allowRequestOptOut = allowRequestOptOut == null ? Boolean.FALSE : allowRequestOptOut;
            judgeTimeout = judgeTimeout == null ? Duration.ofSeconds(20) : judgeTimeout;
            judgeMaxTokens = judgeMaxTokens == null ? 256 : judgeMaxTokens;
        }
    }

    public record CircuitBreaker(
            Integer windowSize,
            Double failureRateThreshold,
            Integer consecutiveFailures,
            Integer latencyWindowSize,
            Duration coolDown,
            Double backoffMultiplier,
            Duration maxCoolDown
    ) {
        public CircuitBreaker {
            windowSize = windowSize == null ? 5 : windowSize;
            failureRateThreshold = failureRateThreshold == null ? 0.5 : failureRateThreshold;
            consecutiveFailures = consecutiveFailures == null ? 3 : consecutiveFailures;
            latencyWindowSize = latencyWindowSize == null ? 20 : latencyWindowSize;
            coolDown = coolDown == null ? Duration.ofSeconds(30) : coolDown;
            backoffMultiplier = backoffMultiplier == null ? 2.0 : backoffMultiplier;
            maxCoolDown = maxCoolDown == null ? Duration.ofMinutes(5) : maxCoolDown;
        }
    }

    public record Probe(
            Boolean enabled,
            Duration interval,
            Duration initialDelay,
            Duration timeout,
            String prompt
    ) {
        public Probe {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            interval = interval == null ? Duration.ofSeconds(60) : interval;
            initialDelay = initialDelay == null ? Duration.ofSeconds(10) : initialDelay;
            timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
            prompt = (prompt == null || prompt.isBlank()) ? "Reply with the word PONG." : prompt;
        }
    }

    public record Metrics(
            Boolean persist,
            Duration retention,
            Duration cleanupInterval
    ) {
        public Metrics {
            persist = persist == null ? Boolean.TRUE : persist;
            retention = retention == null ? Duration.ofDays(7) : retention;
            cleanupInterval = cleanupInterval == null ? Duration.ofHours(6) : cleanupInterval;
        }
    }

    public record Execution(
            Integer trafficThreads,
            Integer probeThreads,
            Integer queueCapacity
    ) {
        public Execution {
            trafficThreads = trafficThreads == null ? 16 : trafficThreads;
            probeThreads = probeThreads == null ? 4 : probeThreads;
            queueCapacity = queueCapacity == null ? 64 : queueCapacity;
        }
    }

    public record Ollama(
            String baseUrl,
            Integer connectTimeoutMs
    ) {
        public Ollama {
            baseUrl = (baseUrl == null || baseUrl.isBlank()) ? "http://localhost:11434" : baseUrl;
            connectTimeoutMs = connectTimeoutMs == null ? 5_000 : connectTimeoutMs;
        }
    }
}
