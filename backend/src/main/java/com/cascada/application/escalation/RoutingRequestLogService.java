/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.escalation;

import com.cascada.config.CascadaProperties;
import com.cascada.infrastructure.persistence.entity.RoutingRequestEntity;
import com.cascada.infrastructure.persistence.repository.RoutingRequestRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Stores one row per finished request. Prompt and answer text are never stored.
 *
 * <p>Rows get their own id; the {@code X-Request-Id} value is only a correlation key, so a
 * client reusing it adds a row instead of replacing one.
 */
@Service
public class RoutingRequestLogService {
    private static final Logger log = LoggerFactory.getLogger(RoutingRequestLogService.class);

    private final RoutingRequestRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean persist;

    public RoutingRequestLogService(RoutingRequestRepository repository, ObjectMapper objectMapper, Clock clock, CascadaProperties properties) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.persist = properties.metrics().persist();
    }

    public void record(RoutingRequest request, RoutingOutcome outcome) {
        if (!persist) return;

        RoutingRequestEntity e = new RoutingRequestEntity();
        e.setId(UUID.randomUUID().toString());
        e.setRequestId(outcome.requestId());
        e.setIntent(outcome.intent() == null ? null : outcome.intent().code());
        e.setModelOverride(request.modelOverride());
        e.setTerminalState(outcome.terminalState());
        e.setReasonCode(outcome.reasonCode());
        e.setOriginalProvider(outcome.originalProvider());
        e.setFinalProvider(outcome.finalProvider());
        e.setAttemptCount(outcome.attempts().size());
        e.setEscalated(outcome.escalated());
        e.setBestEffort(outcome.bestEffort());
        e.setSafetyScore(outcome.verification() == null ? null : outcome.verification().safetyScore());
        e.setConfidenceScore(outcome.confidence() == null ? null : outcome.confidence().score());
        e.setTotalLatencyMs(outcome.totalLatencyMs());
        e.setTotalCost(outcome.totalCost());
        e.setAttemptsJson(attemptsJson(outcome.attempts()));
        e.setCreatedAt(request.createdAt());
        e.setCompletedAt(clock.instant());

        try {
            repository.save(e);
        } catch (DataAccessException ex) {
            log.warn("Failed to store routing request request={} state={}", outcome.requestId(), outcome.terminalState(), ex);
        }
    }

    private String attemptsJson(List<AttemptReport> attempts) {
        List<Map<String, Object>> rows = attempts.stream().map(a -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("sequence", a.sequence());
            row.put("provider", a.providerId());
            row.put("outcome", a.outcome().name());
            row.put("latencyMs", a.latencyMs());
            row.put("cost", a.cost());
            if (a.verification() != null) {
                row.put("safetyScore", a.verification().safetyScore());
                row.put("issues", a.verification().issues());
            }
            if (a.confidence() != null) {
                row.put("confidence", a.confidence().score());
                row.put("action", a.confidence().action().name());
            }
            if (a.safe() != null) row.put("safe", a.safe());
            return row;
        }).toList();
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException ex) {
            log.warn("Could not serialize attempts request attempts={}", attempts.size(), ex);
            return "[]";
        }
    }
}
