/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.persistence.entity;

import com.cascada.domain.model.RequestState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "routing_requests")
public class RoutingRequestEntity {
    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    // caller supplied, so not unique
    @Column(name = "request_id", nullable = false, length = 64)
    private String requestId;

    @Column(name = "intent")
    private String intent;

    @Column(name = "model_override")
    private String modelOverride;

    @Enumerated(EnumType.STRING)
    @Column(name = "terminal_state", nullable = false)
    private RequestState terminalState;

    @Column(name = "reason_code", nullable = false)
    private String reasonCode;

    @Column(name = "original_provider")
    private String originalProvider;

    @Column(name = "final_provider")
    private String finalProvider;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "escalated", nullable = false)
    private boolean escalated;

    @Column(name = "best_effort", nullable = false)
    private boolean bestEffort;

    @Column(name = "safety_score")
    private Double safetyScore;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "total_latency_ms", nullable = false)
    private long totalLatencyMs;

    @Column(name = "total_cost", nullable = false)
    private double totalCost;

    @Column(name = "attempts_json", nullable = false)
    private String attemptsJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public String getIntent() {
        return intent;
    }

    public void setIntent(String intent) {
        this.intent = intent;
    }

    public String getModelOverride() {
        return modelOverride;
    }

    public void setModelOverride(String modelOverride) {
        this.modelOverride = modelOverride;
    }

    public RequestState getTerminalState() {
        return terminalState;
    }

    public void setTerminalState(RequestState terminalState) {
        this.terminalState = terminalState;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public void setReasonCode(String reasonCode) {
        this.reasonCode = reasonCode;
    }

    public String getOriginalProvider() {
        return originalProvider;
    }

    public void setOriginalProvider(String originalProvider) {
        this.originalProvider = originalProvider;
    }

    public String getFinalProvider() {
        return finalProvider;
    }

    public void setFinalProvider(String finalProvider) {
        this.finalProvider = finalProvider;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    public boolean isEscalated() {
        return escalated;
    }

    public void setEscalated(boolean escalated) {
        this.escalated = escalated;
    }

    public boolean isBestEffort() {
        return bestEffort;
    }

    public void setBestEffort(boolean bestEffort) {
        this.bestEffort = bestEffort;
    }

    public Double getSafetyScore() {
        return safetyScore;
    }

    public void setSafetyScore(Double safetyScore) {
        this.safetyScore = safetyScore;
    }

    public Double getConfidenceScore() {
        return confidenceScore;
    }

    public void setConfidenceScore(Double confidenceScore) {
        this.confidenceScore = confidenceScore;
    }

    public long getTotalLatencyMs() {
        return totalLatencyMs;
    }

    public void setTotalLatencyMs(long totalLatencyMs) {
        this.totalLatencyMs = totalLatencyMs;
    }

    public double getTotalCost() {
        return totalCost;
    }

    public void setTotalCost(double totalCost) {
        this.totalCost = totalCost;
    }

    public String getAttemptsJson() {
        return attemptsJson;
    }

    public void setAttemptsJson(String attemptsJson) {
        this.attemptsJson = attemptsJson;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
