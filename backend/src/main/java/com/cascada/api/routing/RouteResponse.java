/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.api.routing;

import com.cascada.application.escalation.AttemptReport;
import com.cascada.application.escalation.RoutingOutcome;
import com.cascada.application.verification.ConfidenceResult;
import com.cascada.application.verification.VerificationResult;
import com.cascada.domain.model.AttemptOutcome;
import com.cascada.domain.model.Intent;
import com.cascada.domain.model.RecommendedAction;
import com.cascada.domain.model.RequestState;

import java.util.List;

public record RouteResponse(
        String requestId,
        RequestState state,
        String reason,
        String answer,
        Intent intent,
        String originalProvider,
        String finalProvider,
        boolean escalated,
        boolean bestEffort,
        Safety safety,
        Confidence confidence,
        List<Attempt> attempts,
        long totalLatencyMs,
        double totalCost
) {
    public static RouteResponse from(RoutingOutcome o) {
        return new RouteResponse(
                o.requestId(),
                o.terminalState(),
                o.reasonCode(),
                o.finalAnswer(),
                o.intent(),
                o.originalProvider(),
                o.finalProvider(),
                o.escalated(),
                o.bestEffort(),
                Safety.from(o.verification()),
                Confidence.from(o.confidence()),
                o.attempts().stream().map(Attempt::from).toList(),
                o.totalLatencyMs(),
                o.totalCost()
        );
    }

    public record Safety(double score, boolean safe, List<String> issues, String explanation, boolean judgeFailed, boolean skipped) {
        static Safety from(VerificationResult v) {
            if (v == null) return null;
            return new Safety(v.safetyScore(), v.safe(), v.issues(), v.explanation(), v.judgeFailed(), v.skipped());
        }
    }

    public record Confidence(double score, RecommendedAction action, String reasoning, boolean judgeFailed, boolean skipped) {
        static Confidence from(ConfidenceResult c) {
            if (c == null) return null;
            return new Confidence(c.score(), c.action(), c.reasoning(), c.judgeFailed(), c.skipped());
        }
    }

    public record Attempt(int sequence, String provider, AttemptOutcome outcome, long latencyMs, Double safetyScore, Double confidence, Boolean safe) {
        static Attempt from(AttemptReport a) {
            return new Attempt(
                    a.sequence(),
                    a.providerId(),
                    a.outcome(),
                    a.latencyMs(),
                    a.verification() == null ? null : a.verification().safetyScore(),
                    a.confidence() == null ? null : a.confidence().score(),
                    a.safe()
            );
        }
    }
}
