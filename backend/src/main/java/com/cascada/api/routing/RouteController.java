/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.api.routing;

import com.cascada.application.escalation.EscalationController;
import com.cascada.application.escalation.RoutingOptions;
import com.cascada.application.escalation.RoutingOutcome;
import com.cascada.application.escalation.RoutingRequest;
import com.cascada.config.RequestIdFilter;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/api/route")
public class RouteController {
    private final EscalationController escalationController;
    private final Clock clock;

    public RouteController(EscalationController escalationController, Clock clock) {
        this.escalationController = escalationController;
        this.clock = clock;
    }

    /**
     * 200 with an answer (accepted or best effort), 422 when the answer was refused, 502 when
     * every attempt failed without an answer.
     */
    @PostMapping
    public ResponseEntity<RouteResponse> route(@Valid @RequestBody RouteRequestBody body) {
        RoutingRequest request = new RoutingRequest(
                RequestIdFilter.currentOrNew(),
                body.prompt(),
                body.intent(),
                body.modelOverride(),
                toOptions(body.options()),
                clock.instant()
        );
        RoutingOutcome outcome = escalationController.route(request);

        HttpStatus status = switch (outcome.terminalState()) {
            case ACCEPTED -> HttpStatus.OK;
            case REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case EXHAUSTED -> outcome.hasAnswer() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY;
            case RUNNING -> throw new IllegalStateException("Routing returned a non-terminal state");
        };
        return ResponseEntity.status(status).body(RouteResponse.from(outcome));
    }

    private static RoutingOptions toOptions(RouteRequestBody.Options options) {
        if (options == null) return RoutingOptions.defaults();
        return new RoutingOptions(
                !Boolean.FALSE.equals(options.enableVerification()),
                !Boolean.FALSE.equals(options.enableConfidenceScoring()),
                !Boolean.FALSE.equals(options.autoEscalate())
        );
    }
}
