/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.api.routing;

import com.cascada.domain.model.RequestState;
import com.cascada.infrastructure.persistence.entity.RoutingRequestEntity;
import com.cascada.infrastructure.persistence.repository.RoutingRequestRepository;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/routing")
public class RoutingHistoryController {
    private final RoutingRequestRepository routingRequestRepository;

    public RoutingHistoryController(RoutingRequestRepository routingRequestRepository) {
        this.routingRequestRepository = routingRequestRepository;
    }

    @GetMapping("/requests")
    public List<RoutingRequestEntity> requests(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "state", required = false) RequestState state,
            @RequestParam(value = "provider", required = false) String provider
    ) {
        return routingRequestRepository.search(from, to, state, provider);
    }
}
