/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.api.providers;

import com.cascada.api.ApiException;
import com.cascada.application.ProviderStatusService;
import com.cascada.application.health.HealthRecord;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/providers")
public class ProviderStatusController {
    private final ProviderStatusService providerStatusService;

    public ProviderStatusController(ProviderStatusService providerStatusService) {
        this.providerStatusService = providerStatusService;
    }

    @GetMapping
    public List<ProviderStatusService.ProviderStatus> list() {
        return providerStatusService.list();
    }

    @GetMapping("/{id}/status")
    public HealthRecord status(@PathVariable("id") String id) {
        return providerStatusService.health(id).orElseThrow(() -> unknown(id));
    }

    @PostMapping("/{id}/probe")
    public HealthRecord probe(@PathVariable("id") String id) {
        return providerStatusService.probeNow(id).orElseThrow(() -> unknown(id));
    }

    private static ApiException unknown(String id) {
        return new ApiException(HttpStatus.NOT_FOUND, "PROVIDER_NOT_FOUND", "Unknown provider " + id);
    }
}
