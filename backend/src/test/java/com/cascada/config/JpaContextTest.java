/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.config;

import com.cascada.infrastructure.persistence.repository.ProviderMetricRepository;
import com.cascada.infrastructure.persistence.repository.RoutingRequestRepository;
import jakarta.persistence.EntityManagerFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
@ActiveProfiles("test")
class JpaContextTest {
    @Autowired
    private EntityManagerFactory entityManagerFactory;

    @Autowired
    private ProviderMetricRepository providerMetricRepository;

    @Autowired
    private RoutingRequestRepository routingRequestRepository;

    @Test
    void contextLoadsWithJpa() {
        assertNotNull(entityManagerFactory);
        assertNotNull(providerMetricRepository);
        assertNotNull(routingRequestRepository);
    }
}
