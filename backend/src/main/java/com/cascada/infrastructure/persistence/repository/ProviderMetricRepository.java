/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.persistence.repository;

import com.cascada.infrastructure.persistence.entity.ProviderMetricEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ProviderMetricRepository extends JpaRepository<ProviderMetricEntity, UUID> {
    @Query("""
            select m from ProviderMetricEntity m
            where m.providerId = :providerId
              and m.createdAt >= :from
            order by m.createdAt desc
            """)
    List<ProviderMetricEntity> findRecentByProvider(
            @Param("providerId") String providerId,
            @Param("from") Instant from
    );

    @Transactional
    @Modifying
    @Query("delete from ProviderMetricEntity m where m.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
