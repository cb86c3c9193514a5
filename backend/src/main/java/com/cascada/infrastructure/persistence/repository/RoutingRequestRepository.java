/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.persistence.repository;

import com.cascada.domain.model.RequestState;
import com.cascada.infrastructure.persistence.entity.RoutingRequestEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface RoutingRequestRepository extends JpaRepository<RoutingRequestEntity, String> {
    @Query("""
            select r from RoutingRequestEntity r
            where (:from is null or r.createdAt >= :from)
              and (:to is null or r.createdAt <= :to)
              and (:state is null or r.terminalState = :state)
              and (:provider is null or r.finalProvider = :provider)
            order by r.createdAt desc
            """)
    List<RoutingRequestEntity> search(
            @Param("from") Instant from,
            @Param("to") Instant to,
            @Param("state") RequestState state,
            @Param("provider") String provider
    );

    List<RoutingRequestEntity> findByRequestIdOrderByCreatedAtAsc(String requestId);

    @Transactional
    @Modifying
    @Query("delete from RoutingRequestEntity r where r.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
