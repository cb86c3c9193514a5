/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Opt-in repair of the schema history, for local SQLite files left behind by an edited migration.
 */
@Configuration
public class FlywayRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayRepairConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "cascada.flyway", name = "auto-repair", havingValue = "true")
    public FlywayMigrationStrategy flywayRepairMigrationStrategy() {
        return flyway -> {
            log.warn("cascada.flyway.auto-repair enabled: repairing schema history before migrating");
            flyway.repair();
            flyway.migrate();
        };
    }
}
