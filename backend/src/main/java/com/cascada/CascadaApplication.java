/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CascadaApplication {
    public static void main(String[] args) {
        SpringApplication.run(CascadaApplication.class, args);
    }
}
