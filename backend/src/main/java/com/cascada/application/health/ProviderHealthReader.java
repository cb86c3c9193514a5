/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.health;

public interface ProviderHealthReader {
    HealthRecord getSnapshot(String providerId);
}
