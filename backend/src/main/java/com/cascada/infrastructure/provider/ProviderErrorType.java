/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

public enum ProviderErrorType {
    AUTH,
    RATE_LIMIT,
    TIMEOUT,
    TRANSPORT,
    MALFORMED_RESPONSE
}
