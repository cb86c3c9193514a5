/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.api;

public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId
) {}
