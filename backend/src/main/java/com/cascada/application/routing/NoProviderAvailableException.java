/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.routing;

public class NoProviderAvailableException extends RuntimeException {
    public NoProviderAvailableException(String message) {
        super(message);
    }
}
