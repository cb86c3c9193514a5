/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.execution;

/**
 * The owning request was cancelled (thread interrupted) while a provider call was in flight.
 */
public class RequestCancelledException extends RuntimeException {
    private final String providerId;

    public RequestCancelledException(String providerId, Throwable cause) {
        super("Request cancelled while calling provider " + providerId, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
