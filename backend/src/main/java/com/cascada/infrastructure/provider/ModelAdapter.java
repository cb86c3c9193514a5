/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.infrastructure.provider;

/**
 * Blocking completion call against one backend.
 * Implementations raise {@link ProviderException} for every failure they can classify.
 */
public interface ModelAdapter {
    String providerId();

    CompletionResult complete(CompletionRequest request);
}
