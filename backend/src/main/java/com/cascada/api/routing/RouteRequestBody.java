/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.api.routing;

import com.cascada.domain.model.Intent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RouteRequestBody(
        @NotBlank @Size(max = 32_000) String prompt,
        Intent intent,
        @Size(max = 128) String modelOverride,
        Options options
) {
    public record Options(
            Boolean enableVerification,
            Boolean enableConfidenceScoring,
            Boolean autoEscalate
    ) {}
}
