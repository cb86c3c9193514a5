/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.verification;

public record Verdict(VerificationResult verification, ConfidenceResult confidence, boolean safe) {}
