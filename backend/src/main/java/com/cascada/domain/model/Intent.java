/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Intent {
    SUMMARIZE("summarize"),
    EXPLAIN("explain"),
    CODE_GEN("code-gen"),
    CREATIVE("creative"),
    RETRIEVAL("retrieval"),
    RAG("rag"),
    CHAT("chat"),
    CLASSIFICATION("classification"),
    STATUS("status"),
    MICROOP("microop"),
    LEGAL("legal"),
    TRANSLATION("translation");

    private final String code;

    Intent(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static Intent fromCode(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Intent intent : values()) {
            if (intent.code.equals(normalized) || intent.name().equalsIgnoreCase(normalized)) {
                return intent;
            }
        }
        throw new IllegalArgumentException("Unknown intent " + value);
    }
}
