/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.intent;

import com.cascada.domain.model.Intent;

public final class PromptProfiles {
    static final String DEFAULT = "You are a concise, accurate assistant. Use numbered steps for procedures. "
            + "If unsure, say 'I don't know, check sources.' "
            + "Do not invent facts; if information depends on external sources label it.";
    static final String CREATIVE = "You are a creative and imaginative assistant. Be expressive while remaining helpful. "
            + "Do not invent facts; if information depends on external sources label it.";
    static final String CODE = "You are a precise coding assistant. Provide clean, working code with brief explanations. "
            + "Use best practices and include error handling. "
            + "Do not invent facts; if information depends on external sources label it.";
    static final String RAG = "You are a retrieval assistant. Answer based strictly on provided context. "
            + "If the answer is not in the context, say 'This information is not available in the provided context.' "
            + "Do not invent facts; cite sources when available.";
    static final String CLASSIFICATION = "You are a classification assistant. Provide only the requested classification without explanation. "
            + "Be precise and consistent.";

    private PromptProfiles() {}

    public static String systemPromptFor(Intent intent) {
        if (intent == null) return DEFAULT;
        return switch (intent) {
            case CODE_GEN -> CODE;
            case CREATIVE -> CREATIVE;
            case RAG, RETRIEVAL -> RAG;
            case CLASSIFICATION, STATUS -> CLASSIFICATION;
            default -> DEFAULT;
        };
    }
}
