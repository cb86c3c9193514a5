/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.intent;

import com.cascada.domain.model.Intent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword based intent guess, used only when the caller supplies no intent. First match wins.
 */
public class IntentDetector {
    private static final Map<Intent, List<String>> KEYWORDS = new LinkedHashMap<>();
    static {
        KEYWORDS.put(Intent.SUMMARIZE, List.of("summarize", "summary", "tldr", "sum up"));
        KEYWORDS.put(Intent.EXPLAIN, List.of("explain", "what is", "what does", "how does"));
        KEYWORDS.put(Intent.CODE_GEN, List.of("code", "function", "class", "implement", "script"));
        KEYWORDS.put(Intent.CREATIVE, List.of("story", "poem", "creative", "imagine"));
        KEYWORDS.put(Intent.TRANSLATION, List.of("translate", "translation", "say in"));
        KEYWORDS.put(Intent.CLASSIFICATION, List.of("classify", "category", "label"));
        KEYWORDS.put(Intent.STATUS, List.of("status", "health", "check"));
    }

    public Intent detect(String prompt) {
        if (prompt == null || prompt.isBlank()) return Intent.CHAT;
        String lower = prompt.toLowerCase(Locale.ROOT);
        for (Map.Entry<Intent, List<String>> entry : KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return Intent.CHAT;
    }
}
