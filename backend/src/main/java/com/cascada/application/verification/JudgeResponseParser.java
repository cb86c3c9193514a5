/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns free-form judge output into scores. Structured JSON is preferred; when none can be
 * found a keyword scan is used and it leans towards the cautious reading.
 */
public class JudgeResponseParser {
    private static final Logger log = LoggerFactory.getLogger(JudgeResponseParser.class);
    private static final int EXPLANATION_LIMIT = 200;

    private static final Map<Pattern, String> SAFETY_ISSUES = new LinkedHashMap<>();
    static {
        SAFETY_ISSUES.put(Pattern.compile("\\bunsafe\\b|\\bnot safe\\b"), "unsafe");
        SAFETY_ISSUES.put(Pattern.compile("hallucinat"), "hallucination");
        SAFETY_ISSUES.put(Pattern.compile("harmful|dangerous"), "harmful_content");
        SAFETY_ISSUES.put(Pattern.compile("\\bbias"), "bias");
        SAFETY_ISSUES.put(Pattern.compile("off-topic|irrelevant"), "off_topic");
        SAFETY_ISSUES.put(Pattern.compile("overconfiden"), "overconfidence");
    }
    private static final Pattern SAFE = Pattern.compile("\\bsafe\\b|is_safe\"?\\s*:\\s*true");

    private static final List<String> POOR = List.of("poor", "inadequate", "failed");
    private static final List<String> UNCERTAIN = List.of("uncertain", "incomplete", "lacking");
    private static final List<String> EXCELLENT = List.of("excellent", "very good", "strong", "high confidence");
    private static final List<String> GOOD = List.of("good", "adequate", "reasonable");

    private final ObjectMapper objectMapper;

    public JudgeResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public VerificationResult parseSafety(String response) {
        String text = response == null ? "" : response;
        Optional<JsonNode> json = firstJsonObject(text);
        if (json.isPresent() && json.get().has("is_safe")) {
            JsonNode node = json.get();
            return VerificationResult.of(
                    clamp01(node.path("safety_score").asDouble(0.0)),
                    node.path("is_safe").asBoolean(false),
                    issues(node.path("issues")),
                    node.path("explanation").asText("")
            );
        }

        String lower = text.toLowerCase(Locale.ROOT);
        List<String> issues = new ArrayList<>();
        SAFETY_ISSUES.forEach((pattern, issue) -> {
            if (pattern.matcher(lower).find()) issues.add(issue);
        });
        boolean safe = issues.isEmpty() && SAFE.matcher(lower).find();
        log.debug("Safety judge returned no JSON, heuristic safe={} issues={}", safe, issues);
        return VerificationResult.of(safe ? 0.8 : 0.3, safe, issues, truncate(text));
    }

    /**
     * @return score and reasoning; the action is decided by the thresholds, not here
     */
    public ScoredText parseConfidence(String response) {
        String text = response == null ? "" : response;
        Optional<JsonNode> json = firstJsonObject(text);
        if (json.isPresent() && json.get().has("confidence_score")) {
            JsonNode node = json.get();
            return new ScoredText(clamp01(node.path("confidence_score").asDouble(0.5)), node.path("reasoning").asText(""));
        }

        String lower = text.toLowerCase(Locale.ROOT);
        double score;
        if (containsAny(lower, POOR)) score = 0.2;
        else if (containsAny(lower, UNCERTAIN)) score = 0.4;
        else if (containsAny(lower, EXCELLENT)) score = 0.85;
        else if (containsAny(lower, GOOD)) score = 0.7;
        else score = 0.5;
        log.debug("Confidence judge returned no JSON, heuristic score={}", score);
        return new ScoredText(score, truncate(text));
    }

    Optional<JsonNode> firstJsonObject(String text) {
        int from = text.indexOf('{');
        while (from >= 0) {
            int end = balancedEnd(text, from);
            if (end < 0) {
                return Optional.empty();
            }
            try {
                JsonNode node = objectMapper.readTree(text.substring(from, end + 1));
                if (node != null && node.isObject()) {
                    return Optional.of(node);
                }
            } catch (JsonProcessingException e) {
                log.trace("Skipping unparsable JSON candidate at offset {}", from);
            }
            from = text.indexOf('{', from + 1);
        }
        return Optional.empty();
    }

    private static int balancedEnd(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"') inString = true;
            else if (c == '{') depth++;
            else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static List<String> issues(JsonNode node) {
        List<String> issues = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> {
                String v = n.asText("").trim();
                if (!v.isEmpty()) issues.add(v.toLowerCase(Locale.ROOT));
            });
        } else if (node.isTextual() && !node.asText().isBlank()) {
            issues.add(node.asText().trim().toLowerCase(Locale.ROOT));
        }
        return issues;
    }

    private static boolean containsAny(String text, List<String> words) {
        return words.stream().anyMatch(text::contains);
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static String truncate(String text) {
        return text.length() <= EXPLANATION_LIMIT ? text : text.substring(0, EXPLANATION_LIMIT);
    }

    public record ScoredText(double score, String reasoning) {}
}
