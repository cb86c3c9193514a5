/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed escalation ladder: provider id to the next, more capable provider id. A missing or blank
 * next id marks the top of the ladder.
 */
public final class EscalationChain {
    private final Map<String, String> next;

    private EscalationChain(Map<String, String> next) {
        this.next = Collections.unmodifiableMap(next);
    }

    public static EscalationChain of(Map<String, String> mapping) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (mapping != null) {
            mapping.forEach((from, to) -> {
                if (from == null || from.isBlank()) {
                    throw new IllegalStateException("Escalation chain contains a blank provider id");
                }
                copy.put(from.trim(), (to == null || to.isBlank()) ? null : to.trim());
            });
        }
        validateAcyclic(copy);
        return new EscalationChain(copy);
    }

    /**
     * Builds the chain from an ordered ladder, lowest tier first.
     */
    public static EscalationChain ladder(List<String> providerIds) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (int i = 0; i < providerIds.size(); i++) {
            mapping.put(providerIds.get(i), i + 1 < providerIds.size() ? providerIds.get(i + 1) : null);
        }
        return of(mapping);
    }

    public Optional<String> nextOf(String providerId) {
        return Optional.ofNullable(next.get(providerId));
    }

    public boolean contains(String providerId) {
        return next.containsKey(providerId);
    }

    public Map<String, String> asMap() {
        return next;
    }

    private static void validateAcyclic(Map<String, String> mapping) {
        for (String start : mapping.keySet()) {
            Set<String> seen = new LinkedHashSet<>();
            String current = start;
            while (current != null) {
                if (!seen.add(current)) {
                    List<String> path = new ArrayList<>(seen);
                    path.add(current);
                    throw new IllegalStateException("Escalation chain has a cycle: " + String.join(" -> ", path));
                }
                current = mapping.get(current);
            }
        }
    }
}
