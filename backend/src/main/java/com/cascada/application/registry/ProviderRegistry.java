/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.registry;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Catalogue of routable backends, fixed at startup. Adapters, the escalation chain and the
 * health schedule are built from the same configuration, so a catalogue change means a restart.
 */
public class ProviderRegistry {
    static final Comparator<ProviderDescriptor> CANDIDATE_ORDER = Comparator
            .comparingInt((ProviderDescriptor d) -> d.role().rank())
            .thenComparing(Comparator.comparingInt(ProviderDescriptor::priority).reversed())
            .thenComparing(ProviderDescriptor::id);

    private final List<ProviderDescriptor> descriptors;

    public ProviderRegistry(List<ProviderDescriptor> descriptors) {
        this.descriptors = validated(descriptors);
    }

    public List<ProviderDescriptor> listCandidates(RoutingConstraints constraints) {
        RoutingConstraints c = constraints == null ? RoutingConstraints.none() : constraints;
        return descriptors.stream()
                .filter(ProviderDescriptor::active)
                .filter(d -> !c.hasOverride() || d.id().equalsIgnoreCase(c.modelOverride().trim()))
                .filter(d -> d.supports(c.intent()))
                .sorted(CANDIDATE_ORDER)
                .toList();
    }

    public Optional<ProviderDescriptor> find(String providerId) {
        if (providerId == null) return Optional.empty();
        return descriptors.stream().filter(d -> d.id().equals(providerId)).findFirst();
    }

    public List<ProviderDescriptor> all() {
        return descriptors;
    }

    private static List<ProviderDescriptor> validated(List<ProviderDescriptor> input) {
        List<ProviderDescriptor> list = input == null ? List.of() : List.copyOf(input);
        Set<String> seen = new HashSet<>();
        for (ProviderDescriptor d : list) {
            if (!seen.add(d.id())) {
                throw new IllegalStateException("Duplicate provider id " + d.id());
            }
        }
        return list;
    }
}
