/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.registry;

import com.qusetta.api.exceptions.RegistryConfigurationException;
import com.qusetta.api.exceptions.UnsupportedGateException;
import com.qusetta.api.model.CanonicalGate;
import com.qusetta.api.model.GateInstruction;
import com.qusetta.api.model.Vocabulary;
import com.qusetta.compiler.expression.ExpressionEvaluator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of vocabularies and, per vocabulary, how each canonical gate is realised:
 * natively under a name (plus aliases) or through a decomposition into other canonical gates.
 *
 * <p>Native names are matched case-sensitively. Dropped operations (measurement, barriers)
 * are matched case-insensitively.
 *
 * <p>Instances are created by {@link #builder()}, {@link GateRegistryLoader} or
 * {@link #standard()} and are safe to share across threads.
 */
public final class GateRegistry {

    private final Map<String, Vocabulary> vocabularies;
    private final Map<String, Map<CanonicalGate, GateMapping>> mappings;
    private final Map<String, Map<String, CanonicalGate>> nameIndex;

    private GateRegistry(Map<String, Vocabulary> vocabularies,
                         Map<String, Map<CanonicalGate, GateMapping>> mappings,
                         Map<String, Map<String, CanonicalGate>> nameIndex) {
        this.vocabularies = Collections.unmodifiableMap(vocabularies);
        this.mappings = mappings;
        this.nameIndex = nameIndex;
    }

    /**
     * The bundled registry ({@value GateRegistryLoader#DEFAULT_RESOURCE}), loaded on first use
     * and checked for completeness.
     */
    public static GateRegistry standard() {
        return StandardHolder.INSTANCE;
    }

    private static final class StandardHolder {
        static final GateRegistry INSTANCE = load();

        private static GateRegistry load() {
            GateRegistry registry = new GateRegistryLoader().loadDefault();
            registry.validateCompleteness();
            return registry;
        }
    }

    public static Builder builder() {
        return new Builder(new ExpressionEvaluator());
    }

    public static Builder builder(ExpressionEvaluator evaluator) {
        return new Builder(evaluator);
    }

    // ==================== Vocabularies ====================

    /**
     * @throws IllegalArgumentException if no vocabulary has this id
     */
    public Vocabulary vocabulary(String id) {
        Objects.requireNonNull(id, "Vocabulary id cannot be null");
        Vocabulary vocabulary = vocabularies.get(id.trim().toUpperCase(Locale.ROOT));
        if (vocabulary == null) {
            throw new IllegalArgumentException("Unknown vocabulary: " + id + " (known: " + vocabularies.keySet() + ")");
        }
        return vocabulary;
    }

    /**
     * Returns the registered instance for {@code vocabulary}. A vocabulary whose id is known but
     * whose convention, angle scale or dropped operations differ from the registered definition
     * is rejected, so callers cannot override the registry's conventions.
     *
     * @throws IllegalArgumentException if the vocabulary is unknown or differs from the registered one
     */
    public Vocabulary requireRegistered(Vocabulary vocabulary) {
        Objects.requireNonNull(vocabulary, "Vocabulary cannot be null");
        Vocabulary registered = vocabularies.get(vocabulary.id());
        if (registered == null) {
            throw new IllegalArgumentException("Vocabulary " + vocabulary.id() + " is not part of this registry");
        }
        if (!registered.equals(vocabulary)) {
            throw new IllegalArgumentException("Vocabulary " + vocabulary.id()
                    + " does not match the registered definition (convention " + registered.qubitConvention()
                    + ", angle scale " + registered.angleScale() + ")");
        }
        return registered;
    }

    public Collection<Vocabulary> vocabularies() {
        return vocabularies.values();
    }

    // ==================== Lookups ====================

    /**
     * @throws UnsupportedGateException if the gate has neither a native name nor a decomposition
     */
    public GateMapping mappingFor(CanonicalGate gate, Vocabulary vocabulary) {
        GateMapping mapping = mappingsOf(vocabulary).get(gate);
        if (mapping == null) {
            throw new UnsupportedGateException(gate.gateName(), vocabulary.id(),
                    gate.gateName() + " has no native mapping or decomposition in " + vocabulary.id());
        }
        return mapping;
    }

    public Optional<String> nativeNameFor(CanonicalGate gate, Vocabulary vocabulary) {
        GateMapping mapping = mappingsOf(vocabulary).get(gate);
        if (mapping instanceof GateMapping.Native nativeMapping) {
            return Optional.of(nativeMapping.primaryName());
        }
        return Optional.empty();
    }

    public Optional<DecompositionTemplate> decompositionFor(CanonicalGate gate, Vocabulary vocabulary) {
        GateMapping mapping = mappingsOf(vocabulary).get(gate);
        if (mapping instanceof GateMapping.Decomposed decomposed) {
            return Optional.of(decomposed.template());
        }
        return Optional.empty();
    }

    /**
     * Expands one level: a native gate comes back unchanged, a decomposed one as its
     * template steps with qubits and parameters substituted.
     *
     * @throws UnsupportedGateException if the gate is unmapped in {@code vocabulary}
     */
    public List<GateInstruction> decompose(GateInstruction instruction, Vocabulary vocabulary) {
        GateMapping mapping = mappingFor(instruction.gate(), vocabulary);
        if (mapping instanceof GateMapping.Decomposed decomposed) {
            return decomposed.template().instantiate(instruction);
        }
        return List.of(instruction);
    }

    public Optional<CanonicalGate> canonicalGateFor(String nativeName, Vocabulary vocabulary) {
        if (nativeName == null) return Optional.empty();
        return Optional.ofNullable(namesOf(vocabulary).get(nativeName));
    }

    public boolean isDropped(String nativeName, Vocabulary vocabulary) {
        Vocabulary registered = requireRegistered(vocabulary);
        for (String dropped : registered.droppedOperations()) {
            if (dropped.equalsIgnoreCase(nativeName)) return true;
        }
        return false;
    }

    // ==================== Validation ====================

    /**
     * Checks that every canonical gate resolves in every vocabulary, natively or through an
     * acyclic chain of decompositions.
     *
     * @throws UnsupportedGateException naming the first gap or cycle found
     */
    public void validateCompleteness() {
        for (Vocabulary vocabulary : vocabularies.values()) {
            Map<CanonicalGate, GateMapping> table = mappings.get(vocabulary.id());
            Set<CanonicalGate> resolved = EnumSet.noneOf(CanonicalGate.class);
            for (CanonicalGate gate : CanonicalGate.values()) {
                resolve(gate, vocabulary, table, resolved, new LinkedHashSet<>());
            }
        }
    }

    private static void resolve(CanonicalGate gate, Vocabulary vocabulary, Map<CanonicalGate, GateMapping> table,
                                Set<CanonicalGate> resolved, LinkedHashSet<CanonicalGate> path) {
        if (resolved.contains(gate)) return;
        if (!path.add(gate)) {
            List<String> cycle = new ArrayList<>();
            path.forEach(g -> cycle.add(g.gateName()));
            cycle.add(gate.gateName());
            throw new UnsupportedGateException(gate.gateName(), vocabulary.id(),
                    "Decomposition cycle in " + vocabulary.id() + ": " + String.join(" -> ", cycle));
        }
        GateMapping mapping = table.get(gate);
        if (mapping == null) {
            throw new UnsupportedGateException(gate.gateName(), vocabulary.id(),
                    gate.gateName() + " has no native mapping or decomposition in " + vocabulary.id());
        }
        if (mapping instanceof GateMapping.Decomposed decomposed) {
            for (DecompositionTemplate.Step step : decomposed.template().steps()) {
                resolve(step.gate(), vocabulary, table, resolved, path);
            }
        }
        path.remove(gate);
        resolved.add(gate);
    }

    // ==================== Internals ====================

    private Map<CanonicalGate, GateMapping> mappingsOf(Vocabulary vocabulary) {
        return mappings.get(requireRegistered(vocabulary).id());
    }

    private Map<String, CanonicalGate> namesOf(Vocabulary vocabulary) {
        return nameIndex.get(requireRegistered(vocabulary).id());
    }

    // ==================== Builder ====================

    /**
     * Assembles a registry. Structural conflicts (unknown vocabulary, a name used twice, a gate
     * both native and decomposed) fail with {@link RegistryConfigurationException}; gaps are
     * allowed until {@link GateRegistry#validateCompleteness()} is called.
     */
    public static final class Builder {
        private final ExpressionEvaluator evaluator;
        private final Map<String, Vocabulary> vocabularies = new LinkedHashMap<>();
        private final Map<String, Map<CanonicalGate, GateMapping>> mappings = new HashMap<>();

        private Builder(ExpressionEvaluator evaluator) {
            this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        }

        public Builder vocabulary(Vocabulary vocabulary) {
            Objects.requireNonNull(vocabulary, "Vocabulary cannot be null");
            if (vocabularies.putIfAbsent(vocabulary.id(), vocabulary) != null) {
                throw new RegistryConfigurationException("Duplicate vocabulary: " + vocabulary.id());
            }
            mappings.put(vocabulary.id(), new EnumMap<>(CanonicalGate.class));
            return this;
        }

        public Builder nativeGate(String vocabularyId, CanonicalGate gate, String primaryName, String... aliases) {
            GateMapping.Native mapping;
            try {
                mapping = new GateMapping.Native(primaryName, List.of(aliases));
            } catch (RuntimeException e) {
                throw new RegistryConfigurationException("Vocabulary '" + vocabularyId + "' native gate "
                        + gate.gateName() + " has no usable name", e);
            }
            put(vocabularyId, gate, mapping);
            return this;
        }

        public Builder decomposition(String vocabularyId, CanonicalGate gate, String... stepTokens) {
            put(vocabularyId, gate, new GateMapping.Decomposed(
                    DecompositionTemplate.parse(gate, List.of(stepTokens), evaluator)));
            return this;
        }

        public Builder decomposition(String vocabularyId, CanonicalGate gate, DecompositionTemplate template) {
            if (template.gate() != gate) {
                throw new RegistryConfigurationException("Template for " + template.gate().gateName()
                        + " registered under " + gate.gateName());
            }
            put(vocabularyId, gate, new GateMapping.Decomposed(template));
            return this;
        }

        private void put(String vocabularyId, CanonicalGate gate, GateMapping mapping) {
            Map<CanonicalGate, GateMapping> table = mappings.get(normalize(vocabularyId));
            if (table == null) {
                throw new RegistryConfigurationException("Unknown vocabulary: " + vocabularyId);
            }
            if (table.putIfAbsent(gate, mapping) != null) {
                throw new RegistryConfigurationException("Vocabulary '" + normalize(vocabularyId)
                        + "' maps " + gate.gateName() + " more than once");
            }
        }

        public GateRegistry build() {
            Map<String, Map<CanonicalGate, GateMapping>> frozenMappings = new HashMap<>();
            Map<String, Map<String, CanonicalGate>> frozenNames = new HashMap<>();

            for (Vocabulary vocabulary : vocabularies.values()) {
                Map<CanonicalGate, GateMapping> table = mappings.get(vocabulary.id());
                Map<String, CanonicalGate> names = new HashMap<>();
                for (Map.Entry<CanonicalGate, GateMapping> entry : table.entrySet()) {
                    if (!(entry.getValue() instanceof GateMapping.Native nativeMapping)) continue;
                    for (String name : nativeMapping.allNames()) {
                        CanonicalGate previous = names.putIfAbsent(name, entry.getKey());
                        if (previous != null && previous != entry.getKey()) {
                            throw new RegistryConfigurationException("Vocabulary '" + vocabulary.id()
                                    + "' uses native name '" + name + "' for both " + previous.gateName()
                                    + " and " + entry.getKey().gateName());
                        }
                    }
                }
                frozenMappings.put(vocabulary.id(), Collections.unmodifiableMap(new EnumMap<>(table)));
                frozenNames.put(vocabulary.id(), Map.copyOf(names));
            }
            return new GateRegistry(new LinkedHashMap<>(vocabularies), Map.copyOf(frozenMappings),
                    Map.copyOf(frozenNames));
        }

        private static String normalize(String id) {
            return id == null ? null : id.trim().toUpperCase(Locale.ROOT);
        }
    }
}
