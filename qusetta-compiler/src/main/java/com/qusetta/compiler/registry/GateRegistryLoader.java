/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qusetta.api.exceptions.RegistryConfigurationException;
import com.qusetta.api.model.CanonicalGate;
import com.qusetta.api.model.QubitConvention;
import com.qusetta.api.model.Vocabulary;
import com.qusetta.compiler.expression.ExpressionEvaluator;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds a {@link GateRegistry} from a JSON array of {@link VocabularyDefinition}s.
 *
 * <p>Every definition is validated before anything is registered; the first problem is reported
 * as a {@link RegistryConfigurationException} naming the vocabulary and entry at fault.
 * Completeness (every gate reachable in every vocabulary) is a separate step, see
 * {@link GateRegistry#validateCompleteness()}.
 */
public class GateRegistryLoader {
    private static final Logger logger = Logger.getLogger(GateRegistryLoader.class.getName());

    public static final String DEFAULT_RESOURCE = "/qusetta/gate-registry.json";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExpressionEvaluator evaluator;

    public GateRegistryLoader() {
        this(new ExpressionEvaluator());
    }

    public GateRegistryLoader(ExpressionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    public GateRegistry load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new RegistryConfigurationException("Failed to read gate registry " + path + ": " + e.getMessage(), e);
        }
        GateRegistry registry = fromDefinitions(parse(content, path.toString()));
        logger.info("Loaded gate registry from " + path + " with " + registry.vocabularies().size() + " vocabularies");
        return registry;
    }

    public GateRegistry load(InputStream in, String origin) {
        Objects.requireNonNull(in, "input stream must not be null");
        String content;
        try {
            content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RegistryConfigurationException("Failed to read gate registry " + origin + ": " + e.getMessage(), e);
        }
        GateRegistry registry = fromDefinitions(parse(content, origin));
        logger.info("Loaded gate registry from " + origin + " with " + registry.vocabularies().size() + " vocabularies");
        return registry;
    }

    /**
     * Loads the registry bundled on the classpath at {@value #DEFAULT_RESOURCE}.
     */
    public GateRegistry loadDefault() {
        try (InputStream in = GateRegistryLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new RegistryConfigurationException("Bundled gate registry not found on classpath: " + DEFAULT_RESOURCE);
            }
            return load(in, "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new RegistryConfigurationException("Failed to close bundled gate registry: " + e.getMessage(), e);
        }
    }

    private List<VocabularyDefinition> parse(String content, String origin) {
        try {
            return objectMapper.readValue(content,
                    objectMapper.getTypeFactory().constructCollectionType(List.class, VocabularyDefinition.class));
        } catch (JsonProcessingException e) {
            throw new RegistryConfigurationException("Malformed gate registry " + origin + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Validates the definitions and assembles the registry.
     */
    GateRegistry fromDefinitions(List<VocabularyDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new RegistryConfigurationException("Gate registry definitions cannot be empty");
        }

        GateRegistry.Builder builder = GateRegistry.builder(evaluator);
        Set<String> seenIds = new HashSet<>();

        for (int i = 0; i < definitions.size(); i++) {
            VocabularyDefinition def = definitions.get(i);
            if (def == null) {
                throw new RegistryConfigurationException("Vocabulary at index " + i + " is null");
            }
            if (def.vocabulary() == null || def.vocabulary().isBlank()) {
                throw new RegistryConfigurationException("Vocabulary at index " + i + " has missing or empty vocabulary");
            }
            String id = def.vocabulary().trim().toUpperCase(Locale.ROOT);
            if (!seenIds.add(id)) {
                throw new RegistryConfigurationException("Duplicate vocabulary: " + id);
            }

            QubitConvention convention = QubitConvention.fromString(def.qubitConvention());
            if (convention == null) {
                throw new RegistryConfigurationException("Vocabulary '" + id + "' has unknown qubit_convention: "
                        + def.qubitConvention());
            }
            double scale = def.angleScale();
            if (!Double.isFinite(scale) || scale == 0.0) {
                throw new RegistryConfigurationException("Vocabulary '" + id + "' angle_scale must be finite and non-zero, got "
                        + scale);
            }
            for (String dropped : def.droppedOperations()) {
                if (dropped == null || dropped.isBlank()) {
                    throw new RegistryConfigurationException("Vocabulary '" + id + "' has an empty dropped operation");
                }
            }
            builder.vocabulary(new Vocabulary(id, convention, scale, Set.copyOf(def.droppedOperations())));

            for (Map.Entry<String, List<String>> entry : def.nativeGates().entrySet()) {
                CanonicalGate gate = gateNamed(id, entry.getKey());
                List<String> names = entry.getValue();
                if (names == null || names.isEmpty() || names.contains(null)) {
                    throw new RegistryConfigurationException("Vocabulary '" + id + "' native gate " + entry.getKey()
                            + " has no names");
                }
                builder.nativeGate(id, gate, names.get(0), names.subList(1, names.size()).toArray(new String[0]));
            }

            for (Map.Entry<String, List<String>> entry : def.decompositions().entrySet()) {
                CanonicalGate gate = gateNamed(id, entry.getKey());
                if (def.nativeGates().containsKey(entry.getKey())) {
                    throw new RegistryConfigurationException("Vocabulary '" + id + "' maps " + entry.getKey()
                            + " both natively and through a decomposition");
                }
                List<String> steps = entry.getValue();
                if (steps == null || steps.isEmpty() || steps.contains(null)) {
                    throw new RegistryConfigurationException("Vocabulary '" + id + "' decomposition of "
                            + entry.getKey() + " has no steps");
                }
                builder.decomposition(id, gate, steps.toArray(new String[0]));
            }
        }
        return builder.build();
    }

    private static CanonicalGate gateNamed(String vocabularyId, String name) {
        return CanonicalGate.fromName(name)
                .orElseThrow(() -> new RegistryConfigurationException("Vocabulary '" + vocabularyId
                        + "' maps unknown gate: " + name));
    }
}
