/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.translator.config;

import com.qusetta.translator.CircuitTranslator;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Settings for assembling a translator.
 *
 * <p>Every property can be overridden through an environment variable:
 * <pre>
 * QUSETTA_REGISTRY_PATH=/etc/qusetta/registry.json
 * QUSETTA_MAX_DECOMPOSITION_DEPTH=32
 * QUSETTA_VALIDATE_REGISTRY=false
 * </pre>
 * An unparseable value is logged and ignored.
 *
 * <pre>{@code
 * TranslatorConfig config = TranslatorConfig.fromEnvironment();
 * CircuitTranslator translator = TranslatorFactory.create(config);
 * }</pre>
 */
public final class TranslatorConfig {
    private static final Logger logger = Logger.getLogger(TranslatorConfig.class.getName());

    static final String ENV_REGISTRY_PATH = "QUSETTA_REGISTRY_PATH";
    static final String ENV_MAX_DECOMPOSITION_DEPTH = "QUSETTA_MAX_DECOMPOSITION_DEPTH";
    static final String ENV_VALIDATE_REGISTRY = "QUSETTA_VALIDATE_REGISTRY";

    private final Path registryPath;
    private final int maxDecompositionDepth;
    private final boolean validateRegistry;

    private TranslatorConfig(Builder builder) {
        this.registryPath = builder.registryPath;
        this.maxDecompositionDepth = builder.maxDecompositionDepth;
        this.validateRegistry = builder.validateRegistry;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Bundled registry, default depth, completeness check on.
     */
    public static TranslatorConfig defaults() {
        return builder().build();
    }

    public static TranslatorConfig fromEnvironment() {
        return fromLookup(key -> {
            String value = System.getenv(key);
            return value != null ? value : System.getProperty(key);
        });
    }

    /**
     * Reads overrides through {@code lookup} (an environment-like key to value function).
     */
    static TranslatorConfig fromLookup(Function<String, String> lookup) {
        Builder builder = builder();
        builder.applyOverrides(lookup);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.registryPath = this.registryPath;
        builder.maxDecompositionDepth = this.maxDecompositionDepth;
        builder.validateRegistry = this.validateRegistry;
        return builder;
    }

    public static class Builder {
        private Path registryPath = null;
        private int maxDecompositionDepth = CircuitTranslator.DEFAULT_MAX_DECOMPOSITION_DEPTH;
        private boolean validateRegistry = true;

        private Builder() {
        }

        private void applyOverrides(Function<String, String> lookup) {
            get(lookup, ENV_REGISTRY_PATH).ifPresent(val -> this.registryPath = Path.of(val));
            get(lookup, ENV_MAX_DECOMPOSITION_DEPTH).ifPresent(val -> {
                try {
                    int depth = Integer.parseInt(val);
                    if (depth < 1) {
                        logger.warning("Invalid " + ENV_MAX_DECOMPOSITION_DEPTH + ": " + val
                                + ", using default: " + this.maxDecompositionDepth);
                    } else {
                        this.maxDecompositionDepth = depth;
                    }
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + ENV_MAX_DECOMPOSITION_DEPTH + ": " + val
                            + ", using default: " + this.maxDecompositionDepth);
                }
            });
            get(lookup, ENV_VALIDATE_REGISTRY).ifPresent(val -> {
                String normalized = val.toLowerCase();
                if ("true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized)) {
                    this.validateRegistry = true;
                } else if ("false".equals(normalized) || "0".equals(normalized) || "no".equals(normalized)) {
                    this.validateRegistry = false;
                } else {
                    logger.warning("Invalid boolean value for " + ENV_VALIDATE_REGISTRY + ": " + val
                            + ", using default: " + this.validateRegistry);
                }
            });
        }

        private static Optional<String> get(Function<String, String> lookup, String key) {
            String value = lookup.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded env var: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        /**
         * @param path registry JSON file, or {@code null} for the bundled registry
         */
        public Builder registryPath(Path path) {
            this.registryPath = path;
            return this;
        }

        public Builder maxDecompositionDepth(int depth) {
            this.maxDecompositionDepth = depth;
            return this;
        }

        public Builder validateRegistry(boolean validate) {
            this.validateRegistry = validate;
            return this;
        }

        public TranslatorConfig build() {
            return new TranslatorConfig(this);
        }
    }

    private void validate() {
        if (maxDecompositionDepth < 1) {
            throw new IllegalArgumentException("maxDecompositionDepth must be positive: " + maxDecompositionDepth);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public Optional<Path> getRegistryPath() { return Optional.ofNullable(registryPath); }
    public int getMaxDecompositionDepth() { return maxDecompositionDepth; }
    public boolean isValidateRegistry() { return validateRegistry; }

    @Override
    public String toString() {
        return "TranslatorConfig{registry=" + (registryPath != null ? registryPath : "classpath")
                + ", maxDecompositionDepth=" + maxDecompositionDepth
                + ", validateRegistry=" + validateRegistry + "}";
    }
}
