/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QubitConventionTest {

    @Test
    @DisplayName("Identity leaves indices unchanged")
    void identity() {
        assertThat(QubitConvention.IDENTITY.remap(2, 3)).isEqualTo(2);
    }

    @Test
    @DisplayName("Reversed maps i to n-1-i")
    void reversed() {
        assertThat(QubitConvention.REVERSED.remap(0, 3)).isEqualTo(2);
        assertThat(QubitConvention.REVERSED.remap(2, 3)).isEqualTo(0);
        assertThat(QubitConvention.REVERSED.remap(1, 3)).isEqualTo(1);
        assertThat(QubitConvention.REVERSED.remap(0, 1)).isEqualTo(0);
    }

    @ParameterizedTest
    @EnumSource(QubitConvention.class)
    @DisplayName("Every convention is its own inverse")
    void involution(QubitConvention convention) {
        for (int n = 1; n <= 6; n++) {
            for (int i = 0; i < n; i++) {
                assertThat(convention.remap(convention.remap(i, n), n)).isEqualTo(i);
            }
        }
    }

    @ParameterizedTest
    @EnumSource(QubitConvention.class)
    @DisplayName("Indices outside the circuit are rejected")
    void outOfRange(QubitConvention convention) {
        assertThatThrownBy(() -> convention.remap(3, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> convention.remap(-1, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Lenient lookup returns null for unknown names")
    void fromString() {
        assertThat(QubitConvention.fromString(" reversed ")).isEqualTo(QubitConvention.REVERSED);
        assertThat(QubitConvention.fromString("little-endian")).isNull();
        assertThat(QubitConvention.fromString(null)).isNull();
    }

    @Test
    @DisplayName("Lookup and vocabulary ids do not depend on the default locale")
    void localeIndependentUpperCasing() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));

            assertThat(QubitConvention.fromString("identity")).isEqualTo(QubitConvention.IDENTITY);
            assertThat(new Vocabulary("quasar", QubitConvention.IDENTITY).id()).isEqualTo("QUASAR");
        } finally {
            Locale.setDefault(original);
        }
    }
}
