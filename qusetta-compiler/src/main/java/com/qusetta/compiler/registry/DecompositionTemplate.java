/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.registry;

import com.qusetta.api.exceptions.ExpressionException;
import com.qusetta.api.exceptions.RegistryConfigurationException;
import com.qusetta.api.exceptions.TranslationException;
import com.qusetta.api.model.CanonicalGate;
import com.qusetta.api.model.GateInstruction;
import com.qusetta.compiler.codec.TokenSyntax;
import com.qusetta.compiler.expression.Expression;
import com.qusetta.compiler.expression.ExpressionEvaluator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered rewrite of one canonical gate into other canonical gates.
 *
 * <p>Steps are written as gate tokens whose qubit entries are operand slots (positions in the
 * decomposed instruction's qubit list) and whose parameters are expressions over
 * {@code p0 .. pN-1}, the decomposed instruction's parameters. For example the controlled-Y
 * template is {@code SDG(1), CX(0, 1), S(1)}.
 */
public record DecompositionTemplate(CanonicalGate gate, List<Step> steps) {

    public DecompositionTemplate {
        Objects.requireNonNull(gate, "Gate cannot be null");
        Objects.requireNonNull(steps, "Steps cannot be null");
        if (steps.isEmpty()) {
            throw new RegistryConfigurationException("Decomposition of " + gate.gateName() + " has no steps");
        }
        steps = List.copyOf(steps);
    }

    /**
     * One templated instruction.
     *
     * @param gate         canonical gate emitted
     * @param parameters   expressions over {@code p0 ..}
     * @param operandSlots positions in the decomposed instruction's qubit list
     * @param source       the token text the step was parsed from
     */
    public record Step(CanonicalGate gate, List<Expression> parameters, List<Integer> operandSlots, String source) {

        public Step {
            parameters = List.copyOf(parameters);
            operandSlots = List.copyOf(operandSlots);
        }

        /**
         * Parses one step token for a decomposition of {@code owner}.
         *
         * @throws RegistryConfigurationException if the step is not a valid template for {@code owner}
         */
        public static Step parse(String token, CanonicalGate owner, ExpressionEvaluator evaluator) {
            TokenSyntax.Parts parts;
            try {
                parts = TokenSyntax.parse(token);
            } catch (TranslationException e) {
                throw new RegistryConfigurationException(prefix(owner) + e.getMessage(), e);
            }

            CanonicalGate gate = CanonicalGate.fromName(parts.name())
                    .orElseThrow(() -> new RegistryConfigurationException(
                            prefix(owner) + "unknown canonical gate '" + parts.name() + "' in step '" + token + "'"));
            if (parts.parameterEntries().size() != gate.parameterArity()
                    || parts.qubitEntries().size() != gate.qubitArity()) {
                throw new RegistryConfigurationException(prefix(owner) + "step '" + token + "' needs "
                        + gate.parameterArity() + " parameter(s) and " + gate.qubitArity() + " qubit(s)");
            }

            List<Integer> slots = new ArrayList<>(gate.qubitArity());
            Set<Integer> seen = new HashSet<>();
            for (String entry : parts.qubitEntries()) {
                int slot;
                try {
                    slot = Integer.parseInt(entry);
                } catch (NumberFormatException e) {
                    throw new RegistryConfigurationException(
                            prefix(owner) + "operand slot '" + entry + "' in step '" + token + "' is not an integer", e);
                }
                if (slot < 0 || slot >= owner.qubitArity()) {
                    throw new RegistryConfigurationException(prefix(owner) + "operand slot " + slot
                            + " in step '" + token + "' is outside 0.." + (owner.qubitArity() - 1));
                }
                if (!seen.add(slot)) {
                    throw new RegistryConfigurationException(
                            prefix(owner) + "operand slot " + slot + " repeated in step '" + token + "'");
                }
                slots.add(slot);
            }

            List<Expression> params = new ArrayList<>(gate.parameterArity());
            for (String entry : parts.parameterEntries()) {
                Expression expression;
                try {
                    expression = evaluator.parse(entry);
                } catch (ExpressionException e) {
                    throw new RegistryConfigurationException(prefix(owner) + e.getMessage(), e);
                }
                for (String variable : ExpressionEvaluator.variablesOf(expression)) {
                    if (!isParameterVariable(variable, owner.parameterArity())) {
                        throw new RegistryConfigurationException(prefix(owner) + "step '" + token
                                + "' refers to '" + variable + "', but " + owner.gateName() + " binds only "
                                + owner.parameterArity() + " parameter(s)");
                    }
                }
                params.add(expression);
            }
            return new Step(gate, params, slots, token.strip());
        }

        private static boolean isParameterVariable(String name, int parameterArity) {
            if (name.length() < 2 || name.charAt(0) != 'p') return false;
            for (int i = 1; i < name.length(); i++) {
                if (!Character.isDigit(name.charAt(i))) return false;
            }
            return Integer.parseInt(name.substring(1)) < parameterArity;
        }

        private static String prefix(CanonicalGate owner) {
            return "Decomposition of " + owner.gateName() + ": ";
        }
    }

    public static DecompositionTemplate parse(CanonicalGate gate, List<String> stepTokens,
                                              ExpressionEvaluator evaluator) {
        if (stepTokens == null || stepTokens.isEmpty()) {
            throw new RegistryConfigurationException("Decomposition of " + gate.gateName() + " has no steps");
        }
        List<Step> steps = new ArrayList<>(stepTokens.size());
        for (String token : stepTokens) {
            steps.add(Step.parse(token, gate, evaluator));
        }
        return new DecompositionTemplate(gate, steps);
    }

    /**
     * Substitutes the instruction's qubits and parameters into every step.
     */
    public List<GateInstruction> instantiate(GateInstruction instruction) {
        if (instruction.gate() != gate) {
            throw new IllegalArgumentException("Template for " + gate.gateName()
                    + " cannot expand " + instruction.gate().gateName());
        }
        Map<String, Double> bindings = new HashMap<>();
        for (int i = 0; i < instruction.params().size(); i++) {
            bindings.put("p" + i, instruction.params().get(i));
        }

        List<GateInstruction> expanded = new ArrayList<>(steps.size());
        for (Step step : steps) {
            List<Integer> qubits = new ArrayList<>(step.operandSlots().size());
            for (int slot : step.operandSlots()) {
                qubits.add(instruction.qubits().get(slot));
            }
            List<Double> params = new ArrayList<>(step.parameters().size());
            for (Expression expression : step.parameters()) {
                params.add(expression.evaluate(bindings));
            }
            expanded.add(new GateInstruction(step.gate(), params, qubits));
        }
        return expanded;
    }
}
