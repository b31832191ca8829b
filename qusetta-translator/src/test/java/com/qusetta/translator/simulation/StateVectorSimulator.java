/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.translator.simulation;

import com.qusetta.api.model.Circuit;
import com.qusetta.api.model.GateInstruction;
import com.qusetta.api.model.QubitConvention;

import java.util.List;

/**
 * Dense state-vector simulator used to check that translated circuits are equivalent.
 *
 * <p>Gates are applied with their canonical matrices. Qubit ordering follows the convention
 * the circuit is indexed in: under IDENTITY qubit 0 is the most significant bit of the basis
 * index, under REVERSED it is the least significant. Probabilities are therefore always
 * reported in canonical order and can be compared across vocabularies.
 */
public final class StateVectorSimulator {

    private static final double SQRT_HALF = Math.sqrt(0.5);

    private final int qubitCount;
    private final QubitConvention convention;
    private final double[] re;
    private final double[] im;

    private StateVectorSimulator(int qubitCount, QubitConvention convention) {
        this.qubitCount = qubitCount;
        this.convention = convention;
        this.re = new double[1 << qubitCount];
        this.im = new double[1 << qubitCount];
        this.re[0] = 1.0;
    }

    public static double[] probabilities(Circuit circuit, QubitConvention convention) {
        StateVectorSimulator simulator = new StateVectorSimulator(circuit.qubitCount(), convention);
        for (GateInstruction instruction : circuit) {
            simulator.apply(instruction);
        }
        double[] probabilities = new double[simulator.re.length];
        for (int i = 0; i < probabilities.length; i++) {
            probabilities[i] = simulator.re[i] * simulator.re[i] + simulator.im[i] * simulator.im[i];
        }
        return probabilities;
    }

    private int mask(int qubit) {
        int canonical = convention.remap(qubit, qubitCount);
        return 1 << (qubitCount - 1 - canonical);
    }

    private void apply(GateInstruction instruction) {
        List<Integer> q = instruction.qubits();
        List<Double> p = instruction.params();
        switch (instruction.gate()) {
            case I -> { }
            case X -> single(q.get(0), 0, 0, 1, 0, 1, 0, 0, 0, 0);
            case Y -> single(q.get(0), 0, 0, 0, -1, 0, 1, 0, 0, 0);
            case Z -> phase(q.get(0), Math.PI, 0);
            case H -> single(q.get(0), 0, SQRT_HALF, 0, SQRT_HALF, 0, SQRT_HALF, 0, -SQRT_HALF, 0);
            case S -> phase(q.get(0), Math.PI / 2, 0);
            case SDG -> phase(q.get(0), -Math.PI / 2, 0);
            case T -> phase(q.get(0), Math.PI / 4, 0);
            case TDG -> phase(q.get(0), -Math.PI / 4, 0);
            case RX -> rx(q.get(0), p.get(0), 0);
            case RY -> {
                double c = Math.cos(p.get(0) / 2), s = Math.sin(p.get(0) / 2);
                single(q.get(0), 0, c, 0, -s, 0, s, 0, c, 0);
            }
            case RZ -> rz(q.get(0), p.get(0), 0);
            case U1 -> phase(q.get(0), p.get(0), 0);
            case U2 -> u3(q.get(0), Math.PI / 2, p.get(0), p.get(1));
            case U3 -> u3(q.get(0), p.get(0), p.get(1), p.get(2));
            case CX -> single(q.get(1), mask(q.get(0)), 0, 0, 1, 0, 1, 0, 0, 0);
            case CY -> single(q.get(1), mask(q.get(0)), 0, 0, 0, -1, 0, 1, 0, 0);
            case CZ -> phase(q.get(1), Math.PI, mask(q.get(0)));
            case CRZ -> rz(q.get(1), p.get(0), mask(q.get(0)));
            case SWAP -> swap(q.get(0), q.get(1), 0);
            case CCX -> single(q.get(2), mask(q.get(0)) | mask(q.get(1)), 0, 0, 1, 0, 1, 0, 0, 0);
            case CSWAP -> swap(q.get(1), q.get(2), mask(q.get(0)));
            default -> throw new IllegalStateException("No matrix for " + instruction.gate());
        }
    }

    private void phase(int qubit, double angle, int controls) {
        single(qubit, controls, 1, 0, 0, 0, 0, 0, Math.cos(angle), Math.sin(angle));
    }

    private void rx(int qubit, double theta, int controls) {
        double c = Math.cos(theta / 2), s = Math.sin(theta / 2);
        single(qubit, controls, c, 0, 0, -s, 0, -s, c, 0);
    }

    private void rz(int qubit, double theta, int controls) {
        double c = Math.cos(theta / 2), s = Math.sin(theta / 2);
        single(qubit, controls, c, -s, 0, 0, 0, 0, c, s);
    }

    private void u3(int qubit, double theta, double phi, double lambda) {
        double c = Math.cos(theta / 2), s = Math.sin(theta / 2);
        single(qubit, 0,
                c, 0,
                -Math.cos(lambda) * s, -Math.sin(lambda) * s,
                Math.cos(phi) * s, Math.sin(phi) * s,
                Math.cos(phi + lambda) * c, Math.sin(phi + lambda) * c);
    }

    /**
     * Applies [[a, b], [c, d]] (given as re/im pairs) to {@code qubit} on every basis state
     * where all bits in {@code controls} are set.
     */
    private void single(int qubit, int controls,
                        double aRe, double aIm, double bRe, double bIm,
                        double cRe, double cIm, double dRe, double dIm) {
        int target = mask(qubit);
        for (int i = 0; i < re.length; i++) {
            if ((i & target) != 0 || (i & controls) != controls) continue;
            int j = i | target;
            double r0 = re[i], i0 = im[i], r1 = re[j], i1 = im[j];
            re[i] = aRe * r0 - aIm * i0 + bRe * r1 - bIm * i1;
            im[i] = aRe * i0 + aIm * r0 + bRe * i1 + bIm * r1;
            re[j] = cRe * r0 - cIm * i0 + dRe * r1 - dIm * i1;
            im[j] = cRe * i0 + cIm * r0 + dRe * i1 + dIm * r1;
        }
    }

    private void swap(int first, int second, int controls) {
        int a = mask(first);
        int b = mask(second);
        for (int i = 0; i < re.length; i++) {
            if ((i & a) != 0 && (i & b) == 0 && (i & controls) == controls) {
                int j = (i & ~a) | b;
                double r = re[i], m = im[i];
                re[i] = re[j];
                im[i] = im[j];
                re[j] = r;
                im[j] = m;
            }
        }
    }
}
