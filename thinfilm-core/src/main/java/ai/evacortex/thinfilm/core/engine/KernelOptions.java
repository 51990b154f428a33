/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.engine;

/**
 * Numeric thresholds of the characteristic-matrix kernel.
 */
public record KernelOptions(
        double energyTolerance,            // |R + T + A − 1| below this counts as conserved
        double normalIncidenceEpsilon,     // |θ₀| below this skips Snell's law
        double methodAgreementTolerance    // direct vs admittance divergence above this is reported
) {

    private static final double ENERGY_TOLERANCE =
            Double.parseDouble(System.getProperty("thinfilm.energy.tolerance", "1e-6"));
    private static final double NORMAL_INCIDENCE_EPSILON =
            Double.parseDouble(System.getProperty("thinfilm.normalIncidence.epsilon", "1e-10"));
    private static final double METHOD_AGREEMENT_TOLERANCE =
            Double.parseDouble(System.getProperty("thinfilm.methods.agreementTolerance", "1e-6"));

    public KernelOptions {
        if (energyTolerance <= 0 || normalIncidenceEpsilon <= 0 || methodAgreementTolerance <= 0) {
            throw new IllegalArgumentException("Kernel tolerances must be positive");
        }
    }

    public static KernelOptions defaultOptions() {
        return new KernelOptions(ENERGY_TOLERANCE, NORMAL_INCIDENCE_EPSILON, METHOD_AGREEMENT_TOLERANCE);
    }

    public boolean isConserved(double total) {
        return Math.abs(total - 1.0) < energyTolerance;
    }

    public boolean isNormalIncidence(double angle) {
        return Math.abs(angle) < normalIncidenceEpsilon;
    }
}
