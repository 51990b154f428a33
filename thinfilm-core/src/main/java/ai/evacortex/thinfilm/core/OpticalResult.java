/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core;

import ai.evacortex.thinfilm.core.math.Complex;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one calculation call. R, T and A are ratios, nominally in [0, 1].
 *
 * <p>For {@link Polarization#AVG} the S-only and P-only results are kept for reporting;
 * they never carry sub-results of their own.</p>
 */
public record OpticalResult(double reflectance,
                            double transmittance,
                            double absorbance,
                            Complex reflectionCoefficient,
                            Complex transmissionCoefficient,
                            double wavelength,
                            double incidentAngle,
                            boolean energyConserved,
                            Polarization polarization,
                            OpticalResult sPolarizationResult,
                            OpticalResult pPolarizationResult) {

    public OpticalResult {
        Objects.requireNonNull(reflectionCoefficient, "reflectionCoefficient");
        Objects.requireNonNull(transmissionCoefficient, "transmissionCoefficient");
        Objects.requireNonNull(polarization, "polarization");
        if (polarization == Polarization.AVG) {
            if (sPolarizationResult == null || pPolarizationResult == null) {
                throw new IllegalArgumentException("AVG result requires both S and P sub-results");
            }
            if (sPolarizationResult.isAveraged() || pPolarizationResult.isAveraged()) {
                throw new IllegalArgumentException("Sub-results must be single-polarization results");
            }
        } else if (sPolarizationResult != null || pPolarizationResult != null) {
            throw new IllegalArgumentException("Only AVG results carry sub-results");
        }
    }

    public static OpticalResult single(double reflectance,
                                       double transmittance,
                                       double absorbance,
                                       Complex reflectionCoefficient,
                                       Complex transmissionCoefficient,
                                       double wavelength,
                                       double incidentAngle,
                                       boolean energyConserved,
                                       Polarization polarization) {
        return new OpticalResult(reflectance, transmittance, absorbance, reflectionCoefficient,
                transmissionCoefficient, wavelength, incidentAngle, energyConserved, polarization, null, null);
    }

    public boolean isAveraged() {
        return polarization == Polarization.AVG;
    }

    public double energySum() {
        return reflectance + transmittance + absorbance;
    }

    public String polarizationDescription() {
        return polarization.description();
    }

    public Optional<OpticalResult> sResult() {
        return Optional.ofNullable(sPolarizationResult);
    }

    public Optional<OpticalResult> pResult() {
        return Optional.ofNullable(pPolarizationResult);
    }
}
