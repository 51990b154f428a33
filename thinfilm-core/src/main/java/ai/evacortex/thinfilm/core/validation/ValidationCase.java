/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.validation;

import ai.evacortex.thinfilm.core.FilmStack;
import ai.evacortex.thinfilm.core.Polarization;
import ai.evacortex.thinfilm.core.math.Complex;

import java.util.List;
import java.util.Objects;

/**
 * Reference input with published R, T and A, expressed in percent.
 */
public record ValidationCase(String name,
                             FilmStack stack,
                             Polarization polarization,
                             double expectedReflectancePercent,
                             double expectedTransmittancePercent,
                             double expectedAbsorbancePercent) {

    /** Largest accepted error per field, in percentage points. */
    public static final double TOLERANCE_PERCENT = 0.01;

    private static final Complex AIR = Complex.ofReal(1.0);
    private static final Complex ABSORBING_FILM = Complex.of(2.385, -0.1);
    private static final Complex GLASS = Complex.ofReal(1.52);

    public ValidationCase {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(stack, "stack");
        Objects.requireNonNull(polarization, "polarization");
    }

    /**
     * Absorbing film on glass at 550 nm, normal incidence, S polarization, at the two
     * reference thicknesses.
     */
    public static List<ValidationCase> referenceCases() {
        return List.of(
                new ValidationCase("Default parameters",
                        new FilmStack(AIR, ABSORBING_FILM, 99.45, GLASS, 550, 0),
                        Polarization.S, 11.1475, 70.3446, 18.5079),
                new ValidationCase("Standard reference case",
                        new FilmStack(AIR, ABSORBING_FILM, 57.65, GLASS, 550, 0),
                        Polarization.S, 31.4424, 59.5727, 8.9849));
    }
}
