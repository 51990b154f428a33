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

/**
 * Incident medium, one film and a substrate, probed at a single wavelength and angle.
 *
 * @param incidentIndex  complex refractive index of the incident half-space
 * @param filmIndex      complex refractive index of the film, {@code n − ik}
 * @param thickness      film thickness in nanometers
 * @param substrateIndex complex refractive index of the substrate half-space
 * @param wavelength     vacuum wavelength in nanometers
 * @param incidentAngle  angle of incidence in radians
 */
public record FilmStack(Complex incidentIndex,
                        Complex filmIndex,
                        double thickness,
                        Complex substrateIndex,
                        double wavelength,
                        double incidentAngle) {

    public FilmStack {
        Objects.requireNonNull(incidentIndex, "incidentIndex");
        Objects.requireNonNull(filmIndex, "filmIndex");
        Objects.requireNonNull(substrateIndex, "substrateIndex");
    }

    public static FilmStack withAngleDegrees(Complex incidentIndex,
                                             Complex filmIndex,
                                             double thickness,
                                             Complex substrateIndex,
                                             double wavelength,
                                             double angleDegrees) {
        return new FilmStack(incidentIndex, filmIndex, thickness, substrateIndex, wavelength,
                Math.toRadians(angleDegrees));
    }

    public double incidentAngleDegrees() {
        return Math.toDegrees(incidentAngle);
    }
}
