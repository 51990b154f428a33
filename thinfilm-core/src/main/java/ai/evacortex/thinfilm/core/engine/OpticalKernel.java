/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.engine;

import ai.evacortex.thinfilm.core.FilmStack;
import ai.evacortex.thinfilm.core.OpticalResult;
import ai.evacortex.thinfilm.core.Polarization;
import ai.evacortex.thinfilm.core.math.Complex;

/**
 * {@code OpticalKernel} computes reflectance, transmittance and absorbance of a single film
 * between two half-spaces with the characteristic-matrix method.
 *
 * <p>The film is described by its characteristic matrix</p>
 * <pre>
 *     M = | cos δ         i·sin δ / η₁ |
 *         | i·η₁·sin δ    cos δ        |
 *
 *     δ = 2π·d·n₁·cos θ₁ / λ
 * </pre>
 * <p>and the boundary parameters of the assembly are</p>
 * <pre>
 *     | B |       | 1  |
 *     | C | = M · | ηₛ |
 * </pre>
 * <p>from which the admittance {@code Y = C / B}, the amplitude reflection coefficient
 * {@code r = (η₀ − Y) / (η₀ + Y)} and the energy ratios follow:</p>
 * <pre>
 *     R = |r|²
 *     T = Re(ηₛ)·(1 − R) / Re(B·C*)
 *     A = 1 − R − T
 * </pre>
 *
 * <p>Implementations are synchronous and run on the caller's thread. They perform no validation
 * of the numeric inputs; arithmetic singularities propagate to the caller unchanged.</p>
 *
 * @see CharacteristicMatrixKernel
 * @see FilmStack
 */
public interface OpticalKernel {

    /**
     * Computes the optical response for a single polarization.
     *
     * @param stack        the film assembly and probe geometry
     * @param polarization {@link Polarization#S} or {@link Polarization#P}
     * @return the result tagged with {@code polarization}
     * @throws IllegalArgumentException if {@code polarization} is {@link Polarization#AVG}
     * @throws ArithmeticException on a zero denominator in any step
     * @throws NullPointerException if any argument is {@code null}
     */
    OpticalResult compute(FilmStack stack, Polarization polarization);

    /**
     * Computes the optical response for S, P, or the average of both.
     *
     * <p>For {@link Polarization#AVG}, R, T, A and both coefficients are the arithmetic means
     * of the S-only and P-only results, which are retained on the returned result.</p>
     *
     * @param stack        the film assembly and probe geometry
     * @param polarization any polarization
     * @return the tagged result
     * @throws ArithmeticException on a zero denominator in any step
     * @throws NullPointerException if any argument is {@code null}
     */
    OpticalResult computeWithPolarization(FilmStack stack, Polarization polarization);

    default OpticalResult compute(Complex incidentIndex, Complex filmIndex, double thickness,
                                  Complex substrateIndex, double wavelength, double incidentAngle,
                                  Polarization polarization) {
        return compute(new FilmStack(incidentIndex, filmIndex, thickness, substrateIndex, wavelength, incidentAngle),
                polarization);
    }

    default OpticalResult computeWithPolarization(Complex incidentIndex, Complex filmIndex, double thickness,
                                                  Complex substrateIndex, double wavelength, double incidentAngle,
                                                  Polarization polarization) {
        return computeWithPolarization(
                new FilmStack(incidentIndex, filmIndex, thickness, substrateIndex, wavelength, incidentAngle),
                polarization);
    }
}
