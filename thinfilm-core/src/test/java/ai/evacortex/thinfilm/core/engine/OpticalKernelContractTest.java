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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

abstract class OpticalKernelContractTest {

    protected static final Complex AIR = Complex.ofReal(1.0);
    protected static final Complex ABSORBING_FILM = Complex.of(2.385, -0.1);
    protected static final Complex GLASS = Complex.ofReal(1.52);

    /** Percentage points. */
    private static final double REFERENCE_TOLERANCE = 0.01;

    protected abstract OpticalKernel kernel();

    protected static FilmStack absorbingStack(double thickness, double angleDegrees) {
        return FilmStack.withAngleDegrees(AIR, ABSORBING_FILM, thickness, GLASS, 550, angleDegrees);
    }

    protected static FilmStack losslessStack(double angleDegrees) {
        return FilmStack.withAngleDegrees(AIR, Complex.ofReal(2.0), 100, GLASS, 550, angleDegrees);
    }

    @Test
    void defaultParameters_matchReference() {
        OpticalResult r = kernel().compute(absorbingStack(99.45, 0), Polarization.S);
        assertEquals(11.1475, r.reflectance() * 100, REFERENCE_TOLERANCE, "R for d = 99.45 nm");
        assertEquals(70.3446, r.transmittance() * 100, REFERENCE_TOLERANCE, "T for d = 99.45 nm");
        assertEquals(18.5079, r.absorbance() * 100, REFERENCE_TOLERANCE, "A for d = 99.45 nm");
        assertTrue(r.energyConserved());
        assertEquals(Polarization.S, r.polarization());
    }

    @Test
    void standardCase_matchesReference() {
        OpticalResult r = kernel().compute(absorbingStack(57.65, 0), Polarization.S);
        assertEquals(31.4424, r.reflectance() * 100, REFERENCE_TOLERANCE, "R for d = 57.65 nm");
        assertEquals(59.5727, r.transmittance() * 100, REFERENCE_TOLERANCE, "T for d = 57.65 nm");
        assertEquals(8.9849, r.absorbance() * 100, REFERENCE_TOLERANCE, "A for d = 57.65 nm");
    }

    @Test
    void sevenArgumentOverload_equalsStackVariant() {
        OpticalResult viaArgs = kernel().compute(AIR, ABSORBING_FILM, 99.45, GLASS, 550, 0, Polarization.S);
        OpticalResult viaStack = kernel().compute(absorbingStack(99.45, 0), Polarization.S);
        assertEquals(viaStack.reflectance(), viaArgs.reflectance(), 0.0);
        assertEquals(viaStack.transmittance(), viaArgs.transmittance(), 0.0);
    }

    @Test
    void losslessStack_conservesEnergy_atEveryAngle() {
        for (Polarization p : new Polarization[]{Polarization.S, Polarization.P}) {
            for (double angle = 0; angle < 90; angle += 7.5) {
                OpticalResult r = kernel().compute(losslessStack(angle), p);
                assertEquals(1.0, r.energySum(), 1e-6, "R + T + A at " + angle + "° " + p);
                assertEquals(0.0, r.absorbance(), 1e-9, "No absorption in a lossless stack at " + angle + "° " + p);
                assertTrue(r.energyConserved());
                assertTrue(r.reflectance() >= 0 && r.reflectance() <= 1, "R in [0, 1]");
            }
        }
    }

    @Test
    void normalIncidence_sAndPCoincide() {
        OpticalResult s = kernel().compute(absorbingStack(99.45, 0), Polarization.S);
        OpticalResult p = kernel().compute(absorbingStack(99.45, 0), Polarization.P);
        assertEquals(s.reflectance(), p.reflectance(), 1e-12);
        assertEquals(s.transmittance(), p.transmittance(), 1e-12);
    }

    @Test
    void obliqueAbsorbingFilm_matchesIndependentComputation() {
        OpticalResult s = kernel().compute(absorbingStack(99.45, 30), Polarization.S);
        assertEquals(0.16053889380820613, s.reflectance(), 1e-9);
        assertEquals(0.6608585617578316, s.transmittance(), 1e-9);
        assertEquals(0.17860254443396217, s.absorbance(), 1e-9);
        assertTrue(s.reflectionCoefficient().approximatelyEquals(
                new Complex(-0.37166978190847483, 0.14966785568154867), 1e-9));

        OpticalResult p = kernel().compute(absorbingStack(99.45, 30), Polarization.P);
        assertEquals(0.09291426084197259, p.reflectance(), 1e-9);
        assertEquals(0.7159342904227836, p.transmittance(), 1e-9);
        assertEquals(0.1911514487352438, p.absorbance(), 1e-9);
    }

    @Test
    void avg_isExactMeanOfIndependentRuns() {
        FilmStack stack = absorbingStack(99.45, 30);
        OpticalResult s = kernel().compute(stack, Polarization.S);
        OpticalResult p = kernel().compute(stack, Polarization.P);
        OpticalResult avg = kernel().computeWithPolarization(stack, Polarization.AVG);

        assertEquals(Polarization.AVG, avg.polarization());
        assertEquals((s.reflectance() + p.reflectance()) / 2.0, avg.reflectance(), 0.0);
        assertEquals((s.transmittance() + p.transmittance()) / 2.0, avg.transmittance(), 0.0);
        assertEquals((s.absorbance() + p.absorbance()) / 2.0, avg.absorbance(), 0.0);
        assertEquals((s.reflectionCoefficient().real + p.reflectionCoefficient().real) / 2,
                avg.reflectionCoefficient().real, 0.0);
        assertEquals(Complex.ZERO, avg.transmissionCoefficient());

        assertTrue(avg.isAveraged());
        assertEquals(Polarization.S, avg.sResult().orElseThrow().polarization());
        assertEquals(Polarization.P, avg.pResult().orElseThrow().polarization());
        assertTrue(avg.sResult().orElseThrow().sResult().isEmpty(), "Sub-results are never nested");
        assertEquals(s.reflectance(), avg.sResult().orElseThrow().reflectance(), 0.0);
        assertTrue(avg.energyConserved());
    }

    @Test
    void dispatch_tagsSingleResults() {
        OpticalResult p = kernel().computeWithPolarization(absorbingStack(57.65, 45), Polarization.P);
        assertEquals(Polarization.P, p.polarization());
        assertFalse(p.isAveraged());
        assertTrue(p.sResult().isEmpty());
        assertEquals(550, p.wavelength(), 0.0);
        assertEquals(Math.toRadians(45), p.incidentAngle(), 0.0);
    }

    @Test
    void admittancePath_leavesTransmissionCoefficientZero() {
        OpticalResult r = kernel().compute(absorbingStack(99.45, 0), Polarization.S);
        assertEquals(Complex.ZERO, r.transmissionCoefficient());
        assertEquals(r.reflectance(), r.reflectionCoefficient().absSquared(), 1e-12);
    }

    @Test
    void compute_rejectsAvg() {
        assertThrows(IllegalArgumentException.class,
                () -> kernel().compute(absorbingStack(99.45, 0), Polarization.AVG));
    }

    @Test
    void nullArguments_throwNpe() {
        FilmStack stack = absorbingStack(99.45, 0);
        assertThrows(NullPointerException.class, () -> kernel().compute(null, Polarization.S));
        assertThrows(NullPointerException.class, () -> kernel().compute(stack, null));
        assertThrows(NullPointerException.class, () -> kernel().computeWithPolarization(null, Polarization.AVG));
        assertThrows(NullPointerException.class, () -> kernel().computeWithPolarization(stack, null));
    }

    @Test
    void zeroFilmIndex_propagatesArithmeticError() {
        FilmStack normal = new FilmStack(AIR, Complex.ZERO, 100, GLASS, 550, 0);
        FilmStack oblique = FilmStack.withAngleDegrees(AIR, Complex.ZERO, 100, GLASS, 550, 30);
        assertThrows(ArithmeticException.class, () -> kernel().compute(normal, Polarization.S));
        assertThrows(ArithmeticException.class, () -> kernel().computeWithPolarization(oblique, Polarization.AVG));
    }
}
