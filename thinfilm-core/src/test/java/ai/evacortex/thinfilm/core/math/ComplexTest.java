/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.math;

import ai.evacortex.thinfilm.core.exceptions.ArithmeticSingularityException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ComplexTest {

    private static final double EPS = 1e-9;

    @Test
    void sqrt_squaredReturnsOriginal() {
        Random r = new Random(42);
        for (int i = 0; i < 1000; i++) {
            Complex z = new Complex(r.nextDouble() * 20 - 10, r.nextDouble() * 20 - 10);
            Complex root = z.sqrt();
            assertTrue(root.multiply(root).approximatelyEquals(z, EPS), "sqrt(z)² must equal z for " + z);
        }
    }

    @Test
    void sqrt_isPrincipalBranch() {
        Complex root = new Complex(-4, 0).sqrt();
        assertEquals(0.0, root.real, EPS);
        assertEquals(2.0, root.imag, EPS);

        Complex other = new Complex(3, -4).sqrt();
        assertTrue(other.real >= 0, "Principal root has a non-negative real part");
        assertEquals(2.0, other.real, EPS);
        assertEquals(-1.0, other.imag, EPS);
    }

    @Test
    void trigonometry_matchesIdentities() {
        Complex z = new Complex(0.7, -0.3);
        Complex cos = z.cos();
        Complex sin = z.sin();
        Complex sum = cos.multiply(cos).add(sin.multiply(sin));
        assertTrue(sum.approximatelyEquals(Complex.ONE, EPS), "cos² + sin² must be 1, got " + sum);

        assertEquals(Math.cos(0.7) * Math.cosh(-0.3), cos.real, EPS);
        assertEquals(-Math.sin(0.7) * Math.sinh(-0.3), cos.imag, EPS);
        assertEquals(Math.sin(0.7) * Math.cosh(-0.3), sin.real, EPS);
        assertEquals(Math.cos(0.7) * Math.sinh(-0.3), sin.imag, EPS);
    }

    @Test
    void exp_ofImaginaryPi_isMinusOne() {
        Complex e = new Complex(0, Math.PI).exp();
        assertTrue(e.approximatelyEquals(new Complex(-1, 0), EPS), "e^{iπ} must be -1, got " + e);
    }

    @Test
    void divide_thenMultiply_restoresNumerator() {
        Complex a = new Complex(2.385, -0.1);
        Complex b = new Complex(1.52, 0.3);
        assertTrue(a.divide(b).multiply(b).approximatelyEquals(a, EPS));
        assertTrue(b.reciprocal().multiply(b).approximatelyEquals(Complex.ONE, EPS));
        assertTrue(a.divide(2.0).approximatelyEquals(new Complex(1.1925, -0.05), EPS));
    }

    @Test
    void divisionByNearZero_throws() {
        Complex a = new Complex(1, 1);
        assertThrows(ArithmeticSingularityException.class, () -> a.divide(Complex.ZERO));
        assertThrows(ArithmeticSingularityException.class, () -> a.divide(new Complex(1e-9, 0)));
        assertThrows(ArithmeticSingularityException.class, () -> a.divide(0.0));
        assertThrows(ArithmeticSingularityException.class, () -> a.divide(1e-9));
        assertThrows(ArithmeticSingularityException.class, () -> a.divide(-1e-9));
        assertTrue(a.divide(1e-7).approximatelyEquals(new Complex(1e7, 1e7), 1e-3),
                "Real divisor above the threshold divides normally");
        assertThrows(ArithmeticSingularityException.class, () -> Complex.ZERO.reciprocal());
    }

    @Test
    void tryDivide_reportsFailureWithoutThrowing() {
        Outcome<Complex> bad = Complex.ONE.tryDivide(Complex.ZERO);
        assertFalse(bad.isSuccess());
        assertInstanceOf(ArithmeticSingularityException.class, bad.error().orElseThrow());
        assertThrows(ArithmeticSingularityException.class, bad::orElseThrow);
        Outcome.Failure<Complex> failure = assertInstanceOf(Outcome.Failure.class, bad);
        assertSame(bad.error().orElseThrow(), failure.cause());
        assertFalse(Complex.ONE.tryDivide(Complex.ofReal(1e-9)).isSuccess());

        Outcome<Complex> good = Complex.ONE.tryDivide(new Complex(0, 1));
        assertTrue(good.isSuccess());
        assertTrue(good.orElseThrow().approximatelyEquals(new Complex(0, -1), EPS));
        assertFalse(Complex.ZERO.tryReciprocal().isSuccess());
    }

    @Test
    void outcome_mapPropagatesFailures() {
        Outcome<Double> magnitude = new Complex(3, 4).tryReciprocal().map(Complex::abs);
        double value = magnitude.orElseThrow();
        assertEquals(0.2, value, EPS);

        Outcome<Complex> chained = Complex.ONE.tryDivide(Complex.I).flatMap(z -> z.tryDivide(Complex.ZERO));
        assertFalse(chained.isSuccess());
    }

    @Test
    void magnitudeAndPhase() {
        Complex z = new Complex(3, -4);
        assertEquals(5.0, z.abs(), EPS);
        assertEquals(25.0, z.absSquared(), EPS);
        assertEquals(Math.atan2(-4, 3), z.phase(), EPS);
        assertEquals(new Complex(3, 4), z.conjugate());
        assertEquals(new Complex(-3, 4), z.negate());
    }

    @Test
    void format_suppressesTinyImaginaryPart() {
        assertEquals("1.5200", new Complex(1.52, 1e-12).format(4));
        assertEquals("2.3850 - 0.1000i", new Complex(2.385, -0.1).format(4));
        assertEquals("0.5000 + 0.2500i", new Complex(0.5, 0.25).format(4));
        assertEquals("1.000000", Complex.ONE.toString());
    }
}
