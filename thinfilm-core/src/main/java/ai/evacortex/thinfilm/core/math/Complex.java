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

import java.util.Locale;

/**
 * Immutable complex number used by the characteristic-matrix computation.
 *
 * <p>Refractive indices follow the {@code N = n − ik} convention, so an absorbing
 * medium carries a negative imaginary part.</p>
 */
public final class Complex {

    /** Squared magnitude below which a denominator is treated as zero. */
    public static final double SINGULARITY_EPSILON = 1e-15;

    /** Imaginary parts below this are rendered as a pure real number. */
    public static final double DISPLAY_EPSILON = 1e-10;

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);
    public static final Complex I = new Complex(0.0, 1.0);

    public final double real;
    public final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    public static Complex of(double real, double imag) {
        return new Complex(real, imag);
    }

    public static Complex ofReal(double real) {
        return new Complex(real, 0.0);
    }

    public Complex add(Complex other) {
        return new Complex(this.real + other.real, this.imag + other.imag);
    }

    public Complex subtract(Complex other) {
        return new Complex(this.real - other.real, this.imag - other.imag);
    }

    public Complex multiply(Complex other) {
        double r = this.real * other.real - this.imag * other.imag;
        double i = this.real * other.imag + this.imag * other.real;
        return new Complex(r, i);
    }

    public Complex multiply(double factor) {
        return scale(factor);
    }

    public Complex scale(double factor) {
        return new Complex(this.real * factor, this.imag * factor);
    }

    /**
     * @throws ArithmeticSingularityException if {@code |other|² < 1e-15}
     */
    public Complex divide(Complex other) {
        double denominator = other.absSquared();
        if (denominator < SINGULARITY_EPSILON) {
            throw new ArithmeticSingularityException("Division by zero complex number " + other);
        }
        return new Complex(
                (this.real * other.real + this.imag * other.imag) / denominator,
                (this.imag * other.real - this.real * other.imag) / denominator);
    }

    /**
     * @throws ArithmeticSingularityException if {@code divisor² < 1e-15}
     */
    public Complex divide(double divisor) {
        if (divisor * divisor < SINGULARITY_EPSILON) {
            throw new ArithmeticSingularityException("Division by zero real scalar " + divisor);
        }
        return new Complex(this.real / divisor, this.imag / divisor);
    }

    public Outcome<Complex> tryDivide(Complex other) {
        return Outcome.attempt(() -> divide(other));
    }

    public Complex reciprocal() {
        double denominator = absSquared();
        if (denominator < SINGULARITY_EPSILON) {
            throw new ArithmeticSingularityException("Cannot compute reciprocal of " + this);
        }
        return new Complex(this.real / denominator, -this.imag / denominator);
    }

    public Outcome<Complex> tryReciprocal() {
        return Outcome.attempt(this::reciprocal);
    }

    public Complex conjugate() {
        return new Complex(this.real, -this.imag);
    }

    public Complex negate() {
        return new Complex(-this.real, -this.imag);
    }

    public double abs() {
        return Math.hypot(this.real, this.imag);
    }

    public double absSquared() {
        return this.real * this.real + this.imag * this.imag;
    }

    public double phase() {
        return Math.atan2(imag, real);
    }

    // cos(a+bi) = cos(a)cosh(b) − i·sin(a)sinh(b)
    public Complex cos() {
        return new Complex(
                Math.cos(real) * Math.cosh(imag),
                -Math.sin(real) * Math.sinh(imag));
    }

    // sin(a+bi) = sin(a)cosh(b) + i·cos(a)sinh(b)
    public Complex sin() {
        return new Complex(
                Math.sin(real) * Math.cosh(imag),
                Math.cos(real) * Math.sinh(imag));
    }

    public Complex exp() {
        double expReal = Math.exp(real);
        return new Complex(expReal * Math.cos(imag), expReal * Math.sin(imag));
    }

    /**
     * Principal square root: half the phase, square root of the magnitude.
     * Only one of the two roots is returned.
     */
    public Complex sqrt() {
        double magnitude = Math.sqrt(real * real + imag * imag);
        double halfPhase = Math.atan2(imag, real) / 2.0;
        double sqrtMagnitude = Math.sqrt(magnitude);
        return new Complex(sqrtMagnitude * Math.cos(halfPhase), sqrtMagnitude * Math.sin(halfPhase));
    }

    public boolean isReal() {
        return Math.abs(imag) < DISPLAY_EPSILON;
    }

    public boolean approximatelyEquals(Complex other, double epsilon) {
        return Math.abs(real - other.real) <= epsilon && Math.abs(imag - other.imag) <= epsilon;
    }

    /**
     * Renders {@code R ± Ii} with the given number of decimals, or just {@code R}
     * when the imaginary part is below {@link #DISPLAY_EPSILON}.
     */
    public String format(int decimals) {
        String pattern = "%." + decimals + "f";
        String re = String.format(Locale.ROOT, pattern, real);
        if (isReal()) {
            return re;
        }
        String im = String.format(Locale.ROOT, pattern, Math.abs(imag));
        return re + (imag > 0 ? " + " : " - ") + im + "i";
    }

    @Override
    public String toString() {
        return format(6);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex other = (Complex) obj;
        return Double.compare(real, other.real) == 0 && Double.compare(imag, other.imag) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(real) * 31 + Double.hashCode(imag);
    }
}
