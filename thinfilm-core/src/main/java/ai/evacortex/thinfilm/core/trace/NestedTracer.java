/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.trace;

import ai.evacortex.thinfilm.core.math.Complex;
import ai.evacortex.thinfilm.core.math.ComplexMatrix;

import java.util.Objects;

/**
 * Records a whole calculation session as one branch of an enclosing session.
 *
 * <p>{@link #header} opens a branch step under the delegate's current step. The session
 * operations close every step still open through this tracer, the branch included, and leave
 * the delegate positioned where the branch was opened. The delegate's root stays open.</p>
 */
public final class NestedTracer implements CalculationTracer {

    private final CalculationTracer delegate;

    /** Steps opened through this tracer and not yet closed. */
    private int openSteps;

    public NestedTracer(CalculationTracer delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public void header(String title) {
        delegate.openStep(title, StepType.HEADER);
        openSteps++;
    }

    @Override
    public void openStep(String title, StepType type) {
        delegate.openStep(title, type);
        openSteps++;
    }

    @Override
    public void addScalar(String name, double value, String unit, String formula) {
        delegate.addScalar(name, value, unit, formula);
    }

    @Override
    public void addComplex(String name, Complex value, String unit, String formula) {
        delegate.addComplex(name, value, unit, formula);
    }

    @Override
    public void addMatrix(String name, ComplexMatrix matrix) {
        delegate.addMatrix(name, matrix);
    }

    @Override
    public void addText(String name, String text) {
        delegate.addText(name, text);
    }

    @Override
    public void logFinalResults(double reflectance, double transmittance, double absorbance, boolean conserved) {
        delegate.logFinalResults(reflectance, transmittance, absorbance, conserved);
    }

    @Override
    public void logEnergyConservation(boolean conserved, double total) {
        delegate.logEnergyConservation(conserved, total);
    }

    @Override
    public void logValidationResult(String caseName,
                                    double expectedR, double expectedT, double expectedA,
                                    double actualR, double actualT, double actualA,
                                    boolean passed) {
        delegate.logValidationResult(caseName, expectedR, expectedT, expectedA, actualR, actualT, actualA, passed);
    }

    @Override
    public void completeStep() {
        delegate.completeStep();
        released();
    }

    @Override
    public void warnStep() {
        delegate.warnStep();
        released();
    }

    @Override
    public void failStep() {
        delegate.failStep();
        released();
    }

    @Override
    public void completeSession() {
        while (openSteps > 0) {
            completeStep();
        }
    }

    @Override
    public void failSession() {
        while (openSteps > 0) {
            failStep();
        }
    }

    int openSteps() {
        return openSteps;
    }

    private void released() {
        if (openSteps > 0) openSteps--;
    }
}
