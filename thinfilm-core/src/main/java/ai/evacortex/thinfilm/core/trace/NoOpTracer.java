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

public class NoOpTracer implements CalculationTracer {

    public static final NoOpTracer INSTANCE = new NoOpTracer();

    @Override
    public void header(String title) {
        // no-op
    }

    @Override
    public void openStep(String title, StepType type) {
        // no-op
    }

    @Override
    public void addScalar(String name, double value, String unit, String formula) {
        // no-op
    }

    @Override
    public void addComplex(String name, Complex value, String unit, String formula) {
        // no-op
    }

    @Override
    public void addMatrix(String name, ComplexMatrix matrix) {
        // no-op
    }

    @Override
    public void addText(String name, String text) {
        // no-op
    }

    @Override
    public void logFinalResults(double reflectance, double transmittance, double absorbance, boolean conserved) {
        // no-op
    }

    @Override
    public void logEnergyConservation(boolean conserved, double total) {
        // no-op
    }

    @Override
    public void logValidationResult(String caseName,
                                    double expectedR, double expectedT, double expectedA,
                                    double actualR, double actualT, double actualA,
                                    boolean passed) {
        // no-op
    }

    @Override
    public void completeStep() {
        // no-op
    }

    @Override
    public void warnStep() {
        // no-op
    }

    @Override
    public void failStep() {
        // no-op
    }

    @Override
    public void completeSession() {
        // no-op
    }

    @Override
    public void failSession() {
        // no-op
    }
}
