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

/**
 * {@code CalculationTracer} receives every intermediate quantity of a calculation.
 *
 * <p>Steps form a stack: {@link #openStep} attaches a child under the currently open step and
 * makes it current; {@link #completeStep()} and {@link #failStep()} close the current step and
 * return to its parent. Results are appended to the current step.</p>
 *
 * <p>The kernel receives its tracer through its constructor. Use {@link NoOpTracer} for
 * headless runs and one {@link CalculationLog} per calculation when the trace is displayed.
 * Implementations are not required to be thread safe.</p>
 *
 * @see CalculationLog
 * @see NoOpTracer
 */
public interface CalculationTracer {

    /**
     * Opens the session root, or reuses it when this tracer already has one.
     */
    void header(String title);

    /**
     * Opens a child of the current step; attaches under the root when no step is open.
     */
    void openStep(String title, StepType type);

    void addScalar(String name, double value, String unit, String formula);

    default void addScalar(String name, double value) {
        addScalar(name, value, "", "");
    }

    void addComplex(String name, Complex value, String unit, String formula);

    default void addComplex(String name, Complex value) {
        addComplex(name, value, "", "");
    }

    void addMatrix(String name, ComplexMatrix matrix);

    void addText(String name, String text);

    /**
     * Records the canonical R, T and A of a calculation with a percentage summary.
     */
    void logFinalResults(double reflectance, double transmittance, double absorbance, boolean conserved);

    void logEnergyConservation(boolean conserved, double total);

    /**
     * Records expected against actual values of a reference case. Expected values are
     * percentages, actual values are ratios.
     */
    void logValidationResult(String caseName,
                             double expectedR, double expectedT, double expectedA,
                             double actualR, double actualT, double actualA,
                             boolean passed);

    void completeStep();

    /**
     * Closes the current step as finished with a reportable condition.
     */
    void warnStep();

    void failStep();

    /**
     * Closes every step still open, innermost first, then the root.
     */
    void completeSession();

    /**
     * Marks every step still open as failed, innermost first, including the root.
     */
    void failSession();
}
