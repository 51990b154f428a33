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

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Recording {@link CalculationTracer} with two projections built from the same appends:
 * a flat fixed-width text log ({@link #fullLog()}) and the step tree ({@link #steps()}).
 *
 * <p>A later {@link #header} reuses the root and reopens it when an earlier session closed it,
 * so consecutive sessions accumulate under one root. Not thread safe.</p>
 */
public class CalculationLog implements CalculationTracer {

    private final Clock clock;
    private final StringBuilder logBuilder = new StringBuilder();
    private final List<CalculationStep> steps = new ArrayList<>();

    private CalculationStep rootStep;
    private CalculationStep currentStep;

    public CalculationLog() {
        this(Clock.systemUTC());
    }

    public CalculationLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void header(String title) {
        logBuilder.append(TraceFormat.SEPARATOR).append('\n');
        logBuilder.append("  ").append(title).append('\n');
        logBuilder.append(TraceFormat.SEPARATOR).append('\n');
        logBuilder.append('\n');

        if (rootStep == null) {
            rootStep = new CalculationStep(title, StepType.HEADER);
            rootStep.updateStatus(StepStatus.RUNNING, now());
            steps.add(rootStep);
            currentStep = rootStep;
        } else if (currentStep == null) {
            if (rootStep.status().isTerminal()) {
                rootStep.updateStatus(StepStatus.RUNNING, now());
            }
            currentStep = rootStep;
        }
    }

    @Override
    public void openStep(String title, StepType type) {
        logBuilder.append(TraceFormat.LINE).append('\n');
        logBuilder.append(title).append(":\n");
        logBuilder.append(TraceFormat.LINE).append('\n');

        CalculationStep step = new CalculationStep(title, type);
        step.updateStatus(StepStatus.RUNNING, now());

        CalculationStep parent = currentStep != null ? currentStep : rootStep;
        if (parent != null) {
            parent.addChild(step);
        } else {
            steps.add(step);
        }
        currentStep = step;
    }

    @Override
    public void addScalar(String name, double value, String unit, String formula) {
        logBuilder.append(TraceFormat.entry(name, TraceFormat.formatReal(value))).append('\n');
        if (currentStep != null) {
            currentStep.addResult(name, new ResultValue.Scalar(value), unit, formula);
        }
    }

    @Override
    public void addComplex(String name, Complex value, String unit, String formula) {
        logBuilder.append(TraceFormat.entry(name, TraceFormat.formatComplex(value))).append('\n');
        if (currentStep != null) {
            currentStep.addResult(name, new ResultValue.ComplexValue(value), unit, formula);
        }
    }

    @Override
    public void addMatrix(String name, ComplexMatrix matrix) {
        logBuilder.append(name).append(":\n");
        logBuilder.append(TraceFormat.formatMatrix(matrix));
        logBuilder.append('\n');
        if (currentStep != null) {
            currentStep.addResult(name, new ResultValue.MatrixValue(matrix), "", "");
        }
    }

    @Override
    public void addText(String name, String text) {
        logBuilder.append(TraceFormat.entry(name, text)).append('\n');
        if (currentStep != null) {
            currentStep.addResult(name, new ResultValue.Text(text), "", "");
        }
    }

    @Override
    public void logFinalResults(double reflectance, double transmittance, double absorbance, boolean conserved) {
        double total = reflectance + transmittance + absorbance;
        appendPercentLine("Reflectance (R)", reflectance, "R = |r|²");
        appendPercentLine("Transmittance (T)", transmittance, "T = Re(ηₛ)(1 − R) / Re(BC*)");
        appendPercentLine("Absorbance (A)", absorbance, "A = 1 − R − T");
        appendPercentLine("Sum", total, "R + T + A");
        appendMarker("Energy conservation", conserved ? "conserved" : "not conserved");
        logBuilder.append('\n');
    }

    @Override
    public void logEnergyConservation(boolean conserved, double total) {
        appendPercentLine("R + T + A", total, "");
        String error = String.format(Locale.ROOT, "%.6f%%", Math.abs(total - 1.0) * 100.0);
        logBuilder.append(TraceFormat.entry("Deviation", error)).append('\n');
        if (currentStep != null) {
            currentStep.addResult("Deviation", new ResultValue.Scalar(Math.abs(total - 1.0)), "", "|R + T + A − 1|");
        }
        appendMarker("Result", conserved ? "passed" : "failed");
        logBuilder.append('\n');
    }

    @Override
    public void logValidationResult(String caseName,
                                    double expectedR, double expectedT, double expectedA,
                                    double actualR, double actualT, double actualA,
                                    boolean passed) {
        openStep("Validation: " + caseName, StepType.VALIDATION);
        logBuilder.append(String.format(Locale.ROOT, "Expected: R=%.4f%%, T=%.4f%%, A=%.4f%%\n",
                expectedR, expectedT, expectedA));
        logBuilder.append(String.format(Locale.ROOT, "Actual:   R=%.4f%%, T=%.4f%%, A=%.4f%%\n",
                actualR * 100, actualT * 100, actualA * 100));
        logBuilder.append(String.format(Locale.ROOT, "Error:    R=%.4f%%, T=%.4f%%, A=%.4f%%\n",
                Math.abs(actualR * 100 - expectedR),
                Math.abs(actualT * 100 - expectedT),
                Math.abs(actualA * 100 - expectedA)));
        logBuilder.append("Verdict: ").append(passed ? "passed" : "failed").append("\n\n");

        currentStep.addResult("Error R", new ResultValue.Scalar(Math.abs(actualR * 100 - expectedR)), "%", "");
        currentStep.addResult("Error T", new ResultValue.Scalar(Math.abs(actualT * 100 - expectedT)), "%", "");
        currentStep.addResult("Error A", new ResultValue.Scalar(Math.abs(actualA * 100 - expectedA)), "%", "");
        currentStep.addResult("Verdict", new ResultValue.Text(passed ? "passed" : "failed"), "", "");
        if (passed) {
            completeStep();
        } else {
            warnStep();
        }
    }

    @Override
    public void completeStep() {
        close(StepStatus.COMPLETED);
    }

    @Override
    public void warnStep() {
        close(StepStatus.WARNING);
    }

    @Override
    public void failStep() {
        close(StepStatus.FAILED);
    }

    @Override
    public void completeSession() {
        closeAll(StepStatus.COMPLETED);
    }

    @Override
    public void failSession() {
        closeAll(StepStatus.FAILED);
    }

    /**
     * Discards the whole tree and the flat text log.
     */
    public void clear() {
        logBuilder.setLength(0);
        steps.clear();
        rootStep = null;
        currentStep = null;
    }

    public String fullLog() {
        return logBuilder.toString();
    }

    /**
     * Top-level steps in insertion order; normally only the session root.
     */
    public List<CalculationStep> steps() {
        return Collections.unmodifiableList(steps);
    }

    public Optional<CalculationStep> root() {
        return Optional.ofNullable(rootStep);
    }

    public Optional<CalculationStep> currentStep() {
        return Optional.ofNullable(currentStep);
    }

    private void close(StepStatus status) {
        if (currentStep == null) {
            return;
        }
        currentStep.updateStatus(status, now());
        currentStep = currentStep.parent().orElse(null);
    }

    private void closeAll(StepStatus status) {
        Instant at = now();
        CalculationStep step = currentStep;
        while (step != null) {
            if (!step.status().isTerminal()) {
                step.updateStatus(status, at);
            }
            step = step.parent().orElse(null);
        }
        if (rootStep != null && !rootStep.status().isTerminal()) {
            rootStep.updateStatus(status, at);
        }
        currentStep = null;
    }

    private void appendPercentLine(String label, double ratio, String formula) {
        logBuilder.append(TraceFormat.entry(label, TraceFormat.formatPercent(ratio))).append('\n');
        if (currentStep != null) {
            currentStep.addResult(label, new ResultValue.Scalar(ratio), "", formula);
        }
    }

    private void appendMarker(String label, String marker) {
        logBuilder.append(TraceFormat.entry(label, marker)).append('\n');
        if (currentStep != null) {
            currentStep.addResult(label, new ResultValue.Text(marker), "", "");
        }
    }

    private Instant now() {
        return clock.instant();
    }
}
