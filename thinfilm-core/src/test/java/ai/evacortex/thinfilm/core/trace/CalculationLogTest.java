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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CalculationLogTest {

    private CalculationLog log;

    @BeforeEach
    void setUp() {
        log = new CalculationLog(Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void header_createsRootOnce_andReusesIt() {
        log.header("Session");
        CalculationStep root = log.root().orElseThrow();
        assertEquals(StepType.HEADER, root.type());
        assertEquals(StepStatus.RUNNING, root.status());
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), root.startTime().orElseThrow());

        log.openStep("First", StepType.INPUT_PARAMETERS);
        log.completeStep();
        log.header("Second header");

        assertSame(root, log.root().orElseThrow(), "Second header must not replace the root");
        assertEquals(1, log.steps().size());
        assertEquals("Session", root.title());
        assertTrue(log.fullLog().contains("  Second header\n"), "Every header is written to the text log");
    }

    @Test
    void secondSession_reopensClosedRoot() {
        log.header("Session");
        log.openStep("First", StepType.PHASE_THICKNESS);
        log.completeSession();
        CalculationStep root = log.root().orElseThrow();
        assertEquals(StepStatus.COMPLETED, root.status());

        log.header("Session");
        assertSame(root, log.root().orElseThrow());
        assertEquals(StepStatus.RUNNING, root.status());
        assertTrue(root.endTime().isEmpty(), "Reopened root has no end time");
        assertTrue(root.progress().isEmpty());
        assertTrue(root.startTime().isPresent(), "First start time is kept");

        log.openStep("Second", StepType.CHARACTERISTIC_MATRIX);
        log.failSession();

        assertEquals(StepStatus.FAILED, root.status());
        assertEquals(StepStatus.FAILED, root.findStep("Second").orElseThrow().status());
        assertEquals(StepStatus.COMPLETED, root.findStep("First").orElseThrow().status());
        assertEquals(2, root.children().size());
    }

    @Test
    void openStep_withoutHeader_isTopLevel() {
        log.openStep("Standalone", StepType.PHASE_THICKNESS);
        log.completeStep();
        log.openStep("Another", StepType.OPTICAL_ADMITTANCE);

        assertTrue(log.root().isEmpty());
        assertEquals(2, log.steps().size());
        assertTrue(log.steps().get(0).parent().isEmpty());
        assertEquals(StepStatus.COMPLETED, log.steps().get(0).status());
        assertEquals(StepStatus.RUNNING, log.steps().get(1).status());
    }

    @Test
    void completeStep_returnsToParent() {
        log.header("Root");
        log.openStep("Outer", StepType.HEADER);
        log.openStep("Inner", StepType.CHARACTERISTIC_MATRIX);
        log.addScalar("x", 1.5);
        log.completeStep();
        log.addScalar("y", 2.5);

        CalculationStep outer = log.root().orElseThrow().children().get(0);
        assertEquals("Outer", log.currentStep().orElseThrow().title());
        assertEquals(1, outer.children().size());
        assertTrue(outer.findResult("y").isPresent(), "Result after close belongs to the parent");
        assertTrue(outer.children().get(0).findResult("x").isPresent());
        assertSame(outer, outer.children().get(0).parent().orElseThrow());
    }

    @Test
    void statusTransitions_setProgress() {
        log.header("Root");
        log.openStep("ok", StepType.TRA_CALCULATION);
        log.completeStep();
        log.openStep("warn", StepType.VALIDATION);
        log.warnStep();
        log.openStep("bad", StepType.BOUNDARY_CONDITION);
        log.failStep();
        log.openStep("open", StepType.COMPARISON);

        CalculationStep root = log.root().orElseThrow();
        CalculationStep ok = root.findStep("ok").orElseThrow();
        CalculationStep warn = root.findStep("warn").orElseThrow();
        CalculationStep bad = root.findStep("bad").orElseThrow();
        CalculationStep open = root.findStep("open").orElseThrow();

        assertEquals(100.0, ok.progress().orElseThrow(), 0.0);
        assertEquals(StepStatus.WARNING, warn.status());
        assertTrue(warn.progress().isEmpty());
        assertEquals(0.0, bad.progress().orElseThrow(), 0.0);
        assertEquals(StepStatus.FAILED, bad.status());
        assertTrue(open.endTime().isEmpty());
        assertTrue(open.duration().isEmpty());
        assertTrue(ok.duration().orElseThrow().isZero());
    }

    @Test
    void failSession_closesEveryOpenStep() {
        log.header("Root");
        log.openStep("A", StepType.HEADER);
        log.openStep("B", StepType.CHARACTERISTIC_MATRIX);
        log.openStep("Done", StepType.PHASE_THICKNESS);
        log.completeStep();
        log.failSession();

        CalculationStep root = log.root().orElseThrow();
        assertEquals(StepStatus.FAILED, root.status());
        assertEquals(StepStatus.FAILED, root.findStep("A").orElseThrow().status());
        assertEquals(StepStatus.FAILED, root.findStep("B").orElseThrow().status());
        assertEquals(StepStatus.COMPLETED, root.findStep("Done").orElseThrow().status(),
                "Already closed steps keep their status");
        assertTrue(log.currentStep().isEmpty());
    }

    @Test
    void resultsOutsideAnyStep_goToTextOnly() {
        log.addScalar("orphan", 3.0);
        assertTrue(log.steps().isEmpty());
        assertTrue(log.fullLog().contains("orphan"));
        log.completeStep();
        assertTrue(log.currentStep().isEmpty());
    }

    @Test
    void clear_discardsTreeAndText() {
        log.header("Root");
        log.openStep("Step", StepType.INPUT_PARAMETERS);
        log.addText("k", "v");
        log.clear();

        assertEquals("", log.fullLog());
        assertTrue(log.steps().isEmpty());
        assertTrue(log.root().isEmpty());
        assertTrue(log.currentStep().isEmpty());

        log.header("Fresh");
        assertEquals("Fresh", log.root().orElseThrow().title());
    }

    @Test
    void entries_padLabelToFixedWidth() {
        log.header("Root");
        log.addScalar("d", 99.45, "nm", "");
        log.addComplex("n", new Complex(2.385, -0.1));
        log.addText("Polarization", "S polarization");

        String text = log.fullLog();
        assertTrue(text.contains("d" + " ".repeat(24) + " = 99.450000\n"), text);
        assertTrue(text.contains("n" + " ".repeat(24) + " = 2.3850 - 0.1000i\n"), text);
        assertTrue(text.contains("Polarization" + " ".repeat(13) + " = S polarization\n"), text);

        CalculationResult d = log.root().orElseThrow().findResult("d").orElseThrow();
        assertEquals(ResultType.SCALAR, d.type());
        assertEquals("nm", d.unit());
        assertEquals("99.450000", d.formattedValue());
    }

    @Test
    void header_andStep_useSeparators() {
        log.header("Title");
        log.openStep("Step", StepType.PHASE_THICKNESS);
        String expected = "=".repeat(60) + "\n  Title\n" + "=".repeat(60) + "\n\n"
                + "-".repeat(40) + "\nStep:\n" + "-".repeat(40) + "\n";
        assertEquals(expected, log.fullLog());
    }

    @Test
    void matrix_rightAlignsColumns() {
        log.header("Root");
        log.addMatrix("M", ComplexMatrix.of2x2(Complex.ONE, Complex.ZERO, Complex.ZERO, new Complex(1, 2)));

        String row0 = "[ " + " ".repeat(6) + "1.0000" + "  " + " ".repeat(10) + "0.0000" + " ]\n";
        String row1 = "[ " + " ".repeat(6) + "0.0000" + "  " + "1.0000 + 2.0000i" + " ]\n";
        assertTrue(log.fullLog().endsWith("M:\n" + row0 + row1 + "\n"), log.fullLog());
        assertEquals("[2×2 Matrix]", log.root().orElseThrow().findResult("M").orElseThrow().formattedValue());
    }

    @Test
    void finalResults_writePercentagesAndMarker() {
        log.header("Root");
        log.openStep("Final", StepType.FINAL_RESULTS);
        log.logFinalResults(0.25, 0.70, 0.05, true);
        log.completeStep();

        String text = log.fullLog();
        assertTrue(text.contains("Reflectance (R)" + " ".repeat(10) + " = 25.0000%\n"));
        assertTrue(text.contains("Transmittance (T)" + " ".repeat(8) + " = 70.0000%\n"));
        assertTrue(text.contains("Absorbance (A)" + " ".repeat(11) + " = 5.0000%\n"));
        assertTrue(text.contains("Sum" + " ".repeat(22) + " = 100.0000%\n"));
        assertTrue(text.contains("Energy conservation" + " ".repeat(6) + " = conserved\n"));

        CalculationStep step = log.root().orElseThrow().findStep("Final").orElseThrow();
        assertEquals(5, step.results().size());
        assertEquals("conserved", step.findResult("Energy conservation").orElseThrow().formattedValue());
    }

    @Test
    void energyConservation_reportsDeviation() {
        log.header("Root");
        log.openStep("Check", StepType.VALIDATION);
        log.logEnergyConservation(false, 1.01);

        String text = log.fullLog();
        assertTrue(text.contains("R + T + A" + " ".repeat(16) + " = 101.0000%\n"), text);
        assertTrue(text.contains("Deviation" + " ".repeat(16) + " = 1.000000%\n"), text);
        assertTrue(text.contains("Result" + " ".repeat(19) + " = failed\n"), text);
    }

    @Test
    void validationResult_opensAndClosesItsOwnStep() {
        log.header("Validation");
        log.logValidationResult("good", 11.1475, 70.3446, 18.5079, 0.111475, 0.703446, 0.185079, true);
        log.logValidationResult("bad", 10.0, 70.0, 20.0, 0.2, 0.6, 0.2, false);

        CalculationStep root = log.root().orElseThrow();
        assertEquals(2, root.children().size());
        CalculationStep good = root.children().get(0);
        CalculationStep bad = root.children().get(1);
        assertEquals("Validation: good", good.title());
        assertEquals(StepType.VALIDATION, good.type());
        assertEquals(StepStatus.COMPLETED, good.status());
        assertEquals(StepStatus.WARNING, bad.status());
        assertEquals("failed", bad.findResult("Verdict").orElseThrow().formattedValue());

        double errorR = ((ResultValue.Scalar) bad.findResult("Error R").orElseThrow().value()).value();
        assertEquals(10.0, errorR, 1e-9);
        assertTrue(log.fullLog().contains("Expected: R=10.0000%, T=70.0000%, A=20.0000%\n"));
        assertTrue(log.fullLog().contains("Actual:   R=20.0000%, T=60.0000%, A=20.0000%\n"));
        assertSame(root, log.currentStep().orElseThrow());
    }
}
