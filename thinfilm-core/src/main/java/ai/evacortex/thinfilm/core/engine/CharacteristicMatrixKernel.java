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
import ai.evacortex.thinfilm.core.math.ComplexMatrix;
import ai.evacortex.thinfilm.core.trace.CalculationTracer;
import ai.evacortex.thinfilm.core.trace.NoOpTracer;
import ai.evacortex.thinfilm.core.trace.StepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public final class CharacteristicMatrixKernel implements OpticalKernel {

    private static final Logger log = LoggerFactory.getLogger(CharacteristicMatrixKernel.class);

    private final CalculationTracer tracer;
    private final KernelOptions options;

    private record Admittance(Complex eta0, Complex eta1, Complex etaS, Complex delta) {}

    private record Tra(double reflectance, double transmittance, double absorbance) {}

    public CharacteristicMatrixKernel() {
        this(NoOpTracer.INSTANCE, KernelOptions.defaultOptions());
    }

    public CharacteristicMatrixKernel(CalculationTracer tracer) {
        this(tracer, KernelOptions.defaultOptions());
    }

    public CharacteristicMatrixKernel(CalculationTracer tracer, KernelOptions options) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    @Override
    public OpticalResult compute(FilmStack stack, Polarization polarization) {
        requireSingle(stack, polarization);
        tracer.header("Thin film calculation (" + polarization.description() + ")");
        try {
            OpticalResult result = calculate(stack, polarization);
            tracer.completeSession();
            return result;
        } catch (RuntimeException e) {
            tracer.failSession();
            throw e;
        }
    }

    @Override
    public OpticalResult computeWithPolarization(FilmStack stack, Polarization polarization) {
        Objects.requireNonNull(polarization, "polarization must not be null");
        if (polarization != Polarization.AVG) {
            return compute(stack, polarization);
        }
        Objects.requireNonNull(stack, "stack must not be null");

        tracer.header("Thin film calculation (" + polarization.description() + ")");
        try {
            OpticalResult result = calculateAverage(stack);
            tracer.completeSession();
            return result;
        } catch (RuntimeException e) {
            tracer.failSession();
            throw e;
        }
    }

    private OpticalResult calculateAverage(FilmStack stack) {
        OpticalResult s = calculateBranch(stack, Polarization.S);
        OpticalResult p = calculateBranch(stack, Polarization.P);

        tracer.openStep("AVG: mean of S and P", StepType.FINAL_RESULTS);
        double avgR = (s.reflectance() + p.reflectance()) / 2.0;
        double avgT = (s.transmittance() + p.transmittance()) / 2.0;
        double avgA = (s.absorbance() + p.absorbance()) / 2.0;
        Complex avgRc = mean(s.reflectionCoefficient(), p.reflectionCoefficient());
        Complex avgTc = mean(s.transmissionCoefficient(), p.transmissionCoefficient());

        tracer.addScalar("AVG reflectance", avgR, "", "(R_s + R_p) / 2");
        tracer.addScalar("AVG transmittance", avgT, "", "(T_s + T_p) / 2");
        tracer.addScalar("AVG absorbance", avgA, "", "(A_s + A_p) / 2");
        tracer.addComplex("AVG r", avgRc, "", "(r_s + r_p) / 2");

        double total = avgR + avgT + avgA;
        boolean conserved = options.isConserved(total);
        tracer.logEnergyConservation(conserved, total);
        tracer.logFinalResults(avgR, avgT, avgA, conserved);
        closeWithConservation(conserved, total);

        return new OpticalResult(avgR, avgT, avgA, avgRc, avgTc,
                stack.wavelength(), stack.incidentAngle(), conserved, Polarization.AVG, s, p);
    }

    private OpticalResult calculateBranch(FilmStack stack, Polarization polarization) {
        tracer.openStep("Sub-calculation: " + polarization.description(), StepType.HEADER);
        OpticalResult result = calculate(stack, polarization);
        tracer.addScalar(polarization.name() + " reflectance", result.reflectance());
        tracer.addScalar(polarization.name() + " transmittance", result.transmittance());
        tracer.addScalar(polarization.name() + " absorbance", result.absorbance());
        tracer.completeStep();
        return result;
    }

    private OpticalResult calculate(FilmStack stack, Polarization polarization) {
        log.debug("Computing {} for λ={} nm, d={} nm, θ₀={} rad",
                polarization, stack.wavelength(), stack.thickness(), stack.incidentAngle());

        logInputs(stack, polarization);

        tracer.openStep("Step 1: Phase thickness", StepType.PHASE_THICKNESS);
        Complex delta = phaseThickness(stack, Complex.ofReal(Math.cos(stack.incidentAngle())));
        tracer.addComplex("δ", delta, "rad", "δ = 2π·d·n₁·cos θ₀ / λ");
        tracer.completeStep();

        tracer.openStep("Step 2: Optical admittance", StepType.OPTICAL_ADMITTANCE);
        Admittance adm = admittance(stack, polarization, delta);
        tracer.addComplex("η₀ (incident medium)", adm.eta0());
        tracer.addComplex("η₁ (film)", adm.eta1());
        tracer.addComplex("ηₛ (substrate)", adm.etaS());
        tracer.completeStep();

        tracer.openStep("Step 3: Characteristic matrix", StepType.CHARACTERISTIC_MATRIX);
        ComplexMatrix m = characteristicMatrix(adm.delta(), adm.eta1());
        tracer.addMatrix("Characteristic matrix M", m);
        tracer.completeStep();

        tracer.openStep("Step 4: Boundary condition parameters", StepType.BOUNDARY_CONDITION);
        Complex b = m.get(0, 0).add(m.get(0, 1).multiply(adm.etaS()));
        Complex c = m.get(1, 0).add(m.get(1, 1).multiply(adm.etaS()));
        tracer.addComplex("B", b, "", "B = M₀₀ + M₀₁·ηₛ");
        tracer.addComplex("C", c, "", "C = M₁₀ + M₁₁·ηₛ");
        tracer.completeStep();

        Complex bcConj = b.multiply(c.conjugate());

        tracer.openStep("Step 5: TRA calculation (direct method)", StepType.TRA_CALCULATION);
        Tra direct = directMethod(adm, b, c, bcConj);
        tracer.completeStep();

        tracer.openStep("Step 6: Admittance method", StepType.REFLECTION_TRANSMISSION);
        Complex y = c.divide(b);
        Complex r = adm.eta0().subtract(y).divide(adm.eta0().add(y));
        double reflectance = r.absSquared();
        double transmittance = adm.etaS().real * (1 - reflectance) / bcConj.real;
        double absorbance = 1 - reflectance - transmittance;
        tracer.addComplex("Admittance Y", y, "", "Y = C / B");
        tracer.addComplex("Reflection coefficient r", r, "", "r = (η₀ − Y) / (η₀ + Y)");
        tracer.addScalar("R (admittance)", reflectance, "", "R = |r|²");
        tracer.addScalar("T (admittance)", transmittance, "", "T = Re(ηₛ)(1 − R) / Re(BC*)");
        tracer.addScalar("A (admittance)", absorbance, "", "A = 1 − R − T");
        tracer.completeStep();

        compareMethods(direct, new Tra(reflectance, transmittance, absorbance));

        double total = reflectance + transmittance + absorbance;
        boolean conserved = options.isConserved(total);

        tracer.openStep("Final results", StepType.FINAL_RESULTS);
        tracer.logFinalResults(reflectance, transmittance, absorbance, conserved);
        tracer.completeStep();

        tracer.openStep("Energy conservation check", StepType.VALIDATION);
        tracer.logEnergyConservation(conserved, total);
        closeWithConservation(conserved, total);

        return OpticalResult.single(reflectance, transmittance, absorbance, r, Complex.ZERO,
                stack.wavelength(), stack.incidentAngle(), conserved, polarization);
    }

    private void logInputs(FilmStack stack, Polarization polarization) {
        tracer.openStep("Input parameters", StepType.INPUT_PARAMETERS);
        tracer.addComplex("n₀ (incident medium)", stack.incidentIndex());
        tracer.addComplex("n₁ (film)", stack.filmIndex());
        tracer.addScalar("d (film thickness)", stack.thickness(), "nm", "");
        tracer.addComplex("nₛ (substrate)", stack.substrateIndex());
        tracer.addScalar("λ (wavelength)", stack.wavelength(), "nm", "");
        tracer.addScalar("θ₀ (incidence angle)", stack.incidentAngleDegrees(), "°", "");
        tracer.addText("Polarization", polarization.description());
        tracer.completeStep();
    }

    private Complex phaseThickness(FilmStack stack, Complex cosTheta1) {
        double k = 2 * Math.PI * stack.thickness() / stack.wavelength();
        return stack.filmIndex().multiply(cosTheta1).scale(k);
    }

    private Admittance admittance(FilmStack stack, Polarization polarization, Complex normalDelta) {
        Complex n0 = stack.incidentIndex();
        Complex n1 = stack.filmIndex();
        Complex ns = stack.substrateIndex();

        if (options.isNormalIncidence(stack.incidentAngle())) {
            return new Admittance(n0, n1, ns, normalDelta);
        }

        // complex Snell's law; cos θ on the principal branch
        Complex sinTheta0 = Complex.ofReal(Math.sin(stack.incidentAngle()));
        Complex cosTheta0 = Complex.ofReal(Math.cos(stack.incidentAngle()));
        Complex sinTheta1 = n0.divide(n1).multiply(sinTheta0);
        Complex sinThetaS = n0.divide(ns).multiply(sinTheta0);
        Complex cosTheta1 = Complex.ONE.subtract(sinTheta1.multiply(sinTheta1)).sqrt();
        Complex cosThetaS = Complex.ONE.subtract(sinThetaS.multiply(sinThetaS)).sqrt();

        tracer.addComplex("sin θ₁", sinTheta1, "", "sin θ₁ = (n₀ / n₁)·sin θ₀");
        tracer.addComplex("cos θ₁", cosTheta1, "", "cos θ₁ = √(1 − sin² θ₁)");
        tracer.addComplex("sin θₛ", sinThetaS, "", "sin θₛ = (n₀ / nₛ)·sin θ₀");
        tracer.addComplex("cos θₛ", cosThetaS, "", "cos θₛ = √(1 − sin² θₛ)");

        Complex eta0;
        Complex eta1;
        Complex etaS;
        if (polarization == Polarization.S) {
            eta0 = n0.multiply(cosTheta0);
            eta1 = n1.multiply(cosTheta1);
            etaS = ns.multiply(cosThetaS);
        } else {
            eta0 = n0.divide(cosTheta0);
            eta1 = n1.divide(cosTheta1);
            etaS = ns.divide(cosThetaS);
        }

        Complex delta = phaseThickness(stack, cosTheta1);
        tracer.addComplex("δ (oblique incidence)", delta, "rad", "δ = 2π·d·n₁·cos θ₁ / λ");
        return new Admittance(eta0, eta1, etaS, delta);
    }

    private ComplexMatrix characteristicMatrix(Complex delta, Complex eta1) {
        Complex cosD = delta.cos();
        Complex sinD = delta.sin();
        tracer.addComplex("cos(δ)", cosD);
        tracer.addComplex("sin(δ)", sinD);
        return ComplexMatrix.of2x2(
                cosD, Complex.I.multiply(sinD).divide(eta1),
                Complex.I.multiply(eta1).multiply(sinD), cosD);
    }

    private Tra directMethod(Admittance adm, Complex b, Complex c, Complex bcConj) {
        Complex denominator = adm.eta0().multiply(b).add(c);
        double denominatorSquared = denominator.absSquared();
        Complex numeratorR = adm.eta0().multiply(b).subtract(c);

        double reflectance = numeratorR.absSquared() / denominatorSquared;
        double transmissionNumerator = 4 * adm.eta0().real * adm.etaS().real;
        double transmittance = transmissionNumerator / denominatorSquared;
        double absorptionNumerator = 4 * adm.eta0().real * (bcConj.real - adm.etaS().real);
        double absorbance = absorptionNumerator / denominatorSquared;

        tracer.addComplex("η₀B + C", denominator);
        tracer.addScalar("|η₀B + C|²", denominatorSquared);
        tracer.addComplex("BC*", bcConj);
        tracer.addScalar("Re(BC*)", bcConj.real);
        tracer.addComplex("η₀B − C", numeratorR);
        tracer.addScalar("|η₀B − C|²", numeratorR.absSquared());
        tracer.addScalar("R (direct)", reflectance, "", "R = |η₀B − C|² / |η₀B + C|²");
        tracer.addScalar("4·Re(η₀)·Re(ηₛ)", transmissionNumerator);
        tracer.addScalar("T (direct)", transmittance, "", "T = 4·Re(η₀)·Re(ηₛ) / |η₀B + C|²");
        tracer.addScalar("Re(BC*) − Re(ηₛ)", bcConj.real - adm.etaS().real);
        tracer.addScalar("A (direct)", absorbance, "", "A = 4·Re(η₀)·(Re(BC*) − Re(ηₛ)) / |η₀B + C|²");
        return new Tra(reflectance, transmittance, absorbance);
    }

    private void compareMethods(Tra direct, Tra admittance) {
        double dR = Math.abs(direct.reflectance() - admittance.reflectance());
        double dT = Math.abs(direct.transmittance() - admittance.transmittance());
        double dA = Math.abs(direct.absorbance() - admittance.absorbance());

        tracer.openStep("Method comparison", StepType.COMPARISON);
        tracer.addScalar("|ΔR|", dR);
        tracer.addScalar("|ΔT|", dT);
        tracer.addScalar("|ΔA|", dA);
        tracer.completeStep();

        double worst = Math.max(dR, Math.max(dT, dA));
        if (worst > options.methodAgreementTolerance()) {
            log.info("Direct and admittance methods diverge by {} (ΔR={}, ΔT={}, ΔA={}); admittance values kept",
                    worst, dR, dT, dA);
        }
    }

    private void closeWithConservation(boolean conserved, double total) {
        if (conserved) {
            tracer.completeStep();
        } else {
            log.warn("Energy not conserved: R + T + A = {}", total);
            tracer.warnStep();
        }
    }

    private static Complex mean(Complex a, Complex b) {
        return new Complex((a.real + b.real) / 2, (a.imag + b.imag) / 2);
    }

    private static void requireSingle(FilmStack stack, Polarization polarization) {
        Objects.requireNonNull(stack, "stack must not be null");
        Objects.requireNonNull(polarization, "polarization must not be null");
        if (polarization == Polarization.AVG) {
            throw new IllegalArgumentException("compute() takes S or P; use computeWithPolarization() for AVG");
        }
    }
}
