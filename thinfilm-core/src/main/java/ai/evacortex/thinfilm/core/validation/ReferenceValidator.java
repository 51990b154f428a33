/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.validation;

import ai.evacortex.thinfilm.core.OpticalResult;
import ai.evacortex.thinfilm.core.engine.CharacteristicMatrixKernel;
import ai.evacortex.thinfilm.core.engine.KernelOptions;
import ai.evacortex.thinfilm.core.engine.OpticalKernel;
import ai.evacortex.thinfilm.core.trace.CalculationTracer;
import ai.evacortex.thinfilm.core.trace.NestedTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs reference cases through the kernel and records expected against actual values.
 * Each case's full calculation trace becomes a branch of the validation session.
 */
public final class ReferenceValidator {

    private static final Logger log = LoggerFactory.getLogger(ReferenceValidator.class);

    private final CalculationTracer tracer;
    private final OpticalKernel kernel;

    public ReferenceValidator(CalculationTracer tracer) {
        this(tracer, KernelOptions.defaultOptions());
    }

    public ReferenceValidator(CalculationTracer tracer, KernelOptions options) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.kernel = new CharacteristicMatrixKernel(new NestedTracer(tracer), options);
    }

    public List<ValidationOutcome> runValidationTests() {
        return run(ValidationCase.referenceCases());
    }

    public List<ValidationOutcome> run(List<ValidationCase> cases) {
        tracer.header("Thin film calculator validation");
        try {
            List<ValidationOutcome> outcomes = new ArrayList<>(cases.size());
            for (ValidationCase vc : cases) {
                OpticalResult result = kernel.computeWithPolarization(vc.stack(), vc.polarization());
                ValidationOutcome outcome = ValidationOutcome.of(vc, result);
                tracer.logValidationResult(vc.name(),
                        vc.expectedReflectancePercent(),
                        vc.expectedTransmittancePercent(),
                        vc.expectedAbsorbancePercent(),
                        result.reflectance(), result.transmittance(), result.absorbance(),
                        outcome.passed());
                if (!outcome.passed()) {
                    log.warn("Reference case '{}' off by R={} T={} A={} percentage points",
                            vc.name(), outcome.reflectanceError(), outcome.transmittanceError(),
                            outcome.absorbanceError());
                }
                outcomes.add(outcome);
            }
            tracer.completeSession();
            log.debug("Validated {} reference cases", outcomes.size());
            return outcomes;
        } catch (RuntimeException e) {
            tracer.failSession();
            throw e;
        }
    }
}
