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

/**
 * Result of running one {@link ValidationCase}. Errors are absolute, in percentage points.
 */
public record ValidationOutcome(ValidationCase validationCase,
                                OpticalResult result,
                                double reflectanceError,
                                double transmittanceError,
                                double absorbanceError) {

    public static ValidationOutcome of(ValidationCase validationCase, OpticalResult result) {
        return new ValidationOutcome(validationCase, result,
                Math.abs(result.reflectance() * 100 - validationCase.expectedReflectancePercent()),
                Math.abs(result.transmittance() * 100 - validationCase.expectedTransmittancePercent()),
                Math.abs(result.absorbance() * 100 - validationCase.expectedAbsorbancePercent()));
    }

    public boolean passed() {
        return reflectanceError < ValidationCase.TOLERANCE_PERCENT
                && transmittanceError < ValidationCase.TOLERANCE_PERCENT
                && absorbanceError < ValidationCase.TOLERANCE_PERCENT;
    }
}
