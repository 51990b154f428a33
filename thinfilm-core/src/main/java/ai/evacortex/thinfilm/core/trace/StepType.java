/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.trace;

/**
 * Kind of a {@link CalculationStep}, used by display layers to pick icons and grouping.
 */
public enum StepType {
    HEADER,
    INPUT_PARAMETERS,
    PHASE_THICKNESS,
    OPTICAL_ADMITTANCE,
    CHARACTERISTIC_MATRIX,
    BOUNDARY_CONDITION,
    REFLECTION_TRANSMISSION,
    TRA_CALCULATION,
    VALIDATION,
    COMPARISON,
    FINAL_RESULTS
}
