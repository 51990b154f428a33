/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.trace;

public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    WARNING;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == WARNING;
    }
}
