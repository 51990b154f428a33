/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.exceptions;

/**
 * Raised by complex division or reciprocal when the denominator is numerically zero.
 */
public class ArithmeticSingularityException extends ArithmeticException {
    public ArithmeticSingularityException(String message) {
        super(message);
    }
}
