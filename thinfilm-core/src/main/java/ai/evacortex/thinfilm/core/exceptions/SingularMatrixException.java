/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.exceptions;

public class SingularMatrixException extends ArithmeticException {
    public SingularMatrixException(String message) {
        super("Matrix is singular and cannot be inverted: " + message);
    }
}
