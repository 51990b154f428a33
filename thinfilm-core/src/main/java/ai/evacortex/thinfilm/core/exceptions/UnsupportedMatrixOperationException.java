/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.exceptions;


public class UnsupportedMatrixOperationException extends UnsupportedOperationException {

    public UnsupportedMatrixOperationException(String operation, int rows, int cols) {
        super(operation + " is only implemented for 2x2 matrices, got " + rows + "x" + cols);
    }
}
