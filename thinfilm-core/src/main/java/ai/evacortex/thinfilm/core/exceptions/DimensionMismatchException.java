/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.exceptions;

public class DimensionMismatchException extends IllegalArgumentException {
    public DimensionMismatchException(String operation, int leftRows, int leftCols, int rightRows, int rightCols) {
        super("Matrix dimensions do not allow " + operation + ": "
                + leftRows + "x" + leftCols + " vs " + rightRows + "x" + rightCols);
    }
}
