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

import java.util.Locale;

/**
 * Fixed-width text formatting shared by the flat log and the step tree.
 * Existing displays parse this layout, so widths and decimals are fixed.
 */
public final class TraceFormat {

    public static final int LABEL_WIDTH = 25;
    public static final int MIN_MATRIX_COLUMN_WIDTH = 12;

    public static final String SEPARATOR = "============================================================";
    public static final String LINE = "----------------------------------------";

    private TraceFormat() {}

    public static String formatReal(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }

    public static String formatComplex(Complex value) {
        return value.format(4);
    }

    public static String formatPercent(double ratio) {
        return String.format(Locale.ROOT, "%.4f%%", ratio * 100.0);
    }

    /** {@code label} left-aligned in 25 characters, then {@code " = "} and the value. */
    public static String entry(String label, String formattedValue) {
        return String.format(Locale.ROOT, "%-" + LABEL_WIDTH + "s = %s", label, formattedValue);
    }

    /**
     * Renders each row as {@code [ cell  cell ]}, right-aligning cells to the widest
     * formatted cell of their column (at least 12 characters).
     */
    public static String formatMatrix(ComplexMatrix matrix) {
        int rows = matrix.rows();
        int cols = matrix.columns();
        String[][] formatted = new String[rows][cols];
        int[] widths = new int[cols];
        for (int j = 0; j < cols; j++) {
            widths[j] = MIN_MATRIX_COLUMN_WIDTH;
            for (int i = 0; i < rows; i++) {
                formatted[i][j] = formatComplex(matrix.get(i, j));
                widths[j] = Math.max(widths[j], formatted[i][j].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            sb.append("[ ");
            for (int j = 0; j < cols; j++) {
                sb.append(padLeft(formatted[i][j], widths[j]));
                if (j < cols - 1) sb.append("  ");
            }
            sb.append(" ]").append('\n');
        }
        return sb.toString();
    }

    private static String padLeft(String s, int width) {
        if (s.length() >= width) return s;
        return " ".repeat(width - s.length()) + s;
    }
}
