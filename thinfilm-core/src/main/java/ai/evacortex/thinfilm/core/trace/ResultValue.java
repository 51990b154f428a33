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

import java.util.Objects;

/**
 * Value attached to a {@link CalculationResult}: a real scalar, a complex number,
 * a matrix or free text. Each variant formats itself for inline display.
 */
public sealed interface ResultValue
        permits ResultValue.Scalar, ResultValue.ComplexValue, ResultValue.MatrixValue, ResultValue.Text {

    ResultType type();

    /** Short single-line rendering used by tree views. */
    String formattedValue();

    record Scalar(double value) implements ResultValue {
        @Override
        public ResultType type() {
            return ResultType.SCALAR;
        }

        @Override
        public String formattedValue() {
            return TraceFormat.formatReal(value);
        }
    }

    record ComplexValue(Complex value) implements ResultValue {
        public ComplexValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ResultType type() {
            return ResultType.COMPLEX;
        }

        @Override
        public String formattedValue() {
            return TraceFormat.formatComplex(value);
        }
    }

    record MatrixValue(ComplexMatrix value) implements ResultValue {
        public MatrixValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ResultType type() {
            return ResultType.MATRIX;
        }

        @Override
        public String formattedValue() {
            return "[" + value.rows() + "×" + value.columns() + " Matrix]";
        }
    }

    record Text(String value) implements ResultValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ResultType type() {
            return ResultType.TEXT;
        }

        @Override
        public String formattedValue() {
            return value;
        }
    }
}
