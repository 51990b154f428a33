/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.trace;

import java.util.Objects;

/**
 * Named value recorded under a {@link CalculationStep}.
 *
 * <p>{@code parentStep} is a lookup link only; the step owns its results.</p>
 */
public final class CalculationResult {

    private final String name;
    private final ResultValue value;
    private final String unit;
    private final String formula;
    private final CalculationStep parentStep;

    CalculationResult(String name, ResultValue value, String unit, String formula, CalculationStep parentStep) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
        this.unit = unit == null ? "" : unit;
        this.formula = formula == null ? "" : formula;
        this.parentStep = parentStep;
    }

    public String name() {
        return name;
    }

    public ResultValue value() {
        return value;
    }

    public ResultType type() {
        return value.type();
    }

    public String unit() {
        return unit;
    }

    public String formula() {
        return formula;
    }

    public CalculationStep parentStep() {
        return parentStep;
    }

    public String formattedValue() {
        return value.formattedValue();
    }

    @Override
    public String toString() {
        return name + " = " + formattedValue() + (unit.isEmpty() ? "" : " " + unit);
    }
}
