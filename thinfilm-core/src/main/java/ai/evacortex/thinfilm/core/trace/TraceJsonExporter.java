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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * JSON projection of the step tree for display layers outside the JVM.
 *
 * <p>Parent links are not serialized; nesting is expressed by {@code children} arrays.
 * Complex values are written as {@code {"re": .., "im": ..}} and matrices as nested arrays of those.</p>
 */
public final class TraceJsonExporter {

    private final ObjectMapper mapper;

    public TraceJsonExporter() {
        this.mapper = new ObjectMapper();
    }

    public ArrayNode toJsonTree(CalculationLog log) {
        return toJsonTree(log.steps());
    }

    public ArrayNode toJsonTree(List<CalculationStep> steps) {
        ArrayNode array = mapper.createArrayNode();
        for (CalculationStep step : steps) {
            array.add(stepNode(step));
        }
        return array;
    }

    public String toJson(CalculationLog log) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonTree(log));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize calculation trace", e);
        }
    }

    private ObjectNode stepNode(CalculationStep step) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", step.id());
        node.put("title", step.title());
        node.put("type", step.type().name());
        node.put("status", step.status().name());
        step.startTime().ifPresent(t -> node.put("startTime", t.toString()));
        step.endTime().ifPresent(t -> node.put("endTime", t.toString()));
        step.duration().ifPresent(d -> node.put("durationNanos", d.toNanos()));
        step.progress().ifPresent(p -> node.put("progress", p));

        ArrayNode results = node.putArray("results");
        for (CalculationResult result : step.results()) {
            ObjectNode r = results.addObject();
            r.put("name", result.name());
            r.put("type", result.type().name());
            r.put("formatted", result.formattedValue());
            if (!result.unit().isEmpty()) r.put("unit", result.unit());
            if (!result.formula().isEmpty()) r.put("formula", result.formula());
            writeValue(r, result.value());
        }

        ArrayNode children = node.putArray("children");
        for (CalculationStep child : step.children()) {
            children.add(stepNode(child));
        }
        return node;
    }

    private void writeValue(ObjectNode target, ResultValue value) {
        if (value instanceof ResultValue.Scalar s) {
            target.put("value", s.value());
        } else if (value instanceof ResultValue.ComplexValue c) {
            target.set("value", complexNode(c.value()));
        } else if (value instanceof ResultValue.MatrixValue m) {
            ComplexMatrix matrix = m.value();
            ArrayNode rows = target.putArray("value");
            for (int i = 0; i < matrix.rows(); i++) {
                ArrayNode row = rows.addArray();
                for (int j = 0; j < matrix.columns(); j++) {
                    row.add(complexNode(matrix.get(i, j)));
                }
            }
        } else if (value instanceof ResultValue.Text t) {
            target.put("value", t.value());
        }
    }

    private ObjectNode complexNode(Complex c) {
        ObjectNode node = mapper.createObjectNode();
        node.put("re", c.real);
        node.put("im", c.imag);
        return node;
    }
}
