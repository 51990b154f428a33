/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.trace;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Node of the calculation trace tree.
 *
 * <p>A step owns its results and children, both append-only. The parent link is
 * for upward navigation only and is {@code null} for top-level steps.</p>
 *
 * <p>Status lifecycle: {@code PENDING → RUNNING → COMPLETED | FAILED | WARNING}.
 * Entering {@code RUNNING} stamps the start time; entering a terminal status stamps the
 * end time, and sets progress to 100 on completion or 0 on failure. A closed step that is
 * reopened keeps its first start time and loses its end time and progress.</p>
 */
public final class CalculationStep {

    private final String id;
    private final String title;
    private final StepType type;
    private final List<CalculationResult> results = new ArrayList<>();
    private final List<CalculationStep> children = new ArrayList<>();
    private CalculationStep parent;

    private StepStatus status = StepStatus.PENDING;
    private Instant startTime;
    private Instant endTime;
    private Double progress;

    CalculationStep(String title, StepType type) {
        this.id = UUID.randomUUID().toString();
        this.title = Objects.requireNonNull(title, "title");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public StepType type() {
        return type;
    }

    public StepStatus status() {
        return status;
    }

    public List<CalculationResult> results() {
        return Collections.unmodifiableList(results);
    }

    public List<CalculationStep> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<CalculationStep> parent() {
        return Optional.ofNullable(parent);
    }

    public Optional<Instant> startTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Instant> endTime() {
        return Optional.ofNullable(endTime);
    }

    /**
     * Elapsed time between start and end, or empty while the step is still open.
     */
    public Optional<Duration> duration() {
        if (startTime == null || endTime == null) return Optional.empty();
        return Optional.of(Duration.between(startTime, endTime));
    }

    public OptionalDouble progress() {
        return progress == null ? OptionalDouble.empty() : OptionalDouble.of(progress);
    }

    public Optional<CalculationResult> findResult(String name) {
        for (CalculationResult r : results) {
            if (r.name().equals(name)) return Optional.of(r);
        }
        return Optional.empty();
    }

    /**
     * Depth-first search over this step and its descendants, by title.
     */
    public Optional<CalculationStep> findStep(String stepTitle) {
        if (title.equals(stepTitle)) return Optional.of(this);
        for (CalculationStep child : children) {
            Optional<CalculationStep> found = child.findStep(stepTitle);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    void addChild(CalculationStep child) {
        child.parent = this;
        children.add(child);
    }

    CalculationResult addResult(String name, ResultValue value, String unit, String formula) {
        CalculationResult result = new CalculationResult(name, value, unit, formula, this);
        results.add(result);
        return result;
    }

    void updateStatus(StepStatus newStatus, Instant now) {
        status = newStatus;
        if (newStatus == StepStatus.RUNNING) {
            if (startTime == null) startTime = now;
            endTime = null;
            progress = null;
        } else if (newStatus.isTerminal()) {
            endTime = now;
            if (newStatus == StepStatus.COMPLETED) {
                progress = 100.0;
            } else if (newStatus == StepStatus.FAILED) {
                progress = 0.0;
            }
        }
    }

    @Override
    public String toString() {
        return "CalculationStep[" + type + " '" + title + "' " + status + "]";
    }
}
