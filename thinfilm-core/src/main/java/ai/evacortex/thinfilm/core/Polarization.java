/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core;

public enum Polarization {
    /** Electric field perpendicular to the plane of incidence. */
    S("S polarization"),
    /** Electric field parallel to the plane of incidence. */
    P("P polarization"),
    /** Unweighted mean of S and P. */
    AVG("AVG polarization (mean of S and P)");

    private final String description;

    Polarization(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
