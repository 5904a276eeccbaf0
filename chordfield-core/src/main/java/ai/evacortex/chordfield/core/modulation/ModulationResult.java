/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.modulation;

import ai.evacortex.chordfield.core.theory.Mode;

import java.util.Objects;

/**
 * A detected key change.
 *
 * @param newKey        tonic pitch class of the new key
 * @param confidence    cadence strength
 * @param suggestedMode mode to adopt in the new key
 */
public record ModulationResult(int newKey, Confidence confidence, Mode suggestedMode) {

    public ModulationResult {
        Objects.requireNonNull(confidence, "confidence must not be null");
        Objects.requireNonNull(suggestedMode, "suggestedMode must not be null");
    }
}
