/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.session;

import ai.evacortex.chordfield.core.Voicing;
import ai.evacortex.chordfield.core.chord.ChordDescriptor;
import ai.evacortex.chordfield.core.modulation.ModulationResult;

import java.util.Optional;

/**
 * Outcome of pressing a pad.
 *
 * @param chord      chord under the pad
 * @param voicing    notes to sound; empty when nothing was voiced
 * @param modulation key change detected by this press, if any
 */
public record PadTrigger(ChordDescriptor chord, Voicing voicing, Optional<ModulationResult> modulation) {

    public boolean accepted() {
        return !voicing.isEmpty();
    }
}
