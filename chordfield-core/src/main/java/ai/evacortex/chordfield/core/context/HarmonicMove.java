/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.context;

import ai.evacortex.chordfield.core.chord.ChordDescriptor;
import ai.evacortex.chordfield.core.theory.ChordQuality;

import java.util.Objects;

/**
 * A candidate next chord together with the relation that produced it.
 */
public record HarmonicMove(ChordDescriptor chord, MoveType type) {

    public HarmonicMove {
        Objects.requireNonNull(chord, "chord must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static HarmonicMove of(int root, ChordQuality quality, MoveType type) {
        return new HarmonicMove(new ChordDescriptor(root, quality), type);
    }

    public int root() {
        return chord.root();
    }

    public ChordQuality quality() {
        return chord.quality();
    }
}
