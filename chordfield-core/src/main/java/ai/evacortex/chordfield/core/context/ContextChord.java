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
 * One of the sixteen context pads.
 */
public record ContextChord(ChordDescriptor chord, Quadrant quadrant, ContextRole role) {

    public ContextChord {
        Objects.requireNonNull(chord, "chord must not be null");
        Objects.requireNonNull(quadrant, "quadrant must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }

    static ContextChord of(int root, ChordQuality quality, Quadrant quadrant, ContextRole role) {
        return new ContextChord(new ChordDescriptor(root, quality), quadrant, role);
    }

    public int root() {
        return chord.root();
    }

    public ChordQuality quality() {
        return chord.quality();
    }

    public String label() {
        return chord.name();
    }
}
