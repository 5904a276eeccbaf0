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

import java.util.Objects;

/**
 * A chord borrowed from the parallel mode, tagged with the scale degree (0–6) it replaces.
 */
public record BorrowedChord(ChordDescriptor chord, int degree) {

    public BorrowedChord {
        Objects.requireNonNull(chord, "chord must not be null");
    }

    public int root() {
        return chord.root();
    }

    public HarmonicMove toMove() {
        return new HarmonicMove(chord, MoveType.MODAL_INTERCHANGE);
    }
}
