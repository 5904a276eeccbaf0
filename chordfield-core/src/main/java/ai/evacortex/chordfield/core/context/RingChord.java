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

/**
 * A slot of the circle-of-fifths ring with its default quality in the current key.
 *
 * @param position index on the ring, 0–11, ascending fifths from C
 * @param diatonic whether the root belongs to the current key and mode
 */
public record RingChord(int position, ChordDescriptor chord, boolean diatonic) {
}
