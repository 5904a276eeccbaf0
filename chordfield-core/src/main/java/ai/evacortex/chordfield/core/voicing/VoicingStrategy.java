/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.voicing;

import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.VoicingType;

/**
 * {@code VoicingStrategy} turns a chord into raw MIDI notes for one {@link VoicingType}.
 *
 * <p>With an empty previous voicing the chord is built from scratch around a fixed register;
 * otherwise it is voice-led from the previous notes. Raw output is unsorted and may leave the
 * playable range: register gravity, octave offset and clamping are applied afterwards by the
 * {@link VoicingEngine}.</p>
 *
 * <p>Implementations must be deterministic and free of side effects.</p>
 */
public interface VoicingStrategy {

    VoicingType type();

    /**
     * @param root         root pitch class, 0–11
     * @param quality      chord quality
     * @param previous     previous voicing, ascending; empty to build from scratch
     * @param previousRoot root pitch class of the previous chord
     * @return raw MIDI notes, never {@code null}
     */
    int[] voice(int root, ChordQuality quality, int[] previous, int previousRoot);
}
