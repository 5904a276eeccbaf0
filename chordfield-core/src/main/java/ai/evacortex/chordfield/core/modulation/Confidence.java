/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.modulation;

/**
 * How firmly a two-chord cadence establishes a new key.
 */
public enum Confidence {
    /** ii–V: the previous chord sits exactly on the supertonic of the new key. */
    STRONG,
    /** IV–V, or a ii found only through another mode's scale. */
    MODERATE
}
