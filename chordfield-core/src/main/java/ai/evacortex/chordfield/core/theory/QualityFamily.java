/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.theory;

/**
 * Coarse harmonic family of a chord quality.
 * - MAJOR / MINOR: stable tonic-type colours.
 * - DOMINANT: contains the major third + minor seventh tritone.
 * - DIMINISHED / AUGMENTED: symmetric or altered-fifth chords.
 * - SUS: third replaced by a second or fourth.
 */
public enum QualityFamily {
    MAJOR,
    MINOR,
    DOMINANT,
    DIMINISHED,
    AUGMENTED,
    SUS
}
