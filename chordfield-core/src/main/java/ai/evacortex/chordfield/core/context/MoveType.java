/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.context;

/**
 * Harmonic function of a generated chord.
 */
public enum MoveType {
    RESOLUTION,
    SECONDARY_DOMINANT,
    TRITONE_SUBSTITUTION,
    MODAL_INTERCHANGE,
    CHROMATIC_MEDIANT,
    NEO_RIEMANNIAN,
    DISTANT
}
