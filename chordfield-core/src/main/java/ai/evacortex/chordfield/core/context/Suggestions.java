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
 * The three next-chord suggestions: functional, colouristic and surprising.
 */
public record Suggestions(HarmonicMove safe, HarmonicMove color, HarmonicMove surprise) {
}
