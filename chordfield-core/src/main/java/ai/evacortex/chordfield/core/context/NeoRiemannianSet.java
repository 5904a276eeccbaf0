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
 * Results of the three Neo-Riemannian transforms of one chord.
 *
 * @param parallel    P: same root, flipped quality
 * @param relative    R: root a minor third away
 * @param leadingTone L: root a major third (from major) or minor sixth (from minor) away
 */
public record NeoRiemannianSet(ChordDescriptor parallel, ChordDescriptor relative, ChordDescriptor leadingTone) {
}
