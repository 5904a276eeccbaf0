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
 * Groups of four context pads, ordered from lowest to highest harmonic energy.
 * {@link #FILL} only appears when generation falls short of sixteen chords.
 */
public enum Quadrant {
    RESOLVE,
    COLOR,
    TENSION,
    PORTAL,
    FILL
}
