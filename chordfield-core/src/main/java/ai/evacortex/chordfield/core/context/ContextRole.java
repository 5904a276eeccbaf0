/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.context;

import java.util.Locale;

public enum ContextRole {
    RESOLUTION,
    PLAGAL,
    DOMINANT,
    DECEPTIVE,
    MEDIANT,
    TONIC,
    SUPERTONIC,
    PARALLEL,
    RELATIVE,
    MEDIANT_UP,
    LEADING_TONE,
    MEDIANT_M3,
    MODAL_BORROW,
    MEDIANT_DOWN,
    SECONDARY_DOMINANT,
    TRITONE_SUB,
    SECONDARY_DOM_II,
    SECONDARY_DOM_VI,
    DOMINANT_CHAIN,
    COLTRANE_UP,
    COLTRANE_DOWN,
    CHROMATIC_SLIDE,
    DIMINISHED_BRIDGE,
    FILL;

    /** Lower snake-case key, e.g. {@code "coltrane_up"}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
