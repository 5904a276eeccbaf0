/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.leading;

/**
 * Chord tones with an idiomatic resolution direction, keyed by their interval above the
 * chord root they were heard against.
 */
public enum TendencyTone {
    FLAT_NINTH(1, -1),
    TRITONE(6, -1),
    SHARP_FIFTH(8, +1),
    MINOR_SEVENTH(10, -1),
    MAJOR_SEVENTH(11, -1);

    private static final TendencyTone[] BY_INTERVAL = new TendencyTone[12];

    static {
        for (TendencyTone t : values()) {
            BY_INTERVAL[t.interval] = t;
        }
    }

    private final int interval;
    private final int resolution;

    TendencyTone(int interval, int resolution) {
        this.interval = interval;
        this.resolution = resolution;
    }

    /**
     * @param interval semitones above the previous root, 0–11
     * @return the tendency for that interval, or {@code null} if it has none
     */
    public static TendencyTone forInterval(int interval) {
        return BY_INTERVAL[Math.floorMod(interval, 12)];
    }

    public int interval() {
        return interval;
    }

    /** Signed semitone step the voice takes when it resolves. */
    public int resolution() {
        return resolution;
    }
}
