/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.theory;

import java.util.Locale;
import java.util.Optional;

import static ai.evacortex.chordfield.core.theory.ChordQuality.*;

/**
 * The seven diatonic modes ordered brightest → darkest. Each adjacent pair differs by exactly
 * one scale tone, so stepping through {@link #cycle(int)} darkens or brightens a single note.
 *
 * <p>Every mode carries its scale (semitones from the tonic) together with the natural triad
 * and seventh-chord quality found on each of its seven degrees.</p>
 */
public enum Mode {

    LYDIAN("Lydian",
            new int[]{0, 2, 4, 6, 7, 9, 11},
            new ChordQuality[]{MAJ, MAJ, MIN, DIM, MAJ, MIN, MIN},
            new ChordQuality[]{MAJ7, DOM7, MIN7, HALFDIM7, MAJ7, MIN7, MIN7}),
    IONIAN("Major (Ionian)",
            new int[]{0, 2, 4, 5, 7, 9, 11},
            new ChordQuality[]{MAJ, MIN, MIN, MAJ, MAJ, MIN, DIM},
            new ChordQuality[]{MAJ7, MIN7, MIN7, MAJ7, DOM7, MIN7, HALFDIM7}),
    MIXOLYDIAN("Mixolydian",
            new int[]{0, 2, 4, 5, 7, 9, 10},
            new ChordQuality[]{MAJ, MIN, DIM, MAJ, MIN, MIN, MAJ},
            new ChordQuality[]{DOM7, MIN7, HALFDIM7, MAJ7, MIN7, MIN7, MAJ7}),
    DORIAN("Dorian",
            new int[]{0, 2, 3, 5, 7, 9, 10},
            new ChordQuality[]{MIN, MIN, MAJ, MAJ, MIN, DIM, MAJ},
            new ChordQuality[]{MIN7, MIN7, MAJ7, DOM7, MIN7, HALFDIM7, MAJ7}),
    AEOLIAN("Minor (Aeolian)",
            new int[]{0, 2, 3, 5, 7, 8, 10},
            new ChordQuality[]{MIN, DIM, MAJ, MIN, MIN, MAJ, MAJ},
            new ChordQuality[]{MIN7, HALFDIM7, MAJ7, MIN7, MIN7, MAJ7, DOM7}),
    PHRYGIAN("Phrygian",
            new int[]{0, 1, 3, 5, 7, 8, 10},
            new ChordQuality[]{MIN, MAJ, MAJ, MIN, DIM, MAJ, MIN},
            new ChordQuality[]{MIN7, MAJ7, DOM7, MIN7, HALFDIM7, MAJ7, MIN7}),
    LOCRIAN("Locrian",
            new int[]{0, 1, 3, 5, 6, 8, 10},
            new ChordQuality[]{DIM, MAJ, MIN, MIN, MAJ, MAJ, MIN},
            new ChordQuality[]{HALFDIM7, MAJ7, MIN7, MIN7, MAJ7, DOM7, MIN7});

    public static final int DEGREES = 7;

    private final String label;
    private final int[] scale;
    private final ChordQuality[] triads;
    private final ChordQuality[] sevenths;

    Mode(String label, int[] scale, ChordQuality[] triads, ChordQuality[] sevenths) {
        this.label = label;
        this.scale = scale;
        this.triads = triads;
        this.sevenths = sevenths;
    }

    /**
     * Case-insensitive lookup by name ({@code "ionian"}, {@code "Dorian"}, …).
     */
    public static Optional<Mode> fromName(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String label() {
        return label;
    }

    /** Semitone offset of {@code degree} (0–6) from the tonic. */
    public int interval(int degree) {
        return scale[degree];
    }

    public int[] scale() {
        return scale.clone();
    }

    /** Root pitch class of {@code degree} in {@code key}. */
    public int degreeRoot(int key, int degree) {
        return PitchClass.of(key + scale[degree]);
    }

    public ChordQuality triad(int degree) {
        return triads[degree];
    }

    public ChordQuality seventh(int degree) {
        return sevenths[degree];
    }

    /**
     * Degree (0–6) of {@code pitchClass} in {@code key}, or {@code -1} when it is not diatonic.
     */
    public int degreeOf(int pitchClass, int key) {
        int pc = PitchClass.of(pitchClass);
        for (int deg = 0; deg < DEGREES; deg++) {
            if (degreeRoot(key, deg) == pc) return deg;
        }
        return -1;
    }

    public boolean isDiatonic(int pitchClass, int key) {
        return degreeOf(pitchClass, key) >= 0;
    }

    /**
     * Natural seventh-chord quality of {@code root} in {@code key}; non-diatonic roots get a
     * dominant seventh, which covers secondary dominants and tritone substitutes.
     */
    public ChordQuality defaultQuality(int root, int key) {
        int deg = degreeOf(root, key);
        return deg >= 0 ? sevenths[deg] : ChordQuality.DOM7;
    }

    /**
     * Lydian, Ionian and Mixolydian have a major third over the tonic.
     */
    public boolean isMajorFamily() {
        return this == LYDIAN || this == IONIAN || this == MIXOLYDIAN;
    }

    /**
     * Parallel mode chords are borrowed from: Aeolian for the major family, Ionian otherwise.
     */
    public Mode interchangeSource() {
        return isMajorFamily() ? AEOLIAN : IONIAN;
    }

    /**
     * Steps through the brightness order; {@code +1} is darker, {@code -1} brighter.
     * Wraps at both ends.
     */
    public Mode cycle(int direction) {
        Mode[] all = values();
        return all[Math.floorMod(ordinal() + direction, all.length)];
    }
}
