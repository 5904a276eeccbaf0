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
 * Raw note arithmetic shared by every component of the engine.
 *
 * <p>A pitch class is an integer in {@code [0, 11]} with {@code 0 = C}. MIDI notes are
 * plain integers; octave {@code n} of pitch class {@code pc} is {@code n * 12 + pc}.</p>
 */
public final class PitchClass {

    public static final int OCTAVE = 12;

    private static final String[] SHARP_NAMES = {"C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"};
    private static final String[] FLAT_NAMES = {"C", "Db", "D", "Eb", "E", "F", "Gb", "G", "Ab", "A", "Bb", "B"};

    private PitchClass() {}

    /**
     * Normalizes any integer (negative included) to a pitch class.
     */
    public static int of(int value) {
        return Math.floorMod(value, OCTAVE);
    }

    /**
     * Ascending interval in semitones from {@code from} to {@code to}, in {@code [0, 11]}.
     */
    public static int interval(int from, int to) {
        return Math.floorMod(to - from, OCTAVE);
    }

    /**
     * Shortest circular distance between two pitch classes, in {@code [0, 6]}.
     */
    public static int circularDistance(int a, int b) {
        int d = Math.abs(of(a) - of(b));
        return Math.min(d, OCTAVE - d);
    }

    /**
     * Returns the MIDI note of {@code pitchClass} closest to {@code target}, checking the
     * target's octave and its two neighbours. Ties resolve to the lower note.
     */
    public static int findClosest(int pitchClass, int target) {
        int octave = Math.floorDiv(target, OCTAVE);
        int pc = of(pitchClass);
        int best = (octave - 1) * OCTAVE + pc;
        int bestDist = Math.abs(best - target);
        for (int o = octave; o <= octave + 1; o++) {
            int candidate = o * OCTAVE + pc;
            int dist = Math.abs(candidate - target);
            if (dist < bestDist) {
                best = candidate;
                bestDist = dist;
            }
        }
        return best;
    }

    /**
     * Returns the lowest MIDI note of {@code pitchClass} strictly above {@code current}.
     */
    public static int findNextAbove(int pitchClass, int current) {
        int note = Math.floorDiv(current, OCTAVE) * OCTAVE + of(pitchClass);
        if (note <= current) note += OCTAVE;
        return note;
    }

    /**
     * Wraps a note by whole octaves until it lies in {@code [low, high]}.
     * The range must span at least one octave.
     */
    public static int wrapInto(int note, int low, int high) {
        while (note < low) note += OCTAVE;
        while (note > high) note -= OCTAVE;
        return note;
    }

    /** Arithmetic mean of a non-empty set of MIDI notes. */
    public static double mean(int[] notes) {
        double sum = 0;
        for (int n : notes) sum += n;
        return sum / notes.length;
    }

    public static String sharpName(int pitchClass) {
        return SHARP_NAMES[of(pitchClass)];
    }

    public static String flatName(int pitchClass) {
        return FLAT_NAMES[of(pitchClass)];
    }

    /**
     * Scientific pitch name of a MIDI note, e.g. {@code 60 → "C4"}.
     */
    public static String midiToNoteName(int midiNote) {
        return SHARP_NAMES[of(midiNote)] + (Math.floorDiv(midiNote, OCTAVE) - 1);
    }
}
