/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.theory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Closed catalogue of chord qualities with their interval templates.
 *
 * <p>Each template is an ordered list of semitone offsets from the root. Extensions above the
 * octave (9ths, 11ths, 13ths) keep their compound value; pitch-class arithmetic reduces them.
 * The order matters: voicing algorithms address chord tones by index (third = 1, fifth = 2,
 * seventh = 3, ninth = 4).</p>
 *
 * <p>Eleventh chords on a dominant omit the third; thirteenths skip the eleventh.</p>
 */
public enum ChordQuality {

    // triads
    MAJ("maj", "", QualityFamily.MAJOR, 0, 4, 7),
    MIN("min", "m", QualityFamily.MINOR, 0, 3, 7),
    DIM("dim", "°", QualityFamily.DIMINISHED, 0, 3, 6),
    AUG("aug", "+", QualityFamily.AUGMENTED, 0, 4, 8),
    SUS2("sus2", "sus2", QualityFamily.SUS, 0, 2, 7),
    SUS4("sus4", "sus4", QualityFamily.SUS, 0, 5, 7),

    // sevenths
    MAJ7("maj7", "maj7", QualityFamily.MAJOR, 0, 4, 7, 11),
    MIN7("min7", "m7", QualityFamily.MINOR, 0, 3, 7, 10),
    DOM7("dom7", "7", QualityFamily.DOMINANT, 0, 4, 7, 10),
    HALFDIM7("halfdim7", "ø7", QualityFamily.DIMINISHED, 0, 3, 6, 10),
    DIM7("dim7", "°7", QualityFamily.DIMINISHED, 0, 3, 6, 9),
    MINMAJ7("minmaj7", "mΔ7", QualityFamily.MINOR, 0, 3, 7, 11),
    AUGMAJ7("augmaj7", "+Δ7", QualityFamily.MAJOR, 0, 4, 8, 11),

    // ninths
    MAJ9("maj9", "maj9", QualityFamily.MAJOR, 0, 4, 7, 11, 14),
    MIN9("min9", "m9", QualityFamily.MINOR, 0, 3, 7, 10, 14),
    DOM9("dom9", "9", QualityFamily.DOMINANT, 0, 4, 7, 10, 14),
    MIN9B5("min9b5", "ø9", QualityFamily.MINOR, 0, 3, 6, 10, 14),

    // elevenths
    MAJ11("maj11", "maj11", QualityFamily.MAJOR, 0, 4, 7, 11, 14, 17),
    MIN11("min11", "m11", QualityFamily.MINOR, 0, 3, 7, 10, 14, 17),
    DOM11("dom11", "11", QualityFamily.DOMINANT, 0, 7, 10, 14, 17),

    // thirteenths
    MAJ13("maj13", "maj13", QualityFamily.MAJOR, 0, 4, 7, 11, 14, 21),
    MIN13("min13", "m13", QualityFamily.MINOR, 0, 3, 7, 10, 14, 21),
    DOM13("dom13", "13", QualityFamily.DOMINANT, 0, 4, 7, 10, 14, 21),

    // altered dominants
    DOM7ALT("dom7alt", "7alt", QualityFamily.DOMINANT, 0, 4, 6, 10, 13, 15),
    DOM7B9("dom7b9", "7♭9", QualityFamily.DOMINANT, 0, 4, 7, 10, 13),
    DOM7SHARP9("dom7sharp9", "7♯9", QualityFamily.DOMINANT, 0, 4, 7, 10, 15),
    DOM7B5("dom7b5", "7♭5", QualityFamily.DOMINANT, 0, 4, 6, 10),
    DOM7SHARP5("dom7sharp5", "7♯5", QualityFamily.DOMINANT, 0, 4, 8, 10),
    DOM7SHARP11("dom7sharp11", "7♯11", QualityFamily.DOMINANT, 0, 4, 7, 10, 14, 18);

    private static final Map<String, ChordQuality> BY_KEY = new HashMap<>();

    static {
        for (ChordQuality q : values()) {
            BY_KEY.put(q.key, q);
        }
    }

    private final String key;
    private final String suffix;
    private final QualityFamily family;
    private final int[] intervals;

    ChordQuality(String key, String suffix, QualityFamily family, int... intervals) {
        this.key = key;
        this.suffix = suffix;
        this.family = family;
        this.intervals = intervals;
    }

    /**
     * Looks up a quality by its table key ({@code "maj7"}, {@code "dom7alt"}, …).
     */
    public static Optional<ChordQuality> fromKey(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(BY_KEY.get(key));
    }

    public String key() {
        return key;
    }

    /** Display suffix appended to the root name, e.g. {@code "m7"}. */
    public String suffix() {
        return suffix;
    }

    public QualityFamily family() {
        return family;
    }

    public int size() {
        return intervals.length;
    }

    public int interval(int index) {
        return intervals[index];
    }

    public int[] intervals() {
        return intervals.clone();
    }

    /**
     * Pitch classes of this quality built on {@code root}, in template order.
     */
    public int[] pitchClasses(int root) {
        int[] pcs = new int[intervals.length];
        for (int i = 0; i < intervals.length; i++) {
            pcs[i] = PitchClass.of(root + intervals[i]);
        }
        return pcs;
    }

    public boolean isDominant() {
        return family == QualityFamily.DOMINANT;
    }

    public boolean isMinorFamily() {
        return family == QualityFamily.MINOR;
    }

    /**
     * Polarity used by the Neo-Riemannian transforms: major-family chords, plain dominants
     * (7, 9, 13) and sus4 read as major; everything else reads as minor.
     */
    public boolean hasMajorPolarity() {
        return family == QualityFamily.MAJOR
                || this == DOM7 || this == DOM9 || this == DOM13
                || this == SUS4;
    }

    /**
     * The three-note triad this quality reduces to.
     */
    public ChordQuality baseTriad() {
        return switch (this) {
            case MAJ, MAJ7, MAJ9, MAJ11, MAJ13,
                 DOM7, DOM9, DOM11, DOM13, DOM7ALT, DOM7B9, DOM7SHARP9, DOM7B5, DOM7SHARP11 -> MAJ;
            case MIN, MIN7, MINMAJ7, MIN9, MIN11, MIN13 -> MIN;
            case DIM, DIM7, HALFDIM7, MIN9B5 -> DIM;
            case AUG, AUGMAJ7, DOM7SHARP5 -> AUG;
            case SUS2 -> SUS2;
            case SUS4 -> SUS4;
        };
    }

    @Override
    public String toString() {
        return key + Arrays.toString(intervals);
    }
}
