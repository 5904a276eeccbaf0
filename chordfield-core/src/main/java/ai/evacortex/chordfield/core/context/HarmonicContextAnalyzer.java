/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.context;

import ai.evacortex.chordfield.core.cache.GridLayoutCache;
import ai.evacortex.chordfield.core.chord.ChordDescriptor;
import ai.evacortex.chordfield.core.chord.GridLayout;
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.Mode;
import ai.evacortex.chordfield.core.theory.PitchClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Harmonic relations between chords: shared notes, the glow heat map and the classic
 * substitution and borrowing rules.
 */
public final class HarmonicContextAnalyzer {

    /** Roots in ascending fifths from C. */
    static final int[] CIRCLE_OF_FIFTHS = {0, 7, 2, 9, 4, 11, 6, 1, 8, 3, 10, 5};

    private final GridLayoutCache grids;

    public HarmonicContextAnalyzer(GridLayoutCache grids) {
        this.grids = Objects.requireNonNull(grids, "grids must not be null");
    }

    /**
     * Number of distinct pitch classes present in both inputs. Duplicates and octave
     * equivalents count once.
     */
    public static int computeSharedNotes(int[] a, int[] b) {
        boolean[] inA = mask(a);
        boolean[] inB = mask(b);
        int shared = 0;
        for (int pc = 0; pc < PitchClass.OCTAVE; pc++) {
            if (inA[pc] && inB[pc]) shared++;
        }
        return shared;
    }

    public GlowGrid computeGlowGrid(int[] reference, int key, Mode mode, Integer chromaticOverride) {
        Objects.requireNonNull(reference, "reference must not be null");
        GridLayout layout = grids.get(key, mode, chromaticOverride);
        int[] levels = new int[GridLayout.CELLS];
        for (int i = 0; i < GridLayout.CELLS; i++) {
            levels[i] = Math.min(computeSharedNotes(reference, layout.cell(i).pitchClasses()), GlowGrid.MAX_LEVEL);
        }
        return new GlowGrid(levels);
    }

    /** Dominant seventh a perfect fifth above {@code targetRoot}. */
    public static HarmonicMove secondaryDominant(int targetRoot) {
        return HarmonicMove.of(targetRoot + 7, ChordQuality.DOM7, MoveType.SECONDARY_DOMINANT);
    }

    /** Dominant seventh a tritone away, sharing the guide tones. */
    public static HarmonicMove tritoneSubstitution(int dominantRoot) {
        return HarmonicMove.of(dominantRoot + 6, ChordQuality.DOM7, MoveType.TRITONE_SUBSTITUTION);
    }

    /**
     * Chords of the parallel mode on every degree whose scale step differs from the current
     * mode, in degree order, with the parallel mode's seventh qualities.
     */
    public static List<BorrowedChord> modalInterchange(int key, Mode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        Mode source = mode.interchangeSource();
        List<BorrowedChord> chords = new ArrayList<>();
        for (int deg = 0; deg < Mode.DEGREES; deg++) {
            if (source.interval(deg) != mode.interval(deg)) {
                chords.add(new BorrowedChord(new ChordDescriptor(source.degreeRoot(key, deg), source.seventh(deg)), deg));
            }
        }
        return Collections.unmodifiableList(chords);
    }

    /** Major third up and down (maj7), minor third up (maj7) and down (min7). */
    public static List<HarmonicMove> chromaticMediants(int root) {
        return List.of(
                HarmonicMove.of(root + 4, ChordQuality.MAJ7, MoveType.CHROMATIC_MEDIANT),
                HarmonicMove.of(root + 8, ChordQuality.MAJ7, MoveType.CHROMATIC_MEDIANT),
                HarmonicMove.of(root + 3, ChordQuality.MAJ7, MoveType.CHROMATIC_MEDIANT),
                HarmonicMove.of(root + 9, ChordQuality.MIN7, MoveType.CHROMATIC_MEDIANT));
    }

    /**
     * P, R and L transforms. Results are seventh chords: a major-polarity source yields min7
     * chords, anything else yields maj7 chords.
     */
    public static NeoRiemannianSet neoRiemannian(int root, ChordQuality quality) {
        Objects.requireNonNull(quality, "quality must not be null");
        boolean major = quality.hasMajorPolarity();
        ChordQuality flipped = major ? ChordQuality.MIN7 : ChordQuality.MAJ7;
        return new NeoRiemannianSet(
                new ChordDescriptor(root, flipped),
                new ChordDescriptor(root + (major ? 9 : 3), flipped),
                new ChordDescriptor(root + (major ? 4 : 8), flipped));
    }

    /**
     * The twelve roots in fifths order with their default quality in {@code key}.
     */
    public static List<RingChord> circleOfFifths(int key, Mode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        List<RingChord> ring = new ArrayList<>(CIRCLE_OF_FIFTHS.length);
        for (int i = 0; i < CIRCLE_OF_FIFTHS.length; i++) {
            int root = CIRCLE_OF_FIFTHS[i];
            ring.add(new RingChord(i, new ChordDescriptor(root, mode.defaultQuality(root, key)), mode.isDiatonic(root, key)));
        }
        return Collections.unmodifiableList(ring);
    }

    private static boolean[] mask(int[] pitchClasses) {
        Objects.requireNonNull(pitchClasses, "pitch classes must not be null");
        boolean[] mask = new boolean[PitchClass.OCTAVE];
        for (int pc : pitchClasses) mask[PitchClass.of(pc)] = true;
        return mask;
    }
}
