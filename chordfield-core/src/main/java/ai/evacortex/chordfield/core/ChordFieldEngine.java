/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core;

import ai.evacortex.chordfield.core.chord.ChordDescriptor;
import ai.evacortex.chordfield.core.context.BorrowedChord;
import ai.evacortex.chordfield.core.context.ContextChord;
import ai.evacortex.chordfield.core.context.GlowGrid;
import ai.evacortex.chordfield.core.context.HarmonicMove;
import ai.evacortex.chordfield.core.context.NeoRiemannianSet;
import ai.evacortex.chordfield.core.context.RingChord;
import ai.evacortex.chordfield.core.context.Suggestions;
import ai.evacortex.chordfield.core.exceptions.InvalidGridPositionException;
import ai.evacortex.chordfield.core.modulation.ModulationResult;
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.Mode;
import ai.evacortex.chordfield.core.theory.VoicingType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@code ChordFieldEngine} defines the contract of the harmonic engine behind a chord-field
 * performance surface: an 8×8 grid of chords derived from a key and mode, turned into concrete
 * MIDI voicings that move smoothly from one chord to the next.
 *
 * <p>The engine owns no performance state. The previous voicing and previous root that drive
 * voice leading are held by the caller (see {@link VoiceLeadingContext}) and passed in on every
 * call; the caller updates them only after it accepts a returned voicing.</p>
 *
 * <p>Every operation is a deterministic function of its arguments, runs in bounded time over
 * fixed-size tables and never fails on musical input: unknown quality keys, empty previous
 * voicings and out-of-range notes are handled by fallbacks. Implementations must be
 * thread-safe so one engine can serve several surfaces.</p>
 *
 * <p>Pitch-class arguments ({@code root}, {@code key}) accept any integer and are reduced
 * modulo 12.</p>
 *
 * @see Voicing
 * @see ChordDescriptor
 * @see VoiceLeadingContext
 */
public interface ChordFieldEngine {

    /**
     * Voices a chord, leading from {@code previous} when it is non-empty.
     *
     * @param root         root pitch class
     * @param quality      chord quality
     * @param type         voicing algorithm
     * @param previous     previous voicing, {@link Voicing#EMPTY} to build from scratch
     * @param octaveOffset whole octaves added after register correction
     * @param previousRoot root of the previous chord; {@code null} is treated as C (0)
     * @return notes strictly ascending within the playable range
     */
    Voicing voiceChord(int root, ChordQuality quality, VoicingType type, Voicing previous,
                       int octaveOffset, Integer previousRoot);

    /**
     * String-keyed variant of {@link #voiceChord(int, ChordQuality, VoicingType, Voicing, int, Integer)}.
     *
     * @return {@link Voicing#EMPTY} when {@code qualityKey} names no known quality; an unknown
     *         voicing type falls back to close position
     */
    Voicing voiceChord(int root, String qualityKey, String voicingTypeKey, Voicing previous,
                       int octaveOffset, Integer previousRoot);

    /**
     * Chord shown at a grid cell.
     *
     * @param chromaticOverride root of the chromatic column 7, {@code null} for the default ♭II
     * @throws InvalidGridPositionException if {@code row} or {@code column} is outside 0–7
     */
    ChordDescriptor getGridChord(int row, int column, int key, Mode mode, Integer chromaticOverride);

    /**
     * Roots of the eight grid columns: seven diatonic degrees and the chromatic column.
     */
    int[] columnRoots(int key, Mode mode, Integer chromaticOverride);

    /**
     * Pitch classes of a chord in interval-template order. An unknown quality key falls back
     * to the major triad.
     */
    int[] pitchClassesOf(int root, String qualityKey);

    /**
     * Number of distinct pitch classes common to both inputs. Symmetric.
     */
    int computeSharedNotes(int[] pitchClassesA, int[] pitchClassesB);

    /**
     * Shared-note count, capped at 3, between {@code reference} and each of the 64 grid chords.
     */
    GlowGrid computeGlowGrid(int[] reference, int key, Mode mode, Integer chromaticOverride);

    /**
     * Safe, color and surprise next-chord candidates.
     *
     * @param recentRoots roots played recently; excluded from the color and surprise picks.
     *                    May be {@code null} or empty.
     */
    Suggestions computeSuggestions(int currentRoot, ChordQuality currentQuality, int key, Mode mode,
                                   Collection<Integer> recentRoots);

    /**
     * The sixteen context pads, four per quadrant in the order resolve, color, tension, portal.
     */
    List<ContextChord> computeContextChords(int currentRoot, ChordQuality currentQuality, int key, Mode mode);

    /**
     * Checks whether {@code previous → current} is a ii–V or IV–V into a key other than
     * {@code currentKey}.
     *
     * @return the new key, or empty when the current chord is not a dominant, resolves into the
     *         current key, or the previous chord is not a predominant of the target key
     */
    Optional<ModulationResult> detectModulation(int previousRoot, ChordQuality previousQuality,
                                                int currentRoot, ChordQuality currentQuality,
                                                int currentKey, Mode mode);

    HarmonicMove secondaryDominant(int targetRoot);

    HarmonicMove tritoneSubstitution(int dominantRoot);

    List<BorrowedChord> modalInterchange(int key, Mode mode);

    List<HarmonicMove> chromaticMediants(int root);

    NeoRiemannianSet neoRiemannian(int root, ChordQuality quality);

    /**
     * Degree 0–6 of {@code pitchClass} in the key, or {@code -1} when it is chromatic.
     */
    int diatonicDegree(int pitchClass, int key, Mode mode);

    boolean isRootDiatonic(int root, int key, Mode mode);

    /**
     * Diatonic seventh quality of {@code root}, dominant seventh for chromatic roots.
     */
    ChordQuality defaultQuality(int root, int key, Mode mode);

    /**
     * The inner ring: twelve roots in fifths order with their default qualities.
     */
    List<RingChord> circleOfFifths(int key, Mode mode);
}
