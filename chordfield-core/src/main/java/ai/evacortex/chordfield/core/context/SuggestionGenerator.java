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
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.Mode;
import ai.evacortex.chordfield.core.theory.PitchClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces the three "what next" suggestions for the current chord.
 *
 * <ul>
 *     <li><b>safe</b>: functional motion. V goes to I, ii to V, I to IV and any other
 *         diatonic degree down a fifth; a chromatic chord slides down to the nearest diatonic
 *         root.</li>
 *     <li><b>color</b>: a borrowed chord or chromatic mediant whose root was not played
 *         recently, picked by {@code currentRoot mod candidates}.</li>
 *     <li><b>surprise</b>: the tritone substitute of V/current, else V/current, else a
 *         dominant a whole step up.</li>
 * </ul>
 */
public final class SuggestionGenerator {

    private static final Logger LOG = Logger.getLogger(SuggestionGenerator.class.getName());

    static final int TONIC = 0;
    static final int SUPERTONIC = 1;
    static final int SUBDOMINANT = 3;
    static final int DOMINANT = 4;

    public Suggestions compute(int currentRoot, ChordQuality currentQuality, int key, Mode mode,
                               Collection<Integer> recentRoots) {
        Objects.requireNonNull(currentQuality, "currentQuality must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        int root = PitchClass.of(currentRoot);
        Set<Integer> recent = RecentRoots.normalize(recentRoots);

        HarmonicMove safe = new HarmonicMove(resolution(root, key, mode, SUBDOMINANT), MoveType.RESOLUTION);
        HarmonicMove color = color(root, key, mode, recent, safe.root());
        HarmonicMove surprise = surprise(root, recent);

        Suggestions suggestions = new Suggestions(safe, color, surprise);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Suggestions for " + new ChordDescriptor(root, currentQuality) + ": " + suggestions);
        }
        return suggestions;
    }

    /**
     * Strongest functional resolution of {@code root}.
     *
     * @param fromTonicDegree degree the tonic chord moves to
     */
    static ChordDescriptor resolution(int root, int key, Mode mode, int fromTonicDegree) {
        int degree = mode.degreeOf(root, key);
        if (degree < 0) {
            for (int offset = 1; offset <= 6; offset++) {
                int candidate = PitchClass.of(root - offset);
                int candidateDegree = mode.degreeOf(candidate, key);
                if (candidateDegree >= 0) {
                    return diatonic(key, mode, candidateDegree);
                }
            }
            return diatonic(key, mode, TONIC);
        }
        return switch (degree) {
            case DOMINANT -> diatonic(key, mode, TONIC);
            case SUPERTONIC -> diatonic(key, mode, DOMINANT);
            case TONIC -> diatonic(key, mode, fromTonicDegree);
            default -> diatonic(key, mode, (degree + 3) % Mode.DEGREES);
        };
    }

    static ChordDescriptor diatonic(int key, Mode mode, int degree) {
        return new ChordDescriptor(mode.degreeRoot(key, degree), mode.seventh(degree));
    }

    private static HarmonicMove color(int root, int key, Mode mode, Set<Integer> recent, int safeRoot) {
        List<BorrowedChord> borrowed = HarmonicContextAnalyzer.modalInterchange(key, mode);
        List<HarmonicMove> candidates = new ArrayList<>();
        for (BorrowedChord b : borrowed) candidates.add(b.toMove());
        candidates.addAll(HarmonicContextAnalyzer.chromaticMediants(root));
        candidates.removeIf(m -> recent.contains(m.root()) || m.root() == root || m.root() == safeRoot);

        if (!candidates.isEmpty()) {
            return candidates.get(root % candidates.size());
        }
        if (!borrowed.isEmpty()) {
            return borrowed.get(0).toMove();
        }
        return HarmonicMove.of(root + 3, ChordQuality.MAJ7, MoveType.CHROMATIC_MEDIANT);
    }

    private static HarmonicMove surprise(int root, Set<Integer> recent) {
        HarmonicMove tritoneSub = HarmonicContextAnalyzer.tritoneSubstitution(root + 7);
        if (!recent.contains(tritoneSub.root()) && tritoneSub.root() != root) {
            return tritoneSub;
        }
        HarmonicMove secondary = HarmonicContextAnalyzer.secondaryDominant(root);
        if (!recent.contains(secondary.root()) && secondary.root() != root) {
            return secondary;
        }
        return HarmonicMove.of(root + 2, ChordQuality.DOM7, MoveType.DISTANT);
    }
}
