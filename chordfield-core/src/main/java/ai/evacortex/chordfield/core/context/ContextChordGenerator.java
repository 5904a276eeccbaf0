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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds the sixteen context pads around the current chord, four per {@link Quadrant}:
 * <pre>
 *   RESOLVE  0–3    resolution, IV (or V), vi (or iii), I (or ii, or V)
 *   COLOR    4–7    P, R, L and the strongest modal borrow
 *   TENSION  8–11   V/current, subV, V/ii (or V/vi), next dominant of the chain
 *   PORTAL  12–15   major third up and down, semitone slide, diminished bridge
 * </pre>
 * Collisions with the current root or with earlier pads of the same quadrant are replaced by
 * the listed fallbacks.
 */
public final class ContextChordGenerator {

    public static final int SIZE = 16;
    public static final int QUADRANT_SIZE = 4;

    private static final int MEDIANT = 2;
    private static final int SUBMEDIANT = 5;
    private static final int BORROWED_SUBDOMINANT = 3;

    public List<ContextChord> compute(int currentRoot, ChordQuality currentQuality, int key, Mode mode) {
        Objects.requireNonNull(currentQuality, "currentQuality must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        int root = PitchClass.of(currentRoot);
        int tonic = PitchClass.of(key);

        List<ContextChord> pads = new ArrayList<>(SIZE);
        pads.addAll(resolve(root, tonic, mode));
        pads.addAll(color(root, currentQuality, tonic, mode));
        pads.addAll(tension(root, tonic, mode));
        pads.addAll(portal(root, currentQuality, tonic, mode));

        while (pads.size() < SIZE) {
            pads.add(ContextChord.of(root + pads.size(), ChordQuality.DOM7, Quadrant.FILL, ContextRole.FILL));
        }
        return Collections.unmodifiableList(pads.subList(0, SIZE));
    }

    private static List<ContextChord> resolve(int root, int key, Mode mode) {
        List<ContextChord> pads = new ArrayList<>(QUADRANT_SIZE);
        ChordDescriptor resolution = SuggestionGenerator.resolution(root, key, mode, SuggestionGenerator.SUPERTONIC);
        pads.add(new ContextChord(resolution, Quadrant.RESOLVE, ContextRole.RESOLUTION));

        int ivRoot = mode.degreeRoot(key, SuggestionGenerator.SUBDOMINANT);
        if (ivRoot != root && ivRoot != resolution.root()) {
            pads.add(diatonic(key, mode, SuggestionGenerator.SUBDOMINANT, ContextRole.PLAGAL));
        } else {
            pads.add(diatonic(key, mode, SuggestionGenerator.DOMINANT, ContextRole.DOMINANT));
        }

        int viRoot = mode.degreeRoot(key, SUBMEDIANT);
        if (viRoot != root && !usesRoot(pads, viRoot)) {
            pads.add(diatonic(key, mode, SUBMEDIANT, ContextRole.DECEPTIVE));
        } else {
            pads.add(diatonic(key, mode, MEDIANT, ContextRole.MEDIANT));
        }

        int iiRoot = mode.degreeRoot(key, SuggestionGenerator.SUPERTONIC);
        if (key != root && !usesRoot(pads, key)) {
            pads.add(diatonic(key, mode, SuggestionGenerator.TONIC, ContextRole.TONIC));
        } else if (iiRoot != root && !usesRoot(pads, iiRoot)) {
            pads.add(diatonic(key, mode, SuggestionGenerator.SUPERTONIC, ContextRole.SUPERTONIC));
        } else {
            pads.add(diatonic(key, mode, SuggestionGenerator.DOMINANT, ContextRole.DOMINANT));
        }
        return pads;
    }

    private static List<ContextChord> color(int root, ChordQuality quality, int key, Mode mode) {
        List<ContextChord> pads = new ArrayList<>(QUADRANT_SIZE);
        NeoRiemannianSet plr = HarmonicContextAnalyzer.neoRiemannian(root, quality);
        pads.add(new ContextChord(plr.parallel(), Quadrant.COLOR, ContextRole.PARALLEL));

        if (plr.relative().root() != plr.parallel().root()) {
            pads.add(new ContextChord(plr.relative(), Quadrant.COLOR, ContextRole.RELATIVE));
        } else {
            pads.add(ContextChord.of(root + 4, quality, Quadrant.COLOR, ContextRole.MEDIANT_UP));
        }

        int lRoot = plr.leadingTone().root();
        if (lRoot != plr.parallel().root() && lRoot != plr.relative().root()) {
            pads.add(new ContextChord(plr.leadingTone(), Quadrant.COLOR, ContextRole.LEADING_TONE));
        } else {
            pads.add(ContextChord.of(root + 3, ChordQuality.MIN7, Quadrant.COLOR, ContextRole.MEDIANT_M3));
        }

        BorrowedChord borrow = null;
        for (BorrowedChord b : HarmonicContextAnalyzer.modalInterchange(key, mode)) {
            if (b.root() == root || usesRoot(pads, b.root())) continue;
            if (borrow == null || b.degree() == BORROWED_SUBDOMINANT) {
                borrow = b;
                if (b.degree() == BORROWED_SUBDOMINANT) break;
            }
        }
        if (borrow != null) {
            pads.add(new ContextChord(borrow.chord(), Quadrant.COLOR, ContextRole.MODAL_BORROW));
        } else {
            pads.add(ContextChord.of(root + 8, ChordQuality.MAJ7, Quadrant.COLOR, ContextRole.MEDIANT_DOWN));
        }
        return pads;
    }

    private static List<ContextChord> tension(int root, int key, Mode mode) {
        List<ContextChord> pads = new ArrayList<>(QUADRANT_SIZE);
        HarmonicMove secondary = HarmonicContextAnalyzer.secondaryDominant(root);
        pads.add(new ContextChord(secondary.chord(), Quadrant.TENSION, ContextRole.SECONDARY_DOMINANT));

        int primaryDominant = mode.degreeRoot(key, SuggestionGenerator.DOMINANT);
        HarmonicMove subV = HarmonicContextAnalyzer.tritoneSubstitution(primaryDominant);
        if (subV.root() == secondary.root() || subV.root() == root) {
            subV = HarmonicContextAnalyzer.tritoneSubstitution(secondary.root());
        }
        pads.add(new ContextChord(subV.chord(), Quadrant.TENSION, ContextRole.TRITONE_SUB));

        HarmonicMove ofII = HarmonicContextAnalyzer.secondaryDominant(mode.degreeRoot(key, SuggestionGenerator.SUPERTONIC));
        if (ofII.root() != root && !usesRoot(pads, ofII.root())) {
            pads.add(new ContextChord(ofII.chord(), Quadrant.TENSION, ContextRole.SECONDARY_DOM_II));
        } else {
            HarmonicMove ofVI = HarmonicContextAnalyzer.secondaryDominant(mode.degreeRoot(key, SUBMEDIANT));
            pads.add(new ContextChord(ofVI.chord(), Quadrant.TENSION, ContextRole.SECONDARY_DOM_VI));
        }

        int chainRoot = PitchClass.of(root + 5);
        if (usesRoot(pads, chainRoot)) {
            chainRoot = PitchClass.of(root + 7);
        }
        pads.add(ContextChord.of(chainRoot, ChordQuality.DOM7, Quadrant.TENSION, ContextRole.DOMINANT_CHAIN));
        return pads;
    }

    private static List<ContextChord> portal(int root, ChordQuality quality, int key, Mode mode) {
        List<ContextChord> pads = new ArrayList<>(QUADRANT_SIZE);
        int up = PitchClass.of(root + 4);
        pads.add(ContextChord.of(up, diatonicOr(up, key, mode, ChordQuality.MAJ7), Quadrant.PORTAL, ContextRole.COLTRANE_UP));
        int down = PitchClass.of(root + 8);
        pads.add(ContextChord.of(down, diatonicOr(down, key, mode, ChordQuality.MAJ7), Quadrant.PORTAL, ContextRole.COLTRANE_DOWN));
        int slide = PitchClass.of(root + 1);
        pads.add(ContextChord.of(slide, diatonicOr(slide, key, mode, quality), Quadrant.PORTAL, ContextRole.CHROMATIC_SLIDE));
        pads.add(ContextChord.of(root + 11, ChordQuality.DIM7, Quadrant.PORTAL, ContextRole.DIMINISHED_BRIDGE));
        return pads;
    }

    private static ChordQuality diatonicOr(int root, int key, Mode mode, ChordQuality chromatic) {
        return mode.isDiatonic(root, key) ? mode.defaultQuality(root, key) : chromatic;
    }

    private static ContextChord diatonic(int key, Mode mode, int degree, ContextRole role) {
        return new ContextChord(SuggestionGenerator.diatonic(key, mode, degree), Quadrant.RESOLVE, role);
    }

    private static boolean usesRoot(List<ContextChord> pads, int root) {
        for (ContextChord c : pads) {
            if (c.root() == root) return true;
        }
        return false;
    }
}
