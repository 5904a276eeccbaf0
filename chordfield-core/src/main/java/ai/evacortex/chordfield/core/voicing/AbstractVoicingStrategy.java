/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.voicing;

import ai.evacortex.chordfield.core.config.EngineConfig;
import ai.evacortex.chordfield.core.leading.BassLeader;
import ai.evacortex.chordfield.core.leading.VoiceLeader;
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.PitchClass;

import java.util.Arrays;
import java.util.Objects;

/**
 * Shared plumbing for strategies that split the chord into an independently led bass and an
 * upper structure led by the {@link VoiceLeader}.
 */
abstract class AbstractVoicingStrategy implements VoicingStrategy {

    protected final EngineConfig config;
    protected final VoiceLeader leader;
    protected final BassLeader bassLeader;

    protected AbstractVoicingStrategy(EngineConfig config, VoiceLeader leader, BassLeader bassLeader) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.leader = Objects.requireNonNull(leader, "leader must not be null");
        this.bassLeader = Objects.requireNonNull(bassLeader, "bassLeader must not be null");
    }

    protected int leadBass(int root, int[] previous) {
        return bassLeader.lead(root, previous.length > 0 ? previous[0] : 0);
    }

    /**
     * Pitch classes of chord tones {@code 1 .. min(size, maxNotes) - 1}, i.e. everything above
     * the root.
     */
    protected static int[] upperPitchClasses(int root, ChordQuality quality, int maxNotes) {
        int count = Math.min(quality.size(), maxNotes) - 1;
        int[] pcs = new int[Math.max(count, 0)];
        for (int i = 0; i < pcs.length; i++) {
            pcs[i] = PitchClass.of(root + quality.interval(i + 1));
        }
        return pcs;
    }

    /**
     * Stacks each pitch class at its next occurrence above the previous note.
     */
    protected static int[] stackAbove(int start, int[] pitchClasses) {
        int[] notes = new int[pitchClasses.length + 1];
        notes[0] = start;
        for (int i = 0; i < pitchClasses.length; i++) {
            notes[i + 1] = PitchClass.findNextAbove(pitchClasses[i], notes[i]);
        }
        return notes;
    }

    /**
     * Leads the upper voices against the previous voicing minus its bass.
     *
     * <p>If the previous bass note is a common tone of the new upper structure and no previous
     * upper voice holds that pitch class, the old bass note takes the place of the lowest upper
     * voice that is not a common tone, so the held note keeps its exact MIDI value.</p>
     *
     * @param previous previous voicing, ascending, at least two notes
     */
    protected int[] leadUpper(int[] upperPcs, int[] previous, int previousRoot) {
        int previousBass = previous[0];
        int[] prevUpper = Arrays.copyOfRange(previous, 1, previous.length);
        int bassPc = PitchClass.of(previousBass);
        if (containsPc(upperPcs, bassPc) && !holdsPc(prevUpper, bassPc)) {
            for (int i = 0; i < prevUpper.length; i++) {
                if (!containsPc(upperPcs, PitchClass.of(prevUpper[i]))) {
                    prevUpper[i] = previousBass;
                    Arrays.sort(prevUpper);
                    break;
                }
            }
        }
        return leader.lead(upperPcs, prevUpper, previousRoot);
    }

    /**
     * Bass plus led upper voices, or a fresh stack above the bass when the previous voicing has
     * no upper voices to lead from.
     */
    protected int[] bassAndUpper(int bass, int[] upperPcs, int[] previous, int previousRoot) {
        if (previous.length > 1) {
            return withBass(bass, leadUpper(upperPcs, previous, previousRoot));
        }
        return stackAbove(bass, upperPcs);
    }

    protected static int[] withBass(int bass, int[] upper) {
        int[] notes = new int[upper.length + 1];
        notes[0] = bass;
        System.arraycopy(upper, 0, notes, 1, upper.length);
        Arrays.sort(notes);
        return notes;
    }

    protected static int[] pitchClassesOf(int[] notes) {
        int[] pcs = new int[notes.length];
        for (int i = 0; i < notes.length; i++) pcs[i] = PitchClass.of(notes[i]);
        return pcs;
    }

    protected static boolean containsPc(int[] pitchClasses, int pc) {
        for (int p : pitchClasses) {
            if (PitchClass.of(p) == pc) return true;
        }
        return false;
    }

    private static boolean holdsPc(int[] notes, int pc) {
        for (int n : notes) {
            if (PitchClass.of(n) == pc) return true;
        }
        return false;
    }
}
