/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.leading;

import ai.evacortex.chordfield.core.config.EngineConfig;
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.PitchClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

abstract class VoiceLeaderContractTest {

    protected abstract VoiceLeader leader();

    private static final int[][] PREVIOUS = {
            {48, 52, 55, 59},
            {55, 59, 62, 65},
            {50, 53, 57},
            {43, 52, 58, 62, 65},
            {60},
    };

    protected static Set<Integer> pitchClassSet(int[] notes) {
        Set<Integer> set = new TreeSet<>();
        for (int n : notes) set.add(PitchClass.of(n));
        return set;
    }

    @Test
    void emptyTargets_yieldEmpty() {
        assertEquals(0, leader().lead(new int[0], new int[]{48, 52, 55}, 0).length);
    }

    @Test
    void emptyPrevious_stacksEachPitchClassOnce() {
        int[] notes = leader().lead(new int[]{2, 5, 9, 0}, new int[0], 0);
        assertEquals(4, notes.length);
        for (int i = 1; i < notes.length; i++) {
            assertTrue(notes[i] > notes[i - 1], "stack must ascend: " + Arrays.toString(notes));
        }
        assertEquals(Set.of(0, 2, 5, 9), pitchClassSet(notes));
    }

    @Test
    void commonTones_keepExactNote() {
        int[] notes = leader().lead(new int[]{2, 5, 9, 0}, new int[]{48, 52, 55, 59}, 0);
        assertTrue(Arrays.stream(notes).anyMatch(n -> n == 48), "C3 is common to Cmaj7 and Dm7 and must not move");
    }

    @Test
    void commonTones_keepExactNote_acrossQualities() {
        for (int[] prev : PREVIOUS) {
            for (ChordQuality q : ChordQuality.values()) {
                for (int root = 0; root < 12; root++) {
                    int[] targets = q.pitchClasses(root);
                    int[] notes = leader().lead(targets, prev, 0);
                    Set<Integer> targetSet = pitchClassSet(targets);
                    Set<Integer> seen = new TreeSet<>();
                    for (int p : prev) {
                        int pc = PitchClass.of(p);
                        if (targetSet.contains(pc) && seen.add(pc)) {
                            assertTrue(Arrays.stream(notes).anyMatch(n -> n == p),
                                    "common tone " + p + " lost leading " + Arrays.toString(prev) + " to " + q + "@" + root);
                        }
                    }
                }
            }
        }
    }

    @Test
    void output_coversTargetsAndHoldsTheRest() {
        for (int[] prev : PREVIOUS) {
            for (ChordQuality q : ChordQuality.values()) {
                for (int root = 0; root < 12; root++) {
                    int[] targets = q.pitchClasses(root);
                    int[] notes = leader().lead(targets, prev, 7);
                    String label = "leading " + Arrays.toString(prev) + " to " + q + "@" + root + " gave " + Arrays.toString(notes);
                    Set<Integer> targetSet = pitchClassSet(targets);
                    assertTrue(pitchClassSet(notes).containsAll(targetSet), label);
                    for (int n : notes) {
                        assertTrue(targetSet.contains(PitchClass.of(n)) || Arrays.stream(prev).anyMatch(p -> p == n),
                                n + " is neither a target nor a held note, " + label);
                    }
                }
            }
        }
    }

    @Test
    void dominantSeventh_resolvesDown() {
        // G7 (G B D F) to C: F falls to E
        int[] notes = leader().lead(new int[]{0, 4, 7}, new int[]{55, 59, 62, 65}, 7);
        assertTrue(Arrays.stream(notes).anyMatch(n -> n == 64), "the seventh must resolve down a step: " + Arrays.toString(notes));
        assertTrue(Arrays.stream(notes).anyMatch(n -> n == 55), "G is common and must hold");
        assertTrue(Arrays.stream(notes).anyMatch(n -> n == 60), "B must step up to C");
    }

    @Test
    void determinismHolds() {
        int[] a = leader().lead(new int[]{7, 11, 2, 5}, new int[]{48, 52, 55, 59}, 0);
        int[] b = leader().lead(new int[]{7, 11, 2, 5}, new int[]{48, 52, 55, 59}, 0);
        assertArrayEquals(a, b, "same input must yield identical result");
    }

    @Test
    void outputIsSorted() {
        int[] notes = leader().lead(new int[]{1, 5, 8}, new int[]{65, 48, 55}, 0);
        int[] sorted = notes.clone();
        Arrays.sort(sorted);
        assertArrayEquals(sorted, notes);
    }
}

@DisplayName("VoiceLeader contract tests (NaturalVoiceLeader)")
class NaturalVoiceLeaderContractTest extends VoiceLeaderContractTest {

    private final VoiceLeader leader = new NaturalVoiceLeader(EngineConfig.defaults());

    @Override
    protected VoiceLeader leader() {
        return leader;
    }

    @Test
    void movesStayInsidePlayableRange() {
        EngineConfig.Range playable = EngineConfig.defaults().playable();
        int[] notes = leader().lead(new int[]{0, 4, 7}, new int[]{30, 82}, 0);
        for (int n : notes) {
            assertTrue(playable.contains(n), n + " left the playable range");
        }
    }

    @Test
    void surplusVoices_holdPreviousNotes() {
        // five voices into D major: D holds, Bb falls to A, G steps to F#, E and F have nowhere to go
        int[] notes = leader().lead(new int[]{2, 6, 9}, new int[]{43, 52, 58, 62, 65}, 0);
        assertArrayEquals(new int[]{42, 52, 57, 62, 65}, notes);
    }
}
