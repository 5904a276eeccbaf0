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
import ai.evacortex.chordfield.core.leading.NaturalVoiceLeader;
import ai.evacortex.chordfield.core.leading.VoiceLeader;
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.PitchClass;
import ai.evacortex.chordfield.core.theory.VoicingType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

abstract class VoicingStrategyContractTest {

    protected static final EngineConfig CONFIG = EngineConfig.defaults();
    protected static final VoiceLeader LEADER = new NaturalVoiceLeader(CONFIG);
    protected static final BassLeader BASS = new BassLeader(CONFIG);

    private static final int[][] PREVIOUS = {
            {48, 52, 55, 59},
            {43, 48, 52, 59},
            {45, 53, 57, 60, 64},
            {50, 57, 60, 65},
            {40, 55, 59, 62, 65}
    };

    protected abstract VoicingStrategy strategy();

    protected abstract VoicingType expectedType();

    protected Set<Integer> allowedPitchClasses(int root, ChordQuality quality) {
        Set<Integer> pcs = new HashSet<>();
        for (int pc : quality.pitchClasses(root)) pcs.add(pc);
        return pcs;
    }

    @Test
    void reportsItsType() {
        assertEquals(expectedType(), strategy().type());
    }

    @Test
    void fromScratch_isDeterministicAndNonEmpty() {
        VoicingStrategy s = strategy();
        for (ChordQuality q : ChordQuality.values()) {
            int[] first = s.voice(2, q, new int[0], 0);
            int[] second = s.voice(2, q, new int[0], 0);
            assertTrue(first.length > 0, q + " produced no notes");
            assertArrayEquals(first, second, q + " is not deterministic");
        }
    }

    @Test
    void fromScratch_usesOnlyChordTones() {
        VoicingStrategy s = strategy();
        for (int root = 0; root < 12; root++) {
            for (ChordQuality q : ChordQuality.values()) {
                assertChordTones(root, q, s.voice(root, q, new int[0], 0));
            }
        }
    }

    @Test
    void voiceLed_usesChordTonesOrHeldNotes() {
        VoicingStrategy s = strategy();
        for (int[] prev : PREVIOUS) {
            for (int root = 0; root < 12; root++) {
                for (ChordQuality q : ChordQuality.values()) {
                    int[] notes = s.voice(root, q, prev, 0);
                    Set<Integer> allowed = allowedPitchClasses(root, q);
                    for (int n : notes) {
                        boolean held = Arrays.stream(prev).anyMatch(p -> PitchClass.of(p) == PitchClass.of(n));
                        assertTrue(allowed.contains(PitchClass.of(n)) || held,
                                "note " + n + " is neither a tone of " + PitchClass.sharpName(root) + q.suffix()
                                        + " nor held from " + Arrays.toString(prev));
                    }
                }
            }
        }
    }

    @Test
    void previousVoicing_isNotMutated() {
        int[] prev = {48, 52, 55, 59};
        strategy().voice(7, ChordQuality.DOM9, prev, 0);
        assertArrayEquals(new int[]{48, 52, 55, 59}, prev);
    }

    private void assertChordTones(int root, ChordQuality quality, int[] notes) {
        Set<Integer> allowed = allowedPitchClasses(root, quality);
        for (int n : notes) {
            assertTrue(allowed.contains(PitchClass.of(n)),
                    "note " + n + " is not a tone of " + PitchClass.sharpName(root) + quality.suffix());
        }
    }
}

@DisplayName("VoicingStrategy contract tests (CloseVoicing)")
class CloseVoicingContractTest extends VoicingStrategyContractTest {

    @Override
    protected VoicingStrategy strategy() {
        return new CloseVoicing(CONFIG, LEADER, BASS);
    }

    @Override
    protected VoicingType expectedType() {
        return VoicingType.CLOSE;
    }

    @Test
    void cmaj7_fromScratch() {
        assertArrayEquals(new int[]{48, 52, 55, 59}, strategy().voice(0, ChordQuality.MAJ7, new int[0], 0));
    }

    @Test
    void extendedChords_capAtFiveNotes() {
        int[] notes = strategy().voice(0, ChordQuality.DOM13, new int[0], 0);
        assertEquals(5, notes.length, "the thirteenth is left out of a close stack");
    }

    @Test
    void cmaj7ToDm7_holdsTheOldBassAsCommonTone() {
        assertArrayEquals(new int[]{48, 50, 53, 57},
                strategy().voice(2, ChordQuality.MIN7, new int[]{48, 52, 55, 59}, 0));
    }

    @Test
    void cmaj7ToAm7_keepsThreeCommonTones() {
        assertArrayEquals(new int[]{45, 48, 52, 55},
                strategy().voice(9, ChordQuality.MIN7, new int[]{48, 52, 55, 59}, 0));
    }
}

@DisplayName("VoicingStrategy contract tests (Drop2)")
class Drop2VoicingContractTest extends VoicingStrategyContractTest {

    @Override
    protected VoicingStrategy strategy() {
        return new DropVoicing(2, CONFIG, LEADER, BASS);
    }

    @Override
    protected VoicingType expectedType() {
        return VoicingType.DROP2;
    }

    @Test
    void cmaj7_dropsSecondFromTop() {
        assertArrayEquals(new int[]{43, 48, 52, 59}, strategy().voice(0, ChordQuality.MAJ7, new int[0], 0));
    }

    @Test
    void triad_isNotDropped() {
        assertArrayEquals(new int[]{48, 52, 55}, strategy().voice(0, ChordQuality.MAJ, new int[0], 0));
    }

    @Test
    void voiceLed_leadsUpperVoicesOfDroppedStack() {
        // Fmaj7 dropped from [41, 45, 48, 52] leaves F A E above the dropped C; E is held
        assertArrayEquals(new int[]{41, 45, 52, 53},
                strategy().voice(5, ChordQuality.MAJ7, new int[]{43, 48, 52, 59}, 0));
    }

    @Test
    void invalidDepth_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DropVoicing(4, CONFIG, LEADER, BASS));
    }
}

@DisplayName("VoicingStrategy contract tests (Drop3)")
class Drop3VoicingContractTest extends VoicingStrategyContractTest {

    @Override
    protected VoicingStrategy strategy() {
        return new DropVoicing(3, CONFIG, LEADER, BASS);
    }

    @Override
    protected VoicingType expectedType() {
        return VoicingType.DROP3;
    }

    @Test
    void cmaj7_dropsThirdFromTop() {
        assertArrayEquals(new int[]{40, 48, 55, 59}, strategy().voice(0, ChordQuality.MAJ7, new int[0], 0));
    }
}

@DisplayName("VoicingStrategy contract tests (OpenVoicing)")
class OpenVoicingContractTest extends VoicingStrategyContractTest {

    private final OpenVoicing open = new OpenVoicing(CONFIG, LEADER, BASS);

    @Override
    protected VoicingStrategy strategy() {
        return open;
    }

    @Override
    protected VoicingType expectedType() {
        return VoicingType.OPEN;
    }

    @Test
    void cmaj7_fromScratch_spreadsUpperVoices() {
        assertArrayEquals(new int[]{48, 52, 67, 71}, open.voice(0, ChordQuality.MAJ7, new int[0], 0));
    }

    @Test
    void parallelOuterVoices_flipSopranoWhenBassCannotMove() {
        assertArrayEquals(new int[]{50, 53, 57, 62},
                open.contraryMotion(50, new int[]{57, 62, 65}, new int[]{48, 55, 60, 64}));
    }

    @Test
    void parallelOuterVoices_flipBassFirst() {
        assertArrayEquals(new int[]{43, 60, 64, 67},
                open.contraryMotion(55, new int[]{60, 64, 67}, new int[]{48, 59, 62, 65}));
    }

    @Test
    void contraryOuterVoices_areLeftAlone() {
        assertArrayEquals(new int[]{50, 57, 60, 64},
                open.contraryMotion(50, new int[]{57, 60, 64}, new int[]{48, 55, 60, 67}));
    }
}

@DisplayName("VoicingStrategy contract tests (RootlessA)")
class RootlessAVoicingContractTest extends VoicingStrategyContractTest {

    @Override
    protected VoicingStrategy strategy() {
        return new RootlessVoicing(RootlessVoicing.Form.A, CONFIG, LEADER, BASS);
    }

    @Override
    protected VoicingType expectedType() {
        return VoicingType.ROOTLESS_A;
    }

    @Test
    void cmaj9_startsOnTheThird() {
        assertArrayEquals(new int[]{52, 55, 59, 62}, strategy().voice(0, ChordQuality.MAJ9, new int[0], 0));
    }

    @Test
    void seventhChords_omitTheRoot() {
        VoicingStrategy s = strategy();
        for (ChordQuality q : ChordQuality.values()) {
            if (q.size() < 4) continue;
            for (int n : s.voice(3, q, new int[0], 0)) {
                assertNotEquals(3, PitchClass.of(n), q + " kept its root");
            }
        }
    }

    @Test
    void triads_fallBackToClosePosition() {
        int[] expected = new CloseVoicing(CONFIG, LEADER, BASS).voice(0, ChordQuality.MAJ, new int[0], 0);
        assertArrayEquals(expected, strategy().voice(0, ChordQuality.MAJ, new int[0], 0));
    }
}

@DisplayName("VoicingStrategy contract tests (RootlessB)")
class RootlessBVoicingContractTest extends VoicingStrategyContractTest {

    @Override
    protected VoicingStrategy strategy() {
        return new RootlessVoicing(RootlessVoicing.Form.B, CONFIG, LEADER, BASS);
    }

    @Override
    protected VoicingType expectedType() {
        return VoicingType.ROOTLESS_B;
    }

    @Test
    void cmaj9_startsOnTheSeventh() {
        assertArrayEquals(new int[]{47, 50, 52, 55}, strategy().voice(0, ChordQuality.MAJ9, new int[0], 0));
    }
}

@DisplayName("VoicingStrategy contract tests (QuartalVoicing)")
class QuartalVoicingContractTest extends VoicingStrategyContractTest {

    @Override
    protected VoicingStrategy strategy() {
        return new QuartalVoicing(CONFIG, LEADER, BASS);
    }

    @Override
    protected VoicingType expectedType() {
        return VoicingType.QUARTAL;
    }

    @Test
    void c7_fourthsSnapToChordTones() {
        assertArrayEquals(new int[]{48, 52, 58, 64}, strategy().voice(0, ChordQuality.DOM7, new int[0], 0));
    }

    @Test
    void snap_prefersEarlierChordToneOnTie() {
        // D is a whole step from both C and E
        assertEquals(0, QuartalVoicing.snap(2, new int[]{0, 4, 7}));
        assertEquals(4, QuartalVoicing.snap(5, new int[]{0, 4, 7, 10}));
    }
}

@DisplayName("VoicingStrategy contract tests (TriadVoicing)")
class TriadVoicingContractTest extends VoicingStrategyContractTest {

    @Override
    protected VoicingStrategy strategy() {
        return new TriadVoicing(CONFIG, LEADER, BASS);
    }

    @Override
    protected VoicingType expectedType() {
        return VoicingType.TRIAD;
    }

    @Override
    protected Set<Integer> allowedPitchClasses(int root, ChordQuality quality) {
        return super.allowedPitchClasses(root, quality.baseTriad());
    }

    @Test
    void cmaj7_reducesToTriad() {
        assertArrayEquals(new int[]{48, 52, 55}, strategy().voice(0, ChordQuality.MAJ7, new int[0], 0));
    }

    @Test
    void everyQuality_yieldsThreeNotesFromScratch() {
        for (ChordQuality q : ChordQuality.values()) {
            assertEquals(3, strategy().voice(0, q, new int[0], 0).length, q.name());
        }
    }
}
