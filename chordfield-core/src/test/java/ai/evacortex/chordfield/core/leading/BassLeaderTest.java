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
import ai.evacortex.chordfield.core.theory.PitchClass;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class BassLeaderTest {

    private EngineConfig config;
    private BassLeader bass;

    @BeforeAll
    void setUp() {
        config = EngineConfig.defaults();
        bass = new BassLeader(config);
    }

    @Test
    void place_usesRegisterCenter() {
        assertEquals(48, bass.place(0));
        assertEquals(43, bass.place(7), "G2 is closer to C3 than G3");
        assertEquals(42, bass.place(6), "tie between F#2 and F#3 resolves low");
    }

    @Test
    void noPreviousBass_placesFresh() {
        assertEquals(bass.place(9), bass.lead(9, 0));
        assertEquals(bass.place(9), bass.lead(9, -1));
    }

    @Test
    void prefersStepsFourthsAndFifths() {
        assertEquals(50, bass.lead(2, 48), "C to D moves up a step");
        assertEquals(43, bass.lead(7, 48), "C to G drops a fourth rather than climbing a fifth");
        assertEquals(48, bass.lead(0, 43), "G to C rises a fourth");
        assertEquals(48, bass.lead(0, 48), "a repeated root stays put");
    }

    @Test
    void score_appliesBonuses() {
        assertEquals(-6, BassLeader.score(48, 48), "oblique bass collects step and common-tone bonuses");
        assertEquals(4, BassLeader.score(55, 48), "fifth: 7 - 3");
        assertEquals(0, BassLeader.score(50, 48), "step: 2 - 2");
        assertEquals(4, BassLeader.score(52, 48), "major third has no bonus");
    }

    @Test
    void alwaysLandsInRegisterOnTheRoot() {
        EngineConfig.Range register = config.bass();
        for (int root = 0; root < 12; root++) {
            for (int prev = register.low(); prev <= register.high(); prev++) {
                int note = bass.lead(root, prev);
                assertTrue(register.contains(note), "bass " + note + " left the register");
                assertEquals(root, PitchClass.of(note), "bass must carry the root");
            }
        }
    }
}
