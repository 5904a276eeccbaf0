/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.session;

import ai.evacortex.chordfield.core.DefaultChordFieldEngine;
import ai.evacortex.chordfield.core.Voicing;
import ai.evacortex.chordfield.core.chord.ChordDescriptor;
import ai.evacortex.chordfield.core.context.GlowGrid;
import ai.evacortex.chordfield.core.exceptions.InvalidGridPositionException;
import ai.evacortex.chordfield.core.modulation.Confidence;
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.Mode;
import ai.evacortex.chordfield.core.theory.VoicingType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ChordFieldSessionTest {

    private DefaultChordFieldEngine engine;
    private ChordFieldSession session;

    @BeforeAll
    void setUpEngine() {
        engine = new DefaultChordFieldEngine();
    }

    @BeforeEach
    void setUp() {
        session = new ChordFieldSession(engine);
    }

    @Test
    void freshSession_defaults() {
        assertEquals(0, session.key());
        assertEquals(Mode.IONIAN, session.mode());
        assertEquals(VoicingType.CLOSE, session.voicingType());
        assertTrue(session.autoModulation());
        assertTrue(session.context().isEmpty());
        assertTrue(session.glow().isDark());
        assertTrue(session.suggestions().isEmpty());
        assertTrue(session.contextChords().isEmpty());
        assertTrue(session.previousChord().isEmpty());
    }

    @Test
    void trigger_leadsFromPreviousChord() {
        PadTrigger first = session.trigger(0, 0);
        assertEquals(new ChordDescriptor(0, ChordQuality.MAJ7), first.chord());
        assertEquals(Voicing.of(48, 52, 55, 59), first.voicing());
        assertTrue(first.accepted());
        assertTrue(first.modulation().isEmpty());

        PadTrigger second = session.trigger(1, 1);
        assertEquals(new ChordDescriptor(2, ChordQuality.MIN7), second.chord());
        assertEquals(Voicing.of(48, 50, 53, 57), second.voicing());
        assertEquals(second.voicing(), session.context().previousVoicing());
        assertEquals(2, session.context().previousRoot());
    }

    @Test
    void trigger_lightsGlowForPlayedChord() {
        PadTrigger t = session.trigger(2, 0);
        assertFalse(session.glow().isDark());
        assertEquals(3, session.glow().level(2, 0));
        assertEquals(engine.computeGlowGrid(new int[]{0, 4, 7, 10}, 0, Mode.IONIAN, null), session.glow());
        assertTrue(t.voicing().pitchClasses().contains(10));
    }

    @Test
    void iiVOfNewKey_autoModulatesWithoutResettingContext() {
        session.trigger(1, 5);
        PadTrigger d7 = session.trigger(2, 1);

        assertTrue(d7.modulation().isPresent());
        assertEquals(Confidence.STRONG, d7.modulation().get().confidence());
        assertEquals(7, session.key());
        assertEquals(Mode.IONIAN, session.mode());
        assertEquals(d7.voicing(), session.context().previousVoicing(), "modulation keeps the voice-leading context");

        int[] pcs = new int[d7.voicing().size()];
        for (int i = 0; i < pcs.length; i++) pcs[i] = d7.voicing().note(i) % 12;
        assertEquals(engine.computeGlowGrid(pcs, 7, Mode.IONIAN, null), session.glow());
    }

    @Test
    void autoModulationOff_reportsButKeepsKey() {
        session.setAutoModulation(false);
        session.trigger(1, 5);
        PadTrigger d7 = session.trigger(2, 1);
        assertTrue(d7.modulation().isPresent());
        assertEquals(0, session.key());
    }

    @Test
    void keyAndModeChanges_resetContextAndGlow() {
        session.trigger(0, 0);
        session.setKey(14);
        assertEquals(2, session.key());
        assertTrue(session.context().isEmpty());
        assertSame(GlowGrid.DARK, session.glow());

        session.trigger(0, 0);
        session.setMode(Mode.DORIAN);
        assertTrue(session.context().isEmpty());

        session.trigger(0, 0);
        session.cycleMode(1);
        assertEquals(Mode.AEOLIAN, session.mode());
        assertTrue(session.context().isEmpty());
        assertTrue(session.glow().isDark());
    }

    @Test
    void cycleMode_wrapsAround() {
        session.cycleMode(-1);
        assertEquals(Mode.LYDIAN, session.mode());
        session.cycleMode(-1);
        assertEquals(Mode.LOCRIAN, session.mode());
        session.cycleMode(1);
        assertEquals(Mode.LYDIAN, session.mode());
    }

    @Test
    void rootRotation_shiftsDiatonicColumnsOnly() {
        session.setRootRotation(1);
        assertEquals(new ChordDescriptor(2, ChordQuality.MAJ7), session.padChord(0, 0));
        assertEquals(new ChordDescriptor(0, ChordQuality.MAJ7), session.padChord(0, 6));
        assertEquals(new ChordDescriptor(1, ChordQuality.MAJ7), session.padChord(0, 7));

        session.setRootRotation(-1);
        assertEquals(6, session.rootRotation());
        session.rotateRoots();
        assertEquals(0, session.rootRotation());
    }

    @Test
    void rotationAndOverride_resetGlowButKeepContext() {
        session.trigger(0, 0);
        session.rotateRoots();
        assertTrue(session.glow().isDark());
        assertFalse(session.context().isEmpty());

        session.trigger(0, 0);
        session.setChromaticOverride(18);
        assertEquals(6, session.chromaticOverride());
        assertTrue(session.glow().isDark());
        assertFalse(session.context().isEmpty());
        assertEquals(new ChordDescriptor(6, ChordQuality.MAJ7), session.padChord(0, 7));
    }

    @Test
    void octaveOffset_isClamped() {
        session.setOctaveOffset(5);
        assertEquals(ChordFieldSession.MAX_OCTAVE_OFFSET, session.octaveOffset());
        session.shiftOctave(-10);
        assertEquals(ChordFieldSession.MIN_OCTAVE_OFFSET, session.octaveOffset());
    }

    @Test
    void recentRoots_keepTheLastWindow() {
        for (int col = 0; col < 6; col++) session.trigger(0, col);
        assertEquals(List.of(4, 5, 7, 9), session.recentRoots());
        assertThrows(UnsupportedOperationException.class, () -> session.recentRoots().add(1));
    }

    @Test
    void zeroWindow_remembersNothing() {
        ChordFieldSession s = new ChordFieldSession(engine, 0);
        s.trigger(0, 0);
        s.trigger(0, 1);
        assertTrue(s.recentRoots().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new ChordFieldSession(engine, -1));
    }

    @Test
    void suggestionsAndContext_followLastChord() {
        session.trigger(2, 4);
        assertEquals(new ChordDescriptor(0, ChordQuality.MAJ7), session.suggestions().orElseThrow().safe().chord());
        assertEquals(16, session.contextChords().size());
        assertEquals(new ChordDescriptor(7, ChordQuality.DOM7), session.previousChord().orElseThrow());
    }

    @Test
    void invalidPad_isRejected() {
        assertThrows(InvalidGridPositionException.class, () -> session.trigger(0, 8));
    }
}
