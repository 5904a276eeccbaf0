/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.theory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QualityModifierTest {

    @Test
    void seventh_isIdentity() {
        for (ChordQuality q : ChordQuality.values()) {
            assertEquals(q, QualityModifier.SEVENTH.apply(q));
        }
    }

    @Test
    void upgradesWithinFamily() {
        assertEquals(ChordQuality.MIN9, QualityModifier.NINTH.apply(ChordQuality.MIN7));
        assertEquals(ChordQuality.DOM13, QualityModifier.THIRTEENTH.apply(ChordQuality.DOM7));
        assertEquals(ChordQuality.MIN9B5, QualityModifier.NINTH.apply(ChordQuality.DIM));
        assertEquals(ChordQuality.MAJ11, QualityModifier.ELEVENTH.apply(ChordQuality.MAJ7));
    }

    @Test
    void triad_stripsToBaseTriad() {
        assertEquals(ChordQuality.MAJ, QualityModifier.TRIAD.apply(ChordQuality.DOM9));
        assertEquals(ChordQuality.MIN, QualityModifier.TRIAD.apply(ChordQuality.MIN7));
        assertEquals(ChordQuality.SUS4, QualityModifier.TRIAD.apply(ChordQuality.SUS2));
    }

    @Test
    void susStaysSusUnlessSus4OrTriad() {
        assertEquals(ChordQuality.SUS2, QualityModifier.NINTH.apply(ChordQuality.SUS2));
        assertEquals(ChordQuality.SUS2, QualityModifier.THIRTEENTH.apply(ChordQuality.SUS2));
        assertEquals(ChordQuality.SUS4, QualityModifier.SUS4.apply(ChordQuality.SUS2));
    }

    @Test
    void missingFamily_keepsBase() {
        assertEquals(ChordQuality.DIM7, QualityModifier.SUS4.apply(ChordQuality.DIM7),
                "diminished chords have no sus4 upgrade");
        assertEquals(ChordQuality.HALFDIM7, QualityModifier.ADD9.apply(ChordQuality.HALFDIM7));
    }
}
