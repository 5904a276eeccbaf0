/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.theory;

import java.util.EnumMap;
import java.util.Map;

import static ai.evacortex.chordfield.core.theory.ChordQuality.*;

/**
 * Extension modifiers that upgrade a base quality within its family,
 * e.g. {@code min7 + NINTH → min9}, {@code dom7 + THIRTEENTH → dom13}.
 *
 * <p>A family with no meaningful upgrade keeps the base quality. {@link #SEVENTH} is the
 * identity modifier.</p>
 */
public enum QualityModifier {

    SEVENTH("7th", "Default 7th voicing"),
    NINTH("9th", "Add the 9th"),
    ELEVENTH("11th", "Ethereal, open sound"),
    THIRTEENTH("13th", "Full, rich voicing"),
    SUS4("sus4", "Suspended floater"),
    ADD9("add9", "Triad + 9th, no 7th"),
    SIX_NINE("6/9", "Smooth upper-structure colour"),
    TRIAD("triad", "Strip to basic triad");

    private static final Map<QualityModifier, Map<QualityFamily, ChordQuality>> UPGRADES =
            new EnumMap<>(QualityModifier.class);

    static {
        for (QualityModifier m : values()) {
            UPGRADES.put(m, m.buildUpgrades());
        }
    }

    private final String label;
    private final String description;

    QualityModifier(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public ChordQuality apply(ChordQuality base) {
        if (this == SEVENTH) return base;
        ChordQuality upgraded = UPGRADES.get(this).get(base.family());
        return upgraded != null ? upgraded : base;
    }

    // missing families keep the base quality
    private Map<QualityFamily, ChordQuality> buildUpgrades() {
        Map<QualityFamily, ChordQuality> m = new EnumMap<>(QualityFamily.class);
        switch (this) {
            case NINTH -> {
                m.put(QualityFamily.MAJOR, MAJ9);
                m.put(QualityFamily.MINOR, MIN9);
                m.put(QualityFamily.DOMINANT, DOM9);
                m.put(QualityFamily.DIMINISHED, MIN9B5);
                m.put(QualityFamily.AUGMENTED, MAJ9);
            }
            case ELEVENTH -> {
                m.put(QualityFamily.MAJOR, MAJ11);
                m.put(QualityFamily.MINOR, MIN11);
                m.put(QualityFamily.DOMINANT, DOM11);
                m.put(QualityFamily.DIMINISHED, MIN11);
                m.put(QualityFamily.AUGMENTED, MAJ11);
            }
            case THIRTEENTH, SIX_NINE -> {
                m.put(QualityFamily.MAJOR, MAJ13);
                m.put(QualityFamily.MINOR, MIN13);
                m.put(QualityFamily.DOMINANT, DOM13);
                if (this == THIRTEENTH) m.put(QualityFamily.DIMINISHED, MIN13);
                m.put(QualityFamily.AUGMENTED, MAJ13);
            }
            case SUS4 -> {
                m.put(QualityFamily.MAJOR, ChordQuality.SUS4);
                m.put(QualityFamily.MINOR, ChordQuality.SUS4);
                m.put(QualityFamily.DOMINANT, ChordQuality.SUS4);
                m.put(QualityFamily.SUS, ChordQuality.SUS4);
            }
            case ADD9 -> {
                m.put(QualityFamily.MAJOR, MAJ9);
                m.put(QualityFamily.MINOR, MIN9);
                m.put(QualityFamily.DOMINANT, DOM9);
                m.put(QualityFamily.AUGMENTED, MAJ9);
            }
            case TRIAD -> {
                m.put(QualityFamily.MAJOR, MAJ);
                m.put(QualityFamily.MINOR, MIN);
                m.put(QualityFamily.DOMINANT, MAJ);
                m.put(QualityFamily.DIMINISHED, DIM);
                m.put(QualityFamily.AUGMENTED, AUG);
                m.put(QualityFamily.SUS, ChordQuality.SUS4);
            }
            default -> { }
        }
        return m;
    }
}
