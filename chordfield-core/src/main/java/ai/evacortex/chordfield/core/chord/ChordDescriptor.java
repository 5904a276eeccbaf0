/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.chord;

import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.PitchClass;
import ai.evacortex.chordfield.core.theory.QualityFamily;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A chord identity: root pitch class plus quality. Pitch classes and names are derived on
 * demand and never stored.
 */
public record ChordDescriptor(int root, ChordQuality quality) {

    public ChordDescriptor {
        Objects.requireNonNull(quality, "quality must not be null");
        root = PitchClass.of(root);
    }

    /** Pitch classes in interval-template order (root first). */
    public int[] pitchClasses() {
        return quality.pitchClasses(root);
    }

    public Set<Integer> pitchClassSet() {
        Set<Integer> set = new LinkedHashSet<>();
        for (int pc : pitchClasses()) set.add(pc);
        return Collections.unmodifiableSet(set);
    }

    public QualityFamily family() {
        return quality.family();
    }

    /** Flat-spelled display name, e.g. {@code "Bbm7"}. */
    public String name() {
        return ChordNames.chordName(root, quality);
    }

    @Override
    public String toString() {
        return name();
    }
}
