/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.modulation;

import ai.evacortex.chordfield.core.chord.ChordNames;
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.Mode;
import ai.evacortex.chordfield.core.theory.PitchClass;
import ai.evacortex.chordfield.core.theory.QualityFamily;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Detects ii–V and IV–V cadences into a key other than the current one.
 *
 * <p>Every dominant chord is the V of the key a fifth below it. When the chord played just
 * before it works as ii or IV in that key, the performer has walked into the new key and the
 * detector reports it. The predominant test accepts the ii and IV of any of the seven modes
 * built on the target tonic.</p>
 */
public final class ModulationDetector {

    private static final Logger LOG = Logger.getLogger(ModulationDetector.class.getName());

    private static final int SUPERTONIC = 1;
    private static final int SUBDOMINANT = 3;

    public Optional<ModulationResult> detect(int previousRoot, ChordQuality previousQuality,
                                             int currentRoot, ChordQuality currentQuality,
                                             int currentKey, Mode mode) {
        Objects.requireNonNull(previousQuality, "previousQuality must not be null");
        Objects.requireNonNull(currentQuality, "currentQuality must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        if (!currentQuality.isDominant()) return Optional.empty();

        int target = PitchClass.of(currentRoot + 5);
        if (target == PitchClass.of(currentKey)) return Optional.empty();

        int prev = PitchClass.of(previousRoot);
        if (!isPredominant(prev, previousQuality.family(), target)) return Optional.empty();

        Confidence confidence = prev == mode.degreeRoot(target, SUPERTONIC) ? Confidence.STRONG : Confidence.MODERATE;
        ModulationResult result = new ModulationResult(target, confidence, mode);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Modulation " + ChordNames.keyName(currentKey) + " -> " + ChordNames.keyName(target)
                    + " (" + confidence + ")");
        }
        return Optional.of(result);
    }

    static boolean isPredominant(int root, QualityFamily family, int targetKey) {
        for (Mode m : Mode.values()) {
            if (root == m.degreeRoot(targetKey, SUPERTONIC)
                    && (family == m.triad(SUPERTONIC).family() || family == QualityFamily.MINOR)) {
                return true;
            }
            if (root == m.degreeRoot(targetKey, SUBDOMINANT)
                    && (family == m.triad(SUBDOMINANT).family() || family == QualityFamily.MAJOR)) {
                return true;
            }
        }
        return false;
    }
}
