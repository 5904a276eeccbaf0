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
import ai.evacortex.chordfield.core.theory.VoicingType;

/**
 * Stacked fourths above the bass, each fourth snapped to the nearest chord tone.
 */
public final class QuartalVoicing extends AbstractVoicingStrategy {

    static final int FOURTH = 5;
    static final int UPPER_VOICES = 3;

    public QuartalVoicing(EngineConfig config, VoiceLeader leader, BassLeader bassLeader) {
        super(config, leader, bassLeader);
    }

    @Override
    public VoicingType type() {
        return VoicingType.QUARTAL;
    }

    @Override
    public int[] voice(int root, ChordQuality quality, int[] previous, int previousRoot) {
        int bass = leadBass(root, previous);
        int[] chordPcs = quality.pitchClasses(root);
        int[] upperPcs = new int[UPPER_VOICES];
        int target = bass + FOURTH;
        for (int i = 0; i < UPPER_VOICES; i++) {
            upperPcs[i] = snap(PitchClass.of(target), chordPcs);
            target += FOURTH;
        }
        return bassAndUpper(bass, upperPcs, previous, previousRoot);
    }

    /**
     * Nearest chord tone by circular distance; the earlier chord tone wins a tie.
     */
    static int snap(int pitchClass, int[] chordPcs) {
        int best = chordPcs[0];
        int bestDistance = Integer.MAX_VALUE;
        for (int pc : chordPcs) {
            int d = PitchClass.circularDistance(pitchClass, pc);
            if (d < bestDistance) {
                bestDistance = d;
                best = pc;
            }
        }
        return best;
    }
}
