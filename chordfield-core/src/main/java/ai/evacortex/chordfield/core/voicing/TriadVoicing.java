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
import ai.evacortex.chordfield.core.theory.VoicingType;

/**
 * Reduces any quality to its base triad and voices it in close position.
 */
public final class TriadVoicing extends AbstractVoicingStrategy {

    public TriadVoicing(EngineConfig config, VoiceLeader leader, BassLeader bassLeader) {
        super(config, leader, bassLeader);
    }

    @Override
    public VoicingType type() {
        return VoicingType.TRIAD;
    }

    @Override
    public int[] voice(int root, ChordQuality quality, int[] previous, int previousRoot) {
        ChordQuality triad = quality.baseTriad();
        int bass = leadBass(root, previous);
        return bassAndUpper(bass, upperPitchClasses(root, triad, triad.size()), previous, previousRoot);
    }
}
