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
 * Close position: root in the bass, up to four chord tones stacked tightly above it.
 */
public final class CloseVoicing extends AbstractVoicingStrategy {

    static final int MAX_NOTES = 5;

    public CloseVoicing(EngineConfig config, VoiceLeader leader, BassLeader bassLeader) {
        super(config, leader, bassLeader);
    }

    @Override
    public VoicingType type() {
        return VoicingType.CLOSE;
    }

    @Override
    public int[] voice(int root, ChordQuality quality, int[] previous, int previousRoot) {
        int bass = leadBass(root, previous);
        return bassAndUpper(bass, upperPitchClasses(root, quality, MAX_NOTES), previous, previousRoot);
    }

    /**
     * Close stack of at most {@code maxNotes} chord tones whose bass sits a major third below
     * the center of the previous voicing, or below the default center.
     */
    int[] closePosition(int root, ChordQuality quality, int[] previous, int maxNotes) {
        int center = previous.length > 0 ? (int) Math.round(PitchClass.mean(previous)) : config.defaultCenter();
        int bass = PitchClass.findClosest(root, center - 4);
        return stackAbove(bass, upperPitchClasses(root, quality, maxNotes));
    }
}
