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

import java.util.Objects;

/**
 * Bill Evans style rootless voicings for chords of four or more tones.
 * <ul>
 *     <li>A form: 3 – 5 – 7 (– 9)</li>
 *     <li>B form: 7 (– 9) – 3 – 5</li>
 * </ul>
 * Triads have no rootless form and are voiced in close position.
 */
public final class RootlessVoicing extends AbstractVoicingStrategy {

    public enum Form { A, B }

    private final Form form;
    private final CloseVoicing close;

    public RootlessVoicing(Form form, EngineConfig config, VoiceLeader leader, BassLeader bassLeader) {
        super(config, leader, bassLeader);
        this.form = Objects.requireNonNull(form, "form must not be null");
        this.close = new CloseVoicing(config, leader, bassLeader);
    }

    @Override
    public VoicingType type() {
        return form == Form.A ? VoicingType.ROOTLESS_A : VoicingType.ROOTLESS_B;
    }

    @Override
    public int[] voice(int root, ChordQuality quality, int[] previous, int previousRoot) {
        if (quality.size() < 4) {
            return close.voice(root, quality, previous, previousRoot);
        }
        int[] pcs = rootlessPitchClasses(quality.pitchClasses(root));
        if (previous.length > 0) {
            return leader.lead(pcs, previous, previousRoot);
        }
        int[] notes = new int[pcs.length];
        int current = config.defaultCenter() - 6;
        for (int i = 0; i < pcs.length; i++) {
            notes[i] = PitchClass.findClosest(pcs[i], current);
            current = notes[i] + 3;
        }
        return notes;
    }

    int[] rootlessPitchClasses(int[] pcs) {
        boolean ninth = pcs.length > 4;
        if (form == Form.A) {
            return ninth ? new int[]{pcs[1], pcs[2], pcs[3], pcs[4]} : new int[]{pcs[1], pcs[2], pcs[3]};
        }
        return ninth ? new int[]{pcs[3], pcs[4], pcs[1], pcs[2]} : new int[]{pcs[3], pcs[1], pcs[2]};
    }
}
