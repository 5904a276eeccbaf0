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

import java.util.Arrays;

/**
 * Drop-2 and drop-3: a four-note close stack with the second (or third) voice from the top
 * lowered an octave.
 *
 * <p>Chords with fewer than four tones have nothing to drop and fall back to close position,
 * or to plain voice leading when a previous voicing exists. When leading, the bass moves
 * independently and the pitch classes above the lowest note of the dropped stack are led
 * against the previous upper voices.</p>
 */
public final class DropVoicing extends AbstractVoicingStrategy {

    private static final int STACK_SIZE = 4;

    private final int depth;
    private final CloseVoicing close;

    public DropVoicing(int depth, EngineConfig config, VoiceLeader leader, BassLeader bassLeader) {
        super(config, leader, bassLeader);
        if (depth != 2 && depth != 3) {
            throw new IllegalArgumentException("drop depth must be 2 or 3, got " + depth);
        }
        this.depth = depth;
        this.close = new CloseVoicing(config, leader, bassLeader);
    }

    @Override
    public VoicingType type() {
        return depth == 2 ? VoicingType.DROP2 : VoicingType.DROP3;
    }

    @Override
    public int[] voice(int root, ChordQuality quality, int[] previous, int previousRoot) {
        int[] stack = close.closePosition(root, quality, previous, STACK_SIZE);
        if (stack.length < STACK_SIZE) {
            if (previous.length > 0) {
                return leader.lead(pitchClassesOf(stack), previous, previousRoot);
            }
            return stack;
        }
        if (previous.length == 0) {
            return drop(stack);
        }
        int[] dropped = drop(stack);
        int bass = leadBass(root, previous);
        int[] upperPcs = pitchClassesOf(Arrays.copyOfRange(dropped, 1, dropped.length));
        return bassAndUpper(bass, upperPcs, previous, previousRoot);
    }

    private int[] drop(int[] stack) {
        int[] notes = stack.clone();
        Arrays.sort(notes);
        notes[notes.length - depth] -= PitchClass.OCTAVE;
        Arrays.sort(notes);
        return notes;
    }
}
