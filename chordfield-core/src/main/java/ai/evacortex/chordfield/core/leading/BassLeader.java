/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.leading;

import ai.evacortex.chordfield.core.config.EngineConfig;
import ai.evacortex.chordfield.core.theory.PitchClass;

import java.util.Objects;

/**
 * Independent bass-voice leading.
 *
 * <p>The bass moves by idiomatic root motion rather than by nearest note. Every placement of
 * the new root inside the bass register is scored as its distance from the previous bass,
 * minus bonuses:</p>
 * <pre>
 *     same note (oblique)        −4
 *     perfect 4th / 5th          −3
 *     step (≤ 2 semitones)       −2
 * </pre>
 * The interval is taken modulo the octave, so an unmoved bass collects both the oblique and the
 * step bonus. The lowest score wins, ties go to the lower note.
 */
public final class BassLeader {

    static final int COMMON_TONE_BONUS = 4;
    static final int FOURTH_FIFTH_BONUS = 3;
    static final int STEP_BONUS = 2;

    private final EngineConfig.Range register;
    private final int center;

    public BassLeader(EngineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.register = config.bass();
        this.center = config.bassCenter();
    }

    /**
     * Places a first bass note with nothing to lead from.
     */
    public int place(int rootPitchClass) {
        return PitchClass.findClosest(rootPitchClass, center);
    }

    /**
     * Leads the bass to {@code rootPitchClass}.
     *
     * @param previousBass previous bass MIDI note; {@code <= 0} means there is none
     */
    public int lead(int rootPitchClass, int previousBass) {
        if (previousBass <= 0) return place(rootPitchClass);

        int pc = PitchClass.of(rootPitchClass);
        int bestNote = -1;
        int bestScore = Integer.MAX_VALUE;
        for (int note = register.low(); note <= register.high(); note++) {
            if (PitchClass.of(note) != pc) continue;
            int score = score(note, previousBass);
            if (score < bestScore) {
                bestScore = score;
                bestNote = note;
            }
        }
        return bestNote >= 0 ? bestNote : place(rootPitchClass);
    }

    static int score(int candidate, int previousBass) {
        int motion = Math.abs(candidate - previousBass);
        int interval = motion % PitchClass.OCTAVE;
        int score = motion;
        if (interval == 5 || interval == 7) score -= FOURTH_FIFTH_BONUS;
        if (interval <= 2) score -= STEP_BONUS;
        if (interval == 0) score -= COMMON_TONE_BONUS;
        return score;
    }
}
