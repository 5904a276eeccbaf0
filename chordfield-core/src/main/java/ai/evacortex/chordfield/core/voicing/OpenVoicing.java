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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Open (spread) voicing: bass in its own register, upper voices spaced roughly a fourth apart
 * in the alto–soprano register.
 *
 * <p>When leading from a previous voicing, outer voices moving in the same direction are turned
 * into contrary motion: the bass is flipped an octave if it stays in its register and below the
 * upper voices, otherwise the soprano is flipped.</p>
 */
public final class OpenVoicing extends AbstractVoicingStrategy {

    private static final Logger LOG = Logger.getLogger(OpenVoicing.class.getName());

    static final int MAX_NOTES = 5;
    static final int UPPER_SPACING = 5;

    public OpenVoicing(EngineConfig config, VoiceLeader leader, BassLeader bassLeader) {
        super(config, leader, bassLeader);
    }

    @Override
    public VoicingType type() {
        return VoicingType.OPEN;
    }

    @Override
    public int[] voice(int root, ChordQuality quality, int[] previous, int previousRoot) {
        int bass = leadBass(root, previous);
        int[] upperPcs = upperPitchClasses(root, quality, MAX_NOTES);
        EngineConfig.Range register = config.openUpper();

        if (previous.length > 1) {
            int[] upper = leadUpper(upperPcs, previous, previousRoot);
            for (int i = 0; i < upper.length; i++) {
                upper[i] = PitchClass.wrapInto(upper[i], register.low(), register.high());
            }
            Arrays.sort(upper);
            return contraryMotion(bass, upper, previous);
        }

        int[] upper = new int[upperPcs.length];
        int target = config.openUpperCenter() - 4;
        for (int i = 0; i < upperPcs.length; i++) {
            upper[i] = PitchClass.wrapInto(PitchClass.findClosest(upperPcs[i], target), register.low(), register.high());
            target += UPPER_SPACING;
        }
        return withBass(bass, upper);
    }

    int[] contraryMotion(int bass, int[] upper, int[] previous) {
        if (upper.length == 0) return new int[]{bass};
        int bassMotion = Integer.signum(bass - previous[0]);
        int sopranoIndex = upper.length - 1;
        int sopranoMotion = Integer.signum(upper[sopranoIndex] - previous[previous.length - 1]);
        if (bassMotion == 0 || bassMotion != sopranoMotion) {
            return withBass(bass, upper);
        }

        int flippedBass = bass - bassMotion * PitchClass.OCTAVE;
        if (config.bass().contains(flippedBass) && flippedBass < upper[0]) {
            log("bass", bass, flippedBass);
            return withBass(flippedBass, upper);
        }

        int flippedSoprano = upper[sopranoIndex] - sopranoMotion * PitchClass.OCTAVE;
        if (config.openUpper().contains(flippedSoprano)
                && flippedSoprano > bass
                && Arrays.binarySearch(upper, flippedSoprano) < 0) {
            log("soprano", upper[sopranoIndex], flippedSoprano);
            int[] flipped = upper.clone();
            flipped[sopranoIndex] = flippedSoprano;
            Arrays.sort(flipped);
            return withBass(bass, flipped);
        }
        return withBass(bass, upper);
    }

    private static void log(String voice, int from, int to) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Parallel outer voices, " + voice + " flipped " + from + " -> " + to);
        }
    }
}
