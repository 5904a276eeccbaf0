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

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Final register pass applied to every raw voicing:
 * <ol>
 *     <li>register gravity: when the mean note leaves the sweet zone, the whole voicing moves by
 *         whole octaves toward the gravity target</li>
 *     <li>octave offset</li>
 *     <li>per-note octave wrapping into the playable range</li>
 *     <li>ascending sort; a repeated note moves to the nearest free octave of its pitch class
 *         inside the playable range, and is dropped only when every octave is taken</li>
 *     <li>max spread: a bass more than {@code maxBassGap} below the next voice is raised an
 *         octave if it stays below that voice</li>
 * </ol>
 */
public final class RegisterCorrection {

    private static final Logger LOG = Logger.getLogger(RegisterCorrection.class.getName());

    private final EngineConfig.Range playable;
    private final EngineConfig.Range gravity;
    private final int gravityTarget;
    private final int maxBassGap;

    public RegisterCorrection(EngineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.playable = config.playable();
        this.gravity = config.gravity();
        this.gravityTarget = config.gravityTarget();
        this.maxBassGap = config.maxBassGap();
    }

    public int[] apply(int[] raw, int octaveOffset) {
        if (raw.length == 0) return new int[0];
        int[] notes = applyGravity(raw);

        int offset = octaveOffset * PitchClass.OCTAVE;
        for (int i = 0; i < notes.length; i++) {
            notes[i] = PitchClass.wrapInto(notes[i] + offset, playable.low(), playable.high());
        }

        notes = distinctAscending(notes);
        return tightenBass(notes);
    }

    /**
     * Returns a shifted copy when the centroid lies outside the sweet zone.
     */
    public int[] applyGravity(int[] raw) {
        int[] notes = raw.clone();
        double centroid = PitchClass.mean(notes);
        if (centroid >= gravity.low() && centroid <= gravity.high()) return notes;

        int shift = (int) Math.round((gravityTarget - centroid) / PitchClass.OCTAVE) * PitchClass.OCTAVE;
        if (shift != 0) {
            for (int i = 0; i < notes.length; i++) notes[i] += shift;
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Register gravity: centroid " + centroid + " shifted by " + shift);
            }
        }
        return notes;
    }

    int[] distinctAscending(int[] notes) {
        int[] sorted = notes.clone();
        Arrays.sort(sorted);
        boolean[] taken = new boolean[playable.high() + 1];
        int count = 0;
        for (int n : sorted) {
            int placed = freeOctave(n, taken);
            if (placed < 0) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Register correction: no free octave for " + n + ", voice dropped");
                }
                continue;
            }
            taken[placed] = true;
            count++;
        }
        int[] out = new int[count];
        int i = 0;
        for (int n = playable.low(); n <= playable.high(); n++) {
            if (taken[n]) out[i++] = n;
        }
        return out;
    }

    /**
     * The note itself when free, otherwise the closest free note of the same pitch class in the
     * playable range (upward on ties), or {@code -1}.
     */
    private int freeOctave(int note, boolean[] taken) {
        if (!taken[note]) return note;
        int best = -1;
        int first = playable.low() + Math.floorMod(note - playable.low(), PitchClass.OCTAVE);
        for (int c = first; c <= playable.high(); c += PitchClass.OCTAVE) {
            if (taken[c]) continue;
            if (best < 0 || Math.abs(c - note) <= Math.abs(best - note)) best = c;
        }
        return best;
    }

    int[] tightenBass(int[] notes) {
        if (notes.length < 2) return notes;
        int gap = notes[1] - notes[0];
        if (gap > maxBassGap && notes[0] + PitchClass.OCTAVE < notes[1]) {
            notes[0] += PitchClass.OCTAVE;
            Arrays.sort(notes);
        }
        return notes;
    }
}
