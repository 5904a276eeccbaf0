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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Three-phase upper-voice leading, the way a pianist's right hand moves between chords:
 * <ol>
 *     <li><b>Common tones</b>: a previous voice whose pitch class belongs to the new chord keeps
 *         its exact MIDI note.</li>
 *     <li><b>Tendency tones</b>: a voice that was a {@link TendencyTone} over the previous root
 *         resolves by its step when the resolved pitch class is an unclaimed chord tone.</li>
 *     <li><b>Stepwise motion</b>: remaining voices greedily take the nearest unclaimed pitch
 *         class, looking one octave either side and staying in the playable range.</li>
 * </ol>
 * Voices that find nothing hold their previous note. Pitch classes still unclaimed are added
 * near the previous centroid.
 */
public final class NaturalVoiceLeader implements VoiceLeader {

    private final EngineConfig.Range playable;
    private final int fallbackCenter;

    public NaturalVoiceLeader(EngineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.playable = config.playable();
        this.fallbackCenter = config.defaultCenter();
    }

    @Override
    public int[] lead(int[] targetPitchClasses, int[] previous, int previousRoot) {
        Objects.requireNonNull(targetPitchClasses, "targetPitchClasses must not be null");
        Objects.requireNonNull(previous, "previous must not be null");

        Set<Integer> targets = new LinkedHashSet<>();
        for (int pc : targetPitchClasses) targets.add(PitchClass.of(pc));
        if (targets.isEmpty()) return new int[0];
        if (previous.length == 0) return stackFromCenter(targets);

        int[] prev = previous.clone();
        Arrays.sort(prev);
        int[] result = new int[prev.length];
        boolean[] filled = new boolean[prev.length];
        boolean[] claimed = new boolean[PitchClass.OCTAVE];

        // 1. common tones
        for (int i = 0; i < prev.length; i++) {
            int pc = PitchClass.of(prev[i]);
            if (targets.contains(pc) && !claimed[pc]) {
                result[i] = prev[i];
                filled[i] = true;
                claimed[pc] = true;
            }
        }

        // 2. tendency tones, judged against the previous root
        for (int i = 0; i < prev.length; i++) {
            if (filled[i]) continue;
            TendencyTone tendency = TendencyTone.forInterval(PitchClass.interval(previousRoot, prev[i]));
            if (tendency == null) continue;
            int resolved = prev[i] + tendency.resolution();
            int resolvedPc = PitchClass.of(resolved);
            if (targets.contains(resolvedPc) && !claimed[resolvedPc]) {
                result[i] = resolved;
                filled[i] = true;
                claimed[resolvedPc] = true;
            }
        }

        // 3. nearest placement for the rest
        List<Integer> open = new ArrayList<>();
        for (int pc : targets) {
            if (!claimed[pc]) open.add(pc);
        }
        boolean[] used = new boolean[PitchClass.OCTAVE];
        for (int i = 0; i < prev.length; i++) {
            if (filled[i]) continue;
            int bestNote = Integer.MIN_VALUE;
            int bestPc = -1;
            int bestDist = Integer.MAX_VALUE;
            int octave = Math.floorDiv(prev[i], PitchClass.OCTAVE);
            for (int pc : open) {
                if (used[pc]) continue;
                for (int o = octave - 1; o <= octave + 1; o++) {
                    int candidate = o * PitchClass.OCTAVE + pc;
                    if (!playable.contains(candidate)) continue;
                    int dist = Math.abs(candidate - prev[i]);
                    if (dist < bestDist) {
                        bestDist = dist;
                        bestNote = candidate;
                        bestPc = pc;
                    }
                }
            }
            if (bestPc >= 0) {
                result[i] = bestNote;
                filled[i] = true;
                used[bestPc] = true;
            }
        }

        // 4. surplus voices hold
        for (int i = 0; i < prev.length; i++) {
            if (!filled[i]) result[i] = prev[i];
        }

        int center = (int) Math.round(PitchClass.mean(prev));
        List<Integer> extra = new ArrayList<>();
        for (int pc : open) {
            if (!used[pc]) extra.add(PitchClass.findClosest(pc, center));
        }

        int[] out = Arrays.copyOf(result, result.length + extra.size());
        for (int i = 0; i < extra.size(); i++) {
            out[result.length + i] = extra.get(i);
        }
        Arrays.sort(out);
        return out;
    }

    private int[] stackFromCenter(Set<Integer> targets) {
        int[] out = new int[targets.size()];
        int i = 0;
        for (int pc : targets) {
            out[i] = i == 0
                    ? PitchClass.findClosest(pc, fallbackCenter)
                    : PitchClass.findNextAbove(pc, out[i - 1]);
            i++;
        }
        return out;
    }
}
