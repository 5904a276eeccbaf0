/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.voicing;

import ai.evacortex.chordfield.core.Voicing;
import ai.evacortex.chordfield.core.config.EngineConfig;
import ai.evacortex.chordfield.core.leading.BassLeader;
import ai.evacortex.chordfield.core.leading.NaturalVoiceLeader;
import ai.evacortex.chordfield.core.leading.RegisterCorrection;
import ai.evacortex.chordfield.core.leading.VoiceLeader;
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.PitchClass;
import ai.evacortex.chordfield.core.theory.VoicingType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the shared voicing pipeline: strategy, register gravity, octave offset, wrapping into
 * the playable range, ascending sort and max-spread correction.
 *
 * <p>Stateless and thread-safe; the caller owns the previous voicing.</p>
 */
public final class VoicingEngine {

    private static final Logger LOG = Logger.getLogger(VoicingEngine.class.getName());

    private final Map<VoicingType, VoicingStrategy> strategies;
    private final RegisterCorrection correction;

    public VoicingEngine(EngineConfig config) {
        this(config, new NaturalVoiceLeader(config), new BassLeader(config));
    }

    public VoicingEngine(EngineConfig config, VoiceLeader leader, BassLeader bassLeader) {
        Objects.requireNonNull(config, "config must not be null");
        this.correction = new RegisterCorrection(config);
        this.strategies = new EnumMap<>(VoicingType.class);
        register(new CloseVoicing(config, leader, bassLeader));
        register(new DropVoicing(2, config, leader, bassLeader));
        register(new DropVoicing(3, config, leader, bassLeader));
        register(new OpenVoicing(config, leader, bassLeader));
        register(new RootlessVoicing(RootlessVoicing.Form.A, config, leader, bassLeader));
        register(new RootlessVoicing(RootlessVoicing.Form.B, config, leader, bassLeader));
        register(new QuartalVoicing(config, leader, bassLeader));
        register(new TriadVoicing(config, leader, bassLeader));
    }

    private void register(VoicingStrategy strategy) {
        strategies.put(strategy.type(), strategy);
    }

    /**
     * Voices a chord.
     *
     * @param root         root pitch class; any integer, reduced modulo 12
     * @param quality      chord quality
     * @param type         voicing algorithm
     * @param previous     previous voicing, {@link Voicing#EMPTY} to build from scratch
     * @param octaveOffset whole octaves added after register gravity
     * @param previousRoot root of the previous chord, {@code null} meaning C (0)
     * @return ascending, duplicate-free notes inside the playable range
     */
    public Voicing voice(int root, ChordQuality quality, VoicingType type, Voicing previous,
                         int octaveOffset, Integer previousRoot) {
        Objects.requireNonNull(quality, "quality must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(previous, "previous must not be null");

        int pc = PitchClass.of(root);
        int prevRoot = previousRoot == null ? 0 : PitchClass.of(previousRoot);
        int[] raw = strategies.get(type).voice(pc, quality, previous.notes(), prevRoot);
        Voicing result = Voicing.of(correction.apply(raw, octaveOffset));

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(type.key() + " " + PitchClass.sharpName(pc) + quality.suffix() + " -> " + result);
        }
        return result;
    }

    /**
     * String-keyed variant. An unknown quality yields {@link Voicing#EMPTY}; an unknown voicing
     * type falls back to close position.
     */
    public Voicing voice(int root, String qualityKey, String typeKey, Voicing previous,
                         int octaveOffset, Integer previousRoot) {
        Optional<ChordQuality> quality = ChordQuality.fromKey(qualityKey);
        if (quality.isEmpty()) {
            LOG.warning("Unknown chord quality '" + qualityKey + "', nothing voiced");
            return Voicing.EMPTY;
        }
        VoicingType type = VoicingType.fromKey(typeKey).orElseGet(() -> {
            LOG.warning("Unknown voicing type '" + typeKey + "', using close");
            return VoicingType.CLOSE;
        });
        return voice(root, quality.get(), type, previous, octaveOffset, previousRoot);
    }
}
