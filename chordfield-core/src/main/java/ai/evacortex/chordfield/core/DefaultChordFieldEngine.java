/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core;

import ai.evacortex.chordfield.core.cache.GridLayoutCache;
import ai.evacortex.chordfield.core.chord.ChordDescriptor;
import ai.evacortex.chordfield.core.chord.GridChordResolver;
import ai.evacortex.chordfield.core.config.EngineConfig;
import ai.evacortex.chordfield.core.context.BorrowedChord;
import ai.evacortex.chordfield.core.context.ContextChord;
import ai.evacortex.chordfield.core.context.ContextChordGenerator;
import ai.evacortex.chordfield.core.context.GlowGrid;
import ai.evacortex.chordfield.core.context.HarmonicContextAnalyzer;
import ai.evacortex.chordfield.core.context.HarmonicMove;
import ai.evacortex.chordfield.core.context.NeoRiemannianSet;
import ai.evacortex.chordfield.core.context.RingChord;
import ai.evacortex.chordfield.core.context.SuggestionGenerator;
import ai.evacortex.chordfield.core.context.Suggestions;
import ai.evacortex.chordfield.core.modulation.ModulationDetector;
import ai.evacortex.chordfield.core.modulation.ModulationResult;
import ai.evacortex.chordfield.core.theory.ChordQuality;
import ai.evacortex.chordfield.core.theory.Mode;
import ai.evacortex.chordfield.core.theory.VoicingType;
import ai.evacortex.chordfield.core.voicing.VoicingEngine;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Default {@link ChordFieldEngine}. Holds the configuration, the grid cache and the stateless
 * collaborators; safe to share between threads.
 */
public final class DefaultChordFieldEngine implements ChordFieldEngine {

    private static final Logger LOG = Logger.getLogger(DefaultChordFieldEngine.class.getName());

    private final EngineConfig config;
    private final GridLayoutCache grids;
    private final VoicingEngine voicing;
    private final HarmonicContextAnalyzer analyzer;
    private final SuggestionGenerator suggestions;
    private final ContextChordGenerator contextChords;
    private final ModulationDetector modulation;

    public DefaultChordFieldEngine() {
        this(EngineConfig.defaults());
    }

    public DefaultChordFieldEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.grids = new GridLayoutCache(config.gridCacheSize());
        this.voicing = new VoicingEngine(config);
        this.analyzer = new HarmonicContextAnalyzer(grids);
        this.suggestions = new SuggestionGenerator();
        this.contextChords = new ContextChordGenerator();
        this.modulation = new ModulationDetector();
    }

    public EngineConfig config() {
        return config;
    }

    GridLayoutCache grids() {
        return grids;
    }

    @Override
    public Voicing voiceChord(int root, ChordQuality quality, VoicingType type, Voicing previous,
                              int octaveOffset, Integer previousRoot) {
        return voicing.voice(root, quality, type, previous, octaveOffset, previousRoot);
    }

    @Override
    public Voicing voiceChord(int root, String qualityKey, String voicingTypeKey, Voicing previous,
                              int octaveOffset, Integer previousRoot) {
        return voicing.voice(root, qualityKey, voicingTypeKey, previous, octaveOffset, previousRoot);
    }

    @Override
    public ChordDescriptor getGridChord(int row, int column, int key, Mode mode, Integer chromaticOverride) {
        return grids.get(key, mode, chromaticOverride).chordAt(row, column);
    }

    @Override
    public int[] columnRoots(int key, Mode mode, Integer chromaticOverride) {
        return GridChordResolver.columnRoots(key, mode, chromaticOverride);
    }

    @Override
    public int[] pitchClassesOf(int root, String qualityKey) {
        ChordQuality quality = ChordQuality.fromKey(qualityKey).orElseGet(() -> {
            LOG.warning("Unknown chord quality '" + qualityKey + "', using major triad");
            return ChordQuality.MAJ;
        });
        return quality.pitchClasses(root);
    }

    @Override
    public int computeSharedNotes(int[] pitchClassesA, int[] pitchClassesB) {
        return HarmonicContextAnalyzer.computeSharedNotes(pitchClassesA, pitchClassesB);
    }

    @Override
    public GlowGrid computeGlowGrid(int[] reference, int key, Mode mode, Integer chromaticOverride) {
        return analyzer.computeGlowGrid(reference, key, mode, chromaticOverride);
    }

    @Override
    public Suggestions computeSuggestions(int currentRoot, ChordQuality currentQuality, int key, Mode mode,
                                          Collection<Integer> recentRoots) {
        return suggestions.compute(currentRoot, currentQuality, key, mode, recentRoots);
    }

    @Override
    public List<ContextChord> computeContextChords(int currentRoot, ChordQuality currentQuality, int key, Mode mode) {
        return contextChords.compute(currentRoot, currentQuality, key, mode);
    }

    @Override
    public Optional<ModulationResult> detectModulation(int previousRoot, ChordQuality previousQuality,
                                                       int currentRoot, ChordQuality currentQuality,
                                                       int currentKey, Mode mode) {
        return modulation.detect(previousRoot, previousQuality, currentRoot, currentQuality, currentKey, mode);
    }

    @Override
    public HarmonicMove secondaryDominant(int targetRoot) {
        return HarmonicContextAnalyzer.secondaryDominant(targetRoot);
    }

    @Override
    public HarmonicMove tritoneSubstitution(int dominantRoot) {
        return HarmonicContextAnalyzer.tritoneSubstitution(dominantRoot);
    }

    @Override
    public List<BorrowedChord> modalInterchange(int key, Mode mode) {
        return HarmonicContextAnalyzer.modalInterchange(key, mode);
    }

    @Override
    public List<HarmonicMove> chromaticMediants(int root) {
        return HarmonicContextAnalyzer.chromaticMediants(root);
    }

    @Override
    public NeoRiemannianSet neoRiemannian(int root, ChordQuality quality) {
        return HarmonicContextAnalyzer.neoRiemannian(root, quality);
    }

    @Override
    public int diatonicDegree(int pitchClass, int key, Mode mode) {
        return Objects.requireNonNull(mode, "mode must not be null").degreeOf(pitchClass, key);
    }

    @Override
    public boolean isRootDiatonic(int root, int key, Mode mode) {
        return diatonicDegree(root, key, mode) >= 0;
    }

    @Override
    public ChordQuality defaultQuality(int root, int key, Mode mode) {
        return Objects.requireNonNull(mode, "mode must not be null").defaultQuality(root, key);
    }

    @Override
    public List<RingChord> circleOfFifths(int key, Mode mode) {
        return HarmonicContextAnalyzer.circleOfFifths(key, mode);
    }
}
