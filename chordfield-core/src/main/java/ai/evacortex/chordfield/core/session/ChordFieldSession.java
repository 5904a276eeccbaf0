/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.session;

import ai.evacortex.chordfield.core.ChordFieldEngine;
import ai.evacortex.chordfield.core.DefaultChordFieldEngine;
import ai.evacortex.chordfield.core.VoiceLeadingContext;
import ai.evacortex.chordfield.core.Voicing;
import ai.evacortex.chordfield.core.chord.ChordDescriptor;
import ai.evacortex.chordfield.core.chord.ChordNames;
import ai.evacortex.chordfield.core.chord.GridChordResolver;
import ai.evacortex.chordfield.core.context.ContextChord;
import ai.evacortex.chordfield.core.context.GlowGrid;
import ai.evacortex.chordfield.core.context.Suggestions;
import ai.evacortex.chordfield.core.modulation.ModulationResult;
import ai.evacortex.chordfield.core.theory.Mode;
import ai.evacortex.chordfield.core.theory.PitchClass;
import ai.evacortex.chordfield.core.theory.VoicingType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Performance state of one chord-field surface.
 *
 * <p>A session turns pad presses into voicings through a shared {@link ChordFieldEngine} and
 * owns everything that changes between presses: the selected key, mode and voicing type, the
 * octave offset, the root rotation, the voice-leading context and the last chords played.</p>
 *
 * <p>Manual key and mode changes restart voice leading. A key change found by auto-modulation
 * does not, so the performer hears no jump. Not thread-safe: one writer per surface.</p>
 */
public final class ChordFieldSession {

    private static final Logger LOG = Logger.getLogger(ChordFieldSession.class.getName());

    public static final int MIN_OCTAVE_OFFSET = -2;
    public static final int MAX_OCTAVE_OFFSET = 2;

    private final ChordFieldEngine engine;
    private final int recentRootsWindow;
    private final VoiceLeadingContext context = new VoiceLeadingContext();
    private final Deque<Integer> recentRoots = new ArrayDeque<>();

    private int key;
    private Mode mode = Mode.IONIAN;
    private VoicingType voicingType = VoicingType.CLOSE;
    private int octaveOffset;
    private int rootRotation;
    private Integer chromaticOverride;
    private boolean autoModulation = true;

    private ChordDescriptor previousChord;
    private GlowGrid glow = GlowGrid.DARK;

    public ChordFieldSession(DefaultChordFieldEngine engine) {
        this(engine, engine.config().recentRootsWindow());
    }

    public ChordFieldSession(ChordFieldEngine engine, int recentRootsWindow) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        if (recentRootsWindow < 0) {
            throw new IllegalArgumentException("recentRootsWindow must be >= 0, got " + recentRootsWindow);
        }
        this.recentRootsWindow = recentRootsWindow;
    }

    /**
     * Chord under a pad with the current root rotation applied to the diatonic columns.
     */
    public ChordDescriptor padChord(int row, int column) {
        GridChordResolver.checkPosition(row, column);
        int effective = column < GridChordResolver.CHROMATIC_COLUMN
                ? (column + rootRotation) % Mode.DEGREES
                : column;
        return engine.getGridChord(row, effective, key, mode, chromaticOverride);
    }

    /**
     * Presses a pad: voices its chord against the running context and, when a voicing comes
     * back, accepts it and checks the last two chords for a modulation.
     */
    public PadTrigger trigger(int row, int column) {
        ChordDescriptor chord = padChord(row, column);
        Voicing voicing = engine.voiceChord(chord.root(), chord.quality(), voicingType,
                context.previousVoicing(), octaveOffset, context.previousRoot());
        if (voicing.isEmpty()) {
            return new PadTrigger(chord, voicing, Optional.empty());
        }

        context.accept(voicing, chord.root());
        remember(chord.root());

        Optional<ModulationResult> modulation = previousChord == null
                ? Optional.empty()
                : engine.detectModulation(previousChord.root(), previousChord.quality(),
                        chord.root(), chord.quality(), key, mode);
        previousChord = chord;

        if (modulation.isPresent() && autoModulation) {
            ModulationResult m = modulation.get();
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Auto-modulating to " + ChordNames.keyName(m.newKey()) + " " + m.suggestedMode().label());
            }
            key = m.newKey();
            mode = m.suggestedMode();
        }

        glow = engine.computeGlowGrid(pitchClasses(voicing), key, mode, null);
        return new PadTrigger(chord, voicing, modulation);
    }

    /**
     * Suggestions around the last played chord, empty before the first press.
     */
    public Optional<Suggestions> suggestions() {
        if (previousChord == null) return Optional.empty();
        return Optional.of(engine.computeSuggestions(previousChord.root(), previousChord.quality(),
                key, mode, recentRoots()));
    }

    /**
     * Context pads around the last played chord, empty before the first press.
     */
    public List<ContextChord> contextChords() {
        if (previousChord == null) return Collections.emptyList();
        return engine.computeContextChords(previousChord.root(), previousChord.quality(), key, mode);
    }

    public void setKey(int key) {
        this.key = PitchClass.of(key);
        restart();
    }

    public void setMode(Mode mode) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        restart();
    }

    /** Moves one step darker ({@code +1}) or brighter ({@code -1}), wrapping around. */
    public void cycleMode(int direction) {
        setMode(mode.cycle(direction));
    }

    public void setVoicingType(VoicingType voicingType) {
        this.voicingType = Objects.requireNonNull(voicingType, "voicingType must not be null");
    }

    /** Sets the octave offset, clamped to [{@value #MIN_OCTAVE_OFFSET}, {@value #MAX_OCTAVE_OFFSET}]. */
    public void setOctaveOffset(int octaveOffset) {
        this.octaveOffset = Math.max(MIN_OCTAVE_OFFSET, Math.min(MAX_OCTAVE_OFFSET, octaveOffset));
    }

    public void shiftOctave(int delta) {
        setOctaveOffset(octaveOffset + delta);
    }

    /** Advances the circle-of-fourths rotation of the diatonic columns by one degree. */
    public void rotateRoots() {
        setRootRotation(rootRotation + 1);
    }

    public void setRootRotation(int rotation) {
        this.rootRotation = Math.floorMod(rotation, Mode.DEGREES);
        glow = GlowGrid.DARK;
    }

    /**
     * @param chromaticOverride root of the chromatic column, {@code null} for ♭II
     */
    public void setChromaticOverride(Integer chromaticOverride) {
        this.chromaticOverride = chromaticOverride == null ? null : PitchClass.of(chromaticOverride);
        glow = GlowGrid.DARK;
    }

    public void setAutoModulation(boolean autoModulation) {
        this.autoModulation = autoModulation;
    }

    private void restart() {
        context.reset();
        glow = GlowGrid.DARK;
    }

    private void remember(int root) {
        if (recentRootsWindow == 0) return;
        recentRoots.addLast(PitchClass.of(root));
        while (recentRoots.size() > recentRootsWindow) {
            recentRoots.removeFirst();
        }
    }

    private static int[] pitchClasses(Voicing voicing) {
        int[] pcs = new int[voicing.size()];
        for (int i = 0; i < pcs.length; i++) pcs[i] = PitchClass.of(voicing.note(i));
        return pcs;
    }

    public int key() {
        return key;
    }

    public Mode mode() {
        return mode;
    }

    public VoicingType voicingType() {
        return voicingType;
    }

    public int octaveOffset() {
        return octaveOffset;
    }

    public int rootRotation() {
        return rootRotation;
    }

    public Integer chromaticOverride() {
        return chromaticOverride;
    }

    public boolean autoModulation() {
        return autoModulation;
    }

    public VoiceLeadingContext context() {
        return context;
    }

    public List<Integer> recentRoots() {
        return Collections.unmodifiableList(new ArrayList<>(recentRoots));
    }

    public Optional<ChordDescriptor> previousChord() {
        return Optional.ofNullable(previousChord);
    }

    public GlowGrid glow() {
        return glow;
    }
}
