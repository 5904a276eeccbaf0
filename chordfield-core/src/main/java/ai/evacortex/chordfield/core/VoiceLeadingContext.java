/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core;

import ai.evacortex.chordfield.core.theory.PitchClass;

import java.util.Objects;

/**
 * Caller-owned memory of the last accepted chord: its voicing and root.
 *
 * <p>One instance per independent voice of the instrument. Only the code path that produced a
 * voicing updates it, and only after that voicing was accepted. Not thread-safe.</p>
 */
public final class VoiceLeadingContext {

    private Voicing previousVoicing = Voicing.EMPTY;
    private Integer previousRoot;

    public Voicing previousVoicing() {
        return previousVoicing;
    }

    /**
     * Root of the previous chord, or {@code null} when voice leading starts from scratch.
     */
    public Integer previousRoot() {
        return previousRoot;
    }

    public boolean isEmpty() {
        return previousVoicing.isEmpty();
    }

    /**
     * Records an accepted voicing. Empty voicings are ignored so a failed lookup never wipes
     * the running context.
     */
    public void accept(Voicing voicing, int root) {
        Objects.requireNonNull(voicing, "voicing must not be null");
        if (voicing.isEmpty()) return;
        this.previousVoicing = voicing;
        this.previousRoot = PitchClass.of(root);
    }

    /** Restarts voice leading, e.g. after a manual key change. */
    public void reset() {
        this.previousVoicing = Voicing.EMPTY;
        this.previousRoot = null;
    }

    @Override
    public String toString() {
        return "VoiceLeadingContext{previous=" + previousVoicing + ", root=" + previousRoot + "}";
    }
}
