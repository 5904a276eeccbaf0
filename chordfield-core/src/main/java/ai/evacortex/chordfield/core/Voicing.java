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

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * One sounding chord: MIDI note numbers in ascending order.
 *
 * <p>Instances are immutable; {@link #notes()} hands out a copy. The caller that receives a
 * voicing owns it and keeps it as the previous voicing for the next call when continuity is
 * wanted.</p>
 */
public final class Voicing {

    public static final Voicing EMPTY = new Voicing(new int[0]);

    private final int[] notes;

    private Voicing(int[] notes) {
        this.notes = notes;
    }

    /**
     * Creates a voicing from arbitrary notes; they are copied and sorted.
     */
    public static Voicing of(int... notes) {
        if (notes == null || notes.length == 0) return EMPTY;
        int[] copy = notes.clone();
        Arrays.sort(copy);
        return new Voicing(copy);
    }

    public int[] notes() {
        return notes.clone();
    }

    public int size() {
        return notes.length;
    }

    public boolean isEmpty() {
        return notes.length == 0;
    }

    public int note(int index) {
        return notes[index];
    }

    /** Lowest note. */
    public int bass() {
        if (isEmpty()) throw new IllegalStateException("Empty voicing has no bass");
        return notes[0];
    }

    /** Highest note. */
    public int soprano() {
        if (isEmpty()) throw new IllegalStateException("Empty voicing has no soprano");
        return notes[notes.length - 1];
    }

    public boolean contains(int midiNote) {
        return Arrays.binarySearch(notes, midiNote) >= 0;
    }

    /** Distinct pitch classes, bass upward. */
    public Set<Integer> pitchClasses() {
        Set<Integer> pcs = new LinkedHashSet<>();
        for (int n : notes) pcs.add(PitchClass.of(n));
        return pcs;
    }

    public double centroid() {
        if (isEmpty()) return Double.NaN;
        return PitchClass.mean(notes);
    }

    public boolean isStrictlyAscending() {
        for (int i = 1; i < notes.length; i++) {
            if (notes[i] <= notes[i - 1]) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Voicing)) return false;
        return Arrays.equals(notes, ((Voicing) o).notes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(notes);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(" ", "[", "]");
        for (int n : notes) joiner.add(PitchClass.midiToNoteName(n) + "(" + n + ")");
        return joiner.toString();
    }
}
