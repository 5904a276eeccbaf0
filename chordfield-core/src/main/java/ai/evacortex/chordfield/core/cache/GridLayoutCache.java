/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.cache;

import ai.evacortex.chordfield.core.chord.GridLayout;
import ai.evacortex.chordfield.core.theory.Mode;
import ai.evacortex.chordfield.core.theory.PitchClass;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.Objects;

/**
 * Memoizes the 64-cell grid per (key, mode, chromatic override). The renderer asks for every
 * cell on each redraw and the glow computation walks the whole grid per chord change, while
 * the layout only changes with key, mode or override.
 */
public class GridLayoutCache {

    /* null override = default ♭II column */
    private record Key(int key, Mode mode, Integer chromaticOverride) {}

    private final LoadingCache<Key, GridLayout> cache;

    public GridLayoutCache(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build(k -> GridLayout.build(k.key(), k.mode(), k.chromaticOverride()));
    }

    public GridLayout get(int key, Mode mode, Integer chromaticOverride) {
        Objects.requireNonNull(mode, "mode must not be null");
        Integer override = chromaticOverride == null ? null : PitchClass.of(chromaticOverride);
        return cache.get(new Key(PitchClass.of(key), mode, override));
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long missCount() {
        return cache.stats().missCount();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
