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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GridLayoutCacheTest {

    @Test
    void repeatedLookup_hitsCache() {
        GridLayoutCache cache = new GridLayoutCache(16);
        GridLayout first = cache.get(0, Mode.IONIAN, null);
        GridLayout second = cache.get(0, Mode.IONIAN, null);
        assertSame(first, second, "same key must return the memoized layout");
        assertEquals(1, cache.missCount());
        assertEquals(1, cache.hitCount());
    }

    @Test
    void keyAndOverride_areNormalized() {
        GridLayoutCache cache = new GridLayoutCache(16);
        GridLayout a = cache.get(2, Mode.DORIAN, 3);
        GridLayout b = cache.get(14, Mode.DORIAN, 15);
        assertSame(a, b, "keys differing by octaves must share an entry");
    }

    @Test
    void distinctKeys_buildDistinctLayouts() {
        GridLayoutCache cache = new GridLayoutCache(16);
        GridLayout ionian = cache.get(0, Mode.IONIAN, null);
        GridLayout aeolian = cache.get(0, Mode.AEOLIAN, null);
        GridLayout overridden = cache.get(0, Mode.IONIAN, 6);
        assertNotSame(ionian, aeolian);
        assertNotSame(ionian, overridden, "a chromatic override is part of the key");
        assertEquals(6, overridden.chordAt(0, 7).root());
        assertEquals(1, ionian.chordAt(0, 7).root(), "default chromatic column is bII");
        assertEquals(3, cache.missCount());
    }

    @Test
    void invalidateAll_forcesRebuild() {
        GridLayoutCache cache = new GridLayoutCache(16);
        GridLayout before = cache.get(5, Mode.LYDIAN, null);
        cache.invalidateAll();
        GridLayout after = cache.get(5, Mode.LYDIAN, null);
        assertNotSame(before, after);
        assertEquals(before.chordAt(3, 3), after.chordAt(3, 3), "rebuilt layout must be equal in content");
    }

    @Test
    void nullMode_isRejected() {
        GridLayoutCache cache = new GridLayoutCache(16);
        assertThrows(NullPointerException.class, () -> cache.get(0, null, null));
    }
}
