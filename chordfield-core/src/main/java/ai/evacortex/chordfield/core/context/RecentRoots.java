/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.context;

import ai.evacortex.chordfield.core.theory.PitchClass;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

final class RecentRoots {

    private RecentRoots() {
    }

    /** Null-tolerant pitch-class set; {@code null} elements are skipped. */
    static Set<Integer> normalize(Collection<Integer> roots) {
        if (roots == null || roots.isEmpty()) return Collections.emptySet();
        Set<Integer> set = new HashSet<>();
        for (Integer r : roots) {
            if (r != null) set.add(PitchClass.of(r));
        }
        return set;
    }
}
