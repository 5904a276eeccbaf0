/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.theory;

import java.util.Optional;

/**
 * Voicing styles offered by the instrument, in side-button order.
 */
public enum VoicingType {
    CLOSE("close", "Close"),
    DROP2("drop2", "Drop 2"),
    DROP3("drop3", "Drop 3"),
    OPEN("open", "Open"),
    ROOTLESS_A("rootlessA", "Rootless A"),
    ROOTLESS_B("rootlessB", "Rootless B"),
    QUARTAL("quartal", "Quartal"),
    TRIAD("triad", "Triad");

    private final String key;
    private final String label;

    VoicingType(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public static Optional<VoicingType> fromKey(String key) {
        for (VoicingType t : values()) {
            if (t.key.equals(key)) return Optional.of(t);
        }
        return Optional.empty();
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }
}
