/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.exceptions;

public class InvalidGridPositionException extends RuntimeException {
    public InvalidGridPositionException(int row, int column) {
        super("Invalid grid position: row=" + row + ", column=" + column + " (expected 0..7)");
    }
}
