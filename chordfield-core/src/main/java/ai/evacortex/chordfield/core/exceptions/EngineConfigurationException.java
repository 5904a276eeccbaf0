/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.exceptions;

public class EngineConfigurationException extends RuntimeException {
    public EngineConfigurationException(String message) {
        super("Invalid engine configuration: " + message);
    }

    public EngineConfigurationException(String message, Throwable cause) {
        super("Invalid engine configuration: " + message, cause);
    }
}
