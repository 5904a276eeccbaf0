/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.leading;

/**
 * {@code VoiceLeader} moves a set of voices from one chord to the next.
 *
 * <p>Given the pitch classes of the new chord and the MIDI notes of the previous voicing, an
 * implementation decides which absolute note each previous voice moves to. The contract:</p>
 * <ul>
 *     <li>every previous voice yields exactly one note; voices are never dropped</li>
 *     <li>target pitch classes left over once every previous voice is assigned are still
 *         placed, so the result may grow</li>
 *     <li>the result is sorted ascending</li>
 *     <li>the computation is deterministic and free of side effects</li>
 * </ul>
 *
 * @see NaturalVoiceLeader
 */
public interface VoiceLeader {

    /**
     * Leads the previous voices onto the target pitch classes.
     *
     * @param targetPitchClasses pitch classes of the new chord (duplicates are ignored, order is
     *                           the tie-break order)
     * @param previous           previous voicing, any order; may be empty
     * @param previousRoot       root pitch class of the previous chord, used to spot tendency tones
     * @return MIDI notes of the new voices, ascending
     * @throws NullPointerException if either array is {@code null}
     */
    int[] lead(int[] targetPitchClasses, int[] previous, int previousRoot);
}
