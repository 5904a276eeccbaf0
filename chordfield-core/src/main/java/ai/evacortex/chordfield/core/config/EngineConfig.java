/*
 * ChordField — Harmonic Voicing Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chordfield.core.config;

import ai.evacortex.chordfield.core.exceptions.EngineConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Register constants and sizing knobs of the voicing engine, bound from JSON.
 *
 * <p>The bundled defaults live in the classpath resource {@value #DEFAULT_RESOURCE}:</p>
 * <pre>
 *     playable   [28 .. 84]   E1 – C6, every produced note is wrapped into it
 *     defaultCenter 54        F#3, first-chord center
 *     bass       [40 .. 60]   E2 – C4, center 48 (C3)
 *     gravity    [48 .. 66]   C3 – F#4 sweet zone, pulled toward 57 (A3)
 *     openUpper  [48 .. 84]   alto–soprano register of open voicings, center 62 (D4)
 *     maxBassGap 19           octave + fifth between bass and next voice
 * </pre>
 */
public record EngineConfig(
        Range playable,
        int defaultCenter,
        Range bass,
        int bassCenter,
        Range gravity,
        int gravityTarget,
        Range openUpper,
        int openUpperCenter,
        int maxBassGap,
        int recentRootsWindow,
        long gridCacheSize
) {

    public static final String DEFAULT_RESOURCE = "/chordfield-engine.json";

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES);

    /** Inclusive MIDI note range. */
    public record Range(int low, int high) {
        public boolean contains(int note) {
            return note >= low && note <= high;
        }

        @Override
        public String toString() {
            return "[" + low + " .. " + high + "]";
        }
    }

    public EngineConfig {
        requireRange("playable", playable, 12);
        requireRange("bass", bass, 12);
        requireRange("gravity", gravity, 1);
        requireRange("openUpper", openUpper, 12);
        requireCenter("defaultCenter", defaultCenter, playable);
        requireCenter("bassCenter", bassCenter, bass);
        requireCenter("gravityTarget", gravityTarget, gravity);
        requireCenter("openUpperCenter", openUpperCenter, openUpper);
        if (playable.low() < 0 || playable.high() > 127) {
            throw new EngineConfigurationException("playable range " + playable + " exceeds MIDI notes 0..127");
        }
        if (bass.low() < playable.low() || bass.high() > playable.high()) {
            throw new EngineConfigurationException("bass register " + bass + " exceeds playable range " + playable);
        }
        if (maxBassGap < 12) {
            throw new EngineConfigurationException("maxBassGap must be at least one octave, got " + maxBassGap);
        }
        if (recentRootsWindow < 0) {
            throw new EngineConfigurationException("recentRootsWindow must be >= 0, got " + recentRootsWindow);
        }
        if (gridCacheSize <= 0) {
            throw new EngineConfigurationException("gridCacheSize must be positive, got " + gridCacheSize);
        }
    }

    /**
     * Loads the bundled defaults.
     *
     * @throws EngineConfigurationException if the resource is missing or malformed
     */
    public static EngineConfig defaults() {
        try (InputStream in = EngineConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new EngineConfigurationException("resource " + DEFAULT_RESOURCE + " not found on classpath");
            }
            return read(in, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new EngineConfigurationException("failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads a configuration file.
     *
     * @throws EngineConfigurationException if the file is unreadable, malformed or out of bounds
     */
    public static EngineConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new EngineConfigurationException("failed to read " + file, e);
        }
    }

    private static EngineConfig read(InputStream in, String source) throws IOException {
        try {
            EngineConfig config = MAPPER.readValue(in, EngineConfig.class);
            LOG.config(() -> "Loaded engine configuration from " + source + ": " + config);
            return config;
        } catch (JsonMappingException e) {
            // constructor validation failures arrive wrapped by the creator
            for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
                if (t instanceof EngineConfigurationException) throw (EngineConfigurationException) t;
            }
            throw new EngineConfigurationException("malformed configuration in " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    private static void requireRange(String name, Range range, int minSpan) {
        if (range == null) {
            throw new EngineConfigurationException(name + " range is missing");
        }
        if (range.high() - range.low() < minSpan) {
            throw new EngineConfigurationException(name + " range " + range + " must span at least " + minSpan + " semitones");
        }
    }

    private static void requireCenter(String name, int center, Range range) {
        if (!range.contains(center)) {
            throw new EngineConfigurationException(name + " " + center + " lies outside " + range);
        }
    }
}
