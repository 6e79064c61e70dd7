package com.linkrank.sim.io;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/** Loads {@link SimulatorSettings} from JSON and validates them. */
@Log4j2
public final class SettingsLoader {
    public static final String DEFAULT_RESOURCE = "simulator.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SettingsLoader() {
    }

    public static SimulatorSettings load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return validated(MAPPER.readValue(in, SimulatorSettings.class), path.toString());
        }
    }

    public static SimulatorSettings parse(String json) {
        try {
            return validated(MAPPER.readValue(json, SimulatorSettings.class), "inline settings");
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed simulator settings", e);
        }
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the built-in
     * defaults when the resource is absent.
     */
    public static SimulatorSettings loadDefault() {
        try (InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.info("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
                return SimulatorSettings.defaults();
            }
            return validated(MAPPER.readValue(in, SimulatorSettings.class), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    private static SimulatorSettings validated(SimulatorSettings settings, String origin) {
        settings.toSolverOptions();
        if (settings.getSemanticThreshold() < 0 || settings.getSemanticThreshold() > 1)
            throw new IllegalArgumentException("semanticThreshold must be in [0, 1]: " + settings.getSemanticThreshold());
        if (settings.getPreviewCount() < 0)
            throw new IllegalArgumentException("previewCount must be >= 0: " + settings.getPreviewCount());
        log.debug("Loaded settings from {}: {}", origin, settings);
        return settings;
    }
}
