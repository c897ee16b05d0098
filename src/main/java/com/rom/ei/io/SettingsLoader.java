package com.rom.ei.io;

import com.rom.ei.api.InvalidConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@link InterpolationSettings} from JSON.
 */
public final class SettingsLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SettingsLoader() {
        // Utility class
    }

    /** Parses a settings file. */
    public static InterpolationSettings load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return validate(MAPPER.readValue(in, InterpolationSettings.class));
        }
    }

    /** Parses a classpath resource. */
    public static InterpolationSettings loadResource(String resource) throws IOException {
        try (InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Settings resource not found: " + resource);
            return validate(MAPPER.readValue(in, InterpolationSettings.class));
        }
    }

    /**
     * Parses a JSON string.
     *
     * @throws InvalidConfigurationException if the JSON is malformed or the
     *                                       options are invalid.
     */
    public static InterpolationSettings parse(String json) {
        try {
            return validate(MAPPER.readValue(json, InterpolationSettings.class));
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException("Malformed settings JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String toJson(InterpolationSettings settings) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize settings", e);
        }
    }

    // fail on load rather than at first use
    private static InterpolationSettings validate(InterpolationSettings s) {
        switch (s.algorithmType()) {
            case EI_GREEDY -> s.toEiGreedyConfig();
            case DEIM -> s.toDeimConfig();
        }
        return s;
    }
}
