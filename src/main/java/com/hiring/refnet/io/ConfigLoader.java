package com.hiring.refnet.io;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Loads {@link RefNetConfig} from JSON.
 *
 * <p>
 * The classpath resource {@value #DEFAULTS_RESOURCE} carries the shipped
 * defaults. Files loaded with {@link #load(Path)} are merged over those
 * defaults, so missing keys keep their default values.
 */
@Log4j2
public final class ConfigLoader {
    public static final String DEFAULTS_RESOURCE = "refnet-defaults.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigLoader() {
        // Utility class
    }

    /** The shipped defaults, or the built-in values if the resource is absent. */
    public static RefNetConfig defaults() {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath, using built-in defaults", DEFAULTS_RESOURCE);
                return new RefNetConfig();
            }
            return MAPPER.readValue(in, RefNetConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    /** Reads a config file and merges it over {@link #defaults()}. */
    public static RefNetConfig load(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a JSON string and merges it over {@link #defaults()}. */
    public static RefNetConfig parse(String json) throws IOException {
        RefNetConfig config = MAPPER.readerForUpdating(defaults()).readValue(json);
        log.info("Loaded config: {}", config);
        return config.validate();
    }
}
