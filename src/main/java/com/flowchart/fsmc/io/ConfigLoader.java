package com.flowchart.fsmc.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowchart.fsmc.CompilerConfig;

import lombok.extern.log4j.Log4j2;

/**
 * Reads {@link CompilerConfig} from JSON. Unknown properties are ignored and
 * absent ones keep their defaults.
 */
@Log4j2
public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigLoader() {
    }

    /**
     * Loads and validates a configuration file. A missing file yields the defaults.
     *
     * @throws IOException if the file exists but is not valid JSON for the config
     * @throws IllegalArgumentException if the configured values are invalid
     */
    public static CompilerConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            log.debug("No configuration at {}, using defaults", path);
            return new CompilerConfig();
        }
        return parse(Files.readString(path));
    }

    public static CompilerConfig parse(String json) throws IOException {
        CompilerConfig config = MAPPER.readValue(json, CompilerConfig.class);
        if (config == null)
            throw new IOException("Configuration is empty");
        return config.validate();
    }
}
