package com.spectrace.tg.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads a {@link TraceConfig} from JSON, overlaying the document onto the
 * defaults. Keys left out of the document keep their default values.
 *
 * <pre>{@code
 * {
 *   "strictMode": true,
 *   "excludedStatuses": ["Deprecated"],
 *   "ids": { "prefix": "SPEC", "pattern": "SPEC-[a-z]\\d{3}" }
 * }
 * }</pre>
 */
public final class TraceConfigLoader {
    private static final Logger log = LogManager.getLogger(TraceConfigLoader.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private TraceConfigLoader() {
        // Utility class
    }

    public static TraceConfig load(Path path) throws IOException {
        TraceConfig config = parse(Files.readString(path));
        log.info("Loaded trace configuration from {}", path);
        return config;
    }

    /** Parses a JSON document. Malformed JSON is an {@link IllegalArgumentException}. */
    public static TraceConfig parse(String json) {
        TraceConfig config = new TraceConfig();
        if (json == null || json.isBlank())
            return config;
        try {
            MAPPER.readerForUpdating(config).readValue(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid trace configuration: " + e.getOriginalMessage(), e);
        }
        // Compile eagerly so a bad pattern fails here rather than mid-build
        IdPatterns.of(config);
        return config;
    }
}
