package com.notibag.sender;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Per-user sender settings read from {@code ~/.notibag/config.json}:
 *
 * {"host": "http://notibag.local:8080"}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class SenderConfig {

    public static final String DEFAULT_HOST = "http://localhost:8080";

    private String host = DEFAULT_HOST;

    public static Path defaultLocation() {
        return Paths.get(System.getProperty("user.home"), ".notibag", "config.json");
    }

    /**
     * Loads the config file, or returns the defaults when it does not exist.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static SenderConfig load(Path path, ObjectMapper objectMapper) throws IOException {
        if (!Files.exists(path)) {
            log.debug("No sender config at {}, using defaults", path);
            return new SenderConfig();
        }
        SenderConfig config = objectMapper.readValue(path.toFile(), SenderConfig.class);
        if (config.getHost() == null || config.getHost().isBlank()) {
            config.setHost(DEFAULT_HOST);
        }
        return config;
    }
}
