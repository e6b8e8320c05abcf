package com.tscan.server.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads {@link ScanConfig}: classpath defaults from {@code /scan_config.json},
 * then an optional user file read over them. Keys missing from the user file
 * keep their default.
 */
public class ScanConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ScanConfigLoader.class);

    public static final String RESOURCE = "/scan_config.json";
    public static final String CONFIG_FILE_PROPERTY = "scan.config.file";
    public static final String USER_FILE_NAME = "scan_config.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Defaults, overridden by the file named in {@code scan.config.file} or,
     * without that property, by {@code scan_config.json} in the data directory.
     */
    public static ScanConfig load() {
        ScanConfig config = loadDefaults();
        Path userFile = resolveUserFile(config);
        if (userFile != null) {
            try {
                config = overlay(config, userFile);
                logger.info("Loaded user configuration from {}", userFile);
            } catch (IOException e) {
                logger.warn("Ignoring unreadable configuration {}: {}", userFile, e.getMessage());
            }
        }
        return config;
    }

    public static ScanConfig loadDefaults() {
        try (InputStream is = ScanConfigLoader.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using built-in defaults", RESOURCE);
                return new ScanConfig();
            }
            return mapper.readValue(is, ScanConfig.class);
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", RESOURCE, e.getMessage());
            return new ScanConfig();
        }
    }

    /**
     * Reads {@code file} over {@code base} in place and returns it.
     */
    public static ScanConfig overlay(ScanConfig base, Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file)) {
            return mapper.readerForUpdating(base).readValue(is);
        }
    }

    private static Path resolveUserFile(ScanConfig defaults) {
        String explicit = System.getProperty(CONFIG_FILE_PROPERTY);
        if (explicit != null && !explicit.isEmpty()) {
            Path p = Paths.get(explicit);
            if (!Files.isRegularFile(p)) {
                logger.warn("Configuration file {} does not exist", p);
                return null;
            }
            return p;
        }
        Path inDataDir = Paths.get(DataPathResolver.resolveDataDirectory(defaults), USER_FILE_NAME);
        return Files.isRegularFile(inDataDir) ? inDataDir : null;
    }
}
