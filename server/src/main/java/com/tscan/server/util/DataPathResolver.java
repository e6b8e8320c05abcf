package com.tscan.server.util;

import java.io.File;

public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "scan.data.dir";
    public static final String DB_FILE_NAME = "scan_candidates.sqlite";
    public static final String LEGACY_JSON_FILE_NAME = "scan_candidates.json";

    public static String resolveDataDirectory(ScanConfig config) {
        // 1. System property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Config
        if (config != null && config.dataDirectory != null && !config.dataDirectory.isEmpty()) {
            return config.dataDirectory;
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath(ScanConfig config) {
        return resolveDataDirectory(config) + File.separator + DB_FILE_NAME;
    }

    public static String resolveLegacyJsonPath(ScanConfig config) {
        return resolveDataDirectory(config) + File.separator + LEGACY_JSON_FILE_NAME;
    }
}
