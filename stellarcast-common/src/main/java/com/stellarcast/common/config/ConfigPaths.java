package com.stellarcast.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * State directory layout: {@code <state>/data} holds durable files,
 * {@code <state>/cache} holds files that may be evicted at any time.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    private static final String STATE_DIRNAME = ".stellarcast";
    private static final String CONFIG_FILENAME = "config.json";

    public static final String TASK_CONFIG_FILENAME = "apod_task_config.json";
    public static final String PICTURE_CACHE_FILENAME = "apod.json";
    public static final String COMPOSED_CACHE_FILENAME = "apod_infopuzzle.png";

    /**
     * State directory. Can be overridden via STELLARCAST_STATE_DIR.
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), System.getProperty("user.home"));
    }

    public static Path resolveStateDir(Map<String, String> env, String homeDir) {
        String override = env.get("STELLARCAST_STATE_DIR");
        if (override != null && !override.isBlank()) {
            return resolveUserPath(override.trim(), homeDir);
        }
        return Path.of(homeDir, STATE_DIRNAME);
    }

    public static Path resolveConfigPath(Path stateDir) {
        return stateDir.resolve(CONFIG_FILENAME);
    }

    public static Path dataDir(Path stateDir) {
        return stateDir.resolve("data");
    }

    public static Path cacheDir(Path stateDir) {
        return stateDir.resolve("cache");
    }

    /**
     * Expand a leading {@code ~} to the home directory.
     */
    public static Path resolveUserPath(String raw, String homeDir) {
        if (raw.equals("~")) {
            return Path.of(homeDir);
        }
        if (raw.startsWith("~/")) {
            return Path.of(homeDir, raw.substring(2));
        }
        return Path.of(raw);
    }
}
