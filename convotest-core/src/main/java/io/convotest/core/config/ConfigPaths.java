package io.convotest.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    static final String HOME_ENV = "CONVOTEST_HOME";
    private static final String HOME_DIR = ".convotest";

    private ConfigPaths() {
    }

    public static Path home() {
        return home(System.getenv());
    }

    static Path home(Map<String, String> env) {
        String override = env.get(HOME_ENV);
        if (override != null && !override.isBlank()) {
            return expandUser(override.trim());
        }
        return userHome().resolve(HOME_DIR);
    }

    public static Path defaultConfigPath() {
        return home().resolve("config.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return home().resolve("workspace");
        }
        return expandUser(rawPath.trim());
    }

    static Path expandUser(String rawPath) {
        if (rawPath.equals("~")) {
            return userHome();
        }
        if (rawPath.startsWith("~/")) {
            return userHome().resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    private static Path userHome() {
        return Path.of(System.getProperty("user.home"));
    }
}
