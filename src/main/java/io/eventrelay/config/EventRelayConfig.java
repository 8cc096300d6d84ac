package io.eventrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class EventRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "eventrelay-settings.json";

    private final Path rootDir;

    public EventRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static EventRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new EventRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("eventrelay.db");
    }

    public Path socketFile() {
        return rootDir.resolve("daemon.sock");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
