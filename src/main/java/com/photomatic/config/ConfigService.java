package com.photomatic.config;

import com.photomatic.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central entry point for resolving configuration values with overrides and persisted preferences.
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    static final String LAYOUT_PROPERTY = "photomatic.layout";
    static final String FAILURE_LOG_PROPERTY = "failureLog";
    private static final String PREF_KEY_OPEN_DIR = "open.dir";
    private static final String PREF_KEY_EXPORT_DIR = "export.dir";

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;
    private volatile LayoutSettings layoutSettings;

    ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public LayoutSettings getLayoutSettings() {
        LayoutSettings current = layoutSettings;
        if (current == null) {
            current = resolveLayoutSettings();
            layoutSettings = current;
        }
        return current;
    }

    public Path getFailureLogFile() {
        String override = System.getProperty(FAILURE_LOG_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override);
        }
        return Paths.get("target", "photomatic-failures.csv");
    }

    public Path getOpenDirectory() {
        return preferences.getPath(PREF_KEY_OPEN_DIR).orElseGet(ConfigService::userHome);
    }

    public void setOpenDirectory(Path directory) {
        if (directory == null) return;
        preferences.putPath(PREF_KEY_OPEN_DIR, directory);
    }

    public Path getExportDirectory() {
        return preferences.getPath(PREF_KEY_EXPORT_DIR).orElseGet(this::getOpenDirectory);
    }

    public void setExportDirectory(Path directory) {
        if (directory == null) return;
        preferences.putPath(PREF_KEY_EXPORT_DIR, directory);
    }

    private LayoutSettings resolveLayoutSettings() {
        String override = System.getProperty(LAYOUT_PROPERTY);
        try {
            if (override != null && !override.isBlank()) {
                Path file = Paths.get(override);
                if (Files.isRegularFile(file)) {
                    LOGGER.info("Using layout settings from " + file.toAbsolutePath());
                    return LayoutSettings.load(file);
                }
                LOGGER.warning("Layout file not found, using bundled settings: " + file.toAbsolutePath());
            }
            return LayoutSettings.loadClasspath(ConfigService.class.getClassLoader());
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.log(Level.WARNING, "Falling back to default layout settings", e);
            return LayoutSettings.defaults();
        }
    }

    private static Path userHome() {
        return Paths.get(System.getProperty("user.home"));
    }
}
