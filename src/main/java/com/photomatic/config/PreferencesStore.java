package com.photomatic.config;

import java.nio.file.Path;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Lightweight wrapper around {@link Preferences} so the desktop shell can remember where the
 * user last opened and saved photos.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/photomatic";

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    static PreferencesStore forNode(Preferences node) {
        return new PreferencesStore(node);
    }

    public Optional<Path> getPath(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Path.of(value));
    }

    public void putPath(String key, Path path) {
        if (key == null || key.isBlank() || path == null) return;
        delegate.put(key, path.toString());
        flushQuietly();
    }

    private void flushQuietly() {
        try {
            delegate.flush();
        } catch (BackingStoreException ignored) {
            // values stay cached in memory until the next successful flush
        }
    }
}
