package com.photomatic.config;

import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Canvas geometry and encoding constants used by ingestion, compositing and export.
 * Values are read from a JSON document; any key that is absent keeps its default.
 */
public record LayoutSettings(int canvasWidth,
                             int canvasHeight,
                             int margin,
                             int overlayMargin,
                             int cornerRadius,
                             int overlayTextOffset,
                             int overlayFontSize,
                             float glowAlpha,
                             double glowSpread,
                             float thumbnailQuality,
                             float exportQuality,
                             int workingCanvasSize) {

    static final String CLASSPATH_RESOURCE = "photomatic-layout.json";

    public LayoutSettings {
        if (canvasWidth <= 0 || canvasHeight <= 0) {
            throw new IllegalArgumentException("Canvas size must be positive: " + canvasWidth + "x" + canvasHeight);
        }
        if (margin < 0 || overlayMargin < 0 || cornerRadius < 0) {
            throw new IllegalArgumentException("Margins and corner radius must not be negative");
        }
        if (2 * margin >= canvasWidth || margin + Math.max(margin, overlayMargin) >= canvasHeight) {
            throw new IllegalArgumentException("Margins leave no room for the photo on a "
                + canvasWidth + "x" + canvasHeight + " canvas");
        }
        if (workingCanvasSize <= 2 * margin) {
            throw new IllegalArgumentException("Working canvas too small: " + workingCanvasSize);
        }
        glowAlpha = clampUnit(glowAlpha);
        thumbnailQuality = clampUnit(thumbnailQuality);
        exportQuality = clampUnit(exportQuality);
    }

    public static LayoutSettings defaults() {
        return new LayoutSettings(1440, 1440, 25, 100, 30, 48, 42, 0.65f, 0.08, 0.8f, 1.0f, 1440);
    }

    public static LayoutSettings fromJson(String json) {
        JSONObject root = new JSONObject(json);
        LayoutSettings d = defaults();

        JSONObject canvas = section(root, "canvas");
        JSONObject overlay = section(root, "overlay");
        JSONObject glow = section(root, "glow");
        JSONObject jpeg = section(root, "jpeg");

        return new LayoutSettings(
            canvas.optInt("width", d.canvasWidth()),
            canvas.optInt("height", d.canvasHeight()),
            root.optInt("margin", d.margin()),
            overlay.optInt("margin", d.overlayMargin()),
            root.optInt("cornerRadius", d.cornerRadius()),
            overlay.optInt("textOffset", d.overlayTextOffset()),
            overlay.optInt("fontSize", d.overlayFontSize()),
            (float) glow.optDouble("alpha", d.glowAlpha()),
            glow.optDouble("spread", d.glowSpread()),
            (float) jpeg.optDouble("thumbnailQuality", d.thumbnailQuality()),
            (float) jpeg.optDouble("exportQuality", d.exportQuality()),
            root.optInt("workingCanvas", d.workingCanvasSize())
        );
    }

    public static LayoutSettings load(Path file) throws IOException {
        try {
            return fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (JSONException e) {
            throw new IOException("Invalid layout file " + file + ": " + e.getMessage(), e);
        }
    }

    static LayoutSettings loadClasspath(ClassLoader loader) throws IOException {
        try (InputStream in = loader.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (JSONException e) {
            throw new IOException("Invalid layout resource " + CLASSPATH_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    private static JSONObject section(JSONObject root, String key) {
        JSONObject section = root.optJSONObject(key);
        return section == null ? new JSONObject() : section;
    }

    private static float clampUnit(float value) {
        if (Float.isNaN(value)) {
            return 1f;
        }
        return Math.max(0f, Math.min(1f, value));
    }
}
