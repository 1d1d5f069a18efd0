package com.tessera.config;

import com.tessera.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.function.Function;

/**
 * Central entry point for engine settings. Each value is resolved from a system property,
 * then an environment variable, then {@code mosaic-engine.properties} on the classpath,
 * then a built-in default.
 */
public final class EngineConfig {

    static final String RESOURCE = "mosaic-engine.properties";

    private static final Setting OUTPUT_DIR = new Setting("mosaic.outputDir", "MOSAIC_OUTPUT_DIR", "output.dir");
    private static final Setting MAX_DIMENSION =
        new Setting("mosaic.maxDimension", "MOSAIC_MAX_DIMENSION", "primary.maxDimension");
    private static final Setting OVERLAY_BLUR =
        new Setting("mosaic.overlayBlurRadius", "MOSAIC_OVERLAY_BLUR", "overlay.blurRadius");
    private static final Setting JPEG_QUALITY =
        new Setting("mosaic.jpegQuality", "MOSAIC_JPEG_QUALITY", "output.jpegQuality");
    private static final Setting PROGRESS_INTERVAL =
        new Setting("mosaic.progressIntervalMs", "MOSAIC_PROGRESS_INTERVAL", "progress.intervalMs");

    private final Path outputDirectory;
    private final int maxPrimaryDimension;
    private final int overlayBlurRadius;
    private final float jpegQuality;
    private final long progressIntervalMs;

    private EngineConfig(Path outputDirectory,
                         int maxPrimaryDimension,
                         int overlayBlurRadius,
                         float jpegQuality,
                         long progressIntervalMs) {
        this.outputDirectory = outputDirectory;
        this.maxPrimaryDimension = maxPrimaryDimension;
        this.overlayBlurRadius = overlayBlurRadius;
        this.jpegQuality = jpegQuality;
        this.progressIntervalMs = progressIntervalMs;
    }

    public static EngineConfig load() {
        return load(System::getenv);
    }

    static EngineConfig load(Function<String, String> environment) {
        Properties file = loadFileProperties();
        Function<Setting, String> lookup = setting -> setting.resolve(environment, file);
        return new EngineConfig(
            parsePath(lookup.apply(OUTPUT_DIR)),
            parseInt(lookup.apply(MAX_DIMENSION), 2048, 64),
            parseInt(lookup.apply(OVERLAY_BLUR), 8, 0),
            parseQuality(lookup.apply(JPEG_QUALITY)),
            parseInt(lookup.apply(PROGRESS_INTERVAL), 250, 0)
        );
    }

    public static EngineConfig defaults() {
        return new EngineConfig(parsePath(null), 2048, 8, 0.95f, 250);
    }

    public EngineConfig withOutputDirectory(Path directory) {
        if (directory == null) {
            return this;
        }
        return new EngineConfig(directory, maxPrimaryDimension, overlayBlurRadius, jpegQuality, progressIntervalMs);
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public int maxPrimaryDimension() {
        return maxPrimaryDimension;
    }

    public int overlayBlurRadius() {
        return overlayBlurRadius;
    }

    public float jpegQuality() {
        return jpegQuality;
    }

    public long progressIntervalMs() {
        return progressIntervalMs;
    }

    private static Properties loadFileProperties() {
        Properties props = new Properties();
        try (InputStream stream = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ex) {
            AppLogger.get().warning("Could not read " + RESOURCE + ", using defaults: " + ex.getMessage());
        }
        return props;
    }

    private static Path parsePath(String raw) {
        if (raw == null || raw.isBlank()) {
            return Paths.get(System.getProperty("java.io.tmpdir"));
        }
        return Paths.get(raw.trim());
    }

    private static int parseInt(String raw, int fallback, int minimum) {
        if (raw == null) {
            return fallback;
        }
        try {
            return Math.max(minimum, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static float parseQuality(String raw) {
        if (raw == null) {
            return 0.95f;
        }
        try {
            float value = Float.parseFloat(raw.trim());
            return value > 0f && value <= 1f ? value : 0.95f;
        } catch (NumberFormatException ex) {
            return 0.95f;
        }
    }

    private record Setting(String property, String environmentVariable, String fileKey) {

        String resolve(Function<String, String> environment, Properties file) {
            String[] candidates = {
                System.getProperty(property),
                environment.apply(environmentVariable),
                file.getProperty(fileKey)
            };
            for (String candidate : candidates) {
                if (candidate != null && !candidate.isBlank()) {
                    return candidate.trim();
                }
            }
            return null;
        }
    }
}
