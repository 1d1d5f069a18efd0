package com.tessera.core.color;

import com.tessera.core.model.QuadrantColors;
import com.tessera.core.model.RgbColor;

/**
 * Distances between colors and quadrant signatures.
 */
public final class ColorMath {

    public static final double MAX_COLOR_DISTANCE = 255.0 * Math.sqrt(3.0);
    public static final double MAX_QUADRANT_DISTANCE = 4.0 * MAX_COLOR_DISTANCE;

    private ColorMath() {
    }

    public static double distance(RgbColor a, RgbColor b) {
        int dr = a.r() - b.r();
        int dg = a.g() - b.g();
        int db = a.b() - b.b();
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    /**
     * Sum of the four per-quadrant Euclidean distances, in {@code [0, MAX_QUADRANT_DISTANCE]}.
     */
    public static double quadrantDistance(QuadrantColors source, QuadrantColors target) {
        return distance(source.topLeft(), target.topLeft())
            + distance(source.topRight(), target.topRight())
            + distance(source.bottomLeft(), target.bottomLeft())
            + distance(source.bottomRight(), target.bottomRight());
    }

    /**
     * Moves {@code argb} toward {@code target} by {@code percent} (0..100) and returns opaque RGB.
     */
    public static int blend(int argb, RgbColor target, int percent) {
        if (percent <= 0) {
            return argb;
        }
        float factor = Math.min(100, percent) / 100f;
        int r = blendChannel((argb >> 16) & 0xFF, target.r(), factor);
        int g = blendChannel((argb >> 8) & 0xFF, target.g(), factor);
        int b = blendChannel(argb & 0xFF, target.b(), factor);
        return 0xFF000000 | (r << 16) | (g << 8) | b;
    }

    private static int blendChannel(int value, int target, float factor) {
        int mixed = (int) (value * (1 - factor) + target * factor);
        return Math.max(0, Math.min(255, mixed));
    }
}
