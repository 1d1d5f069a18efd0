package com.tessera.core.model;

public record RgbColor(int r, int g, int b) {

    public static final RgbColor GRAY = new RgbColor(128, 128, 128);

    public RgbColor {
        if (r < 0 || r > 255 || g < 0 || g > 255 || b < 0 || b > 255) {
            throw new IllegalArgumentException("RGB components must be 0-255: " + r + "," + g + "," + b);
        }
    }

    public static RgbColor fromArgb(int argb) {
        return new RgbColor((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
    }

    public int toArgb() {
        return 0xFF000000 | (r << 16) | (g << 8) | b;
    }
}
