package com.tessera.core.model;

/**
 * Average colors of the four quarters of a photo or of a target region.
 */
public record QuadrantColors(RgbColor topLeft, RgbColor topRight, RgbColor bottomLeft, RgbColor bottomRight) {

    public static final QuadrantColors GRAY = uniform(RgbColor.GRAY);

    public static QuadrantColors uniform(RgbColor color) {
        return new QuadrantColors(color, color, color, color);
    }
}
