package com.tessera.core.model;

import java.util.Locale;

public enum CellShape {
    SQUARE(1, 1),
    RECTANGLE_4X3(4, 3),
    RECTANGLE_3X2(3, 2);

    private final int longSide;
    private final int shortSide;

    CellShape(int longSide, int shortSide) {
        this.longSide = longSide;
        this.shortSide = shortSide;
    }

    /**
     * Returns {@code {width, height}} of a landscape cell whose long side is {@code basePixels}.
     */
    public int[] landscapeDimensions(int basePixels) {
        int width = Math.max(1, basePixels);
        int height = Math.max(1, (int) (basePixels * (double) shortSide / longSide));
        return new int[] {width, height};
    }

    public static CellShape from(String value) {
        if (value == null || value.isBlank()) {
            return SQUARE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace(":", "X");
        return switch (normalized) {
            case "4X3", "RECTANGLE4X3", "RECTANGLE_4X3" -> RECTANGLE_4X3;
            case "3X2", "RECTANGLE3X2", "RECTANGLE_3X2" -> RECTANGLE_3X2;
            case "SQUARE", "1X1" -> SQUARE;
            default -> throw new IllegalArgumentException("Unknown cell shape: " + value);
        };
    }
}
