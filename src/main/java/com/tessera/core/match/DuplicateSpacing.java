package com.tessera.core.match;

/**
 * Minimum distance between two placements of the same photo, per axis. Standard patterns
 * measure it in grid cells, parquet in pixels.
 */
public record DuplicateSpacing(int rows, int columns) {

    private static final DuplicateSpacing NONE = new DuplicateSpacing(0, 0);

    public DuplicateSpacing {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("Spacing cannot be negative: " + rows + "/" + columns);
        }
    }

    public static DuplicateSpacing none() {
        return NONE;
    }

    public static DuplicateSpacing cells(int spacing) {
        return spacing <= 0 ? NONE : new DuplicateSpacing(spacing, spacing);
    }

    public static DuplicateSpacing pixels(int spacing, int cellHeight, int cellWidth) {
        if (spacing <= 0) {
            return NONE;
        }
        return new DuplicateSpacing(spacing * Math.max(1, cellHeight), spacing * Math.max(1, cellWidth));
    }

    public boolean isEnabled() {
        return rows > 0 || columns > 0;
    }
}
