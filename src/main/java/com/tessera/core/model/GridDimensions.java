package com.tessera.core.model;

/**
 * Pixel layout of the mosaic canvas.
 *
 * <p>For the parquet pattern {@code rows}/{@code columns} equal the unit rows/columns.</p>
 */
public record GridDimensions(int width,
                             int height,
                             int unitSize,
                             int cellWidth,
                             int cellHeight,
                             int landscapeCellWidth,
                             int landscapeCellHeight,
                             int portraitCellWidth,
                             int portraitCellHeight,
                             int rows,
                             int columns,
                             int unitRows,
                             int unitColumns) {

    public GridDimensions {
        requirePositive("width", width);
        requirePositive("height", height);
        requirePositive("unitSize", unitSize);
        requirePositive("cellWidth", cellWidth);
        requirePositive("cellHeight", cellHeight);
        requirePositive("landscapeCellWidth", landscapeCellWidth);
        requirePositive("landscapeCellHeight", landscapeCellHeight);
        requirePositive("portraitCellWidth", portraitCellWidth);
        requirePositive("portraitCellHeight", portraitCellHeight);
        requirePositive("rows", rows);
        requirePositive("columns", columns);
        requirePositive("unitRows", unitRows);
        requirePositive("unitColumns", unitColumns);
    }

    public int maxCellWidth() {
        return Math.max(landscapeCellWidth, portraitCellWidth);
    }

    public int maxCellHeight() {
        return Math.max(landscapeCellHeight, portraitCellHeight);
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, was " + value);
        }
    }
}
