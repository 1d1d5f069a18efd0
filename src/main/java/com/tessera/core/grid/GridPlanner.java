package com.tessera.core.grid;

import com.tessera.core.model.CellShape;
import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.PatternInfo;
import com.tessera.core.model.PatternKind;
import com.tessera.core.model.PhotoOrientation;
import com.tessera.core.model.PrimaryImageSizingMode;
import com.tessera.core.model.PrintSize;

/**
 * Derives the mosaic's pixel grid from print settings and the primary image's shape.
 *
 * <p>All divisions floor and every dimension is clamped to at least 1.</p>
 */
public final class GridPlanner {

    private static final double MM_PER_INCH = 25.4;

    private GridPlanner() {
    }

    public static GridDimensions plan(PrintSize printSize,
                                      int resolutionPpi,
                                      double cellSizeMm,
                                      CellShape cellShape,
                                      PrimaryImageSizingMode sizingMode,
                                      int primaryWidth,
                                      int primaryHeight,
                                      PatternInfo pattern) {
        double longSide = Math.max(printSize.widthInches(), printSize.heightInches());
        double shortSide = Math.min(printSize.widthInches(), printSize.heightInches());
        double printWidthIn = printSize.widthInches();
        double printHeightIn = printSize.heightInches();

        switch (PhotoOrientation.of(primaryWidth, primaryHeight)) {
            case LANDSCAPE -> {
                printWidthIn = longSide;
                printHeightIn = shortSide;
            }
            case PORTRAIT -> {
                printWidthIn = shortSide;
                printHeightIn = longSide;
            }
            default -> {
            }
        }

        if (sizingMode == PrimaryImageSizingMode.KEEP_ASPECT_RATIO) {
            double primaryAspect = primaryWidth / (double) Math.max(1, primaryHeight);
            double printAspect = printWidthIn / printHeightIn;
            if (primaryAspect >= printAspect) {
                printHeightIn = printWidthIn / primaryAspect;
            } else {
                printWidthIn = printHeightIn * primaryAspect;
            }
        }

        int pixelWidth = Math.max(1, (int) (printWidthIn * resolutionPpi));
        int pixelHeight = Math.max(1, (int) (printHeightIn * resolutionPpi));
        int baseCellPixels = Math.max(1, (int) (cellSizeMm / MM_PER_INCH * resolutionPpi));

        CellShape effectiveShape = cellShape == null ? CellShape.SQUARE : cellShape;
        if (pattern.kind() == PatternKind.PARQUET && effectiveShape == CellShape.SQUARE) {
            // interlocking needs distinct landscape and portrait footprints
            effectiveShape = CellShape.RECTANGLE_4X3;
        }
        int[] landscape = effectiveShape.landscapeDimensions(baseCellPixels);
        int landscapeWidth = landscape[0];
        int landscapeHeight = landscape[1];
        int portraitWidth = landscapeHeight;
        int portraitHeight = landscapeWidth;

        if (pattern.kind() == PatternKind.SQUARE) {
            landscapeWidth = baseCellPixels;
            landscapeHeight = baseCellPixels;
            portraitWidth = baseCellPixels;
            portraitHeight = baseCellPixels;
        }

        boolean portraitCells = pattern.kind() == PatternKind.PORTRAIT_ONLY;
        int cellWidth = portraitCells ? portraitWidth : landscapeWidth;
        int cellHeight = portraitCells ? portraitHeight : landscapeHeight;

        int unitSize = gcd(landscapeWidth, landscapeHeight);
        int unitColumns = Math.max(1, pixelWidth / unitSize);
        int unitRows = Math.max(1, pixelHeight / unitSize);
        int columns = Math.max(1, pixelWidth / cellWidth);
        int rows = Math.max(1, pixelHeight / cellHeight);

        boolean parquet = pattern.isParquet();
        return new GridDimensions(
            parquet ? unitColumns * unitSize : columns * cellWidth,
            parquet ? unitRows * unitSize : rows * cellHeight,
            unitSize,
            cellWidth,
            cellHeight,
            landscapeWidth,
            landscapeHeight,
            portraitWidth,
            portraitHeight,
            parquet ? unitRows : rows,
            parquet ? unitColumns : columns,
            unitRows,
            unitColumns
        );
    }

    static int gcd(int a, int b) {
        int x = Math.max(1, a);
        int y = Math.max(1, b);
        while (y != 0) {
            int temp = y;
            y = x % y;
            x = temp;
        }
        return Math.max(1, x);
    }
}
