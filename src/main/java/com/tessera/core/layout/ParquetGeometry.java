package com.tessera.core.layout;

import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.PatternInfo;
import com.tessera.core.model.PhotoOrientation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unit sizes, padding and bounds of the parquet walk.
 *
 * <p>Each tiling row starts {@code portraitWidth} units further left than the previous one and
 * every portrait cell drops the cursor by {@code delta} units. The top and left padding absorb
 * both drifts so that no cursor position ever maps to a negative grid index.</p>
 */
public record ParquetGeometry(int unitSize,
                              int landscapeWidth,
                              int landscapeHeight,
                              int portraitWidth,
                              int portraitHeight,
                              int delta,
                              int cycleWidth,
                              int cyclesAcross,
                              int topPadding,
                              int rowCount,
                              int leftPadding,
                              int totalColumns,
                              int totalRows,
                              List<PhotoOrientation> sequence) {

    public ParquetGeometry {
        sequence = List.copyOf(sequence);
    }

    public static ParquetGeometry of(GridDimensions grid, PatternInfo pattern) {
        int unit = grid.unitSize();
        int landscapeWidth = Math.max(1, grid.landscapeCellWidth() / unit);
        int landscapeHeight = Math.max(1, grid.landscapeCellHeight() / unit);
        int portraitWidth = Math.max(1, grid.portraitCellWidth() / unit);
        int portraitHeight = Math.max(1, grid.portraitCellHeight() / unit);

        int delta = Math.max(0, portraitHeight - landscapeHeight);
        int cycleWidth = Math.max(1,
            pattern.landscapeCount() * landscapeWidth + pattern.portraitCount() * portraitWidth);
        int cyclesAcross = Math.max(1, ceilDiv(grid.unitColumns(), cycleWidth)) + 1;
        int topPadding = delta * Math.max(0, pattern.portraitCount() * cyclesAcross);
        int rowCount = Math.max(1, ceilDiv(grid.unitRows() + topPadding, landscapeHeight));
        int leftPadding = portraitWidth * rowCount;
        int totalColumns = grid.unitColumns() + leftPadding + cycleWidth;
        int totalRows = grid.unitRows() + topPadding + portraitHeight;

        return new ParquetGeometry(unit, landscapeWidth, landscapeHeight, portraitWidth, portraitHeight,
            delta, cycleWidth, cyclesAcross, topPadding, rowCount, leftPadding, totalColumns, totalRows,
            sequence(pattern));
    }

    /**
     * Repeating cell order: {@code L} landscape cells followed by {@code P} portrait cells.
     */
    static List<PhotoOrientation> sequence(PatternInfo pattern) {
        List<PhotoOrientation> sequence = new ArrayList<>(
            Collections.nCopies(Math.max(1, pattern.landscapeCount()), PhotoOrientation.LANDSCAPE));
        sequence.addAll(Collections.nCopies(Math.max(1, pattern.portraitCount()), PhotoOrientation.PORTRAIT));
        return sequence;
    }

    public int widthUnits(PhotoOrientation orientation) {
        return orientation == PhotoOrientation.PORTRAIT ? portraitWidth : landscapeWidth;
    }

    public int heightUnits(PhotoOrientation orientation) {
        return orientation == PhotoOrientation.PORTRAIT ? portraitHeight : landscapeHeight;
    }

    public OccupancyGrid newOccupancyGrid() {
        return new OccupancyGrid(totalColumns, totalRows);
    }

    private static int ceilDiv(int value, int divisor) {
        return (value + divisor - 1) / divisor;
    }
}
