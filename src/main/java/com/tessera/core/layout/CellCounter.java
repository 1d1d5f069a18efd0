package com.tessera.core.layout;

import com.tessera.core.model.CellCounts;
import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.PatternInfo;

public final class CellCounter {

    private CellCounter() {
    }

    /**
     * Cells the mosaic will hold, split by slot orientation. Square-pattern cells count toward
     * neither orientation.
     */
    public static CellCounts count(GridDimensions grid, PatternInfo pattern) {
        int total = Math.max(0, grid.rows() * grid.columns());
        return switch (pattern.kind()) {
            case LANDSCAPE_ONLY -> new CellCounts(total, total, 0);
            case PORTRAIT_ONLY -> new CellCounts(total, 0, total);
            case PARQUET -> new ParquetTiler(grid, pattern).count();
            case SQUARE -> new CellCounts(total, 0, 0);
        };
    }
}
