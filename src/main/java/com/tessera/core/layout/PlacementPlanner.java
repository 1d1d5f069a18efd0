package com.tessera.core.layout;

import com.tessera.core.color.ColorSampler;
import com.tessera.core.engine.CancellationCheck;
import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.MosaicPlacement;
import com.tessera.core.model.PatternInfo;
import com.tessera.core.model.PhotoOrientation;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Row-major cell enumeration for the Square, Landscape and Portrait patterns.
 */
public final class PlacementPlanner {

    private PlacementPlanner() {
    }

    /**
     * One placement per grid cell. Square-pattern cells are tagged landscape, which selects the
     * landscape signature of every candidate.
     */
    public static List<MosaicPlacement> plan(GridDimensions grid,
                                             PatternInfo pattern,
                                             BufferedImage primary,
                                             CancellationCheck cancellation) {
        if (pattern.isParquet()) {
            throw new IllegalArgumentException("Parquet placements come from ParquetTiler");
        }
        PhotoOrientation orientation = pattern.requiredOrientation().orElse(PhotoOrientation.LANDSCAPE);
        int imageWidth = primary.getWidth();
        int imageHeight = primary.getHeight();
        int[] pixels = ColorSampler.pixels(primary);
        int cellWidth = grid.cellWidth();
        int cellHeight = grid.cellHeight();

        List<MosaicPlacement> placements = new ArrayList<>(grid.rows() * grid.columns());
        for (int row = 0; row < grid.rows(); row++) {
            cancellation.throwIfCancelled();
            for (int col = 0; col < grid.columns(); col++) {
                int x = col * cellWidth;
                int y = row * cellHeight;
                placements.add(new MosaicPlacement(row, col, x, y, cellWidth, cellHeight, orientation,
                    ColorSampler.averageRegion(pixels, imageWidth, imageHeight, x, y, cellWidth, cellHeight),
                    ColorSampler.quadrants(pixels, imageWidth, imageHeight, x, y, cellWidth, cellHeight, false)));
            }
        }
        return placements;
    }
}
