package com.tessera.core.layout;

import com.tessera.core.color.ColorSampler;
import com.tessera.core.engine.CancellationCheck;
import com.tessera.core.model.CellCounts;
import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.MosaicPlacement;
import com.tessera.core.model.PatternInfo;
import com.tessera.core.model.PhotoOrientation;
import com.tessera.core.model.QuadrantColors;
import com.tessera.core.model.RgbColor;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Interlocking landscape/portrait tiling over the padded unit grid.
 *
 * <p>Counting and placement generation share one walk, so the planned cell counts always
 * agree with the placements that are actually produced.</p>
 */
public final class ParquetTiler {

    private final GridDimensions grid;
    private final ParquetGeometry geometry;

    public ParquetTiler(GridDimensions grid, PatternInfo pattern) {
        this.grid = Objects.requireNonNull(grid, "grid");
        if (!pattern.isParquet()) {
            throw new IllegalArgumentException("Parquet tiling needs a parquet pattern, was " + pattern);
        }
        this.geometry = ParquetGeometry.of(grid, pattern);
    }

    public ParquetGeometry geometry() {
        return geometry;
    }

    /**
     * Number of visible landscape and portrait cells the walk produces.
     */
    public CellCounts count() {
        int[] counts = new int[2];
        walk(CancellationCheck.never(), (orientation, unitRow, unitCol, x, y, width, height) -> {
            if (orientation == PhotoOrientation.PORTRAIT) {
                counts[1]++;
            } else {
                counts[0]++;
            }
        });
        return new CellCounts(counts[0] + counts[1], counts[0], counts[1]);
    }

    /**
     * Visible placements with targets sampled from {@code primary}. Cells hanging over the
     * canvas edge are sampled on their visible interior.
     */
    public List<MosaicPlacement> placements(BufferedImage primary, CancellationCheck cancellation) {
        int width = primary.getWidth();
        int height = primary.getHeight();
        int[] pixels = ColorSampler.pixels(primary);
        List<MosaicPlacement> placements = new ArrayList<>();
        walk(cancellation, (orientation, unitRow, unitCol, x, y, w, h) -> {
            RgbColor color = ColorSampler.averageRegion(pixels, width, height, x, y, w, h);
            QuadrantColors quadrants = ColorSampler.quadrants(pixels, width, height, x, y, w, h, true);
            placements.add(new MosaicPlacement(unitRow, unitCol, x, y, w, h, orientation, color, quadrants));
        });
        return placements;
    }

    void walk(CancellationCheck cancellation, CellVisitor visitor) {
        ParquetGeometry g = geometry;
        OccupancyGrid planned = g.newOccupancyGrid();
        List<PhotoOrientation> sequence = g.sequence();
        int unit = g.unitSize();

        for (int rowIndex = 0; rowIndex * g.landscapeHeight() < g.totalRows(); rowIndex++) {
            cancellation.throwIfCancelled();
            int currentY = rowIndex * g.landscapeHeight() - g.topPadding();
            int x = g.leftPadding() - rowIndex * g.portraitWidth();
            int patternIndex = 0;

            while (x < g.totalColumns()) {
                int occupancyRow = currentY + g.topPadding();
                if (occupancyRow >= g.totalRows() || x < 0) {
                    x++;
                    continue;
                }

                PhotoOrientation orientation = sequence.get(patternIndex);
                int widthUnits = g.widthUnits(orientation);
                int heightUnits = g.heightUnits(orientation);
                if (!planned.canPlace(x, occupancyRow, widthUnits, heightUnits)) {
                    x++;
                    continue;
                }
                planned.markOccupied(x, occupancyRow, widthUnits, heightUnits);

                int px = (x - g.leftPadding()) * unit;
                int py = currentY * unit;
                int pw = widthUnits * unit;
                int ph = heightUnits * unit;
                if (px + pw > 0 && py + ph > 0 && px < grid.width() && py < grid.height()) {
                    visitor.visit(orientation, occupancyRow, x, px, py, pw, ph);
                }

                if (orientation == PhotoOrientation.PORTRAIT && g.delta() > 0) {
                    currentY += g.delta();
                }
                patternIndex = (patternIndex + 1) % sequence.size();
                x += widthUnits;
            }
        }
    }

    @FunctionalInterface
    interface CellVisitor {
        void visit(PhotoOrientation orientation, int unitRow, int unitCol, int x, int y, int width, int height);
    }
}
