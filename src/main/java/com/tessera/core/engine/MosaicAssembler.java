package com.tessera.core.engine;

import com.tessera.core.layout.OccupancyGrid;
import com.tessera.core.layout.ParquetTiler;
import com.tessera.core.layout.PlacementPlanner;
import com.tessera.core.match.CellMatcher;
import com.tessera.core.match.DuplicateSpacing;
import com.tessera.core.match.UsageHistory;
import com.tessera.core.match.UseAllImagesPass;
import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.MosaicPlacement;
import com.tessera.core.model.MosaicProject;
import com.tessera.core.model.PatternInfo;
import com.tessera.core.model.PhotoOrientation;
import com.tessera.core.render.MosaicCompositor;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Fills the mosaic canvas: placements, optional use-all pass, then the randomized matching
 * pass over the shuffled remainder.
 */
final class MosaicAssembler {

    record Assembly(BufferedImage mosaic, UsageHistory history, int placements) {
    }

    private final MosaicProject project;
    private final GridDimensions grid;
    private final PatternInfo pattern;
    private final List<CellPhotoCache> cache;
    private final int maxUses;
    private final Random random;
    private final ProgressListener progress;
    private final CancellationCheck cancellation;

    MosaicAssembler(MosaicProject project,
                    GridDimensions grid,
                    PatternInfo pattern,
                    List<CellPhotoCache> cache,
                    int maxUses,
                    Random random,
                    ProgressListener progress,
                    CancellationCheck cancellation) {
        this.project = project;
        this.grid = grid;
        this.pattern = pattern;
        this.cache = cache;
        this.maxUses = maxUses;
        this.random = random;
        this.progress = progress;
        this.cancellation = cancellation;
    }

    Assembly assemble(BufferedImage preparedPrimary) {
        try (MosaicCompositor compositor =
                 new MosaicCompositor(grid.width(), grid.height(), project.colorChangePercent())) {
            UsageHistory history = new UsageHistory();
            int placements = pattern.isParquet()
                ? assembleParquet(preparedPrimary, compositor, history)
                : assembleStandard(preparedPrimary, compositor, history);
            return new Assembly(compositor.image(), history, placements);
        }
    }

    private int assembleStandard(BufferedImage primary, MosaicCompositor compositor, UsageHistory history) {
        List<MosaicPlacement> placements = PlacementPlanner.plan(grid, pattern, primary, cancellation);
        List<MosaicPlacement> remaining = placements;
        if (project.useAllImages()) {
            remaining = new UseAllImagesPass(false).run(cache, placements, maxUses, (photo, placement) -> {
                if (compositor.draw(photo, placement)) {
                    history.record(photo, placement.row(), placement.col(), placement.x(), placement.y());
                }
            }, cancellation);
        }
        remaining = shuffled(remaining);

        CellMatcher matcher = new CellMatcher(cache, random);
        DuplicateSpacing spacing = DuplicateSpacing.cells(project.duplicateSpacing().orElse(0));
        Optional<PhotoOrientation> required = pattern.requiredOrientation();
        int candidates = project.randomCellCandidates();
        int processed = 0;
        int lastReported = -1;
        for (MosaicPlacement placement : remaining) {
            cancellation.throwIfCancelled();
            Optional<CellPhotoCache> match = matcher.findBestMatch(placement.targetQuadrants(), maxUses, spacing,
                placement.row(), placement.col(), candidates, history, required);
            if (match.isPresent() && compositor.draw(match.get(), placement)) {
                history.record(match.get(), placement.row(), placement.col(), placement.x(), placement.y());
            }
            processed++;
            lastReported = reportPlacing(processed, remaining.size(), lastReported);
        }
        return placements.size();
    }

    private int assembleParquet(BufferedImage primary, MosaicCompositor compositor, UsageHistory history) {
        ParquetTiler tiler = new ParquetTiler(grid, pattern);
        List<MosaicPlacement> placements = tiler.placements(primary, cancellation);
        OccupancyGrid occupied = tiler.geometry().newOccupancyGrid();
        int unit = grid.unitSize();

        List<MosaicPlacement> remaining = placements;
        if (project.useAllImages()) {
            remaining = new UseAllImagesPass(true).run(cache, placements, maxUses, (photo, placement) -> {
                if (fill(occupied, unit, compositor, photo, placement)) {
                    history.record(photo, placement.y(), placement.x(), placement.x(), placement.y());
                }
            }, cancellation);
        }
        remaining = shuffled(remaining);

        CellMatcher matcher = new CellMatcher(cache, random);
        DuplicateSpacing spacing = DuplicateSpacing.pixels(
            project.duplicateSpacing().orElse(0), grid.maxCellHeight(), grid.maxCellWidth());
        int candidates = project.randomCellCandidates();
        int processed = 0;
        int lastReported = -1;
        for (MosaicPlacement placement : remaining) {
            cancellation.throwIfCancelled();
            if (occupied.canPlace(placement.col(), placement.row(), widthUnits(placement, unit), heightUnits(placement, unit))) {
                Optional<CellPhotoCache> match = matcher.findBestMatch(placement.targetQuadrants(), maxUses, spacing,
                    placement.y(), placement.x(), candidates, history, Optional.of(placement.orientation()));
                if (match.isPresent() && fill(occupied, unit, compositor, match.get(), placement)) {
                    history.record(match.get(), placement.y(), placement.x(), placement.x(), placement.y());
                }
            }
            processed++;
            lastReported = reportPlacing(processed, remaining.size(), lastReported);
        }
        return placements.size();
    }

    /**
     * Draws the photo and claims the placement's unit rectangle, unless the rectangle is taken.
     */
    private static boolean fill(OccupancyGrid occupied,
                                int unit,
                                MosaicCompositor compositor,
                                CellPhotoCache photo,
                                MosaicPlacement placement) {
        int widthUnits = widthUnits(placement, unit);
        int heightUnits = heightUnits(placement, unit);
        if (!occupied.canPlace(placement.col(), placement.row(), widthUnits, heightUnits)) {
            return false;
        }
        if (!compositor.draw(photo, placement)) {
            return false;
        }
        occupied.markOccupied(placement.col(), placement.row(), widthUnits, heightUnits);
        return true;
    }

    private static int widthUnits(MosaicPlacement placement, int unit) {
        return Math.max(1, placement.width() / unit);
    }

    private static int heightUnits(MosaicPlacement placement, int unit) {
        return Math.max(1, placement.height() / unit);
    }

    private List<MosaicPlacement> shuffled(List<MosaicPlacement> placements) {
        List<MosaicPlacement> copy = new ArrayList<>(placements);
        Collections.shuffle(copy, random);
        return copy;
    }

    private int reportPlacing(int processed, int total, int lastReported) {
        int percent = GenerationStage.interpolate(
            GenerationStage.CREATE_MOSAIC.percent(), GenerationStage.MOSAIC_END_PERCENT, processed, total);
        if (percent != lastReported) {
            progress.report(percent, "Placing cells: " + processed + "/" + total);
        }
        return percent;
    }
}
