package com.tessera.core.engine;

import com.tessera.core.grid.GridPlanner;
import com.tessera.core.grid.PatternParser;
import com.tessera.core.image.ImageCodec;
import com.tessera.core.layout.CellCounter;
import com.tessera.core.model.CellCounts;
import com.tessera.core.model.CellPhoto;
import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.MosaicPlan;
import com.tessera.core.model.MosaicProject;
import com.tessera.core.model.PatternInfo;
import com.tessera.core.model.PatternKind;
import com.tessera.core.model.PhotoCounts;
import com.tessera.core.model.PhotoOrientation;

import java.awt.Dimension;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Layout planning shared by generation and the lightweight preview: validation, pattern
 * resolution, grid sizing and the recommended per-photo use limit.
 */
public final class MosaicPlanner {

    private final ImageCodec codec;

    public MosaicPlanner(ImageCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Cell and photo counts for {@code project} without decoding any candidate photo. Only the
     * primary image's header is read.
     *
     * @throws MosaicConfigurationException when the project is incomplete or the primary image is missing
     * @throws IOException              when the primary image's dimensions cannot be read
     */
    public MosaicPlan plan(MosaicProject project) throws IOException {
        validate(project);
        PatternInfo pattern = resolvePattern(PatternParser.parse(project.pattern()), project.cellPhotos());
        Path primary = requireExistingPrimary(project);
        Dimension size = codec.readDimensions(primary);
        GridDimensions grid = calculateGrid(project, size.width, size.height, pattern);
        return buildPlan(CellCounter.count(grid, pattern), countCandidates(project.cellPhotos(), pattern), pattern);
    }

    /**
     * Rejects a project that is missing a required setting, before any image is touched.
     */
    public static void validate(MosaicProject project) {
        if (project.primaryImagePath().isEmpty()) {
            throw new MosaicConfigurationException("Primary image is not selected");
        }
        if (project.cellPhotos().isEmpty()) {
            throw new MosaicConfigurationException("No cell photos have been added");
        }
        if (project.printSize().isEmpty()) {
            throw new MosaicConfigurationException("Print size is not selected");
        }
        if (project.resolutionPpi().isEmpty()) {
            throw new MosaicConfigurationException("Resolution is not selected");
        }
        if (project.cellSizeMm().isEmpty()) {
            throw new MosaicConfigurationException("Cell size is not selected");
        }
    }

    static Path requireExistingPrimary(MosaicProject project) {
        Path primary = project.primaryImagePath()
            .orElseThrow(() -> new MosaicConfigurationException("Primary image is not selected"));
        if (!Files.isRegularFile(primary)) {
            throw new MosaicConfigurationException("Primary image file not found: " + primary);
        }
        return primary;
    }

    /**
     * For parquet, replaces the configured ratio with the library's own landscape:portrait
     * ratio when the library holds photos for both orientations.
     */
    public static PatternInfo resolvePattern(PatternInfo pattern, List<CellPhoto> photos) {
        if (!pattern.isParquet()) {
            return pattern;
        }
        PhotoCounts counts = countCandidates(photos, pattern);
        int landscape = counts.landscape();
        int portrait = counts.portrait();
        if (landscape <= 0 || portrait <= 0) {
            return pattern;
        }
        if (landscape >= portrait) {
            return PatternInfo.parquet(Math.max(1, landscape / portrait), 1);
        }
        return PatternInfo.parquet(1, Math.max(1, portrait / landscape));
    }

    static GridDimensions calculateGrid(MosaicProject project, int primaryWidth, int primaryHeight, PatternInfo pattern) {
        GridDimensions grid = GridPlanner.plan(
            project.printSize().orElseThrow(() -> new MosaicConfigurationException("Print size is not selected")),
            project.resolutionPpi().orElseThrow(() -> new MosaicConfigurationException("Resolution is not selected")),
            project.cellSizeMm().orElseThrow(() -> new MosaicConfigurationException("Cell size is not selected")),
            project.cellShape(),
            project.primarySizing(),
            primaryWidth,
            primaryHeight,
            pattern);
        requireAllocatableCanvas(grid);
        return grid;
    }

    /**
     * Rejects a canvas whose pixel count does not fit a single image raster.
     */
    static void requireAllocatableCanvas(GridDimensions grid) {
        long pixels = (long) grid.width() * grid.height();
        if (pixels > Integer.MAX_VALUE) {
            throw new MosaicConfigurationException("Mosaic canvas " + grid.width() + "x" + grid.height()
                + " px is too large; lower the print size or resolution");
        }
    }

    /**
     * Candidate counts by orientation; Square photos count toward both. For single-orientation
     * patterns the total is the number of photos that can fill those cells.
     */
    public static PhotoCounts countCandidates(List<CellPhoto> photos, PatternInfo pattern) {
        int landscape = 0;
        int portrait = 0;
        for (CellPhoto photo : photos) {
            if (photo.orientation().servesLandscape()) {
                landscape++;
            }
            if (photo.orientation().servesPortrait()) {
                portrait++;
            }
        }
        int total = switch (pattern.kind()) {
            case LANDSCAPE_ONLY -> landscape;
            case PORTRAIT_ONLY -> portrait;
            default -> photos.size();
        };
        return new PhotoCounts(total, landscape, portrait);
    }

    public static PhotoCounts countCached(List<CellPhotoCache> cache) {
        int landscape = 0;
        int portrait = 0;
        for (CellPhotoCache item : cache) {
            PhotoOrientation orientation = item.orientation();
            if (orientation.servesLandscape()) {
                landscape++;
            }
            if (orientation.servesPortrait()) {
                portrait++;
            }
        }
        return new PhotoCounts(cache.size(), landscape, portrait);
    }

    public static MosaicPlan buildPlan(CellCounts cells, PhotoCounts photos, PatternInfo pattern) {
        return new MosaicPlan(
            cells.total(),
            photos.total(),
            recommendedMaxUses(cells, photos, pattern),
            cells.landscape(),
            cells.portrait(),
            photos.landscape(),
            photos.portrait());
    }

    /**
     * Twice the uses each photo needs for every cell to be fillable; unlimited when there is
     * nothing to divide or a parquet orientation has cells but no photos.
     */
    public static int recommendedMaxUses(CellCounts cells, PhotoCounts photos, PatternInfo pattern) {
        if (cells.total() <= 0 || photos.total() <= 0) {
            return Integer.MAX_VALUE;
        }
        int required;
        if (pattern.kind() == PatternKind.PARQUET) {
            if (cells.landscape() > 0 && photos.landscape() == 0) {
                return Integer.MAX_VALUE;
            }
            if (cells.portrait() > 0 && photos.portrait() == 0) {
                return Integer.MAX_VALUE;
            }
            required = Math.max(
                ceilDiv(cells.landscape(), photos.landscape()),
                ceilDiv(cells.portrait(), photos.portrait()));
        } else {
            required = ceilDiv(cells.total(), photos.total());
        }
        return Math.max(1, required * 2);
    }

    private static int ceilDiv(int cells, int photos) {
        if (cells <= 0) {
            return 0;
        }
        int divisor = Math.max(1, photos);
        return (cells + divisor - 1) / divisor;
    }
}
