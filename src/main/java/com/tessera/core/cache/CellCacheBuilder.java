package com.tessera.core.cache;

import com.tessera.core.color.ColorSampler;
import com.tessera.core.engine.CancellationCheck;
import com.tessera.core.engine.GenerationCancelledException;
import com.tessera.core.engine.GenerationStage;
import com.tessera.core.engine.ProgressListener;
import com.tessera.core.image.ImageCodec;
import com.tessera.core.image.ImageFitting;
import com.tessera.core.model.CellImageFitMode;
import com.tessera.core.model.CellPhoto;
import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.PatternInfo;
import com.tessera.core.model.PhotoOrientation;
import com.tessera.core.model.QuadrantColors;
import com.tessera.core.model.RgbColor;
import com.tessera.logging.AppLogger;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads candidate photos and turns them into fitted cell images with color signatures.
 *
 * <p>A photo that cannot be decoded is logged and left out. Whether an empty result is fatal
 * is the caller's decision.</p>
 */
public final class CellCacheBuilder {

    private static final Logger LOGGER = AppLogger.get();

    private final ImageCodec codec;
    private final ImageFitting fitting;

    public CellCacheBuilder(ImageCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.fitting = new ImageFitting(codec);
    }

    /**
     * Builds the cache for one run. Cancellation is checked before every candidate; when it
     * fires, everything cached so far is released and the cancellation propagates.
     */
    public List<CellPhotoCache> build(List<CellPhoto> photos,
                                      GridDimensions grid,
                                      CellImageFitMode fitMode,
                                      PatternInfo pattern,
                                      ProgressListener progress,
                                      CancellationCheck cancellation) {
        List<CellPhotoCache> cache = new ArrayList<>();
        buildInto(cache, photos, grid, fitMode, pattern, progress, cancellation);
        return cache;
    }

    void buildInto(List<CellPhotoCache> cache,
                   List<CellPhoto> photos,
                   GridDimensions grid,
                   CellImageFitMode fitMode,
                   PatternInfo pattern,
                   ProgressListener progress,
                   CancellationCheck cancellation) {
        Optional<PhotoOrientation> required = pattern.requiredOrientation();
        int total = photos.size();
        int processed = 0;
        int lastReported = -1;

        try {
            for (CellPhoto photo : photos) {
                cancellation.throwIfCancelled();
                if (required.isEmpty() || photo.orientation().canServe(required.get())) {
                    cacheOne(photo, grid, fitMode).ifPresent(cache::add);
                } else {
                    LOGGER.fine(() -> "Skipping " + photo.path() + ": " + photo.orientation()
                        + " photo cannot fill a " + pattern + " mosaic");
                }

                processed++;
                int percent = GenerationStage.interpolate(
                    GenerationStage.BUILD_CELL_CACHE.percent(), GenerationStage.CACHE_END_PERCENT, processed, total);
                if (percent != lastReported) {
                    progress.report(percent, "Loading Cell Images: " + processed + "/" + total);
                    lastReported = percent;
                }
            }
        } catch (GenerationCancelledException ex) {
            release(cache);
            throw ex;
        }
    }

    public static void release(List<CellPhotoCache> cache) {
        for (CellPhotoCache item : cache) {
            item.release();
        }
    }

    private Optional<CellPhotoCache> cacheOne(CellPhoto photo, GridDimensions grid, CellImageFitMode fitMode) {
        BufferedImage source = null;
        try {
            source = codec.load(photo.path(), grid.maxCellWidth(), grid.maxCellHeight());
            RgbColor average = ColorSampler.averageColorFast(source);

            BufferedImage landscape = null;
            QuadrantColors landscapeQuadrants = QuadrantColors.GRAY;
            if (photo.orientation().servesLandscape()) {
                landscape = fitting.fitCell(source, grid.landscapeCellWidth(), grid.landscapeCellHeight(), fitMode);
                landscapeQuadrants = ColorSampler.quadrants(landscape);
            }

            BufferedImage portrait = null;
            QuadrantColors portraitQuadrants = QuadrantColors.GRAY;
            if (photo.orientation().servesPortrait()) {
                portrait = fitting.fitCell(source, grid.portraitCellWidth(), grid.portraitCellHeight(), fitMode);
                portraitQuadrants = ColorSampler.quadrants(portrait);
            }

            return Optional.of(new CellPhotoCache(photo.path(), photo.orientation(), average,
                landscape, portrait, landscapeQuadrants, portraitQuadrants));
        } catch (Exception ex) {
            LOGGER.log(Level.WARNING, "Failed to cache cell photo " + photo.path() + ": " + ex.getMessage(), ex);
            return Optional.empty();
        } finally {
            if (source != null) {
                source.flush();
            }
        }
    }
}
