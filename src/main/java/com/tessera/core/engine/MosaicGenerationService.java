package com.tessera.core.engine;

import com.tessera.config.EngineConfig;
import com.tessera.core.cache.CellCacheBuilder;
import com.tessera.core.grid.PatternParser;
import com.tessera.core.image.AwtImageCodec;
import com.tessera.core.image.ImageCodec;
import com.tessera.core.image.ImageFitting;
import com.tessera.core.layout.CellCounter;
import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.MosaicPlan;
import com.tessera.core.model.MosaicProject;
import com.tessera.core.model.MosaicResult;
import com.tessera.core.model.PatternInfo;
import com.tessera.core.pdf.MosaicPdfExporter;
import com.tessera.core.report.GenerationFailureLog;
import com.tessera.core.report.UsageReportWriter;
import com.tessera.logging.AppLogger;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Random;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one mosaic generation from project settings to files on disk.
 *
 * <p>{@link #generate} never throws: configuration errors, cancellation and unexpected failures
 * all come back as a {@link MosaicResult}. Runs share no mutable state, so one service can serve
 * concurrent callers.</p>
 */
public class MosaicGenerationService {

    private static final Logger LOGGER = AppLogger.get();
    static final String CANCELLED_MESSAGE = "Mosaic generation cancelled";

    private final EngineConfig config;
    private final ImageCodec codec;
    private final GenerationFailureLog failureLog;
    private final Supplier<Random> randomSource;
    private final MosaicPlanner planner;

    public MosaicGenerationService() {
        this(EngineConfig.load(), new AwtImageCodec(), new GenerationFailureLog(), Random::new);
    }

    public MosaicGenerationService(EngineConfig config,
                                   ImageCodec codec,
                                   GenerationFailureLog failureLog,
                                   Supplier<Random> randomSource) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.failureLog = Objects.requireNonNull(failureLog, "failureLog");
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
        this.planner = new MosaicPlanner(codec);
    }

    /**
     * Generation-free preview of cell and photo counts.
     *
     * @throws MosaicConfigurationException when the project is incomplete
     * @throws IOException when the primary image header cannot be read
     */
    public MosaicPlan plan(MosaicProject project) throws IOException {
        return planner.plan(project);
    }

    public MosaicResult generate(MosaicProject project) {
        return generate(project, OptionalInt.empty(), ProgressListener.NONE, CancellationCheck.never());
    }

    public MosaicResult generate(MosaicProject project,
                                 OptionalInt maxUsesOverride,
                                 ProgressListener progress,
                                 CancellationCheck cancellation) {
        ProgressListener listener = progress == null ? ProgressListener.NONE : progress;
        CancellationCheck cancel = cancellation == null ? CancellationCheck.never() : cancellation;
        long startedAt = System.currentTimeMillis();
        MosaicResult.Builder result = MosaicResult.builder();
        GenerationStage stage = GenerationStage.VALIDATING;
        List<CellPhotoCache> cache = List.of();
        BufferedImage primary = null;
        BufferedImage prepared = null;

        try {
            enter(listener, stage);
            MosaicPlanner.validate(project);

            stage = enter(listener, GenerationStage.RESOLVE_PATTERN);
            PatternInfo pattern = MosaicPlanner.resolvePattern(PatternParser.parse(project.pattern()), project.cellPhotos());

            stage = enter(listener, GenerationStage.VERIFY_PRIMARY_IMAGE);
            Path primaryPath = MosaicPlanner.requireExistingPrimary(project);

            stage = enter(listener, GenerationStage.CALCULATE_GRID);
            Dimension primarySize = codec.readDimensions(primaryPath);
            GridDimensions grid = MosaicPlanner.calculateGrid(project, primarySize.width, primarySize.height, pattern);
            result.grid(grid);
            LOGGER.fine(() -> "Grid " + grid.columns() + "x" + grid.rows() + " at " + grid.width() + "x"
                + grid.height() + "px, pattern " + pattern);

            stage = enter(listener, GenerationStage.LOAD_PRIMARY_IMAGE);
            int[] decode = primaryDecodeSize(grid, primarySize, config.maxPrimaryDimension());
            primary = codec.load(primaryPath, decode[0], decode[1]);

            stage = enter(listener, GenerationStage.BUILD_CELL_CACHE);
            cache = new CellCacheBuilder(codec).build(
                project.cellPhotos(), grid, project.cellFitMode(), pattern, listener, cancel);
            if (cache.isEmpty()) {
                throw new IllegalStateException("No valid cell photos were loaded");
            }
            cancel.throwIfCancelled();

            stage = enter(listener, GenerationStage.BUILD_PLAN);
            MosaicPlan plan = MosaicPlanner.buildPlan(
                CellCounter.count(grid, pattern), MosaicPlanner.countCached(cache), pattern);
            int maxUses = maxUsesOverride.orElse(plan.maxPhotoUses());
            LOGGER.fine(() -> "Plan " + plan + ", max uses " + maxUses);

            stage = enter(listener, GenerationStage.PREPARE_PRIMARY_IMAGE);
            prepared = new ImageFitting(codec)
                .preparePrimary(primary, grid.width(), grid.height(), project.primarySizing());

            stage = enter(listener, GenerationStage.CREATE_MOSAIC);
            MosaicAssembler.Assembly assembly = new MosaicAssembler(project, grid, pattern, cache, maxUses,
                randomSource.get(), listener, cancel).assemble(prepared);

            stage = enter(listener, GenerationStage.SAVE_RESULTS);
            Path outputDir = config.outputDirectory();
            Files.createDirectories(outputDir);
            String runId = UUID.randomUUID().toString();
            Path mosaicPath = outputDir.resolve("mosaic_" + runId + ".jpg");
            Path overlayPath = outputDir.resolve("mosaic_overlay_" + runId + ".jpg");
            codec.writeJpeg(assembly.mosaic(), mosaicPath, config.jpegQuality());
            BufferedImage overlay = codec.blur(prepared, config.overlayBlurRadius());
            codec.writeJpeg(overlay, overlayPath, config.jpegQuality());
            overlay.flush();
            result.mosaicPath(mosaicPath).overlayPath(overlayPath);

            if (project.exportPdf()) {
                Path pdfPath = outputDir.resolve("mosaic_print_" + runId + ".pdf");
                new MosaicPdfExporter(config.jpegQuality())
                    .export(assembly.mosaic(), project.printSize().orElseThrow(), pdfPath);
                result.printPdfPath(pdfPath);
            }

            stage = enter(listener, GenerationStage.WRITE_REPORT);
            if (project.createReport()) {
                Path reportPath = outputDir.resolve("mosaic_usage_" + runId + ".csv");
                UsageReportWriter.write(reportPath, cache, assembly.history().usages());
                result.usageReportPath(reportPath);
            }

            result.photoCounts(cache.size(), assembly.history().distinctPhotosUsed());
            assembly.mosaic().flush();

            enter(listener, GenerationStage.COMPLETE);
            LOGGER.info("Mosaic " + mosaicPath.getFileName() + " created: " + assembly.placements()
                + " cells, " + assembly.history().distinctPhotosUsed() + "/" + cache.size() + " photos used");
        } catch (GenerationCancelledException ex) {
            LOGGER.info("Mosaic generation cancelled during " + stage.label());
            result.cancelled(CANCELLED_MESSAGE);
        } catch (MosaicConfigurationException ex) {
            LOGGER.warning("Mosaic generation rejected: " + ex.getMessage());
            result.failed("Mosaic generation failed: " + ex.getMessage());
        } catch (Exception | OutOfMemoryError ex) {
            LOGGER.log(Level.SEVERE, "Mosaic generation error during " + stage.label(), ex);
            failureLog.logFailure(stage.label(), project == null ? null : project.primaryImagePath().orElse(null),
                project == null ? 0 : project.cellPhotos().size(), ex);
            result.failed("Mosaic generation failed: " + describe(ex));
        } finally {
            CellCacheBuilder.release(cache);
            if (primary != null) {
                primary.flush();
            }
            if (prepared != null && prepared != primary) {
                prepared.flush();
            }
        }

        return result.generationTimeMs(System.currentTimeMillis() - startedAt).build();
    }

    /**
     * Size the primary image is decoded at: the grid scaled so its longer edge fits
     * {@code maxDimension}, and never beyond the image's native size.
     */
    static int[] primaryDecodeSize(GridDimensions grid, Dimension primarySize, int maxDimension) {
        int width = grid.width();
        int height = grid.height();
        int longest = Math.max(width, height);
        if (longest > maxDimension) {
            float scale = maxDimension / (float) longest;
            width = Math.max(1, (int) (width * scale));
            height = Math.max(1, (int) (height * scale));
        }
        return new int[] {
            Math.max(1, Math.min(width, primarySize.width)),
            Math.max(1, Math.min(height, primarySize.height))
        };
    }

    static String describe(Throwable ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    private static GenerationStage enter(ProgressListener listener, GenerationStage stage) {
        listener.report(stage.percent(), stage.label());
        return stage;
    }
}
