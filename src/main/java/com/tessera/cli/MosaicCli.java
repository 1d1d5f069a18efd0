package com.tessera.cli;

import com.tessera.config.EngineConfig;
import com.tessera.core.engine.CancellationCheck;
import com.tessera.core.engine.MosaicGenerationService;
import com.tessera.core.engine.ProgressListener;
import com.tessera.core.engine.ThrottledProgressListener;
import com.tessera.core.image.AwtImageCodec;
import com.tessera.core.image.ImageCodec;
import com.tessera.core.json.MosaicProjectLoader;
import com.tessera.core.model.MosaicPlan;
import com.tessera.core.model.MosaicResult;
import com.tessera.core.report.GenerationFailureLog;
import com.tessera.logging.AppLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point: reads a project JSON file and generates the mosaic, or with
 * {@code --plan} only prints the cell/photo plan.
 */
public final class MosaicCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOGGER = AppLogger.get();
    private static final String USAGE =
        "Usage: MosaicCli <project.json> [--max-uses N] [--output DIR] [--plan]";

    private MosaicCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, EngineConfig.load(), System.out, System.err));
    }

    static int run(String[] args, EngineConfig baseConfig, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (!Files.isRegularFile(options.projectFile())) {
            err.println("Project file not found: " + options.projectFile());
            return EXIT_USAGE;
        }

        ImageCodec codec = new AwtImageCodec();
        EngineConfig config = baseConfig.withOutputDirectory(options.outputDir());
        MosaicGenerationService service =
            new MosaicGenerationService(config, codec, new GenerationFailureLog(), Random::new);

        MosaicProjectLoader.ProjectFile projectFile;
        try {
            projectFile = new MosaicProjectLoader(codec).load(options.projectFile());
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Cannot read project " + options.projectFile(), ex);
            err.println("Cannot read project: " + ex.getMessage());
            return EXIT_FAILED;
        }

        if (options.planOnly()) {
            try {
                MosaicPlan plan = service.plan(projectFile.project());
                out.printf("Cells: %d (landscape %d, portrait %d)%n",
                    plan.totalCells(), plan.landscapeCells(), plan.portraitCells());
                out.printf("Photos: %d (landscape-capable %d, portrait-capable %d)%n",
                    plan.availablePhotos(), plan.availableLandscapePhotos(), plan.availablePortraitPhotos());
                out.println("Recommended max uses: " + formatUses(plan.maxPhotoUses()));
                return EXIT_OK;
            } catch (IOException | IllegalArgumentException ex) {
                err.println("Cannot plan mosaic: " + ex.getMessage());
                return EXIT_FAILED;
            }
        }

        OptionalInt maxUses = options.maxUses().isPresent() ? options.maxUses() : projectFile.maxUses();
        ProgressListener progress = new ThrottledProgressListener(
            p -> out.printf("[%3d%%] %s%n", p.percentComplete(), p.stage()), config.progressIntervalMs());
        MosaicResult result = service.generate(
            projectFile.project(), maxUses, progress, CancellationCheck.threadInterruption());

        printSummary(result, out, err);
        return result.isSuccess() ? EXIT_OK : EXIT_FAILED;
    }

    private static void printSummary(MosaicResult result, PrintStream out, PrintStream err) {
        if (!result.isSuccess()) {
            err.println(result.errorMessage().orElse("Mosaic generation failed"));
            return;
        }
        out.printf("Grid: %d x %d cells, %d x %d px%n",
            result.gridColumns(), result.gridRows(), result.outputWidth(), result.outputHeight());
        out.printf("Photos used: %d of %d (%d unused)%n",
            result.usedCellPhotos(), result.totalCellPhotos(), result.unusedCellPhotos());
        result.mosaicPath().ifPresent(p -> out.println("Mosaic: " + p));
        result.overlayPath().ifPresent(p -> out.println("Overlay: " + p));
        result.usageReportPath().ifPresent(p -> out.println("Usage report: " + p));
        result.printPdfPath().ifPresent(p -> out.println("Print PDF: " + p));
        out.printf("Completed in %d ms%n", result.generationTimeMs());
    }

    private static String formatUses(int uses) {
        return uses == Integer.MAX_VALUE ? "unlimited" : Integer.toString(uses);
    }

    record Options(Path projectFile, OptionalInt maxUses, Path outputDir, boolean planOnly) {

        static Options parse(String[] args) {
            if (args == null || args.length == 0) {
                throw new IllegalArgumentException("Missing project file");
            }
            Path projectFile = null;
            OptionalInt maxUses = OptionalInt.empty();
            Path outputDir = null;
            boolean planOnly = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--max-uses" -> {
                        int value = parsePositive(requireValue(args, ++i, arg), arg);
                        maxUses = OptionalInt.of(value);
                    }
                    case "--output" -> outputDir = Path.of(requireValue(args, ++i, arg));
                    case "--plan" -> planOnly = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (projectFile != null) {
                            throw new IllegalArgumentException("Only one project file may be given");
                        }
                        projectFile = Path.of(arg);
                    }
                }
            }
            if (projectFile == null) {
                throw new IllegalArgumentException("Missing project file");
            }
            return new Options(projectFile, maxUses, outputDir, planOnly);
        }

        private static String requireValue(String[] args, int index, String option) {
            if (index >= args.length || args[index].startsWith("--")) {
                throw new IllegalArgumentException(option + " needs a value");
            }
            return args[index];
        }

        private static int parsePositive(String raw, String option) {
            try {
                int value = Integer.parseInt(raw.trim());
                if (value < 1) {
                    throw new IllegalArgumentException(option + " must be at least 1, was " + value);
                }
                return value;
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(option + " expects a number, was " + raw);
            }
        }
    }
}
