package com.tessera.core.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable generation request: the primary image, the photo library and every layout setting.
 */
public final class MosaicProject {

    public static final int DEFAULT_RANDOM_CELL_CANDIDATES = 5;
    public static final int MAX_RANDOM_CELL_CANDIDATES = 20;

    private final Path primaryImagePath;
    private final List<CellPhoto> cellPhotos;
    private final PrintSize printSize;
    private final Integer resolutionPpi;
    private final Double cellSizeMm;
    private final CellShape cellShape;
    private final CellImageFitMode cellFitMode;
    private final PrimaryImageSizingMode primarySizing;
    private final String pattern;
    private final int colorChangePercent;
    private final Integer duplicateSpacing;
    private final int randomCellCandidates;
    private final boolean useAllImages;
    private final boolean createReport;
    private final boolean exportPdf;

    private MosaicProject(Builder builder) {
        this.primaryImagePath = builder.primaryImagePath;
        this.cellPhotos = List.copyOf(builder.cellPhotos);
        this.printSize = builder.printSize;
        this.resolutionPpi = builder.resolutionPpi;
        this.cellSizeMm = builder.cellSizeMm;
        this.cellShape = builder.cellShape;
        this.cellFitMode = builder.cellFitMode;
        this.primarySizing = builder.primarySizing;
        this.pattern = builder.pattern;
        this.colorChangePercent = builder.colorChangePercent;
        this.duplicateSpacing = builder.duplicateSpacing;
        this.randomCellCandidates = builder.randomCellCandidates;
        this.useAllImages = builder.useAllImages;
        this.createReport = builder.createReport;
        this.exportPdf = builder.exportPdf;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Path> primaryImagePath() {
        return Optional.ofNullable(primaryImagePath);
    }

    public List<CellPhoto> cellPhotos() {
        return cellPhotos;
    }

    public Optional<PrintSize> printSize() {
        return Optional.ofNullable(printSize);
    }

    public OptionalInt resolutionPpi() {
        return resolutionPpi == null ? OptionalInt.empty() : OptionalInt.of(resolutionPpi);
    }

    public Optional<Double> cellSizeMm() {
        return Optional.ofNullable(cellSizeMm);
    }

    public CellShape cellShape() {
        return cellShape;
    }

    public CellImageFitMode cellFitMode() {
        return cellFitMode;
    }

    public PrimaryImageSizingMode primarySizing() {
        return primarySizing;
    }

    public String pattern() {
        return pattern;
    }

    /**
     * Blend percentage toward the target color, clamped to 0..100.
     */
    public int colorChangePercent() {
        return Math.max(0, Math.min(100, colorChangePercent));
    }

    public OptionalInt duplicateSpacing() {
        return duplicateSpacing == null ? OptionalInt.empty() : OptionalInt.of(duplicateSpacing);
    }

    /**
     * Shortlist size for the randomized pick, clamped to 1..20.
     */
    public int randomCellCandidates() {
        return Math.max(1, Math.min(MAX_RANDOM_CELL_CANDIDATES, randomCellCandidates));
    }

    public boolean useAllImages() {
        return useAllImages;
    }

    public boolean createReport() {
        return createReport;
    }

    public boolean exportPdf() {
        return exportPdf;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .primaryImage(primaryImagePath)
            .cellPhotos(cellPhotos)
            .printSize(printSize)
            .cellShape(cellShape)
            .cellFitMode(cellFitMode)
            .primarySizing(primarySizing)
            .pattern(pattern)
            .colorChangePercent(colorChangePercent)
            .randomCellCandidates(randomCellCandidates)
            .useAllImages(useAllImages)
            .createReport(createReport)
            .exportPdf(exportPdf);
        builder.resolutionPpi = resolutionPpi;
        builder.cellSizeMm = cellSizeMm;
        builder.duplicateSpacing = duplicateSpacing;
        return builder;
    }

    public static final class Builder {
        private Path primaryImagePath;
        private final List<CellPhoto> cellPhotos = new ArrayList<>();
        private PrintSize printSize;
        private Integer resolutionPpi;
        private Double cellSizeMm;
        private CellShape cellShape = CellShape.SQUARE;
        private CellImageFitMode cellFitMode = CellImageFitMode.CROP_CENTER;
        private PrimaryImageSizingMode primarySizing = PrimaryImageSizingMode.KEEP_ASPECT_RATIO;
        private String pattern = "Square";
        private int colorChangePercent;
        private Integer duplicateSpacing;
        private int randomCellCandidates = DEFAULT_RANDOM_CELL_CANDIDATES;
        private boolean useAllImages;
        private boolean createReport = true;
        private boolean exportPdf;

        private Builder() {
        }

        public Builder primaryImage(Path primaryImagePath) {
            this.primaryImagePath = primaryImagePath;
            return this;
        }

        public Builder cellPhotos(List<CellPhoto> photos) {
            this.cellPhotos.clear();
            if (photos != null) {
                this.cellPhotos.addAll(photos);
            }
            return this;
        }

        public Builder addCellPhoto(Path path, PhotoOrientation orientation) {
            this.cellPhotos.add(new CellPhoto(path, orientation));
            return this;
        }

        public Builder printSize(PrintSize printSize) {
            this.printSize = printSize;
            return this;
        }

        public Builder resolutionPpi(int ppi) {
            if (ppi < 1) {
                throw new IllegalArgumentException("Resolution must be at least 1 PPI, was " + ppi);
            }
            this.resolutionPpi = ppi;
            return this;
        }

        public Builder cellSizeMm(double sizeMm) {
            if (!(sizeMm > 0)) {
                throw new IllegalArgumentException("Cell size must be positive, was " + sizeMm);
            }
            this.cellSizeMm = sizeMm;
            return this;
        }

        public Builder cellShape(CellShape cellShape) {
            this.cellShape = cellShape == null ? CellShape.SQUARE : cellShape;
            return this;
        }

        public Builder cellFitMode(CellImageFitMode cellFitMode) {
            this.cellFitMode = cellFitMode == null ? CellImageFitMode.CROP_CENTER : cellFitMode;
            return this;
        }

        public Builder primarySizing(PrimaryImageSizingMode primarySizing) {
            this.primarySizing = primarySizing == null ? PrimaryImageSizingMode.KEEP_ASPECT_RATIO : primarySizing;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder colorChangePercent(int colorChangePercent) {
            this.colorChangePercent = colorChangePercent;
            return this;
        }

        public Builder duplicateSpacing(int spacing) {
            this.duplicateSpacing = spacing <= 0 ? null : spacing;
            return this;
        }

        public Builder randomCellCandidates(int randomCellCandidates) {
            this.randomCellCandidates = randomCellCandidates;
            return this;
        }

        public Builder useAllImages(boolean useAllImages) {
            this.useAllImages = useAllImages;
            return this;
        }

        public Builder createReport(boolean createReport) {
            this.createReport = createReport;
            return this;
        }

        public Builder exportPdf(boolean exportPdf) {
            this.exportPdf = exportPdf;
            return this;
        }

        public MosaicProject build() {
            return new MosaicProject(this);
        }
    }
}
