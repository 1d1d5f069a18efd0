package com.tessera.core.model;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of one generation run. An absent error message means success.
 */
public final class MosaicResult {

    public enum Outcome {
        SUCCESS,
        FAILED,
        CANCELLED
    }

    private final Outcome outcome;
    private final int gridRows;
    private final int gridColumns;
    private final int outputWidth;
    private final int outputHeight;
    private final Path mosaicPath;
    private final Path overlayPath;
    private final Path usageReportPath;
    private final Path printPdfPath;
    private final int totalCellPhotos;
    private final int usedCellPhotos;
    private final long generationTimeMs;
    private final String errorMessage;

    private MosaicResult(Builder builder) {
        this.outcome = builder.outcome;
        this.gridRows = builder.gridRows;
        this.gridColumns = builder.gridColumns;
        this.outputWidth = builder.outputWidth;
        this.outputHeight = builder.outputHeight;
        this.mosaicPath = builder.mosaicPath;
        this.overlayPath = builder.overlayPath;
        this.usageReportPath = builder.usageReportPath;
        this.printPdfPath = builder.printPdfPath;
        this.totalCellPhotos = builder.totalCellPhotos;
        this.usedCellPhotos = builder.usedCellPhotos;
        this.generationTimeMs = builder.generationTimeMs;
        this.errorMessage = builder.errorMessage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isCancelled() {
        return outcome == Outcome.CANCELLED;
    }

    public int gridRows() {
        return gridRows;
    }

    public int gridColumns() {
        return gridColumns;
    }

    public int outputWidth() {
        return outputWidth;
    }

    public int outputHeight() {
        return outputHeight;
    }

    public Optional<Path> mosaicPath() {
        return Optional.ofNullable(mosaicPath);
    }

    public Optional<Path> overlayPath() {
        return Optional.ofNullable(overlayPath);
    }

    public Optional<Path> usageReportPath() {
        return Optional.ofNullable(usageReportPath);
    }

    public Optional<Path> printPdfPath() {
        return Optional.ofNullable(printPdfPath);
    }

    public int totalCellPhotos() {
        return totalCellPhotos;
    }

    public int usedCellPhotos() {
        return usedCellPhotos;
    }

    public int unusedCellPhotos() {
        return Math.max(0, totalCellPhotos - usedCellPhotos);
    }

    public long generationTimeMs() {
        return generationTimeMs;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        return "MosaicResult[" + outcome
            + ", grid=" + gridRows + "x" + gridColumns
            + ", size=" + outputWidth + "x" + outputHeight
            + ", photos=" + usedCellPhotos + "/" + totalCellPhotos
            + ", ms=" + generationTimeMs
            + (errorMessage == null ? "" : ", error=" + errorMessage)
            + "]";
    }

    public static final class Builder {
        private Outcome outcome = Outcome.SUCCESS;
        private int gridRows;
        private int gridColumns;
        private int outputWidth;
        private int outputHeight;
        private Path mosaicPath;
        private Path overlayPath;
        private Path usageReportPath;
        private Path printPdfPath;
        private int totalCellPhotos;
        private int usedCellPhotos;
        private long generationTimeMs;
        private String errorMessage;

        private Builder() {
        }

        public Builder grid(GridDimensions grid) {
            this.gridRows = grid.rows();
            this.gridColumns = grid.columns();
            this.outputWidth = grid.width();
            this.outputHeight = grid.height();
            return this;
        }

        public Builder mosaicPath(Path mosaicPath) {
            this.mosaicPath = mosaicPath;
            return this;
        }

        public Builder overlayPath(Path overlayPath) {
            this.overlayPath = overlayPath;
            return this;
        }

        public Builder usageReportPath(Path usageReportPath) {
            this.usageReportPath = usageReportPath;
            return this;
        }

        public Builder printPdfPath(Path printPdfPath) {
            this.printPdfPath = printPdfPath;
            return this;
        }

        public Builder photoCounts(int total, int used) {
            this.totalCellPhotos = total;
            this.usedCellPhotos = used;
            return this;
        }

        public Builder generationTimeMs(long generationTimeMs) {
            this.generationTimeMs = generationTimeMs;
            return this;
        }

        public Builder failed(String message) {
            this.outcome = Outcome.FAILED;
            this.errorMessage = message;
            return this;
        }

        public Builder cancelled(String message) {
            this.outcome = Outcome.CANCELLED;
            this.errorMessage = message;
            return this;
        }

        public MosaicResult build() {
            return new MosaicResult(this);
        }
    }
}
