package com.tessera.core.model;

import java.util.Optional;

/**
 * Cell photo pattern together with the landscape:portrait repeat ratio used by parquet tiling.
 */
public record PatternInfo(PatternKind kind, int landscapeCount, int portraitCount) {

    public PatternInfo {
        if (kind == null) {
            throw new IllegalArgumentException("Pattern kind is required");
        }
        if (kind == PatternKind.PARQUET && (landscapeCount < 1 || portraitCount < 1)) {
            throw new IllegalArgumentException(
                "Parquet ratio must be at least 1L 1P, was " + landscapeCount + "L " + portraitCount + "P");
        }
    }

    public static PatternInfo square() {
        return new PatternInfo(PatternKind.SQUARE, 0, 0);
    }

    public static PatternInfo landscapeOnly() {
        return new PatternInfo(PatternKind.LANDSCAPE_ONLY, 1, 0);
    }

    public static PatternInfo portraitOnly() {
        return new PatternInfo(PatternKind.PORTRAIT_ONLY, 0, 1);
    }

    public static PatternInfo parquet(int landscapeCount, int portraitCount) {
        return new PatternInfo(PatternKind.PARQUET, landscapeCount, portraitCount);
    }

    public boolean isParquet() {
        return kind == PatternKind.PARQUET;
    }

    /**
     * Orientation every cell must have, present only for the single-orientation patterns.
     */
    public Optional<PhotoOrientation> requiredOrientation() {
        return switch (kind) {
            case LANDSCAPE_ONLY -> Optional.of(PhotoOrientation.LANDSCAPE);
            case PORTRAIT_ONLY -> Optional.of(PhotoOrientation.PORTRAIT);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SQUARE -> "Square";
            case LANDSCAPE_ONLY -> "Landscape";
            case PORTRAIT_ONLY -> "Portrait";
            case PARQUET -> "Parquet " + landscapeCount + "L " + portraitCount + "P";
        };
    }
}
