package com.tessera.core.engine;

/**
 * Ordered stages of a generation run with the percent each one starts at.
 */
public enum GenerationStage {
    VALIDATING(0, "Validating"),
    RESOLVE_PATTERN(1, "Get Pattern"),
    VERIFY_PRIMARY_IMAGE(2, "Verify Primary Image"),
    CALCULATE_GRID(3, "Calculating Grid"),
    LOAD_PRIMARY_IMAGE(4, "Loading Primary Image"),
    BUILD_CELL_CACHE(5, "Building Cell Cache"),
    BUILD_PLAN(10, "Building Mosaic Plan"),
    PREPARE_PRIMARY_IMAGE(10, "Preparing Primary Image"),
    CREATE_MOSAIC(10, "Creating Mosaic"),
    SAVE_RESULTS(95, "Saving Results"),
    WRITE_REPORT(98, "Writing Report"),
    COMPLETE(100, "Complete");

    public static final int CACHE_END_PERCENT = 10;
    public static final int MOSAIC_END_PERCENT = 95;

    private final int percent;
    private final String label;

    GenerationStage(int percent, String label) {
        this.percent = percent;
        this.label = label;
    }

    public int percent() {
        return percent;
    }

    public String label() {
        return label;
    }

    /**
     * Linear interpolation between {@code from} and {@code to} for {@code done} of {@code total}.
     */
    public static int interpolate(int from, int to, int done, int total) {
        if (total <= 0) {
            return to;
        }
        int clamped = Math.max(0, Math.min(done, total));
        return from + (int) ((long) (to - from) * clamped / total);
    }
}
