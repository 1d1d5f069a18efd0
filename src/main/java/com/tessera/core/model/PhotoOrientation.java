package com.tessera.core.model;

/**
 * Orientation of a candidate photo or of a cell slot in the mosaic.
 */
public enum PhotoOrientation {
    LANDSCAPE,
    PORTRAIT,
    SQUARE;

    public static PhotoOrientation of(int width, int height) {
        if (width > height) {
            return LANDSCAPE;
        }
        if (height > width) {
            return PORTRAIT;
        }
        return SQUARE;
    }

    /**
     * A square photo can fill either kind of slot; otherwise orientations must agree.
     */
    public boolean canServe(PhotoOrientation slot) {
        if (slot == null || slot == SQUARE || this == SQUARE) {
            return true;
        }
        return this == slot;
    }

    public boolean servesLandscape() {
        return this == LANDSCAPE || this == SQUARE;
    }

    public boolean servesPortrait() {
        return this == PORTRAIT || this == SQUARE;
    }
}
