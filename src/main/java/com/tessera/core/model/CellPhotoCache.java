package com.tessera.core.model;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Pre-analysed candidate photo: fitted cell images plus color signatures.
 *
 * <p>Owned by exactly one generation run. The use count is mutated while cells are placed and
 * the images are released when the run ends.</p>
 */
public final class CellPhotoCache {

    private final Path path;
    private final PhotoOrientation orientation;
    private final RgbColor averageColor;
    private final QuadrantColors landscapeQuadrants;
    private final QuadrantColors portraitQuadrants;
    private BufferedImage landscapeImage;
    private BufferedImage portraitImage;
    private int useCount;

    public CellPhotoCache(Path path,
                          PhotoOrientation orientation,
                          RgbColor averageColor,
                          BufferedImage landscapeImage,
                          BufferedImage portraitImage,
                          QuadrantColors landscapeQuadrants,
                          QuadrantColors portraitQuadrants) {
        this.path = Objects.requireNonNull(path, "path");
        this.orientation = Objects.requireNonNull(orientation, "orientation");
        this.averageColor = averageColor == null ? RgbColor.GRAY : averageColor;
        this.landscapeImage = landscapeImage;
        this.portraitImage = portraitImage;
        this.landscapeQuadrants = landscapeQuadrants == null ? QuadrantColors.GRAY : landscapeQuadrants;
        this.portraitQuadrants = portraitQuadrants == null ? QuadrantColors.GRAY : portraitQuadrants;
    }

    public Path path() {
        return path;
    }

    public PhotoOrientation orientation() {
        return orientation;
    }

    public RgbColor averageColor() {
        return averageColor;
    }

    public QuadrantColors landscapeQuadrants() {
        return landscapeQuadrants;
    }

    public QuadrantColors portraitQuadrants() {
        return portraitQuadrants;
    }

    public QuadrantColors quadrantsFor(PhotoOrientation slot) {
        return slot == PhotoOrientation.PORTRAIT ? portraitQuadrants : landscapeQuadrants;
    }

    /**
     * Fitted image for the slot orientation, falling back to the other variant when absent.
     */
    public BufferedImage imageFor(PhotoOrientation slot) {
        if (slot == PhotoOrientation.PORTRAIT) {
            return portraitImage != null ? portraitImage : landscapeImage;
        }
        return landscapeImage != null ? landscapeImage : portraitImage;
    }

    public int useCount() {
        return useCount;
    }

    public void recordUse() {
        useCount++;
    }

    public boolean isReleased() {
        return landscapeImage == null && portraitImage == null;
    }

    public void release() {
        if (landscapeImage != null) {
            landscapeImage.flush();
            landscapeImage = null;
        }
        if (portraitImage != null) {
            portraitImage.flush();
            portraitImage = null;
        }
    }

    @Override
    public String toString() {
        return "CellPhotoCache[" + path.getFileName() + ", " + orientation + ", uses=" + useCount + "]";
    }
}
