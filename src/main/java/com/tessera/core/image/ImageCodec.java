package com.tessera.core.image;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Raster decode, encode and resampling primitives used by the mosaic engine.
 */
public interface ImageCodec {

    /**
     * Reads the pixel dimensions without decoding the raster.
     */
    Dimension readDimensions(Path path) throws IOException;

    /**
     * Decodes the image, subsampled so that it is no larger than it needs to be to cover
     * {@code maxWidth x maxHeight}.
     */
    BufferedImage load(Path path, int maxWidth, int maxHeight) throws IOException;

    BufferedImage resize(BufferedImage source, int width, int height);

    /**
     * Cuts a centered {@code width x height} window out of the source (or less, when smaller).
     */
    BufferedImage cropCenter(BufferedImage source, int width, int height);

    BufferedImage blur(BufferedImage source, int radius);

    void writeJpeg(BufferedImage image, Path target, float quality) throws IOException;
}
