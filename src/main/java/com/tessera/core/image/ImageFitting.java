package com.tessera.core.image;

import com.tessera.core.model.CellImageFitMode;
import com.tessera.core.model.PrimaryImageSizingMode;

import java.awt.image.BufferedImage;

/**
 * Fits photos into cell footprints and the primary image onto the mosaic canvas.
 */
public final class ImageFitting {

    private final ImageCodec codec;

    public ImageFitting(ImageCodec codec) {
        this.codec = codec;
    }

    public BufferedImage fitCell(BufferedImage source, int width, int height, CellImageFitMode mode) {
        if (mode == CellImageFitMode.STRETCH_TO_FIT) {
            return codec.resize(source, width, height);
        }
        double scale = Math.max(width / (double) source.getWidth(), height / (double) source.getHeight());
        int scaledWidth = Math.max(width, (int) Math.ceil(source.getWidth() * scale));
        int scaledHeight = Math.max(height, (int) Math.ceil(source.getHeight() * scale));
        BufferedImage scaled = codec.resize(source, scaledWidth, scaledHeight);
        BufferedImage cropped = codec.cropCenter(scaled, width, height);
        if (cropped != scaled) {
            scaled.flush();
        }
        return cropped;
    }

    /**
     * Scales the primary image onto a {@code width x height} canvas. Keep-aspect mode stretches
     * (the grid already matches the aspect ratio); crop mode covers and trims the overflow.
     */
    public BufferedImage preparePrimary(BufferedImage source, int width, int height, PrimaryImageSizingMode mode) {
        if (mode == PrimaryImageSizingMode.KEEP_ASPECT_RATIO) {
            return codec.resize(source, width, height);
        }
        double scale = Math.max(width / (double) source.getWidth(), height / (double) source.getHeight());
        int scaledWidth = Math.max(1, (int) (source.getWidth() * scale));
        int scaledHeight = Math.max(1, (int) (source.getHeight() * scale));
        BufferedImage scaled = codec.resize(source, scaledWidth, scaledHeight);
        BufferedImage cropped = codec.cropCenter(scaled, width, height);
        if (cropped.getWidth() == width && cropped.getHeight() == height) {
            return cropped;
        }
        return codec.resize(cropped, width, height);
    }
}
