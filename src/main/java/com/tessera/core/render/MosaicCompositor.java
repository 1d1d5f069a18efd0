package com.tessera.core.render;

import com.tessera.core.color.ColorMath;
import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.MosaicPlacement;
import com.tessera.core.model.RgbColor;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Canvas the matched cell photos are drawn onto. Unfilled cells stay white.
 */
public final class MosaicCompositor implements AutoCloseable {

    private final BufferedImage canvas;
    private final Graphics2D graphics;
    private final int colorChangePercent;

    public MosaicCompositor(int width, int height, int colorChangePercent) {
        this.canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        this.graphics = canvas.createGraphics();
        this.colorChangePercent = Math.max(0, Math.min(100, colorChangePercent));
        setupRendering(graphics);
        graphics.setColor(Color.WHITE);
        graphics.fillRect(0, 0, width, height);
    }

    /**
     * Draws the photo's fitted variant for the placement orientation at the placement origin,
     * blended toward the target color when a color change is configured.
     *
     * @return false when the photo has no image left to draw
     */
    public boolean draw(CellPhotoCache photo, MosaicPlacement placement) {
        BufferedImage cell = photo.imageFor(placement.orientation());
        if (cell == null) {
            return false;
        }
        if (colorChangePercent > 0) {
            cell = blended(cell, placement.targetColor(), colorChangePercent);
        }
        graphics.drawImage(cell, placement.x(), placement.y(), null);
        return true;
    }

    public BufferedImage image() {
        return canvas;
    }

    @Override
    public void close() {
        graphics.dispose();
    }

    static BufferedImage blended(BufferedImage source, RgbColor target, int percent) {
        int width = source.getWidth();
        int height = source.getHeight();
        int[] pixels = source.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = ColorMath.blend(pixels[i], target, percent);
        }
        BufferedImage copy = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        copy.setRGB(0, 0, width, height, pixels, 0, width);
        return copy;
    }

    private static void setupRendering(Graphics2D g2d) {
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
    }
}
