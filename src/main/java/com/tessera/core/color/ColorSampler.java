package com.tessera.core.color;

import com.tessera.core.model.QuadrantColors;
import com.tessera.core.model.RgbColor;

import java.awt.image.BufferedImage;

/**
 * Sparse-sampling color averages over packed ARGB pixel arrays.
 *
 * <p>Only every Nth pixel is read. Accuracy is traded for speed on large libraries.</p>
 */
public final class ColorSampler {

    private static final int WHOLE_IMAGE_SAMPLES_PER_ROW = 50;
    private static final int REGION_SAMPLES_PER_ROW = 10;

    private ColorSampler() {
    }

    public static int[] pixels(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        return image.getRGB(0, 0, width, height, null, 0, width);
    }

    public static RgbColor averageColorFast(BufferedImage image) {
        return averageColorFast(pixels(image), image.getWidth(), image.getHeight());
    }

    public static RgbColor averageColorFast(int[] pixels, int width, int height) {
        int step = Math.max(1, width / WHOLE_IMAGE_SAMPLES_PER_ROW);
        long rSum = 0;
        long gSum = 0;
        long bSum = 0;
        int count = 0;
        for (int y = 0; y < height; y += step) {
            for (int x = 0; x < width; x += step) {
                int pixel = pixels[y * width + x];
                rSum += (pixel >> 16) & 0xFF;
                gSum += (pixel >> 8) & 0xFF;
                bSum += pixel & 0xFF;
                count++;
            }
        }
        if (count == 0) {
            return RgbColor.GRAY;
        }
        return new RgbColor((int) (rSum / count), (int) (gSum / count), (int) (bSum / count));
    }

    /**
     * Average of the region clipped to the image; gray when nothing of it is inside.
     */
    public static RgbColor averageRegion(int[] pixels, int imageWidth, int imageHeight,
                                         int x, int y, int width, int height) {
        int x1 = Math.max(0, x);
        int y1 = Math.max(0, y);
        int x2 = Math.min(imageWidth, x + width);
        int y2 = Math.min(imageHeight, y + height);
        int w = x2 - x1;
        int h = y2 - y1;
        if (w <= 0 || h <= 0) {
            return RgbColor.GRAY;
        }

        int step = Math.max(1, w / REGION_SAMPLES_PER_ROW);
        long rSum = 0;
        long gSum = 0;
        long bSum = 0;
        int count = 0;
        for (int sy = y1; sy < y2; sy += step) {
            for (int sx = x1; sx < x2; sx += step) {
                int pixel = pixels[sy * imageWidth + sx];
                rSum += (pixel >> 16) & 0xFF;
                gSum += (pixel >> 8) & 0xFF;
                bSum += pixel & 0xFF;
                count++;
            }
        }
        return new RgbColor((int) (rSum / count), (int) (gSum / count), (int) (bSum / count));
    }

    /**
     * Samples only the central half of the clipped region, so cells hanging over the canvas
     * edge are judged by their visible interior.
     */
    public static RgbColor averageRegionClamped(int[] pixels, int imageWidth, int imageHeight,
                                                int x, int y, int width, int height) {
        int x1 = Math.max(0, x);
        int y1 = Math.max(0, y);
        int x2 = Math.min(imageWidth, x + width);
        int y2 = Math.min(imageHeight, y + height);
        int w = x2 - x1;
        int h = y2 - y1;
        if (w <= 0 || h <= 0) {
            return RgbColor.GRAY;
        }
        int sampleX = x1 + Math.max(1, w / 4);
        int sampleY = y1 + Math.max(1, h / 4);
        return averageRegion(pixels, imageWidth, imageHeight,
            sampleX, sampleY, Math.max(1, w / 2), Math.max(1, h / 2));
    }

    public static QuadrantColors quadrants(BufferedImage image) {
        return quadrants(pixels(image), image.getWidth(), image.getHeight(),
            0, 0, image.getWidth(), image.getHeight(), false);
    }

    public static QuadrantColors quadrants(int[] pixels, int imageWidth, int imageHeight,
                                           int x, int y, int width, int height, boolean clamp) {
        int halfWidth = Math.max(1, width / 2);
        int halfHeight = Math.max(1, height / 2);
        int restWidth = Math.max(1, width - halfWidth);
        int restHeight = Math.max(1, height - halfHeight);

        RgbColor topLeft = sample(pixels, imageWidth, imageHeight, x, y, halfWidth, halfHeight, clamp);
        RgbColor topRight = sample(pixels, imageWidth, imageHeight, x + halfWidth, y, restWidth, halfHeight, clamp);
        RgbColor bottomLeft = sample(pixels, imageWidth, imageHeight, x, y + halfHeight, halfWidth, restHeight, clamp);
        RgbColor bottomRight = sample(pixels, imageWidth, imageHeight,
            x + halfWidth, y + halfHeight, restWidth, restHeight, clamp);
        return new QuadrantColors(topLeft, topRight, bottomLeft, bottomRight);
    }

    private static RgbColor sample(int[] pixels, int imageWidth, int imageHeight,
                                   int x, int y, int width, int height, boolean clamp) {
        return clamp
            ? averageRegionClamped(pixels, imageWidth, imageHeight, x, y, width, height)
            : averageRegion(pixels, imageWidth, imageHeight, x, y, width, height);
    }
}
