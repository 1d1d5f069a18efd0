package com.tessera.core.render;

import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.MosaicPlacement;
import com.tessera.core.model.PhotoOrientation;
import com.tessera.core.model.QuadrantColors;
import com.tessera.core.model.RgbColor;
import com.tessera.testing.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MosaicCompositorTest {

    private static CellPhotoCache redSquare() {
        BufferedImage cell = TestImages.solid(10, 10, Color.RED);
        QuadrantColors quadrants = QuadrantColors.uniform(new RgbColor(255, 0, 0));
        return new CellPhotoCache(Path.of("red.png"), PhotoOrientation.SQUARE, new RgbColor(255, 0, 0),
            cell, cell, quadrants, quadrants);
    }

    private static MosaicPlacement at(int x, int y, RgbColor target) {
        return new MosaicPlacement(0, 0, x, y, 10, 10, PhotoOrientation.LANDSCAPE, target,
            QuadrantColors.uniform(target));
    }

    @Test
    void drawsAtThePlacementOriginAndLeavesTheRestWhite() {
        try (MosaicCompositor compositor = new MosaicCompositor(30, 20, 0)) {
            assertTrue(compositor.draw(redSquare(), at(10, 10, new RgbColor(0, 0, 255))));

            BufferedImage image = compositor.image();
            assertEquals(Color.RED.getRGB(), image.getRGB(15, 15));
            assertEquals(Color.WHITE.getRGB(), image.getRGB(5, 5));
            assertEquals(Color.WHITE.getRGB(), image.getRGB(25, 15));
        }
    }

    @Test
    void colorChangeBlendsTowardTheTarget() {
        try (MosaicCompositor compositor = new MosaicCompositor(10, 10, 50)) {
            compositor.draw(redSquare(), at(0, 0, new RgbColor(0, 0, 255)));

            Color pixel = new Color(compositor.image().getRGB(5, 5));
            assertTrue(pixel.getRed() > 100 && pixel.getRed() < 155);
            assertTrue(pixel.getBlue() > 100 && pixel.getBlue() < 155);
        }
    }

    @Test
    void releasedPhotosAreNotDrawn() {
        CellPhotoCache photo = redSquare();
        photo.release();
        try (MosaicCompositor compositor = new MosaicCompositor(10, 10, 0)) {
            assertFalse(compositor.draw(photo, at(0, 0, RgbColor.GRAY)));
            assertEquals(Color.WHITE.getRGB(), compositor.image().getRGB(5, 5));
        }
    }

    @Test
    void cellsOverhangingTheCanvasAreClipped() {
        try (MosaicCompositor compositor = new MosaicCompositor(10, 10, 0)) {
            assertTrue(compositor.draw(redSquare(), at(-5, 5, RgbColor.GRAY)));

            assertEquals(Color.RED.getRGB(), compositor.image().getRGB(2, 7));
            assertEquals(Color.WHITE.getRGB(), compositor.image().getRGB(7, 7));
        }
    }
}
