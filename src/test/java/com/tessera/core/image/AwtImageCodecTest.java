package com.tessera.core.image;

import com.tessera.core.model.CellImageFitMode;
import com.tessera.core.model.PrimaryImageSizingMode;
import com.tessera.testing.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AwtImageCodecTest {

    @TempDir
    Path tempDir;

    private final AwtImageCodec codec = new AwtImageCodec();

    @Test
    void subsamplingNeverDropsBelowTheTarget() {
        assertEquals(1, AwtImageCodec.sampleSize(100, 100, 100, 100));
        assertEquals(2, AwtImageCodec.sampleSize(400, 400, 150, 150));
        assertEquals(4, AwtImageCodec.sampleSize(4000, 3000, 900, 700));
        assertEquals(1, AwtImageCodec.sampleSize(400, 100, 100, 80));
    }

    @Test
    void loadsSubsampledImageAndReadsDimensions() throws IOException {
        Path file = TestImages.solidPng(tempDir, "big.png", 400, 200, Color.ORANGE);

        assertEquals(new Dimension(400, 200), codec.readDimensions(file));
        BufferedImage loaded = codec.load(file, 100, 50);
        assertEquals(100, loaded.getWidth());
        assertEquals(50, loaded.getHeight());
        assertEquals(BufferedImage.TYPE_INT_RGB, loaded.getType());
    }

    @Test
    void missingOrCorruptFilesFailWithIoException() throws IOException {
        Path corrupt = Files.writeString(tempDir.resolve("corrupt.jpg"), "garbage");

        assertThrows(IOException.class, () -> codec.load(tempDir.resolve("nope.png"), 10, 10));
        assertThrows(IOException.class, () -> codec.readDimensions(corrupt));
    }

    @Test
    void cropCenterKeepsTheMiddle() {
        BufferedImage source = TestImages.quartered(100, 100, Color.RED, Color.GREEN, Color.BLUE, Color.YELLOW);

        BufferedImage cropped = codec.cropCenter(source, 20, 20);

        assertEquals(20, cropped.getWidth());
        assertEquals(Color.RED.getRGB(), cropped.getRGB(0, 0));
        assertEquals(Color.YELLOW.getRGB(), cropped.getRGB(19, 19));
    }

    @Test
    void cropFitCoversTheCellWithoutDistortion() {
        // wide source: red left half, blue right half
        BufferedImage source = TestImages.quartered(200, 100, Color.RED, Color.BLUE, Color.RED, Color.BLUE);
        ImageFitting fitting = new ImageFitting(codec);

        BufferedImage fitted = fitting.fitCell(source, 30, 40, CellImageFitMode.CROP_CENTER);

        assertEquals(30, fitted.getWidth());
        assertEquals(40, fitted.getHeight());
        assertEquals(Color.RED.getRGB(), fitted.getRGB(2, 20));
        assertEquals(Color.BLUE.getRGB(), fitted.getRGB(27, 20));
    }

    @Test
    void preparePrimaryFillsTheCanvas() {
        BufferedImage source = TestImages.solid(300, 100, Color.GREEN);
        ImageFitting fitting = new ImageFitting(codec);

        BufferedImage keep = fitting.preparePrimary(source, 120, 40, PrimaryImageSizingMode.KEEP_ASPECT_RATIO);
        BufferedImage crop = fitting.preparePrimary(source, 100, 100, PrimaryImageSizingMode.CROP_TO_FILL);

        assertEquals(120, keep.getWidth());
        assertEquals(40, keep.getHeight());
        assertEquals(100, crop.getWidth());
        assertEquals(100, crop.getHeight());
    }

    @Test
    void blurWritesAndSmoothsEdges() throws IOException {
        BufferedImage source = TestImages.quartered(40, 40, Color.BLACK, Color.WHITE, Color.BLACK, Color.WHITE);

        BufferedImage blurred = codec.blur(source, 4);
        int edge = blurred.getRGB(20, 10) & 0xFF;
        assertTrue(edge > 0 && edge < 255);

        Path jpeg = tempDir.resolve("out/blurred.jpg");
        codec.writeJpeg(blurred, jpeg, 0.9f);
        assertTrue(Files.size(jpeg) > 0);
        assertEquals(new Dimension(40, 40), codec.readDimensions(jpeg));
    }
}
