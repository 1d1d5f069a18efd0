package com.tessera.core.image;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * {@link ImageCodec} backed by ImageIO and Java2D.
 */
public final class AwtImageCodec implements ImageCodec {

    private static final int MAX_BLUR_DIMENSION = 1024;

    @Override
    public Dimension readDimensions(Path path) throws IOException {
        try (ImageInputStream input = openStream(path)) {
            ImageReader reader = firstReader(input, path);
            try {
                reader.setInput(input, true, true);
                return new Dimension(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        }
    }

    @Override
    public BufferedImage load(Path path, int maxWidth, int maxHeight) throws IOException {
        try (ImageInputStream input = openStream(path)) {
            ImageReader reader = firstReader(input, path);
            try {
                reader.setInput(input, true, true);
                int sampleSize = sampleSize(reader.getWidth(0), reader.getHeight(0), maxWidth, maxHeight);
                ImageReadParam param = reader.getDefaultReadParam();
                if (sampleSize > 1) {
                    param.setSourceSubsampling(sampleSize, sampleSize, 0, 0);
                }
                BufferedImage decoded = reader.read(0, param);
                if (decoded == null) {
                    throw new IOException("Decoder produced no image for " + path);
                }
                return toRgb(decoded);
            } finally {
                reader.dispose();
            }
        }
    }

    @Override
    public BufferedImage resize(BufferedImage source, int width, int height) {
        int w = Math.max(1, width);
        int h = Math.max(1, height);
        BufferedImage target = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = target.createGraphics();
        try {
            setupQualityRendering(g2d);
            g2d.drawImage(source, 0, 0, w, h, null);
        } finally {
            g2d.dispose();
        }
        return target;
    }

    @Override
    public BufferedImage cropCenter(BufferedImage source, int width, int height) {
        if (source.getWidth() == width && source.getHeight() == height) {
            return source;
        }
        int cropX = Math.max(0, (source.getWidth() - width) / 2);
        int cropY = Math.max(0, (source.getHeight() - height) / 2);
        int cropWidth = Math.max(1, Math.min(width, source.getWidth() - cropX));
        int cropHeight = Math.max(1, Math.min(height, source.getHeight() - cropY));

        BufferedImage copy = new BufferedImage(cropWidth, cropHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(source.getSubimage(cropX, cropY, cropWidth, cropHeight), 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }

    @Override
    public BufferedImage blur(BufferedImage source, int radius) {
        int longest = Math.max(source.getWidth(), source.getHeight());
        BufferedImage working = source;
        if (longest > MAX_BLUR_DIMENSION) {
            double scale = MAX_BLUR_DIMENSION / (double) longest;
            working = resize(source,
                Math.max(1, (int) (source.getWidth() * scale)),
                Math.max(1, (int) (source.getHeight() * scale)));
        }
        if (radius <= 0) {
            return working == source ? resize(source, source.getWidth(), source.getHeight()) : working;
        }
        return boxBlur(working, radius);
    }

    @Override
    public void writeJpeg(BufferedImage image, Path target, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (ImageOutputStream output = ImageIO.createImageOutputStream(target.toFile())) {
            if (output == null) {
                throw new IOException("Cannot open output stream for " + target);
            }
            writer.setOutput(output);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(Math.max(0f, Math.min(1f, quality)));
            writer.write(null, new IIOImage(toRgb(image), null, null), param);
        } finally {
            writer.dispose();
        }
    }

    static int sampleSize(int width, int height, int maxWidth, int maxHeight) {
        int sampleSize = 1;
        int limitWidth = Math.max(1, maxWidth);
        int limitHeight = Math.max(1, maxHeight);
        while (width / (sampleSize * 2) >= limitWidth && height / (sampleSize * 2) >= limitHeight) {
            sampleSize *= 2;
        }
        return sampleSize;
    }

    private static ImageInputStream openStream(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IOException("Image file not found: " + path);
        }
        ImageInputStream input = ImageIO.createImageInputStream(path.toFile());
        if (input == null) {
            throw new IOException("Cannot open image stream: " + path);
        }
        return input;
    }

    private static ImageReader firstReader(ImageInputStream input, Path path) throws IOException {
        Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
        if (!readers.hasNext()) {
            throw new IOException("Unsupported image format: " + path);
        }
        return readers.next();
    }

    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static BufferedImage boxBlur(BufferedImage source, int radius) {
        int width = source.getWidth();
        int height = source.getHeight();
        int[] pixels = source.getRGB(0, 0, width, height, null, 0, width);
        int[] horizontal = new int[pixels.length];
        int[] blurred = new int[pixels.length];
        blurPass(pixels, horizontal, width, height, radius, true);
        blurPass(horizontal, blurred, width, height, radius, false);

        BufferedImage output = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        output.setRGB(0, 0, width, height, blurred, 0, width);
        return output;
    }

    // Separable pass; edges are clamped.
    private static void blurPass(int[] in, int[] out, int width, int height, int radius, boolean alongRows) {
        int boxSize = 2 * radius + 1;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rSum = 0;
                int gSum = 0;
                int bSum = 0;
                for (int d = -radius; d <= radius; d++) {
                    int nx = alongRows ? Math.max(0, Math.min(width - 1, x + d)) : x;
                    int ny = alongRows ? y : Math.max(0, Math.min(height - 1, y + d));
                    int pixel = in[ny * width + nx];
                    rSum += (pixel >> 16) & 0xFF;
                    gSum += (pixel >> 8) & 0xFF;
                    bSum += pixel & 0xFF;
                }
                out[y * width + x] = 0xFF000000
                    | ((rSum / boxSize) << 16)
                    | ((gSum / boxSize) << 8)
                    | (bSum / boxSize);
            }
        }
    }

    private static void setupQualityRendering(Graphics2D g2d) {
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
    }
}
