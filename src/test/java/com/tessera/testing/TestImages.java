package com.tessera.testing;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

public final class TestImages {

    private TestImages() {
    }

    public static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * Image split into four equal quarters: top-left, top-right, bottom-left, bottom-right.
     */
    public static BufferedImage quartered(int width, int height, Color tl, Color tr, Color bl, Color br) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            int halfW = width / 2;
            int halfH = height / 2;
            g.setColor(tl);
            g.fillRect(0, 0, halfW, halfH);
            g.setColor(tr);
            g.fillRect(halfW, 0, width - halfW, halfH);
            g.setColor(bl);
            g.fillRect(0, halfH, halfW, height - halfH);
            g.setColor(br);
            g.fillRect(halfW, halfH, width - halfW, height - halfH);
        } finally {
            g.dispose();
        }
        return image;
    }

    public static Path writePng(BufferedImage image, Path target) throws IOException {
        if (!ImageIO.write(image, "png", target.toFile())) {
            throw new IOException("No PNG writer available");
        }
        return target;
    }

    public static Path solidPng(Path directory, String name, int width, int height, Color color) throws IOException {
        return writePng(solid(width, height, color), directory.resolve(name));
    }
}
