package com.tessera.core.pdf;

import com.tessera.core.model.PrintSize;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes the finished mosaic as a single-page PDF sized to the physical print.
 */
public class MosaicPdfExporter {

    static final float POINTS_PER_INCH = 72f;

    private final float jpegQuality;

    public MosaicPdfExporter(float jpegQuality) {
        this.jpegQuality = jpegQuality;
    }

    /**
     * The page takes the print size in the mosaic's orientation, trimmed to the mosaic's aspect
     * ratio, and the image is drawn edge to edge.
     *
     * @param mosaic    rendered mosaic
     * @param printSize physical print size; its sides are swapped to match the mosaic orientation
     * @param target    PDF file to create
     * @throws IOException if the document cannot be written
     */
    public void export(BufferedImage mosaic, PrintSize printSize, Path target) throws IOException {
        Objects.requireNonNull(mosaic, "mosaic");
        Objects.requireNonNull(printSize, "printSize");
        Objects.requireNonNull(target, "target");
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }

        PDRectangle pageSize = pageSize(printSize, mosaic.getWidth(), mosaic.getHeight());
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(pageSize);
            document.addPage(page);
            PDImageXObject image = JPEGFactory.createFromImage(document, mosaic, jpegQuality);
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                stream.drawImage(image, 0, 0, pageSize.getWidth(), pageSize.getHeight());
            }
            document.save(target.toFile());
        }
    }

    /**
     * Oriented print rectangle shrunk on one side to the mosaic's aspect ratio.
     */
    static PDRectangle pageSize(PrintSize printSize, int imageWidth, int imageHeight) {
        double longSide = Math.max(printSize.widthInches(), printSize.heightInches());
        double shortSide = Math.min(printSize.widthInches(), printSize.heightInches());
        boolean landscape = imageWidth >= imageHeight;
        double widthInches = landscape ? longSide : shortSide;
        double heightInches = landscape ? shortSide : longSide;

        double imageAspect = imageWidth / (double) Math.max(1, imageHeight);
        if (imageAspect >= widthInches / heightInches) {
            heightInches = widthInches / imageAspect;
        } else {
            widthInches = heightInches * imageAspect;
        }
        return new PDRectangle((float) (widthInches * POINTS_PER_INCH), (float) (heightInches * POINTS_PER_INCH));
    }
}
