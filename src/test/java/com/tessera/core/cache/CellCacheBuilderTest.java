package com.tessera.core.cache;

import com.tessera.core.engine.CancellationCheck;
import com.tessera.core.engine.GenerationCancelledException;
import com.tessera.core.engine.ProgressListener;
import com.tessera.core.image.AwtImageCodec;
import com.tessera.core.model.CellImageFitMode;
import com.tessera.core.model.CellPhoto;
import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.GenerationProgress;
import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.PatternInfo;
import com.tessera.core.model.PhotoOrientation;
import com.tessera.core.model.RgbColor;
import com.tessera.testing.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CellCacheBuilderTest {

    @TempDir
    Path tempDir;

    private static GridDimensions grid() {
        return new GridDimensions(400, 300, 10, 40, 30, 40, 30, 30, 40, 30, 40, 30, 40);
    }

    private List<CellPhoto> solidPhotos(int count) throws IOException {
        List<CellPhoto> photos = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Path file = TestImages.solidPng(tempDir, "photo-" + i + ".png", 60, 60, new Color(i * 20, 100, 200));
            photos.add(new CellPhoto(file, PhotoOrientation.SQUARE));
        }
        return photos;
    }

    @Test
    void squarePhotosGetBothCellVariants() throws IOException {
        List<CellPhotoCache> cache = new CellCacheBuilder(new AwtImageCodec()).build(solidPhotos(2), grid(),
            CellImageFitMode.CROP_CENTER, PatternInfo.parquet(2, 1), ProgressListener.NONE, CancellationCheck.never());

        assertEquals(2, cache.size());
        CellPhotoCache first = cache.get(0);
        assertEquals(40, first.imageFor(PhotoOrientation.LANDSCAPE).getWidth());
        assertEquals(30, first.imageFor(PhotoOrientation.LANDSCAPE).getHeight());
        assertEquals(30, first.imageFor(PhotoOrientation.PORTRAIT).getWidth());
        assertEquals(40, first.imageFor(PhotoOrientation.PORTRAIT).getHeight());
        assertEquals(new RgbColor(0, 100, 200), first.averageColor());
        assertEquals(new RgbColor(20, 100, 200), cache.get(1).landscapeQuadrants().topLeft());
    }

    @Test
    void unreadablePhotosAreLeftOut() throws IOException {
        List<CellPhoto> photos = new ArrayList<>(solidPhotos(1));
        Path broken = Files.writeString(tempDir.resolve("broken.png"), "not an image");
        photos.add(new CellPhoto(broken, PhotoOrientation.LANDSCAPE));
        photos.add(new CellPhoto(tempDir.resolve("missing.png"), PhotoOrientation.LANDSCAPE));

        List<CellPhotoCache> cache = new CellCacheBuilder(new AwtImageCodec()).build(photos, grid(),
            CellImageFitMode.STRETCH_TO_FIT, PatternInfo.square(), ProgressListener.NONE, CancellationCheck.never());

        assertEquals(1, cache.size());
        assertEquals(photos.get(0).path(), cache.get(0).path());
    }

    @Test
    void photosThatCannotServeTheRequiredOrientationAreSkipped() throws IOException {
        Path wide = TestImages.solidPng(tempDir, "wide.png", 80, 40, Color.RED);
        Path tall = TestImages.solidPng(tempDir, "tall.png", 40, 80, Color.BLUE);
        List<CellPhoto> photos = List.of(
            new CellPhoto(wide, PhotoOrientation.LANDSCAPE),
            new CellPhoto(tall, PhotoOrientation.PORTRAIT));

        List<CellPhotoCache> cache = new CellCacheBuilder(new AwtImageCodec()).build(photos, grid(),
            CellImageFitMode.STRETCH_TO_FIT, PatternInfo.portraitOnly(), ProgressListener.NONE,
            CancellationCheck.never());

        assertEquals(1, cache.size());
        CellPhotoCache only = cache.get(0);
        assertEquals(tall, only.path());
        assertNotNull(only.imageFor(PhotoOrientation.PORTRAIT));
        // portrait-only photos fall back to their portrait variant for landscape lookups
        assertEquals(30, only.imageFor(PhotoOrientation.LANDSCAPE).getWidth());
    }

    @Test
    void progressClimbsFromFiveToTen() throws IOException {
        List<GenerationProgress> events = new ArrayList<>();

        new CellCacheBuilder(new AwtImageCodec()).build(solidPhotos(4), grid(), CellImageFitMode.CROP_CENTER,
            PatternInfo.square(), events::add, CancellationCheck.never());

        assertFalse(events.isEmpty());
        GenerationProgress last = events.get(events.size() - 1);
        assertEquals(10, last.percentComplete());
        assertEquals("Loading Cell Images: 4/4", last.stage());
        for (GenerationProgress event : events) {
            assertTrue(event.percentComplete() >= 5 && event.percentComplete() <= 10);
        }
    }

    @Test
    void cancellationReleasesEverythingCachedSoFar() throws IOException {
        List<CellPhoto> photos = solidPhotos(6);
        AtomicInteger checks = new AtomicInteger();
        CancellationCheck cancelAfterThree = () -> checks.incrementAndGet() > 3;
        List<CellPhotoCache> cache = new ArrayList<>();

        assertThrows(GenerationCancelledException.class, () -> new CellCacheBuilder(new AwtImageCodec())
            .buildInto(cache, photos, grid(), CellImageFitMode.CROP_CENTER, PatternInfo.square(),
                ProgressListener.NONE, cancelAfterThree));

        assertEquals(3, cache.size());
        for (CellPhotoCache item : cache) {
            assertTrue(item.isReleased());
            assertNull(item.imageFor(PhotoOrientation.LANDSCAPE));
        }
    }
}
