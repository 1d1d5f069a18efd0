package com.tessera.core.engine;

import com.tessera.core.image.AwtImageCodec;
import com.tessera.core.model.CellCounts;
import com.tessera.core.model.CellPhoto;
import com.tessera.core.model.GridDimensions;
import com.tessera.core.model.MosaicPlan;
import com.tessera.core.model.MosaicProject;
import com.tessera.core.model.PatternInfo;
import com.tessera.core.model.PhotoCounts;
import com.tessera.core.model.PhotoOrientation;
import com.tessera.core.model.PrintSize;
import com.tessera.testing.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.Dimension;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MosaicPlannerTest {

    @TempDir
    Path tempDir;

    private static List<CellPhoto> photos(int landscape, int portrait, int square) {
        List<CellPhoto> photos = new ArrayList<>();
        for (int i = 0; i < landscape; i++) {
            photos.add(new CellPhoto(Path.of("l" + i + ".jpg"), PhotoOrientation.LANDSCAPE));
        }
        for (int i = 0; i < portrait; i++) {
            photos.add(new CellPhoto(Path.of("p" + i + ".jpg"), PhotoOrientation.PORTRAIT));
        }
        for (int i = 0; i < square; i++) {
            photos.add(new CellPhoto(Path.of("s" + i + ".jpg"), PhotoOrientation.SQUARE));
        }
        return photos;
    }

    @Test
    void validationReportsTheFirstMissingSetting() {
        MosaicProject.Builder builder = MosaicProject.builder();
        assertMessage("Primary image is not selected", builder);

        builder.primaryImage(Path.of("primary.jpg"));
        assertMessage("No cell photos have been added", builder);

        builder.addCellPhoto(Path.of("a.jpg"), PhotoOrientation.LANDSCAPE);
        assertMessage("Print size is not selected", builder);

        builder.printSize(PrintSize.of(10, 8));
        assertMessage("Resolution is not selected", builder);

        builder.resolutionPpi(300);
        assertMessage("Cell size is not selected", builder);

        builder.cellSizeMm(10);
        MosaicPlanner.validate(builder.build());
    }

    private static void assertMessage(String expected, MosaicProject.Builder builder) {
        MosaicConfigurationException ex = assertThrows(MosaicConfigurationException.class,
            () -> MosaicPlanner.validate(builder.build()));
        assertEquals(expected, ex.getMessage());
    }

    @Test
    void parquetRatioFollowsTheLibrary() {
        PatternInfo configured = PatternInfo.parquet(1, 1);

        assertEquals(PatternInfo.parquet(3, 1), MosaicPlanner.resolvePattern(configured, photos(6, 2, 0)));
        assertEquals(PatternInfo.parquet(1, 3), MosaicPlanner.resolvePattern(configured, photos(1, 3, 0)));
        assertEquals(PatternInfo.parquet(2, 1), MosaicPlanner.resolvePattern(configured, photos(2, 0, 2)));
        assertEquals(configured, MosaicPlanner.resolvePattern(configured, photos(5, 0, 0)));
        assertEquals(PatternInfo.square(), MosaicPlanner.resolvePattern(PatternInfo.square(), photos(6, 2, 0)));
    }

    @Test
    void candidateCountsFollowThePattern() {
        List<CellPhoto> library = photos(3, 2, 1);

        assertEquals(new PhotoCounts(6, 4, 3), MosaicPlanner.countCandidates(library, PatternInfo.square()));
        assertEquals(new PhotoCounts(4, 4, 3), MosaicPlanner.countCandidates(library, PatternInfo.landscapeOnly()));
        assertEquals(new PhotoCounts(3, 4, 3), MosaicPlanner.countCandidates(library, PatternInfo.portraitOnly()));
    }

    @Test
    void recommendedUsesDoubleTheMinimum() {
        assertEquals(8, MosaicPlanner.recommendedMaxUses(
            new CellCounts(100, 0, 0), new PhotoCounts(30, 30, 30), PatternInfo.square()));
        assertEquals(2, MosaicPlanner.recommendedMaxUses(
            new CellCounts(4, 0, 0), new PhotoCounts(10, 10, 10), PatternInfo.square()));
        assertEquals(148, MosaicPlanner.recommendedMaxUses(
            new CellCounts(221, 147, 74), new PhotoCounts(3, 2, 1), PatternInfo.parquet(2, 1)));
    }

    @Test
    void recommendedUsesAreUnlimitedWhenNothingCanBeDivided() {
        assertEquals(Integer.MAX_VALUE, MosaicPlanner.recommendedMaxUses(
            new CellCounts(0, 0, 0), new PhotoCounts(5, 5, 0), PatternInfo.square()));
        assertEquals(Integer.MAX_VALUE, MosaicPlanner.recommendedMaxUses(
            new CellCounts(10, 0, 0), new PhotoCounts(0, 0, 0), PatternInfo.square()));
        assertEquals(Integer.MAX_VALUE, MosaicPlanner.recommendedMaxUses(
            new CellCounts(30, 20, 10), new PhotoCounts(4, 4, 0), PatternInfo.parquet(2, 1)));
    }

    @Test
    void planReadsOnlyThePrimaryHeader() throws IOException {
        Path primary = TestImages.solidPng(tempDir, "primary.png", 200, 200, Color.GRAY);
        MosaicProject project = MosaicProject.builder()
            .primaryImage(primary)
            .cellPhotos(photos(0, 0, 4))
            .printSize(PrintSize.of(2, 2))
            .resolutionPpi(100)
            .cellSizeMm(25.4)
            .build();

        MosaicPlan plan = new MosaicPlanner(new AwtImageCodec()).plan(project);

        assertEquals(new MosaicPlan(4, 4, 2, 0, 0, 4, 4), plan);
    }

    @Test
    void canvasLargerThanOneRasterIsRejected() throws IOException {
        MosaicProject project = MosaicProject.builder()
            .primaryImage(TestImages.solidPng(tempDir, "primary.png", 200, 200, Color.GRAY))
            .cellPhotos(photos(0, 0, 1))
            .printSize(PrintSize.of(300, 300))
            .resolutionPpi(300)
            .cellSizeMm(25.4)
            .build();

        MosaicConfigurationException ex = assertThrows(MosaicConfigurationException.class,
            () -> new MosaicPlanner(new AwtImageCodec()).plan(project));
        assertTrue(ex.getMessage().startsWith("Mosaic canvas "), ex.getMessage());
    }

    @Test
    void canvasAtTheRasterLimitIsAccepted() {
        GridDimensions edge = new GridDimensions(46340, 46340, 10, 10, 10, 10, 10, 10, 10, 4634, 4634, 1, 1);
        GridDimensions over = new GridDimensions(46341, 46341, 10, 10, 10, 10, 10, 10, 10, 4634, 4634, 1, 1);

        MosaicPlanner.requireAllocatableCanvas(edge);
        assertThrows(MosaicConfigurationException.class, () -> MosaicPlanner.requireAllocatableCanvas(over));
    }

    @Test
    void planRejectsMissingPrimaryFile() {
        MosaicProject project = MosaicProject.builder()
            .primaryImage(tempDir.resolve("gone.png"))
            .cellPhotos(photos(1, 0, 0))
            .printSize(PrintSize.of(2, 2))
            .resolutionPpi(100)
            .cellSizeMm(25.4)
            .build();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> new MosaicPlanner(new AwtImageCodec()).plan(project));
        assertTrue(ex.getMessage().startsWith("Primary image file not found: "));
    }

    @Test
    void primaryIsDecodedNoLargerThanNeeded() {
        GridDimensions large = new GridDimensions(4000, 3000, 100, 100, 100, 100, 100, 100, 100, 30, 40, 30, 40);

        assertArrayEquals(new int[] {2048, 1536},
            MosaicGenerationService.primaryDecodeSize(large, new Dimension(5000, 4000), 2048));
        assertArrayEquals(new int[] {1000, 800},
            MosaicGenerationService.primaryDecodeSize(large, new Dimension(1000, 800), 2048));
    }
}
