package com.tessera.core.match;

import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.PhotoOrientation;
import com.tessera.core.model.QuadrantColors;
import com.tessera.core.model.RgbColor;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CellMatcherTest {

    private static final RgbColor RED = new RgbColor(255, 0, 0);
    private static final RgbColor GREEN = new RgbColor(0, 255, 0);
    private static final RgbColor BLUE = new RgbColor(0, 0, 255);
    private static final RgbColor YELLOW = new RgbColor(255, 255, 0);

    static CellPhotoCache photo(String name, PhotoOrientation orientation, RgbColor color) {
        QuadrantColors quadrants = QuadrantColors.uniform(color);
        return new CellPhotoCache(Path.of(name), orientation, color, null, null, quadrants, quadrants);
    }

    @Test
    void singleCandidatePicksTheClosestPhoto() {
        List<CellPhotoCache> cache = List.of(
            photo("red.png", PhotoOrientation.SQUARE, RED),
            photo("green.png", PhotoOrientation.SQUARE, GREEN),
            photo("blue.png", PhotoOrientation.SQUARE, BLUE),
            photo("yellow.png", PhotoOrientation.SQUARE, YELLOW));
        CellMatcher matcher = new CellMatcher(cache, new Random(7));
        UsageHistory history = new UsageHistory();

        RgbColor[] targets = {RED, GREEN, BLUE, YELLOW};
        for (int i = 0; i < targets.length; i++) {
            Optional<CellPhotoCache> match = matcher.findBestMatch(QuadrantColors.uniform(targets[i]),
                Integer.MAX_VALUE, DuplicateSpacing.none(), i / 2, i % 2, 1, history, Optional.empty());
            assertEquals(cache.get(i), match.orElseThrow());
        }
    }

    @Test
    void exhaustedPhotosLeaveTheCellUnfilled() {
        List<CellPhotoCache> cache = List.of(
            photo("a.png", PhotoOrientation.SQUARE, RED),
            photo("b.png", PhotoOrientation.SQUARE, BLUE));
        CellMatcher matcher = new CellMatcher(cache, new Random(1));
        UsageHistory history = new UsageHistory();

        int filled = 0;
        int empty = 0;
        for (int col = 0; col < 3; col++) {
            Optional<CellPhotoCache> match = matcher.findBestMatch(QuadrantColors.uniform(RED), 1,
                DuplicateSpacing.none(), 0, col, 5, history, Optional.empty());
            if (match.isPresent()) {
                history.record(match.get(), 0, col, col * 10, 0);
                filled++;
            } else {
                empty++;
            }
        }

        assertEquals(2, filled);
        assertEquals(1, empty);
        cache.forEach(p -> assertEquals(1, p.useCount()));
    }

    @Test
    void spacingSkipsPhotosPlacedNearby() {
        CellPhotoCache red = photo("red.png", PhotoOrientation.SQUARE, RED);
        CellPhotoCache blue = photo("blue.png", PhotoOrientation.SQUARE, BLUE);
        CellMatcher matcher = new CellMatcher(List.of(red, blue), new Random(3));
        UsageHistory history = new UsageHistory();
        history.record(red, 4, 4, 0, 0);

        DuplicateSpacing spacing = DuplicateSpacing.cells(2);
        QuadrantColors target = QuadrantColors.uniform(RED);

        assertEquals(blue, matcher.findBestMatch(target, 10, spacing, 5, 6, 1, history, Optional.empty())
            .orElseThrow());
        assertEquals(red, matcher.findBestMatch(target, 10, spacing, 4, 7, 1, history, Optional.empty())
            .orElseThrow());
    }

    @Test
    void requiredOrientationFiltersMismatchedPhotos() {
        CellPhotoCache landscape = photo("wide.png", PhotoOrientation.LANDSCAPE, RED);
        CellPhotoCache portrait = photo("tall.png", PhotoOrientation.PORTRAIT, BLUE);
        CellPhotoCache square = photo("square.png", PhotoOrientation.SQUARE, GREEN);
        CellMatcher matcher = new CellMatcher(List.of(landscape, portrait, square), new Random(5));
        UsageHistory history = new UsageHistory();

        Optional<CellPhotoCache> match = matcher.findBestMatch(QuadrantColors.uniform(RED), 10,
            DuplicateSpacing.none(), 0, 0, 1, history, Optional.of(PhotoOrientation.PORTRAIT));
        // the red landscape photo is closer but cannot fill a portrait slot
        assertTrue(match.isPresent());
        assertFalse(match.get() == landscape);
    }

    @Test
    void shortlistDrawsFromTheBestFewOnly() {
        List<CellPhotoCache> cache = List.of(
            photo("r1.png", PhotoOrientation.SQUARE, new RgbColor(250, 0, 0)),
            photo("r2.png", PhotoOrientation.SQUARE, new RgbColor(240, 10, 0)),
            photo("far.png", PhotoOrientation.SQUARE, BLUE));
        CellMatcher matcher = new CellMatcher(cache, new Random(11));
        UsageHistory history = new UsageHistory();

        Set<CellPhotoCache> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            seen.add(matcher.findBestMatch(QuadrantColors.uniform(RED), Integer.MAX_VALUE,
                DuplicateSpacing.none(), 0, 0, 2, history, Optional.empty()).orElseThrow());
        }
        assertEquals(Set.of(cache.get(0), cache.get(1)), seen);
    }

    @Test
    void candidateCountIsClamped() {
        assertEquals(1, CellMatcher.clampCandidates(0));
        assertEquals(1, CellMatcher.clampCandidates(-4));
        assertEquals(7, CellMatcher.clampCandidates(7));
        assertEquals(20, CellMatcher.clampCandidates(500));
    }

    @Test
    void pixelSpacingScalesByCellSize() {
        DuplicateSpacing spacing = DuplicateSpacing.pixels(2, 30, 40);
        assertEquals(60, spacing.rows());
        assertEquals(80, spacing.columns());
        assertFalse(DuplicateSpacing.pixels(0, 30, 40).isEnabled());
    }
}
