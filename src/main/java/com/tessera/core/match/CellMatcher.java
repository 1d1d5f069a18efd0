package com.tessera.core.match;

import com.tessera.core.color.ColorMath;
import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.PhotoOrientation;
import com.tessera.core.model.QuadrantColors;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Picks a cached photo for a target cell: filter, rank by quadrant distance, then choose at
 * random among the best few.
 */
public final class CellMatcher {

    public static final int MIN_CANDIDATES = 1;
    public static final int MAX_CANDIDATES = 20;

    private final List<CellPhotoCache> cache;
    private final Random random;

    public CellMatcher(List<CellPhotoCache> cache, Random random) {
        this.cache = List.copyOf(cache);
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Best match for {@code target}, or empty when every photo is used up, of the wrong
     * orientation, or placed too close to ({@code row}, {@code col}). An empty result means the
     * cell stays unfilled.
     *
     * @param requiredOrientation slot orientation; empty accepts any photo and ranks it by its
     *                            landscape signature
     */
    public Optional<CellPhotoCache> findBestMatch(QuadrantColors target,
                                                  int maxUses,
                                                  DuplicateSpacing spacing,
                                                  int row,
                                                  int col,
                                                  int candidateCount,
                                                  UsageHistory history,
                                                  Optional<PhotoOrientation> requiredOrientation) {
        PhotoOrientation slot = requiredOrientation.orElse(PhotoOrientation.LANDSCAPE);
        List<Candidate> candidates = new ArrayList<>();
        for (CellPhotoCache item : cache) {
            if (item.useCount() >= maxUses) {
                continue;
            }
            if (requiredOrientation.isPresent() && !item.orientation().canServe(requiredOrientation.get())) {
                continue;
            }
            if (history.isTooClose(item.path(), row, col, spacing)) {
                continue;
            }
            candidates.add(new Candidate(item, ColorMath.quadrantDistance(item.quadrantsFor(slot), target)));
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        candidates.sort(Comparator.comparingDouble(Candidate::distance));
        int shortlist = Math.min(candidates.size(), clampCandidates(candidateCount));
        return Optional.of(candidates.get(random.nextInt(shortlist)).photo());
    }

    public static int clampCandidates(int candidateCount) {
        return Math.max(MIN_CANDIDATES, Math.min(MAX_CANDIDATES, candidateCount));
    }

    private record Candidate(CellPhotoCache photo, double distance) {
    }
}
