package com.tessera.core.match;

import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.CellUsage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Where each photo has been placed during one run. Not shared between runs.
 */
public final class UsageHistory {

    private final Map<Path, List<int[]>> positions = new HashMap<>();
    private final List<CellUsage> usages = new ArrayList<>();

    /**
     * Counts one use of {@code photo}. {@code spacingRow}/{@code spacingCol} are the coordinates
     * later spacing checks compare against; {@code x}/{@code y} are the pixel origin.
     */
    public void record(CellPhotoCache photo, int spacingRow, int spacingCol, int x, int y) {
        photo.recordUse();
        positions.computeIfAbsent(photo.path(), ignored -> new ArrayList<>()).add(new int[] {spacingRow, spacingCol});
        usages.add(new CellUsage(photo.path(), x, y));
    }

    public boolean isTooClose(Path photo, int row, int col, DuplicateSpacing spacing) {
        if (!spacing.isEnabled()) {
            return false;
        }
        List<int[]> previous = positions.get(photo);
        if (previous == null) {
            return false;
        }
        for (int[] position : previous) {
            if (Math.abs(position[0] - row) <= spacing.rows() && Math.abs(position[1] - col) <= spacing.columns()) {
                return true;
            }
        }
        return false;
    }

    public List<CellUsage> usages() {
        return Collections.unmodifiableList(usages);
    }

    public int distinctPhotosUsed() {
        LinkedHashSet<Path> distinct = new LinkedHashSet<>();
        for (CellUsage usage : usages) {
            distinct.add(usage.path());
        }
        return distinct.size();
    }
}
