package com.tessera.core.match;

import com.tessera.core.color.ColorMath;
import com.tessera.core.engine.CancellationCheck;
import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.MosaicPlacement;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy pre-pass that gives every still-usable photo its single best remaining cell, so the
 * whole library shows up before the randomized pass fills the rest.
 */
public final class UseAllImagesPass {

    @FunctionalInterface
    public interface PlacementSink {
        /**
         * Fills {@code placement} with {@code photo}. The placement is consumed either way.
         */
        void place(CellPhotoCache photo, MosaicPlacement placement);
    }

    private final boolean matchOrientation;

    /**
     * @param matchOrientation only offer a photo the cells whose orientation it can serve
     */
    public UseAllImagesPass(boolean matchOrientation) {
        this.matchOrientation = matchOrientation;
    }

    /**
     * Runs the pass and returns the placements still left for the main pass.
     */
    public List<MosaicPlacement> run(List<CellPhotoCache> cache,
                                     List<MosaicPlacement> placements,
                                     int maxUses,
                                     PlacementSink sink,
                                     CancellationCheck cancellation) {
        List<MosaicPlacement> remaining = new ArrayList<>(placements);
        for (CellPhotoCache item : cache) {
            cancellation.throwIfCancelled();
            if (remaining.isEmpty()) {
                break;
            }
            if (item.useCount() >= maxUses) {
                continue;
            }

            int bestIndex = -1;
            double bestDistance = Double.MAX_VALUE;
            for (int i = 0; i < remaining.size(); i++) {
                MosaicPlacement placement = remaining.get(i);
                if (matchOrientation && !item.orientation().canServe(placement.orientation())) {
                    continue;
                }
                double distance = ColorMath.quadrantDistance(
                    item.quadrantsFor(placement.orientation()), placement.targetQuadrants());
                if (distance < bestDistance) {
                    bestDistance = distance;
                    bestIndex = i;
                }
            }

            if (bestIndex >= 0) {
                sink.place(item, remaining.remove(bestIndex));
            }
        }
        return remaining;
    }
}
