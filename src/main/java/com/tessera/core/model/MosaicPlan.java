package com.tessera.core.model;

public record MosaicPlan(int totalCells,
                         int availablePhotos,
                         int maxPhotoUses,
                         int landscapeCells,
                         int portraitCells,
                         int availableLandscapePhotos,
                         int availablePortraitPhotos) {
}
