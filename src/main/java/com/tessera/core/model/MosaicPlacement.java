package com.tessera.core.model;

/**
 * One target cell of the mosaic.
 *
 * <p>{@code row}/{@code col} are grid coordinates for the standard patterns and padded
 * unit-grid coordinates for parquet.</p>
 */
public record MosaicPlacement(int row,
                              int col,
                              int x,
                              int y,
                              int width,
                              int height,
                              PhotoOrientation orientation,
                              RgbColor targetColor,
                              QuadrantColors targetQuadrants) {
}
