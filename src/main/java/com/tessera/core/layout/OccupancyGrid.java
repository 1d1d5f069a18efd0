package com.tessera.core.layout;

/**
 * Claimed/free flags over the padded parquet unit grid, stored row-major in one array.
 */
public final class OccupancyGrid {

    private final int columns;
    private final int rows;
    private final boolean[] cells;

    public OccupancyGrid(int columns, int rows) {
        if (columns < 1 || rows < 1) {
            throw new IllegalArgumentException("Occupancy grid needs at least one cell, was " + columns + "x" + rows);
        }
        this.columns = columns;
        this.rows = rows;
        this.cells = new boolean[Math.multiplyExact(columns, rows)];
    }

    public int columns() {
        return columns;
    }

    public int rows() {
        return rows;
    }

    /**
     * True when the {@code width x height} rectangle at ({@code col}, {@code row}) lies inside
     * the grid and none of its cells is claimed.
     */
    public boolean canPlace(int col, int row, int width, int height) {
        if (col < 0 || row < 0 || col + width > columns || row + height > rows) {
            return false;
        }
        for (int y = row; y < row + height; y++) {
            int offset = y * columns;
            for (int x = col; x < col + width; x++) {
                if (cells[offset + x]) {
                    return false;
                }
            }
        }
        return true;
    }

    public void markOccupied(int col, int row, int width, int height) {
        if (col < 0 || row < 0 || col + width > columns || row + height > rows) {
            throw new IndexOutOfBoundsException(
                "Rectangle " + width + "x" + height + " at (" + col + "," + row + ") outside "
                    + columns + "x" + rows + " grid");
        }
        for (int y = row; y < row + height; y++) {
            int offset = y * columns;
            for (int x = col; x < col + width; x++) {
                cells[offset + x] = true;
            }
        }
    }

    public boolean isOccupied(int col, int row) {
        if (col < 0 || row < 0 || col >= columns || row >= rows) {
            throw new IndexOutOfBoundsException("(" + col + "," + row + ") outside " + columns + "x" + rows + " grid");
        }
        return cells[row * columns + col];
    }
}
