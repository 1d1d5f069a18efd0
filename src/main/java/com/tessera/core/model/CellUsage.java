package com.tessera.core.model;

import java.nio.file.Path;

/**
 * A single placement of a library photo at pixel coordinates.
 */
public record CellUsage(Path path, int x, int y) {
}
