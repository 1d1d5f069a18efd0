package com.tessera.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A candidate library photo and the orientation it was catalogued with.
 */
public record CellPhoto(Path path, PhotoOrientation orientation) {

    public CellPhoto {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(orientation, "orientation");
    }
}
