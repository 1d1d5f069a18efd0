package com.tessera.core.model;

/**
 * How the print rectangle relates to the primary image's aspect ratio.
 */
public enum PrimaryImageSizingMode {
    KEEP_ASPECT_RATIO,
    CROP_TO_FILL
}
