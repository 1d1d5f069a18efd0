package com.tessera.core.model;

/**
 * How a candidate photo is fitted into a cell footprint.
 */
public enum CellImageFitMode {
    STRETCH_TO_FIT,
    CROP_CENTER
}
