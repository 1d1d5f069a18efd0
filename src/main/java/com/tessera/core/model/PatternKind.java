package com.tessera.core.model;

public enum PatternKind {
    SQUARE,
    LANDSCAPE_ONLY,
    PORTRAIT_ONLY,
    PARQUET
}
