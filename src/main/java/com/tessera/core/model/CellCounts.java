package com.tessera.core.model;

public record CellCounts(int total, int landscape, int portrait) {
}
