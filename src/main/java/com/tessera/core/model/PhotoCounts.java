package com.tessera.core.model;

public record PhotoCounts(int total, int landscape, int portrait) {
}
