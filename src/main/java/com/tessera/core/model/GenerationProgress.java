package com.tessera.core.model;

public record GenerationProgress(int percentComplete, String stage) {

    public GenerationProgress {
        if (percentComplete < 0 || percentComplete > 100) {
            throw new IllegalArgumentException("Progress must be 0-100, was " + percentComplete);
        }
        stage = stage == null ? "" : stage;
    }
}
