package com.tessera.core.engine;

import com.tessera.core.model.GenerationProgress;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> {
    };

    void onProgress(GenerationProgress progress);

    default void report(int percent, String stage) {
        onProgress(new GenerationProgress(Math.max(0, Math.min(100, percent)), stage));
    }
}
