package com.tessera.core.engine;

/**
 * Raised at a cancellation point once the caller has asked the run to stop.
 */
public class GenerationCancelledException extends RuntimeException {

    public GenerationCancelledException() {
        super("Mosaic generation cancelled");
    }
}
