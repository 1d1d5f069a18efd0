package com.tessera.core.engine;

import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation hook polled by the engine between cache and placement iterations.
 */
@FunctionalInterface
public interface CancellationCheck {

    boolean isCancelled();

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new GenerationCancelledException();
        }
    }

    static CancellationCheck never() {
        return () -> false;
    }

    static CancellationCheck of(BooleanSupplier cancelRequested) {
        return cancelRequested::getAsBoolean;
    }

    /**
     * Treats interruption of the calling thread as a cancellation request.
     */
    static CancellationCheck threadInterruption() {
        return () -> Thread.currentThread().isInterrupted();
    }
}
