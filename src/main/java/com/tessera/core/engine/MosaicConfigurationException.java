package com.tessera.core.engine;

/**
 * A project setting that makes generation impossible: a missing input, an absent primary image
 * file or a canvas too large to allocate. Reported to the caller without a failure journal entry.
 */
public class MosaicConfigurationException extends IllegalArgumentException {

    public MosaicConfigurationException(String message) {
        super(message);
    }
}
