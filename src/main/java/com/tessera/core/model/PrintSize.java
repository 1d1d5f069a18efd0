package com.tessera.core.model;

/**
 * Physical print dimensions in inches.
 */
public record PrintSize(String name, double widthInches, double heightInches) {

    public PrintSize {
        if (!(widthInches > 0) || !(heightInches > 0)) {
            throw new IllegalArgumentException("Print size must be positive: " + widthInches + "x" + heightInches);
        }
        name = (name == null || name.isBlank()) ? widthInches + "x" + heightInches : name;
    }

    public static PrintSize of(double widthInches, double heightInches) {
        return new PrintSize(null, widthInches, heightInches);
    }
}
