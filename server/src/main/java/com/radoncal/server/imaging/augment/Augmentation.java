package com.radoncal.server.imaging.augment;

import java.util.Random;

/**
 * The atomic transforms the augmenter composes. Only {@link #ROTATE} shifts
 * the orientation label; the others preserve it.
 */
public enum Augmentation {
    ROTATE("rotate"),
    RESAMPLE("resample"),
    BLUR("blur");

    private final String tag;

    Augmentation(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Draws a parameter from this transform's range: rotate angle in [0, 180),
     * resample count in [15, 100), blur sigma in [0, 2).
     */
    public double sampleParameter(Random random) {
        switch (this) {
            case ROTATE:
                return random.nextInt(180);
            case RESAMPLE:
                return 15 + random.nextInt(85);
            case BLUR:
                return random.nextDouble() * 2.0;
            default:
                throw new IllegalStateException("Unhandled augmentation " + this);
        }
    }
}
