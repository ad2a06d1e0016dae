package com.radoncal.server.imaging.augment;

import java.util.List;

public interface Augmenter {
    /**
     * Produces {@code count} independently sampled augmentations of the image.
     * The input image is never modified.
     */
    List<AugmentResult> randomAugment(double[][] image, int count);
}
