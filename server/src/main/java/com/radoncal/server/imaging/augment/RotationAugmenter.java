package com.radoncal.server.imaging.augment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Rotation only, with a uniform integer angle in [0, 180).
 */
public class RotationAugmenter implements Augmenter {

    private final Random random;

    public RotationAugmenter(Random random) {
        this.random = random;
    }

    @Override
    public List<AugmentResult> randomAugment(double[][] image, int count) {
        List<AugmentResult> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int angle = random.nextInt(180);
            double[][] rotated = ImageTransforms.rotateClockwise(image, angle);
            results.add(new AugmentResult(rotated, angle,
                    Collections.singletonList(AppliedAugmentation.rotate(angle))));
        }
        return results;
    }
}
