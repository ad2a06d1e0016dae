package com.radoncal.server.imaging.augment;

import com.radoncal.server.imaging.ImageOps;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Composes rotate, resample and blur in a random order, each one included
 * with probability 1/2, so a single augmentation runs between zero and three
 * transforms.
 */
public class RandomAugmenter implements Augmenter {

    public static final double DEFAULT_BRIGHTNESS_MODIFIER = 30.0;

    private final Random random;
    private final double brightnessModifier;

    public RandomAugmenter(Random random, double brightnessModifier) {
        this.random = random;
        this.brightnessModifier = brightnessModifier;
    }

    public RandomAugmenter(Random random) {
        this(random, DEFAULT_BRIGHTNESS_MODIFIER);
    }

    @Override
    public List<AugmentResult> randomAugment(double[][] image, int count) {
        List<AugmentResult> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            results.add(apply(image, sampleSteps()));
        }
        return results;
    }

    /**
     * Draws the transforms for one augmentation: shuffled order, coin flip per
     * transform, parameter drawn for every transform that is kept.
     */
    List<AppliedAugmentation> sampleSteps() {
        List<Augmentation> order = new ArrayList<>(Arrays.asList(Augmentation.values()));
        Collections.shuffle(order, random);

        List<AppliedAugmentation> steps = new ArrayList<>();
        for (Augmentation augmentation : order) {
            if (random.nextDouble() > 0.5) {
                steps.add(new AppliedAugmentation(augmentation, augmentation.sampleParameter(random)));
            }
        }
        return steps;
    }

    /**
     * Applies the given steps in order. Rotation deltas accumulate modulo 180.
     */
    public AugmentResult apply(double[][] image, List<AppliedAugmentation> steps) {
        double[][] current = ImageOps.copy(image);
        int delta = 0;
        for (AppliedAugmentation step : steps) {
            switch (step.getType()) {
                case ROTATE:
                    current = ImageTransforms.rotateClockwise(current, step.getParameter());
                    break;
                case RESAMPLE:
                    current = ImageTransforms.resample(current, (int) step.getParameter(), brightnessModifier,
                            random);
                    break;
                case BLUR:
                    current = ImageTransforms.gaussianBlur(current, step.getParameter());
                    break;
                default:
                    throw new IllegalStateException("Unhandled augmentation " + step.getType());
            }
            delta = (delta + step.angleDelta()) % 180;
        }
        return new AugmentResult(current, delta, steps);
    }
}
