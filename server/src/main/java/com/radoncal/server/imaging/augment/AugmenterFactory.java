package com.radoncal.server.imaging.augment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

public class AugmenterFactory {

    private static final Logger logger = LoggerFactory.getLogger(AugmenterFactory.class);

    public static Augmenter create(String type, Random random, double brightnessModifier) {
        String kind = type == null || type.trim().isEmpty() ? "random" : type.trim().toLowerCase();

        switch (kind) {
            case "random":
                return new RandomAugmenter(random, brightnessModifier);
            case "rotation":
                return new RotationAugmenter(random);
            default:
                logger.warn("Unknown augmenter '{}', defaulting to 'random'", type);
                return new RandomAugmenter(random, brightnessModifier);
        }
    }
}
