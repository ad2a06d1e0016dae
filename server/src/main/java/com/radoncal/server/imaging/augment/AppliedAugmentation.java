package com.radoncal.server.imaging.augment;

import java.util.Locale;

/**
 * One transform as it was applied, with the parameter that was used.
 */
public class AppliedAugmentation {
    private final Augmentation type;
    private final double parameter;

    public AppliedAugmentation(Augmentation type, double parameter) {
        this.type = type;
        this.parameter = parameter;
    }

    public static AppliedAugmentation rotate(int angle) {
        return new AppliedAugmentation(Augmentation.ROTATE, angle);
    }

    public static AppliedAugmentation resample(int sampleCount) {
        return new AppliedAugmentation(Augmentation.RESAMPLE, sampleCount);
    }

    public static AppliedAugmentation blur(double sigma) {
        return new AppliedAugmentation(Augmentation.BLUR, sigma);
    }

    public Augmentation getType() {
        return type;
    }

    public double getParameter() {
        return parameter;
    }

    /**
     * Rotation contributed to the orientation label, in whole degrees.
     */
    public int angleDelta() {
        return type == Augmentation.ROTATE ? (int) parameter : 0;
    }

    @Override
    public String toString() {
        if (type == Augmentation.BLUR) {
            return String.format(Locale.ROOT, "%s(%.2f)", type.getTag(), parameter);
        }
        return type.getTag() + "(" + (int) parameter + ")";
    }
}
