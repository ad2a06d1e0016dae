package com.radoncal.server.imaging.augment;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An augmented image together with the rotation it introduced.
 */
public class AugmentResult {
    private final double[][] image;
    private final int angleDelta;
    private final List<AppliedAugmentation> provenance;

    public AugmentResult(double[][] image, int angleDelta, List<AppliedAugmentation> provenance) {
        this.image = image;
        this.angleDelta = Math.floorMod(angleDelta, 180);
        this.provenance = Collections.unmodifiableList(provenance);
    }

    public double[][] getImage() {
        return image;
    }

    /**
     * Net clockwise rotation in degrees, in [0, 180).
     */
    public int getAngleDelta() {
        return angleDelta;
    }

    public List<AppliedAugmentation> getProvenance() {
        return provenance;
    }

    public String getProvenanceTag() {
        if (provenance.isEmpty()) {
            return "identity";
        }
        return provenance.stream().map(AppliedAugmentation::toString).collect(Collectors.joining(" > "));
    }
}
