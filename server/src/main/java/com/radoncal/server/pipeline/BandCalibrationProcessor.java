package com.radoncal.server.pipeline;

import com.radoncal.db.WorkUnit;
import com.radoncal.server.error.RunningErrorCalculator;
import com.radoncal.server.imaging.BandImage;
import com.radoncal.server.imaging.BandImagePipeline;
import com.radoncal.server.imaging.augment.AugmentResult;
import com.radoncal.server.imaging.augment.Augmenter;
import com.radoncal.server.ingest.BandImageSource;
import com.radoncal.server.ingest.InvalidBandException;
import com.radoncal.server.radon.RadonTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Measures the estimator's error on one band: the oracle angle of the
 * preprocessed band is the reference, and each augmentation's known rotation
 * says where the estimate should move.
 */
public class BandCalibrationProcessor implements UnitFunction<WorkUnit, CalibrationResult> {

    private static final Logger logger = LoggerFactory.getLogger(BandCalibrationProcessor.class);

    private final BandImageSource imageSource;
    private final BandImagePipeline preprocessing;
    private final RadonTransformer radonTransformer;
    private final Augmenter augmenter;
    private final int augmentationCount;
    private final Duration unitTimeout;

    public BandCalibrationProcessor(BandImageSource imageSource, BandImagePipeline preprocessing,
            RadonTransformer radonTransformer, Augmenter augmenter, int augmentationCount, Duration unitTimeout) {
        if (augmentationCount <= 0) {
            throw new IllegalArgumentException("Augmentation count must be positive, got " + augmentationCount);
        }
        this.imageSource = imageSource;
        this.preprocessing = preprocessing;
        this.radonTransformer = radonTransformer;
        this.augmenter = augmenter;
        this.augmentationCount = augmentationCount;
        this.unitTimeout = unitTimeout;
    }

    @Override
    public CalibrationResult apply(WorkUnit unit) throws IOException, InvalidBandException {
        BandImage band = imageSource.load(unit.getSourceId(), unit.getBinId(), unit.getBand());
        CalibrationResult result = calibrate(band.getPixels());
        logger.debug("Calibrated {}: {}", unit, result);
        return result;
    }

    /**
     * Runs the calibration on raw, non-negative band pixels.
     */
    public CalibrationResult calibrate(double[][] rawPixels) {
        UnitDeadline deadline = UnitDeadline.after(unitTimeout);

        double[][] image = preprocessing.build(rawPixels);
        int idealRotation = radonTransformer.transform(image).getRotation();

        List<AugmentResult> augmentations = augmenter.randomAugment(image, augmentationCount);
        RunningErrorCalculator runningError = new RunningErrorCalculator();

        int index = 0;
        for (AugmentResult augmentation : augmentations) {
            deadline.check("before augmentation " + index + "/" + augmentations.size());
            int actualRotation = radonTransformer.transform(augmentation.getImage()).getRotation();
            runningError.update(idealRotation + augmentation.getAngleDelta(), actualRotation);
            index++;
        }
        return new CalibrationResult(idealRotation, runningError);
    }

    public int getAugmentationCount() {
        return augmentationCount;
    }
}
