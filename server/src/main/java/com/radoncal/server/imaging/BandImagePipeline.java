package com.radoncal.server.imaging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Immutable, ordered list of named preprocessing stages. {@link #build}
 * applies them left to right; every {@code with*} call returns a new
 * pipeline, so one instance can be shared between worker threads.
 */
public final class BandImagePipeline {

    public static final class Stage {
        private final String name;
        private final UnaryOperator<double[][]> operation;

        Stage(String name, UnaryOperator<double[][]> operation) {
            this.name = name;
            this.operation = operation;
        }

        public String getName() {
            return name;
        }
    }

    private final List<Stage> stages;

    private BandImagePipeline(List<Stage> stages) {
        this.stages = Collections.unmodifiableList(stages);
    }

    public static BandImagePipeline empty() {
        return new BandImagePipeline(new ArrayList<>());
    }

    /**
     * The standard preprocessing: ambient denoise measured on the unmasked
     * frame, then the aperture mask. Pixels outside the aperture end at zero
     * either way, so this equals masking first with the noise floor taken from
     * the raw background.
     */
    public static BandImagePipeline standard(MaskGenerator maskGenerator, Denoiser denoiser) {
        return empty().withDenoise(maskGenerator, denoiser).withMask(maskGenerator);
    }

    public BandImagePipeline withStage(String name, UnaryOperator<double[][]> operation) {
        List<Stage> next = new ArrayList<>(stages);
        next.add(new Stage(name, operation));
        return new BandImagePipeline(next);
    }

    public BandImagePipeline withMask(MaskGenerator maskGenerator) {
        return withStage("mask", maskGenerator::apply);
    }

    public BandImagePipeline withDenoise(MaskGenerator maskGenerator, Denoiser denoiser) {
        return withStage("denoise",
                image -> denoiser.denoise(image, maskGenerator.generate(image.length, image[0].length)));
    }

    public List<String> getStageNames() {
        List<String> names = new ArrayList<>();
        for (Stage stage : stages) {
            names.add(stage.getName());
        }
        return names;
    }

    public double[][] build(double[][] image) {
        double[][] current = ImageOps.copy(image);
        for (Stage stage : stages) {
            current = stage.operation.apply(current);
        }
        return current;
    }
}
