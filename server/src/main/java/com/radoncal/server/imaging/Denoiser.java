package com.radoncal.server.imaging;

public interface Denoiser {
    /**
     * Removes background noise from the image, using the mask to tell source
     * pixels from background pixels. The input is not modified.
     */
    double[][] denoise(double[][] image, boolean[][] mask);
}
