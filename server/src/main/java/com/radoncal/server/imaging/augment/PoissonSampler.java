package com.radoncal.server.imaging.augment;

import java.util.Random;

/**
 * Poisson variates: multiplication method for small rates, Hormann's
 * transformed rejection (PTRS) above {@link #SMALL_RATE_LIMIT}.
 */
public class PoissonSampler {

    static final double SMALL_RATE_LIMIT = 10.0;

    private final Random random;

    public PoissonSampler(Random random) {
        this.random = random;
    }

    public long sample(double rate) {
        if (rate < 0 || Double.isNaN(rate)) {
            throw new IllegalArgumentException("Poisson rate must be non-negative, got " + rate);
        }
        if (rate == 0) {
            return 0;
        }
        if (rate < SMALL_RATE_LIMIT) {
            return sampleSmall(rate);
        }
        return sampleLarge(rate);
    }

    private long sampleSmall(double rate) {
        double limit = Math.exp(-rate);
        double product = random.nextDouble();
        long k = 0;
        while (product > limit) {
            k++;
            product *= random.nextDouble();
        }
        return k;
    }

    private long sampleLarge(double rate) {
        double sqrtRate = Math.sqrt(rate);
        double logRate = Math.log(rate);
        double b = 0.931 + 2.53 * sqrtRate;
        double a = -0.059 + 0.02483 * b;
        double invAlpha = 1.1239 + 1.1328 / (b - 3.4);
        double vr = 0.9277 - 3.6224 / (b - 2);

        while (true) {
            double u = random.nextDouble() - 0.5;
            double v = random.nextDouble();
            double us = 0.5 - Math.abs(u);
            long k = (long) Math.floor((2 * a / us + b) * u + rate + 0.43);
            if (us >= 0.07 && v <= vr) {
                return k;
            }
            if (k < 0 || (us < 0.013 && v > us)) {
                continue;
            }
            double lhs = Math.log(v) + Math.log(invAlpha) - Math.log(a / (us * us) + b);
            double rhs = -rate + k * logRate - logGamma(k + 1.0);
            if (lhs <= rhs) {
                return k;
            }
        }
    }

    private static final double[] LANCZOS = {
            0.99999999999980993, 676.5203681218851, -1259.1392167224028,
            771.32342877765313, -176.61502916214059, 12.507343278686905,
            -0.13857109526572012, 9.9843695780195716e-6, 1.5056327351493116e-7 };

    /**
     * Lanczos approximation (g = 7) of ln(Gamma(x)) for x >= 0.5.
     */
    static double logGamma(double x) {
        double xm1 = x - 1.0;
        double sum = LANCZOS[0];
        for (int i = 1; i < LANCZOS.length; i++) {
            sum += LANCZOS[i] / (xm1 + i);
        }
        double t = xm1 + 7.5;
        return 0.5 * Math.log(2 * Math.PI) + (xm1 + 0.5) * Math.log(t) - t + Math.log(sum);
    }
}
