package com.example.est.tomography;

/**
 * Equally sloped angle sampling: the sines of the returned angles are equally spaced
 * over [-1, 1], which gives a more uniform coverage of Fourier space than equal
 * angular steps.
 */
public class AngleSampler {

    public AngleSet sample(int count) {
        if (count < 2) {
            throw new InvalidConfigurationException(
                    "São necessárias pelo menos 2 projeções, recebido " + count);
        }
        double[] angles = new double[count];
        for (int k = 0; k < count; k++) {
            double slope = -1.0 + 2.0 * k / (count - 1);
            angles[k] = Math.toDegrees(Math.asin(slope));
        }
        return AngleSet.of(angles);
    }
}
