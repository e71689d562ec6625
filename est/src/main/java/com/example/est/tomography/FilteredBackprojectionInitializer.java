package com.example.est.tomography;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

/**
 * Ramp-filtered backprojection onto a {@code D x D} canvas, where {@code D} is the
 * detector count. Only used as the starting estimate of the EST loop.
 */
public class FilteredBackprojectionInitializer implements ReconstructionInitializer {

    private final BackprojectionOperator backprojector;

    public FilteredBackprojectionInitializer(BackprojectionOperator backprojector) {
        this.backprojector = backprojector;
    }

    @Override
    public INDArray initialize(INDArray sinogram, AngleSet angles) {
        double[][] lines = sinogram.toDoubleMatrix();
        int detectors = lines[0].length;
        double[] kernel = ramLakKernel(detectors);

        double[][] filtered = new double[lines.length][];
        for (int k = 0; k < lines.length; k++) {
            filtered[k] = convolve(lines[k], kernel);
        }

        INDArray image = backprojector.backproject(Nd4j.createFromArray(filtered), angles, detectors);
        return image.muli(Math.PI / angles.size());
    }

    static double[] ramLakKernel(int detectors) {
        // Kak & Slaney eq. 61, unit detector spacing
        double[] kernel = new double[2 * detectors - 1];
        for (int k = 0; k < kernel.length; k++) {
            int dk = k - kernel.length / 2;
            if (dk == 0)
                kernel[k] = .25;
            else if (Math.abs(dk) % 2 == 1)
                kernel[k] = -Math.pow(Math.PI * dk, -2);
        }
        return kernel;
    }

    private static double[] convolve(double[] line, double[] kernel) {
        int half = kernel.length / 2;
        double[] result = new double[line.length];
        for (int i = 0; i < line.length; i++) {
            double sum = 0;
            for (int j = 0; j < line.length; j++) {
                sum += line[j] * kernel[i - j + half];
            }
            result[i] = sum;
        }
        return result;
    }
}
