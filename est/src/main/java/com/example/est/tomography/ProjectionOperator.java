package com.example.est.tomography;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.stream.IntStream;

/**
 * Forward model: rotates the image by each angle and sums it over the rows to get one
 * simulated projection per angle. The sinogram comes back in the canonical
 * {@link SinogramLayout#ANGLE_ROWS} layout.
 */
public class ProjectionOperator {

    private final ImageRotator rotator;
    private final boolean parallel;

    public ProjectionOperator(ImageRotator rotator, boolean parallel) {
        this.rotator = rotator;
        this.parallel = parallel;
    }

    /**
     * @param image     square image estimate
     * @param angles    acquisition angles, one output row each
     * @param detectors number of detector columns; profiles longer than this are
     *                  truncated at the end, shorter ones are zero-padded at the end
     * @return sinogram of shape {@code (angles.size(), detectors)}
     */
    public INDArray project(INDArray image, AngleSet angles, int detectors) {
        double[][] pixels = image.toDoubleMatrix();
        double[][] rows = AngleStreams.parallele(IntStream.range(0, angles.size()), parallel)
                .mapToObj(k -> projectionLine(pixels, angles.get(k), detectors))
                .toArray(double[][]::new);
        return Nd4j.createFromArray(rows);
    }

    private double[] projectionLine(double[][] pixels, double angle, int detectors) {
        double[][] rotated = rotator.rotate(pixels, angle);
        double[] line = new double[detectors];
        int width = rotated.length == 0 ? 0 : rotated[0].length;
        int used = Math.min(width, detectors);
        for (double[] row : rotated) {
            for (int col = 0; col < used; col++) {
                line[col] += row[col];
            }
        }
        return line;
    }
}
