package com.example.est.tomography;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.stream.IntStream;

/**
 * Unfiltered backprojection of a sinogram-space residual. Each residual row is smeared
 * over the image height along the detector axis, rotated back by {@code -angle}, and
 * the per-angle fields are summed in angle order.
 */
public class BackprojectionOperator {

    private final ImageRotator rotator;
    private final boolean parallel;

    public BackprojectionOperator(ImageRotator rotator, boolean parallel) {
        this.rotator = rotator;
        this.parallel = parallel;
    }

    public INDArray backproject(INDArray residual, AngleSet angles, int side) {
        double[][] lines = residual.toDoubleMatrix();
        double[][][] fields = AngleStreams.parallele(IntStream.range(0, angles.size()), parallel)
                .mapToObj(k -> backprojectedField(lines[k], angles.get(k), side))
                .toArray(double[][][]::new);

        // fold in angle order so the sum does not depend on scheduling
        INDArray correction = Nd4j.zeros(DataType.DOUBLE, side, side);
        for (double[][] field : fields) {
            correction.addi(Nd4j.createFromArray(field));
        }
        return correction;
    }

    private double[][] backprojectedField(double[] line, double angle, int side) {
        double[][] smeared = new double[side][side];
        int used = Math.min(line.length, side);
        for (double[] row : smeared) {
            System.arraycopy(line, 0, row, 0, used);
        }
        return rotator.rotate(smeared, -angle);
    }
}
