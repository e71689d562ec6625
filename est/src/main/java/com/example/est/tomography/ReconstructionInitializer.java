package com.example.est.tomography;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Direct-inversion estimate used once to seed the iterative loop.
 */
public interface ReconstructionInitializer {

    /**
     * @param sinogram observed sinogram, already adapted to {@link #sinogramLayout()}
     * @param angles   acquisition angles in sinogram order
     * @return a square image estimate in this initializer's own orientation
     */
    INDArray initialize(INDArray sinogram, AngleSet angles);

    default SinogramLayout sinogramLayout() {
        return SinogramLayout.ANGLE_ROWS;
    }

    /**
     * Brings an image returned by {@link #initialize} into the orientation of
     * {@link ProjectionOperator}. Identity for initializers built on the same operators.
     */
    default INDArray toCanonicalImage(INDArray image) {
        return image;
    }
}
