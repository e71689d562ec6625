package com.example.est.tomography;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Axis convention of a sinogram. The engine works in {@link #ANGLE_ROWS}; collaborators
 * that expect something else declare it and get an adapted copy.
 */
public enum SinogramLayout {

    /** One row per angle, one column per detector position. */
    ANGLE_ROWS {
        @Override
        public INDArray fromCanonical(INDArray sinogram) {
            return sinogram;
        }
    },

    /** One row per detector position, one column per angle. */
    DETECTOR_ROWS {
        @Override
        public INDArray fromCanonical(INDArray sinogram) {
            return sinogram.transpose().dup();
        }
    };

    public abstract INDArray fromCanonical(INDArray sinogram);
}
