package com.example.est.tomography;

/**
 * Iteration budget, plateau tolerance and step size of one reconstruction run.
 * Checked by {@link ReconstructionEngine} before any work starts.
 */
public record ReconstructionSettings(int iterations, double tolerance, double learningRate) {

    public static final int DEFAULT_ITERATIONS = 200;
    public static final double DEFAULT_TOLERANCE = 1e-5;
    public static final double DEFAULT_LEARNING_RATE = 5e-5;

    public static ReconstructionSettings defaults() {
        return new ReconstructionSettings(DEFAULT_ITERATIONS, DEFAULT_TOLERANCE, DEFAULT_LEARNING_RATE);
    }

    public ReconstructionSettings withIterations(int iterations) {
        return new ReconstructionSettings(iterations, tolerance, learningRate);
    }

    public ReconstructionSettings withTolerance(double tolerance) {
        return new ReconstructionSettings(iterations, tolerance, learningRate);
    }

    public ReconstructionSettings withLearningRate(double learningRate) {
        return new ReconstructionSettings(iterations, tolerance, learningRate);
    }

    void validate() {
        if (iterations < 1) {
            throw new InvalidConfigurationException("Número de iterações deve ser positivo: " + iterations);
        }
        if (!(tolerance > 0) || Double.isInfinite(tolerance)) {
            throw new InvalidConfigurationException("Tolerância deve ser positiva: " + tolerance);
        }
        if (!(learningRate > 0) || Double.isInfinite(learningRate)) {
            throw new InvalidConfigurationException("Taxa de aprendizado deve ser positiva: " + learningRate);
        }
    }
}
