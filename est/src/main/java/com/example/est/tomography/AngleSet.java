package com.example.est.tomography;

import java.util.Arrays;

// ângulos em graus; índice k = linha k do sinograma
public final class AngleSet {

    private final double[] degrees;

    private AngleSet(double[] degrees) {
        this.degrees = degrees;
    }

    public static AngleSet of(double... degrees) {
        if (degrees == null || degrees.length == 0) {
            throw new InvalidConfigurationException("Conjunto de ângulos vazio.");
        }
        return new AngleSet(degrees.clone());
    }

    public int size() {
        return degrees.length;
    }

    public double get(int index) {
        return degrees[index];
    }

    public double[] toArray() {
        return degrees.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AngleSet other)) return false;
        return Arrays.equals(degrees, other.degrees);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(degrees);
    }

    @Override
    public String toString() {
        return "AngleSet" + Arrays.toString(degrees);
    }
}
