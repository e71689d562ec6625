package com.example.est.tomography;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class AngleSamplerTest {

    private final AngleSampler sampler = new AngleSampler();

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 7, 60, 181})
    @DisplayName("angles are symmetric about zero")
    void anglesAreSymmetric(int count) {
        AngleSet angles = sampler.sample(count);

        assertEquals(count, angles.size());
        for (int k = 0; k < count; k++) {
            assertEquals(-angles.get(count - 1 - k), angles.get(k), 1e-9, "k=" + k);
        }
    }

    @Test
    @DisplayName("sines are equally spaced between -1 and 1")
    void sinesAreEquallySpaced() {
        AngleSet angles = sampler.sample(9);

        assertEquals(-90.0, angles.get(0), 1e-12);
        assertEquals(90.0, angles.get(8), 1e-12);
        for (int k = 1; k < 9; k++) {
            double step = Math.sin(Math.toRadians(angles.get(k))) - Math.sin(Math.toRadians(angles.get(k - 1)));
            assertEquals(0.25, step, 1e-12);
        }
    }

    @Test
    void angleSteps_areFinerNearZeroThanNearNinety() {
        AngleSet angles = sampler.sample(11);

        double middleStep = angles.get(6) - angles.get(5);
        double edgeStep = angles.get(10) - angles.get(9);
        assertTrue(edgeStep > middleStep);
    }

    @Test
    void oddCountContainsZero() {
        assertEquals(0.0, sampler.sample(5).get(2), 1e-12);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 0, -3})
    @DisplayName("fewer than two projections are rejected")
    void degenerateCountsRejected(int count) {
        assertThrows(InvalidConfigurationException.class, () -> sampler.sample(count));
    }
}
