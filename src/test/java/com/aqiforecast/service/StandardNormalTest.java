package com.aqiforecast.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StandardNormalTest {

    @Test
    void twoSidedQuantile_matchesTables() {
        assertThat(StandardNormal.twoSidedQuantile(0.8)).isCloseTo(1.2815516, within(1e-6));
        assertThat(StandardNormal.twoSidedQuantile(0.9)).isCloseTo(1.6448536, within(1e-6));
        assertThat(StandardNormal.twoSidedQuantile(0.95)).isCloseTo(1.9599640, within(1e-6));
        assertThat(StandardNormal.twoSidedQuantile(0.99)).isCloseTo(2.5758293, within(1e-6));
    }

    @Test
    void inverseCdf_isSymmetric() {
        assertThat(StandardNormal.inverseCdf(0.5)).isCloseTo(0.0, within(1e-9));
        assertThat(StandardNormal.inverseCdf(0.01)).isCloseTo(-StandardNormal.inverseCdf(0.99), within(1e-9));
    }
}
