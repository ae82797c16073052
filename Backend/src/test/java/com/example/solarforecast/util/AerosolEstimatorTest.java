package com.example.solarforecast.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AerosolEstimatorTest {

    @Test
    void stepValues() {
        assertThat(AerosolEstimator.transmission(-1)).isEqualTo(0.0);
        assertThat(AerosolEstimator.transmission(5)).isEqualTo(0.85);
        assertThat(AerosolEstimator.transmission(15)).isEqualTo(0.90);
        assertThat(AerosolEstimator.transmission(25)).isEqualTo(0.93);
        assertThat(AerosolEstimator.transmission(50)).isEqualTo(0.95);
    }

    @Test
    void breakpointsBelongToUpperStep() {
        assertThat(AerosolEstimator.transmission(0)).isEqualTo(0.85);
        assertThat(AerosolEstimator.transmission(10)).isEqualTo(0.90);
        assertThat(AerosolEstimator.transmission(20)).isEqualTo(0.93);
        assertThat(AerosolEstimator.transmission(30)).isEqualTo(0.95);
    }
}
