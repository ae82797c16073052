package com.example.solarforecast.util;

import com.example.solarforecast.model.IrradianceComponents;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IrradianceDecomposerTest {

    @Test
    void horizonAndNightGiveNoComponents() {
        assertThat(IrradianceDecomposer.decompose(300, 0, 20)).isEqualTo(new IrradianceComponents(0, 0));
        assertThat(IrradianceDecomposer.decompose(300, -4, 20)).isEqualTo(new IrradianceComponents(0, 0));
    }

    @Test
    void highClearnessIsMostlyDirect() {
        // 고도 45도 청천 GHI ≈ 1282 → 청명도 0.936
        IrradianceComponents components = IrradianceDecomposer.decompose(1200, 45, 0);

        assertThat(components.getDhi()).isCloseTo(329.9, within(1.0));
        assertThat(components.getDni()).isCloseTo(1230.5, within(2.0));
    }

    @Test
    void lowClearnessIsMostlyDiffuse() {
        IrradianceComponents components = IrradianceDecomposer.decompose(100, 45, 95);

        assertThat(components.getDhi()).isGreaterThan(95);
        assertThat(components.getDni()).isEqualTo(0.0);
    }

    @Test
    void componentsAreNeverNegative() {
        for (double elevation = 0.5; elevation <= 90; elevation += 4.5) {
            for (double ghi = 0; ghi <= 1400; ghi += 50) {
                IrradianceComponents components = IrradianceDecomposer.decompose(ghi, elevation, 50);
                assertThat(components.getDni()).isGreaterThanOrEqualTo(0.0);
                assertThat(components.getDhi()).isGreaterThanOrEqualTo(0.0);
                assertThat(Double.isFinite(components.getDni())).isTrue();
            }
        }
    }
}
