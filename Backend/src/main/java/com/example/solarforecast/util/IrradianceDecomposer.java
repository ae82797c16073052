package com.example.solarforecast.util;

import com.example.solarforecast.model.IrradianceComponents;

/**
 * 수평면 전일사량(GHI)을 직달(DNI)/산란(DHI) 성분으로 분리 (Erbs 상관식)
 * 결과는 참고용이며 예측 일사량 합계에는 반영하지 않는다
 */
public final class IrradianceDecomposer {

    private IrradianceDecomposer() {
    }

    public static IrradianceComponents decompose(double ghi, double elevation, double cloudCover) {
        if (elevation <= 0) {
            return IrradianceComponents.none();
        }

        double elevationRad = Math.toRadians(elevation);
        double sinElevation = Math.sin(elevationRad);

        // 청명도 지수
        double clearSkyGhi = ClearSkyModel.ghi(elevation, 90 - elevation);
        double clearness = clearSkyGhi > 0 ? Math.min(1, ghi / clearSkyGhi) : 0;

        double dhi;
        if (clearness <= 0.3) {
            dhi = ghi * (1.020 - 0.254 * clearness + 0.0123 * sinElevation);
        } else if (clearness <= 0.78) {
            dhi = ghi * (0.972 - 0.306 * clearness + 0.0311 * sinElevation);
        } else {
            dhi = ghi * (0.29 * clearness + 0.0049 * sinElevation);
        }

        // 지평선 부근 발산 방지 (sin 하한 0.01)
        double dni = Math.max(0, (ghi - dhi) / Math.max(0.01, sinElevation));

        return new IrradianceComponents(Math.max(0, dni), Math.max(0, dhi));
    }
}
