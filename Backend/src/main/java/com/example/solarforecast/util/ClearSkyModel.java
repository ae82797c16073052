package com.example.solarforecast.util;

/**
 * 청천(구름 없음) 수평면 전일사량 모델
 * Kasten-Young 대기질량 근사, 천정각 96도 미만에서만 유효
 */
public final class ClearSkyModel {

    private static final double C0 = 910.6;
    private static final double C1 = 0.6797;
    private static final double C2 = -0.00639;

    private ClearSkyModel() {
    }

    /**
     * 청천 GHI 계산 (W/m²), 해가 지평선 아래면 0
     */
    public static double ghi(double elevation, double zenith) {
        if (elevation <= 0) {
            return 0;
        }

        double zenithRad = Math.toRadians(zenith);
        double airmass = 1 / (Math.cos(zenithRad) + 0.50572 * Math.pow(96.07995 - zenith, -1.6364));

        double clearSkyGhi = C0 * Math.exp(C1 - C2 * airmass) * Math.max(0, Math.cos(zenithRad));
        if (!Double.isFinite(clearSkyGhi)) {
            return 0;
        }
        return Math.max(0, clearSkyGhi);
    }
}
