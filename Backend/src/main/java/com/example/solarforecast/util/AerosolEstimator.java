package com.example.solarforecast.util;

/**
 * 태양 고도에 따른 대기 투과율 (에어로졸 산란)
 */
public final class AerosolEstimator {

    private AerosolEstimator() {
    }

    public static double transmission(double elevation) {
        if (elevation < 0) return 0;
        if (elevation < 10) return 0.85;
        if (elevation < 20) return 0.90;
        if (elevation < 30) return 0.93;
        return 0.95;
    }
}
