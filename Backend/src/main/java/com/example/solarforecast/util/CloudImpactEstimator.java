package com.example.solarforecast.util;

/**
 * 운량에 따른 일사 감쇠 계수
 * 온도는 구름 고도(종류)의 대략적인 대용값으로만 사용
 */
public final class CloudImpactEstimator {

    static final double CLEAR_SKY_FACTOR = 0.95;
    static final double OVERCAST_FACTOR = 0.15;
    static final double MIN_FACTOR = 0.1;

    private CloudImpactEstimator() {
    }

    public static double impact(double cloudCover, double temperature) {
        if (cloudCover < 10) {
            return CLEAR_SKY_FACTOR; // 잔여 산란
        }
        if (cloudCover > 90) {
            return OVERCAST_FACTOR;
        }

        double opacity = Math.pow(cloudCover / 100.0, 1.3);

        // 낮은 온도 = 높은 구름(권운)으로 가정 → 영향 감소
        double tempFactor = Math.max(0.8, Math.min(1.0, (temperature + 5) / 45.0));

        // 기존 식과 의도적으로 다름: 10~13% 구간에서 원식은 0.95를 넘으므로(10%, 25°C → 0.966) 청천 계수로 상한 적용
        double reduction = Math.min(CLEAR_SKY_FACTOR, 1 - opacity * tempFactor * 0.85);
        return Math.max(MIN_FACTOR, reduction);
    }
}
