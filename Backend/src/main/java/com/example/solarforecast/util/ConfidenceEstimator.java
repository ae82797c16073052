package com.example.solarforecast.util;

import com.example.solarforecast.model.WeatherSeries;

/**
 * 시간별 예측 신뢰도 (0.1 ~ 1)
 * 인접 시간의 운량 변화, 태양 고도, 극한 온도 여부로 계산
 */
public final class ConfidenceEstimator {

    public static final double NIGHT_CONFIDENCE = 0.95;
    static final double MIN_CONFIDENCE = 0.1;

    private static final double DEFAULT_LOW_TEMPERATURE = -10.0;
    private static final double DEFAULT_HIGH_TEMPERATURE = 40.0;

    private ConfidenceEstimator() {
    }

    public static double estimate(double cloudCover, double elevation, double temperature,
                                  int index, WeatherSeries series) {
        return estimate(cloudCover, elevation, temperature, index, series,
                DEFAULT_LOW_TEMPERATURE, DEFAULT_HIGH_TEMPERATURE);
    }

    public static double estimate(double cloudCover, double elevation, double temperature,
                                  int index, WeatherSeries series,
                                  double extremeLowTemperature, double extremeHighTemperature) {
        // 야간은 "확실히 0"
        if (elevation < 0) {
            return NIGHT_CONFIDENCE;
        }

        // 앞뒤 시간 운량 차이
        double cloudVariance = 0;
        if (index > 0 && index < series.size() - 1) {
            double prevCloud = series.get(index - 1).getCloudCover();
            double nextCloud = series.get(index + 1).getCloudCover();
            cloudVariance = Math.abs(prevCloud - nextCloud) / 100.0;
        }

        double cloudConfidence = 1 - cloudVariance * 0.4;
        double elevationConfidence = Math.min(1, elevation / 80.0);
        double tempConfidence = temperature < extremeLowTemperature || temperature > extremeHighTemperature ? 0.7 : 0.9;

        return Math.max(MIN_CONFIDENCE, cloudConfidence * elevationConfidence * tempConfidence);
    }
}
