package com.example.solarforecast.util;

import java.util.List;

/**
 * 기상 시계열 통계 (평균, 모분산, 최소제곱 기울기)
 */
public final class WeatherStatistics {

    private WeatherStatistics() {
    }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    public static double variance(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum / values.size();
    }

    /**
     * 최소제곱 선형 회귀 기울기 (y 단위 / x 단위)
     * 점이 2개 미만이거나 x 분산이 0이면 0
     */
    public static double slope(List<Double> xs, List<Double> ys) {
        if (xs.size() != ys.size()) {
            throw new IllegalArgumentException("x, y 길이가 다릅니다: " + xs.size() + " != " + ys.size());
        }
        if (xs.size() < 2) {
            return 0;
        }

        double xMean = mean(xs);
        double yMean = mean(ys);

        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < xs.size(); i++) {
            double dx = xs.get(i) - xMean;
            numerator += dx * (ys.get(i) - yMean);
            denominator += dx * dx;
        }

        return denominator != 0 ? numerator / denominator : 0;
    }

    public static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
