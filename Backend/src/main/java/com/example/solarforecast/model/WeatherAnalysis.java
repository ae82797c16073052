package com.example.solarforecast.model;

import lombok.Data;

@Data
public class WeatherAnalysis {
    private CurrentConditions currentConditions;
    private WeatherTrends weatherTrends;
    private WeatherAlerts weatherAlerts;
    private double forecastQuality; // 0.1 ~ 0.99
    private String dataFreshness;

    // 첫 번째 시간(인덱스 0)의 기상 상태
    @Data
    public static class CurrentConditions {
        private double temperature;
        private double humidity;
        private double cloudCover;
        private double windSpeed;
        private double windDirection;
        private double pressure;
        private double precipitation;
        private Double uvIndex;
        private Double visibility;
    }

    // 시간당 변화량 (선형 회귀 기울기)
    @Data
    public static class WeatherTrends {
        private double tempTrend;
        private double cloudCoverTrend;
        private double windSpeedTrend;
        private double pressureTrend;
        private double humidityTrend;
    }

    @Data
    public static class WeatherAlerts {
        private boolean cloudCoverAlert;
        private boolean temperatureAlert;
        private boolean windAlert;
        private boolean pressureAlert;
        private boolean precipitationAlert;
    }
}
