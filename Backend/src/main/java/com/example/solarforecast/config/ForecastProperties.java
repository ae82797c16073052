package com.example.solarforecast.config;

import lombok.Data;

/**
 * 예측 모델 상수 및 기상 경보 임계값
 * 기본값은 application.properties 와 동일
 */
@Data
public class ForecastProperties {

    // 시스템 효율 (인버터, 배선 손실 등)
    private double systemEfficiency = 0.85;

    // 기준 온도(25°C) 초과 1°C 당 출력 변화율
    private double temperatureCoefficient = -0.004;
    private double referenceTemperature = 25.0;

    private int parallelPoolSize = 4;

    // 극한 온도 (경보 및 신뢰도 계산 공통)
    private double extremeLowTemperature = -10.0;
    private double extremeHighTemperature = 40.0;

    private double cloudCoverAlertThreshold = 80.0;
    private double cloudVariabilityAlertThreshold = 50.0;
    private int cloudVariabilityWindowHours = 6;
    private double windSpeedAlertThreshold = 20.0;      // m/s
    private double pressureTrendAlertThreshold = 1.5;   // hPa/h
    private double precipitationAlertThreshold = 5.0;   // mm
}
