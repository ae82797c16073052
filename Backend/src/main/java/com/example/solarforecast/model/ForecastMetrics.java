package com.example.solarforecast.model;

import lombok.Data;

@Data
public class ForecastMetrics {
    private double peakIrradiance;  // W/m²
    private double avgIrradiance;   // W/m²
    private double avgConfidence;
    private double totalEnergyKwh;  // kWh/m² (시간당 예측값 합계)
    private double avgTemperature;  // °C
    private double avgCloudCover;   // %
    private double avgHumidity;     // %
}
