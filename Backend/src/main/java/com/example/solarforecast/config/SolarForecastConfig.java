package com.example.solarforecast.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SolarForecastConfig {

    private static final Logger logger = LoggerFactory.getLogger(SolarForecastConfig.class);

    @Bean
    public ForecastProperties forecastProperties(
            @Value("${solar.forecast.system-efficiency:0.85}") double systemEfficiency,
            @Value("${solar.forecast.temperature-coefficient:-0.004}") double temperatureCoefficient,
            @Value("${solar.forecast.reference-temperature:25.0}") double referenceTemperature,
            @Value("${solar.forecast.parallel-pool-size:4}") int parallelPoolSize,
            @Value("${solar.alert.extreme-low-temperature:-10.0}") double extremeLowTemperature,
            @Value("${solar.alert.extreme-high-temperature:40.0}") double extremeHighTemperature,
            @Value("${solar.alert.cloud-cover:80.0}") double cloudCoverAlertThreshold,
            @Value("${solar.alert.cloud-variability:50.0}") double cloudVariabilityAlertThreshold,
            @Value("${solar.alert.cloud-variability-window-hours:6}") int cloudVariabilityWindowHours,
            @Value("${solar.alert.wind-speed:20.0}") double windSpeedAlertThreshold,
            @Value("${solar.alert.pressure-trend:1.5}") double pressureTrendAlertThreshold,
            @Value("${solar.alert.precipitation:5.0}") double precipitationAlertThreshold) {

        ForecastProperties properties = new ForecastProperties();
        properties.setSystemEfficiency(systemEfficiency);
        properties.setTemperatureCoefficient(temperatureCoefficient);
        properties.setReferenceTemperature(referenceTemperature);
        properties.setParallelPoolSize(parallelPoolSize);
        properties.setExtremeLowTemperature(extremeLowTemperature);
        properties.setExtremeHighTemperature(extremeHighTemperature);
        properties.setCloudCoverAlertThreshold(cloudCoverAlertThreshold);
        properties.setCloudVariabilityAlertThreshold(cloudVariabilityAlertThreshold);
        properties.setCloudVariabilityWindowHours(cloudVariabilityWindowHours);
        properties.setWindSpeedAlertThreshold(windSpeedAlertThreshold);
        properties.setPressureTrendAlertThreshold(pressureTrendAlertThreshold);
        properties.setPrecipitationAlertThreshold(precipitationAlertThreshold);

        logger.info("예측 모델 설정 로드: 시스템 효율={}, 온도 계수={}, 병렬 스레드={}",
                systemEfficiency, temperatureCoefficient, parallelPoolSize);
        return properties;
    }
}
