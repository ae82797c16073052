package com.example.solarforecast.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 한 시간 분량의 기상 값
 * 온도/운량/일사량은 항상 값이 있고, 나머지 채널은 없으면 null
 */
@Getter
@Builder
@ToString
public class WeatherSample {
    private final String time;
    private final Instant instant;

    private final double temperature;        // °C
    private final double cloudCover;         // %
    private final double shortwaveRadiation; // W/m²

    private final Double humidity;
    private final Double windSpeed;
    private final Double windDirection;
    private final Double pressure;
    private final Double precipitation;
    private final Double uvIndex;
    private final Double visibility;
}
