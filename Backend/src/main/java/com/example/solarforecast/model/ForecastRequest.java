package com.example.solarforecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class ForecastRequest {

    @JsonProperty("location")
    private GeoLocation location;

    @JsonProperty("weather")
    private HourlyWeatherData weather;

    @JsonProperty("parallel")
    private boolean parallel = false; // 시간별 계산 병렬 처리 여부
}
