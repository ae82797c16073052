package com.example.solarforecast.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 외부 날씨 API(Open-Meteo hourly)에서 받은 채널 배열 형태의 시간별 기상 데이터
 * 모든 배열은 time 배열과 인덱스가 일치한다
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class HourlyWeatherData {

    @JsonProperty("time")
    private List<String> time = new ArrayList<>();

    @JsonProperty("temperature_2m")
    private List<Double> temperature;

    @JsonProperty("cloud_cover")
    private List<Double> cloudCover;

    @JsonProperty("shortwave_radiation")
    private List<Double> shortwaveRadiation;

    @JsonProperty("humidity")
    private List<Double> humidity;

    @JsonProperty("windSpeed")
    private List<Double> windSpeed; // m/s

    @JsonProperty("windDirection")
    private List<Double> windDirection;

    @JsonProperty("pressure")
    private List<Double> pressure; // hPa

    @JsonProperty("precipitation")
    private List<Double> precipitation; // mm

    @JsonProperty("uvIndex")
    private List<Double> uvIndex;

    @JsonProperty("visibility")
    private List<Double> visibility;
}
