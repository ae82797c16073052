package com.example.solarforecast.model;

import java.util.function.Function;

/**
 * 추세 분석 등에서 사용하는 기상 채널
 */
public enum WeatherChannel {
    TEMPERATURE(WeatherSample::getTemperature),
    CLOUD_COVER(WeatherSample::getCloudCover),
    SHORTWAVE_RADIATION(WeatherSample::getShortwaveRadiation),
    HUMIDITY(WeatherSample::getHumidity),
    WIND_SPEED(WeatherSample::getWindSpeed),
    WIND_DIRECTION(WeatherSample::getWindDirection),
    PRESSURE(WeatherSample::getPressure),
    PRECIPITATION(WeatherSample::getPrecipitation),
    UV_INDEX(WeatherSample::getUvIndex),
    VISIBILITY(WeatherSample::getVisibility);

    private final Function<WeatherSample, Double> extractor;

    WeatherChannel(Function<WeatherSample, Double> extractor) {
        this.extractor = extractor;
    }

    /**
     * 샘플에서 채널 값 추출 (값이 없으면 null)
     */
    public Double extract(WeatherSample sample) {
        return extractor.apply(sample);
    }
}
