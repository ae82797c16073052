package com.example.solarforecast.model;

import com.example.solarforecast.util.TimestampParser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 시간 오름차순으로 정렬된 기상 샘플 목록 (불변)
 * 필수 채널의 기본값 채우기는 여기서만 수행한다
 */
public final class WeatherSeries {

    public static final double DEFAULT_TEMPERATURE = 25.0;
    public static final double DEFAULT_CLOUD_COVER = 0.0;
    public static final double DEFAULT_SHORTWAVE_RADIATION = 0.0;

    private final List<WeatherSample> samples;
    private final Map<Instant, WeatherSample> samplesByInstant;

    private WeatherSeries(List<WeatherSample> samples) {
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
        Map<Instant, WeatherSample> index = new LinkedHashMap<>();
        for (WeatherSample sample : this.samples) {
            index.putIfAbsent(sample.getInstant(), sample);
        }
        this.samplesByInstant = Collections.unmodifiableMap(index);
    }

    public static WeatherSeries empty() {
        return new WeatherSeries(List.of());
    }

    /**
     * 채널 배열 데이터를 시간별 샘플로 변환
     * 값이 없거나 유한하지 않은 필수 채널은 기본값(25°C / 0% / 0 W/m²)으로 채운다
     */
    public static WeatherSeries from(HourlyWeatherData data) {
        if (data == null || data.getTime() == null) {
            throw new IllegalArgumentException("기상 데이터에 time 배열이 없습니다");
        }

        List<String> times = data.getTime();
        List<WeatherSample> samples = new ArrayList<>(times.size());

        for (int i = 0; i < times.size(); i++) {
            String time = times.get(i);
            samples.add(WeatherSample.builder()
                    .time(time)
                    .instant(TimestampParser.parse(time))
                    .temperature(valueOrDefault(data.getTemperature(), i, DEFAULT_TEMPERATURE))
                    .cloudCover(valueOrDefault(data.getCloudCover(), i, DEFAULT_CLOUD_COVER))
                    .shortwaveRadiation(valueOrDefault(data.getShortwaveRadiation(), i, DEFAULT_SHORTWAVE_RADIATION))
                    .humidity(optionalValue(data.getHumidity(), i))
                    .windSpeed(optionalValue(data.getWindSpeed(), i))
                    .windDirection(optionalValue(data.getWindDirection(), i))
                    .pressure(optionalValue(data.getPressure(), i))
                    .precipitation(optionalValue(data.getPrecipitation(), i))
                    .uvIndex(optionalValue(data.getUvIndex(), i))
                    .visibility(optionalValue(data.getVisibility(), i))
                    .build());
        }

        return new WeatherSeries(samples);
    }

    private static double valueOrDefault(List<Double> channel, int index, double defaultValue) {
        Double value = optionalValue(channel, index);
        return value != null ? value : defaultValue;
    }

    private static Double optionalValue(List<Double> channel, int index) {
        if (channel == null || index >= channel.size()) {
            return null;
        }
        Double value = channel.get(index);
        return value != null && Double.isFinite(value) ? value : null;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public WeatherSample get(int index) {
        return samples.get(index);
    }

    public List<WeatherSample> getSamples() {
        return samples;
    }

    /**
     * 앞에서부터 최대 maxSamples 개의 샘플
     */
    public List<WeatherSample> window(int maxSamples) {
        return samples.subList(0, Math.min(Math.max(0, maxSamples), samples.size()));
    }

    /**
     * 시각 값으로 샘플 조회 (UTC 기준 동일 시각 매칭)
     */
    public Optional<WeatherSample> sampleAt(String time) {
        return TimestampParser.tryParse(time).map(samplesByInstant::get);
    }
}
