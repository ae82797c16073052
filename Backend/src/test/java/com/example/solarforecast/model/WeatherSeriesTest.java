package com.example.solarforecast.model;

import com.example.solarforecast.WeatherTestData;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeatherSeriesTest {

    @Test
    void missingRequiredChannelsAreFilledWithDefaults() {
        HourlyWeatherData data = new HourlyWeatherData();
        data.setTime(List.of("2024-06-21T10:00", "2024-06-21T11:00"));

        WeatherSeries series = WeatherSeries.from(data);

        assertThat(series.size()).isEqualTo(2);
        WeatherSample sample = series.get(1);
        assertThat(sample.getTemperature()).isEqualTo(25.0);
        assertThat(sample.getCloudCover()).isEqualTo(0.0);
        assertThat(sample.getShortwaveRadiation()).isEqualTo(0.0);
        assertThat(sample.getHumidity()).isNull();
        assertThat(sample.getPressure()).isNull();
    }

    @Test
    void nullShortAndNonFiniteEntriesUseDefaultsButZeroIsKept() {
        HourlyWeatherData data = new HourlyWeatherData();
        data.setTime(List.of("2024-06-21T10:00", "2024-06-21T11:00", "2024-06-21T12:00"));
        data.setTemperature(Arrays.asList(0.0, null, Double.NaN));
        data.setCloudCover(List.of(40.0));
        data.setHumidity(Arrays.asList(null, 60.0, 70.0));

        WeatherSeries series = WeatherSeries.from(data);

        assertThat(series.get(0).getTemperature()).isEqualTo(0.0);
        assertThat(series.get(1).getTemperature()).isEqualTo(25.0);
        assertThat(series.get(2).getTemperature()).isEqualTo(25.0);
        assertThat(series.get(0).getCloudCover()).isEqualTo(40.0);
        assertThat(series.get(2).getCloudCover()).isEqualTo(0.0);
        assertThat(series.get(0).getHumidity()).isNull();
        assertThat(series.get(1).getHumidity()).isEqualTo(60.0);
    }

    @Test
    void timestampsAreKeptAndNormalized() {
        HourlyWeatherData data = new HourlyWeatherData();
        data.setTime(List.of("2024-06-21T16:00"));

        WeatherSample sample = WeatherSeries.from(data).get(0);

        assertThat(sample.getTime()).isEqualTo("2024-06-21T16:00");
        assertThat(sample.getInstant()).isEqualTo(Instant.parse("2024-06-21T16:00:00Z"));
    }

    @Test
    void structurallyInvalidDataIsRejected() {
        HourlyWeatherData noTime = new HourlyWeatherData();
        noTime.setTime(null);
        assertThatThrownBy(() -> WeatherSeries.from(noTime)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WeatherSeries.from(null)).isInstanceOf(IllegalArgumentException.class);

        HourlyWeatherData badTime = new HourlyWeatherData();
        badTime.setTime(List.of("yesterday"));
        assertThatThrownBy(() -> WeatherSeries.from(badTime))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("yesterday");
    }

    @Test
    void sampleAtJoinsOnTimestampEquality() {
        WeatherSeries series = WeatherSeries.from(WeatherTestData.hourly("2024-06-21T10:00:00Z",
                new double[]{18, 19, 20}, new double[]{10, 20, 30}, new double[]{100, 200, 300}));

        assertThat(series.sampleAt("2024-06-21T11:00:00Z"))
                .hasValueSatisfying(sample -> assertThat(sample.getCloudCover()).isEqualTo(20.0));
        // 오프셋 표기가 달라도 같은 시각이면 매칭
        assertThat(series.sampleAt("2024-06-21T14:00:00+02:00"))
                .hasValueSatisfying(sample -> assertThat(sample.getTemperature()).isEqualTo(20.0));
        assertThat(series.sampleAt("2024-06-21T13:00:00Z")).isEmpty();
        assertThat(series.sampleAt("garbage")).isEmpty();
    }

    @Test
    void windowIsBoundedBySeriesLength() {
        WeatherSeries series = WeatherSeries.from(WeatherTestData.hourly("2024-06-21T10:00:00Z",
                new double[]{1, 2, 3}, new double[]{0, 0, 0}, new double[]{0, 0, 0}));

        assertThat(series.window(24)).hasSize(3);
        assertThat(series.window(2)).hasSize(2);
        assertThat(WeatherSeries.empty().window(24)).isEmpty();
    }

    @Test
    void samplesCannotBeModified() {
        WeatherSeries series = WeatherTestData.singleHour("2024-06-21T10:00:00Z", 20, 0, 0);

        assertThatThrownBy(() -> series.getSamples().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
