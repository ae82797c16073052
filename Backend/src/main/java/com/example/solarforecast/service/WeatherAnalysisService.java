package com.example.solarforecast.service;

import com.example.solarforecast.config.ForecastProperties;
import com.example.solarforecast.model.WeatherAnalysis;
import com.example.solarforecast.model.WeatherChannel;
import com.example.solarforecast.model.WeatherSample;
import com.example.solarforecast.model.WeatherSeries;
import com.example.solarforecast.util.WeatherStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class WeatherAnalysisService {

    // 추세/품질 계산에 사용하는 최대 시간 수
    static final int ANALYSIS_WINDOW_HOURS = 24;

    static final double EMPTY_SERIES_QUALITY = 0.5;
    static final String DATA_FRESHNESS = "Real-time";

    private final ForecastProperties properties;

    public WeatherAnalysisService(ForecastProperties properties) {
        this.properties = properties;
    }

    /**
     * 기상 데이터 종합 분석 (현재 상태, 추세, 경보, 예보 품질)
     */
    public WeatherAnalysis analyze(WeatherSeries series) {
        if (series == null) {
            throw new IllegalArgumentException("기상 데이터가 없습니다");
        }

        WeatherAnalysis.WeatherTrends trends = analyzeTrends(series);

        WeatherAnalysis analysis = new WeatherAnalysis();
        analysis.setCurrentConditions(currentConditions(series));
        analysis.setWeatherTrends(trends);
        analysis.setWeatherAlerts(detectAlerts(series, trends));
        analysis.setForecastQuality(scoreQuality(series));
        analysis.setDataFreshness(DATA_FRESHNESS);

        log.info("기상 분석 완료: {}시간, 예보 품질={}%", series.size(),
                String.format("%.1f", analysis.getForecastQuality() * 100));
        return analysis;
    }

    /**
     * 채널 값의 시간당 변화량 (앞 24시간 최소제곱 기울기)
     * 해당 채널 값이 있는 샘플만 사용하며 x는 샘플 인덱스
     */
    public double analyzeTrend(WeatherSeries series, WeatherChannel channel) {
        List<WeatherSample> window = series.window(ANALYSIS_WINDOW_HOURS);

        List<Double> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        for (int i = 0; i < window.size(); i++) {
            Double value = channel.extract(window.get(i));
            if (value != null) {
                xs.add((double) i);
                ys.add(value);
            }
        }

        return WeatherStatistics.slope(xs, ys);
    }

    public WeatherAnalysis.WeatherTrends analyzeTrends(WeatherSeries series) {
        WeatherAnalysis.WeatherTrends trends = new WeatherAnalysis.WeatherTrends();
        trends.setTempTrend(WeatherStatistics.round(analyzeTrend(series, WeatherChannel.TEMPERATURE), 3));
        trends.setCloudCoverTrend(WeatherStatistics.round(analyzeTrend(series, WeatherChannel.CLOUD_COVER), 2));
        trends.setWindSpeedTrend(WeatherStatistics.round(analyzeTrend(series, WeatherChannel.WIND_SPEED), 3));
        trends.setPressureTrend(WeatherStatistics.round(analyzeTrend(series, WeatherChannel.PRESSURE), 2));
        trends.setHumidityTrend(WeatherStatistics.round(analyzeTrend(series, WeatherChannel.HUMIDITY), 2));
        return trends;
    }

    /**
     * 기상 경보 판정 ("현재" = 인덱스 0)
     */
    public WeatherAnalysis.WeatherAlerts detectAlerts(WeatherSeries series, WeatherAnalysis.WeatherTrends trends) {
        WeatherAnalysis.WeatherAlerts alerts = new WeatherAnalysis.WeatherAlerts();
        if (series.isEmpty()) {
            return alerts;
        }

        WeatherSample current = series.get(0);

        // 앞 6시간 운량 변동폭
        List<WeatherSample> nextHours = series.window(properties.getCloudVariabilityWindowHours());
        double cloudVariability = 0;
        if (nextHours.size() > 1) {
            double max = Double.NEGATIVE_INFINITY;
            double min = Double.POSITIVE_INFINITY;
            for (WeatherSample sample : nextHours) {
                max = Math.max(max, sample.getCloudCover());
                min = Math.min(min, sample.getCloudCover());
            }
            cloudVariability = max - min;
        }

        double currentWind = current.getWindSpeed() != null ? current.getWindSpeed() : 0;
        double currentPrecip = current.getPrecipitation() != null ? current.getPrecipitation() : 0;

        alerts.setCloudCoverAlert(current.getCloudCover() > properties.getCloudCoverAlertThreshold()
                || cloudVariability > properties.getCloudVariabilityAlertThreshold());
        alerts.setTemperatureAlert(current.getTemperature() < properties.getExtremeLowTemperature()
                || current.getTemperature() > properties.getExtremeHighTemperature());
        alerts.setWindAlert(currentWind > properties.getWindSpeedAlertThreshold());
        alerts.setPressureAlert(Math.abs(trends.getPressureTrend()) > properties.getPressureTrendAlertThreshold());
        alerts.setPrecipitationAlert(currentPrecip > properties.getPrecipitationAlertThreshold());

        return alerts;
    }

    /**
     * 예보 품질 점수 (0.1 ~ 0.99), 온도/운량 안정성과 강수 여부로 계산
     */
    public double scoreQuality(WeatherSeries series) {
        if (series.isEmpty()) {
            return EMPTY_SERIES_QUALITY;
        }

        List<Double> temps = new ArrayList<>();
        List<Double> clouds = new ArrayList<>();
        boolean hasPrecip = false;
        for (WeatherSample sample : series.window(ANALYSIS_WINDOW_HOURS)) {
            temps.add(sample.getTemperature());
            clouds.add(sample.getCloudCover());
            if (sample.getPrecipitation() != null && sample.getPrecipitation() > 0) {
                hasPrecip = true;
            }
        }

        double tempStability = Math.max(0.3, 1 - Math.sqrt(WeatherStatistics.variance(temps)) / 20);
        double cloudStability = Math.max(0.3, 1 - Math.sqrt(WeatherStatistics.variance(clouds)) / 40);
        double precipFactor = hasPrecip ? 0.85 : 1.0;

        double quality = tempStability * 0.4 + cloudStability * 0.4 + precipFactor * 0.2;
        return Math.min(0.99, Math.max(0.1, quality));
    }

    private WeatherAnalysis.CurrentConditions currentConditions(WeatherSeries series) {
        WeatherAnalysis.CurrentConditions conditions = new WeatherAnalysis.CurrentConditions();
        if (series.isEmpty()) {
            conditions.setHumidity(50);
            conditions.setPressure(1013);
            return conditions;
        }

        WeatherSample current = series.get(0);
        conditions.setTemperature(current.getTemperature());
        conditions.setCloudCover(current.getCloudCover());
        conditions.setHumidity(orDefault(current.getHumidity(), 50));
        conditions.setWindSpeed(orDefault(current.getWindSpeed(), 0));
        conditions.setWindDirection(orDefault(current.getWindDirection(), 0));
        conditions.setPressure(orDefault(current.getPressure(), 1013));
        conditions.setPrecipitation(orDefault(current.getPrecipitation(), 0));
        conditions.setUvIndex(current.getUvIndex());
        conditions.setVisibility(current.getVisibility());
        return conditions;
    }

    private static double orDefault(Double value, double defaultValue) {
        return value != null ? value : defaultValue;
    }

    /**
     * 사람이 읽을 수 있는 기상 요약 문자열
     */
    public String summarize(WeatherAnalysis analysis) {
        WeatherAnalysis.CurrentConditions current = analysis.getCurrentConditions();
        WeatherAnalysis.WeatherTrends trends = analysis.getWeatherTrends();
        WeatherAnalysis.WeatherAlerts alerts = analysis.getWeatherAlerts();

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("기온 %.1f°C | 운량 %.0f%% | 습도 %.0f%% | 풍속 %.1f m/s%n",
                current.getTemperature(), current.getCloudCover(), current.getHumidity(), current.getWindSpeed()));
        sb.append(String.format("예보 품질: %.0f%%%n", analysis.getForecastQuality() * 100));

        String tempDirection = trends.getTempTrend() > 0.1 ? "상승" : trends.getTempTrend() < -0.1 ? "하강" : "유지";
        String cloudDirection = trends.getCloudCoverTrend() > 1 ? "증가" : trends.getCloudCoverTrend() < -1 ? "감소" : "유지";
        sb.append(String.format("기온 추세(%s): %+.2f°C/h%n", tempDirection, trends.getTempTrend()));
        sb.append(String.format("운량 추세(%s): %+.1f%%/h", cloudDirection, trends.getCloudCoverTrend()));

        List<String> activeAlerts = new ArrayList<>();
        if (alerts.isCloudCoverAlert()) activeAlerts.add("짙은 구름");
        if (alerts.isTemperatureAlert()) activeAlerts.add("극한 기온");
        if (alerts.isWindAlert()) activeAlerts.add("강풍");
        if (alerts.isPressureAlert()) activeAlerts.add("기압 급변");
        if (alerts.isPrecipitationAlert()) activeAlerts.add("강수");

        if (!activeAlerts.isEmpty()) {
            sb.append(String.format("%n경보: %s", String.join(" | ", activeAlerts)));
        }

        return sb.toString();
    }
}
