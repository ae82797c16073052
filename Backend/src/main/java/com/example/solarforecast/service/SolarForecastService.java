package com.example.solarforecast.service;

import com.example.solarforecast.config.ForecastProperties;
import com.example.solarforecast.model.ForecastMetrics;
import com.example.solarforecast.model.ForecastPoint;
import com.example.solarforecast.model.GeoLocation;
import com.example.solarforecast.model.IrradianceComponents;
import com.example.solarforecast.model.SolarPosition;
import com.example.solarforecast.model.WeatherSample;
import com.example.solarforecast.model.WeatherSeries;
import com.example.solarforecast.util.AerosolEstimator;
import com.example.solarforecast.util.ClearSkyModel;
import com.example.solarforecast.util.CloudImpactEstimator;
import com.example.solarforecast.util.ConfidenceEstimator;
import com.example.solarforecast.util.IrradianceDecomposer;
import com.example.solarforecast.util.SolarPositionCalculator;
import com.example.solarforecast.util.WeatherStatistics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@Service
public class SolarForecastService {

    private static final Logger logger = LoggerFactory.getLogger(SolarForecastService.class);

    // 태양광 잠재력 점수 계산 시 기준 일사량 (W/m²)
    private static final double REFERENCE_RADIATION = 800.0;

    private final ForecastProperties properties;
    private final ExecutorService executorService;

    public SolarForecastService(ForecastProperties properties) {
        this.properties = properties;
        this.executorService = Executors.newFixedThreadPool(Math.max(1, properties.getParallelPoolSize()));
    }

    /**
     * 주어진 시각과 위치에 대한 태양 위치 계산
     */
    public SolarPosition calculateSolarPosition(GeoLocation location, Instant instant) {
        if (location == null || instant == null) {
            throw new IllegalArgumentException("위치와 시각이 모두 필요합니다");
        }
        location.validate();
        return SolarPositionCalculator.calculate(location.getLatitude(), location.getLongitude(), instant);
    }

    /**
     * 시간별 일사량 예측 (입력 샘플 1개당 예측 1개, 순서 유지)
     */
    public List<ForecastPoint> generateForecast(GeoLocation location, WeatherSeries series) {
        validateInput(location, series);

        List<ForecastPoint> forecast = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            forecast.add(forecastHour(location, series, i));
        }

        logger.info("일사량 예측 완료: 위치=({}, {}), {}시간",
                location.getLatitude(), location.getLongitude(), forecast.size());
        return forecast;
    }

    /**
     * 병렬로 시간별 일사량 예측 (결과 순서는 입력 순서와 동일)
     */
    public CompletableFuture<List<ForecastPoint>> generateForecastInParallel(GeoLocation location,
                                                                             WeatherSeries series) {
        validateInput(location, series);

        List<CompletableFuture<ForecastPoint>> futures = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            final int index = i;
            futures.add(CompletableFuture.supplyAsync(
                    () -> forecastHour(location, series, index), executorService));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    List<ForecastPoint> forecast = new ArrayList<>(futures.size());
                    for (CompletableFuture<ForecastPoint> future : futures) {
                        forecast.add(future.join());
                    }
                    logger.info("병렬 일사량 예측 완료: 위치=({}, {}), {}시간",
                            location.getLatitude(), location.getLongitude(), forecast.size());
                    return forecast;
                });
    }

    /**
     * 단일 시간 예측
     */
    private ForecastPoint forecastHour(GeoLocation location, WeatherSeries series, int index) {
        WeatherSample sample = series.get(index);
        double temperature = sample.getTemperature();
        double cloudCover = sample.getCloudCover();
        double baseGhi = sample.getShortwaveRadiation();

        // 1. 태양 위치
        SolarPosition solarPos = SolarPositionCalculator.calculate(
                location.getLatitude(), location.getLongitude(), sample.getInstant());

        // 해가 지평선 아래
        if (solarPos.isBelowHorizon()) {
            return new ForecastPoint(sample.getTime(), 0, ConfidenceEstimator.NIGHT_CONFIDENCE);
        }

        // 2. 청천 최대치 (분해 단계의 청명도 지수에서만 사용)
        double clearSkyGhi = ClearSkyModel.ghi(solarPos.getElevation(), solarPos.getZenith());

        // 3. 운량 감쇠
        double cloudImpact = CloudImpactEstimator.impact(cloudCover, temperature);

        // 4. 에어로졸 산란
        double aerosolFactor = AerosolEstimator.transmission(solarPos.getElevation());

        // 5. 관측 일사량에 감쇠 계수 적용
        // FIXME: 관측값에 이미 구름 영향이 포함되어 있어 운량 감쇠가 이중 적용됨 (기존 결과 호환을 위해 유지)
        double predictedGhi = Math.max(0, baseGhi * cloudImpact * aerosolFactor);

        // 6. 온도 손실
        double tempDeviation = Math.max(0, temperature - properties.getReferenceTemperature());
        double tempLossFactor = 1 + properties.getTemperatureCoefficient() * tempDeviation;

        // 7. 시스템 효율
        double predictedIrradiance = Math.max(0, predictedGhi * properties.getSystemEfficiency() * tempLossFactor);

        // 8. 직달/산란 분리 (참고용)
        IrradianceComponents components = IrradianceDecomposer.decompose(
                predictedGhi, solarPos.getElevation(), cloudCover);

        // 9. 신뢰도
        double confidence = ConfidenceEstimator.estimate(cloudCover, solarPos.getElevation(), temperature,
                index, series, properties.getExtremeLowTemperature(), properties.getExtremeHighTemperature());

        logger.debug("{}: 고도={}, 청천GHI={}, 운량계수={}, 예측={}, DNI={}, DHI={}, 신뢰도={}",
                sample.getTime(), solarPos.getElevation(), clearSkyGhi, cloudImpact,
                predictedIrradiance, components.getDni(), components.getDhi(), confidence);

        return new ForecastPoint(sample.getTime(), predictedIrradiance, confidence);
    }

    private void validateInput(GeoLocation location, WeatherSeries series) {
        if (location == null) {
            throw new IllegalArgumentException("위치 정보가 없습니다");
        }
        if (series == null) {
            throw new IllegalArgumentException("기상 데이터가 없습니다");
        }
        location.validate();
    }

    /**
     * 예측 결과 요약 지표 계산
     * 기상 평균값은 예측 시각과 같은 시각의 기상 샘플을 매칭해서 계산
     */
    public ForecastMetrics calculateMetrics(List<ForecastPoint> forecast, WeatherSeries series) {
        ForecastMetrics metrics = new ForecastMetrics();
        if (forecast == null || forecast.isEmpty()) {
            return metrics;
        }

        List<Double> irradiance = new ArrayList<>();
        List<Double> confidence = new ArrayList<>();
        List<Double> temperatures = new ArrayList<>();
        List<Double> clouds = new ArrayList<>();
        List<Double> humidity = new ArrayList<>();

        double peak = 0;
        double total = 0;
        for (ForecastPoint point : forecast) {
            irradiance.add(point.getPredictedIrradiance());
            confidence.add(point.getConfidence());
            peak = Math.max(peak, point.getPredictedIrradiance());
            total += point.getPredictedIrradiance();

            Optional<WeatherSample> matched = series != null ? series.sampleAt(point.getTime()) : Optional.empty();
            matched.ifPresent(sample -> {
                temperatures.add(sample.getTemperature());
                clouds.add(sample.getCloudCover());
                if (sample.getHumidity() != null) {
                    humidity.add(sample.getHumidity());
                }
            });
        }

        metrics.setPeakIrradiance(peak);
        metrics.setAvgIrradiance(WeatherStatistics.mean(irradiance));
        metrics.setAvgConfidence(WeatherStatistics.mean(confidence));
        metrics.setTotalEnergyKwh(total / 1000.0); // 1시간 간격
        metrics.setAvgTemperature(WeatherStatistics.mean(temperatures));
        metrics.setAvgCloudCover(WeatherStatistics.mean(clouds));
        metrics.setAvgHumidity(WeatherStatistics.mean(humidity));

        logger.debug("예측 지표: 최대={}, 평균={}, 에너지={}kWh",
                metrics.getPeakIrradiance(), metrics.getAvgIrradiance(), metrics.getTotalEnergyKwh());
        return metrics;
    }

    /**
     * 기상 조건 기반 태양광 잠재력 점수 (0 ~ 100)
     */
    public int calculateSolarPotential(WeatherSeries series) {
        if (series == null || series.isEmpty()) {
            return 0;
        }

        List<Double> daytimeRadiation = new ArrayList<>();
        List<Double> clouds = new ArrayList<>();
        for (WeatherSample sample : series.getSamples()) {
            if (sample.getShortwaveRadiation() > 0) {
                daytimeRadiation.add(sample.getShortwaveRadiation());
            }
            clouds.add(sample.getCloudCover());
        }
        if (daytimeRadiation.isEmpty()) {
            return 0;
        }

        double cloudFactor = (100 - WeatherStatistics.mean(clouds)) / 100.0;
        double radiationFactor = Math.min(1, WeatherStatistics.mean(daytimeRadiation) / REFERENCE_RADIATION);

        return (int) Math.round(cloudFactor * radiationFactor * 100);
    }

    /**
     * 셧다운 처리
     */
    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
