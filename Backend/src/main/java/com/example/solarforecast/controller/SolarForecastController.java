package com.example.solarforecast.controller;

import com.example.solarforecast.model.ForecastMetrics;
import com.example.solarforecast.model.ForecastPoint;
import com.example.solarforecast.model.ForecastRequest;
import com.example.solarforecast.model.GeoLocation;
import com.example.solarforecast.model.HourlyWeatherData;
import com.example.solarforecast.model.SolarPosition;
import com.example.solarforecast.model.WeatherAnalysis;
import com.example.solarforecast.model.WeatherSeries;
import com.example.solarforecast.service.SolarForecastService;
import com.example.solarforecast.service.WeatherAnalysisService;
import com.example.solarforecast.util.TimestampParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/solar")
public class SolarForecastController {

    private static final Logger logger = LoggerFactory.getLogger(SolarForecastController.class);

    private final SolarForecastService solarForecastService;
    private final WeatherAnalysisService weatherAnalysisService;

    public SolarForecastController(SolarForecastService solarForecastService,
                                   WeatherAnalysisService weatherAnalysisService) {
        this.solarForecastService = solarForecastService;
        this.weatherAnalysisService = weatherAnalysisService;
    }

    /**
     * 시간별 일사량 예측 API
     */
    @PostMapping("/forecast")
    public ResponseEntity<Map<String, Object>> getForecast(@RequestBody ForecastRequest request) {
        try {
            GeoLocation location = request.getLocation();
            WeatherSeries series = WeatherSeries.from(request.getWeather());

            logger.info("=== 일사량 예측 요청 ===");
            logger.info("위치: {}, 기상 데이터: {}시간, 병렬={}", location, series.size(), request.isParallel());

            List<ForecastPoint> forecast = request.isParallel()
                    ? solarForecastService.generateForecastInParallel(location, series).join()
                    : solarForecastService.generateForecast(location, series);
            ForecastMetrics metrics = solarForecastService.calculateMetrics(forecast, series);

            Map<String, Object> response = new HashMap<>();
            response.put("forecast", forecast);
            response.put("totalCount", forecast.size());
            response.put("metrics", metrics);
            response.put("solarPotential", solarForecastService.calculateSolarPotential(series));

            logger.info("일사량 예측 응답 완료: {}개 지점", forecast.size());
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            logger.warn("잘못된 예측 요청: {}", e.getMessage());
            return ResponseEntity.badRequest().body(errorBody("잘못된 입력입니다", e.getMessage()));
        } catch (Exception e) {
            logger.error("일사량 예측 요청 처리 오류: " + e.getMessage(), e);
            return ResponseEntity.internalServerError().body(errorBody("예측 중 오류가 발생했습니다", e.getMessage()));
        }
    }

    /**
     * 기상 추세/경보/예보 품질 분석 API
     */
    @PostMapping("/analysis")
    public ResponseEntity<Map<String, Object>> getAnalysis(@RequestBody HourlyWeatherData weather) {
        try {
            WeatherSeries series = WeatherSeries.from(weather);
            WeatherAnalysis analysis = weatherAnalysisService.analyze(series);

            Map<String, Object> response = new HashMap<>();
            response.put("analysis", analysis);
            response.put("summary", weatherAnalysisService.summarize(analysis));
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            logger.warn("잘못된 분석 요청: {}", e.getMessage());
            return ResponseEntity.badRequest().body(errorBody("잘못된 입력입니다", e.getMessage()));
        } catch (Exception e) {
            logger.error("기상 분석 요청 처리 오류: " + e.getMessage(), e);
            return ResponseEntity.internalServerError().body(errorBody("분석 중 오류가 발생했습니다", e.getMessage()));
        }
    }

    /**
     * 태양 위치 조회 API
     */
    @GetMapping("/position")
    public ResponseEntity<?> getSolarPosition(
            @RequestParam double latitude,
            @RequestParam double longitude,
            @RequestParam String dateTime) {

        try {
            Instant instant = TimestampParser.parse(dateTime);
            SolarPosition position = solarForecastService.calculateSolarPosition(
                    new GeoLocation(latitude, longitude), instant);
            return ResponseEntity.ok(position);
        } catch (IllegalArgumentException e) {
            logger.warn("잘못된 태양 위치 요청: {}", e.getMessage());
            return ResponseEntity.badRequest().body(errorBody("잘못된 입력입니다", e.getMessage()));
        }
    }

    /**
     * 시스템 상태 확인 (헬스체크)
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", LocalDateTime.now());
        health.put("service", "solar-forecast");

        return ResponseEntity.ok(health);
    }

    /**
     * 요청 본문 역직렬화 실패 (좌표 누락 등)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        String message = e.getMostSpecificCause().getMessage();
        logger.warn("요청 본문 해석 실패: {}", message);
        return ResponseEntity.badRequest().body(errorBody("잘못된 입력입니다", message));
    }

    private Map<String, Object> errorBody(String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
