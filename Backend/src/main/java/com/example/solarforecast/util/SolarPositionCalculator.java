package com.example.solarforecast.util;

import com.example.solarforecast.model.SolarPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * 태양 위치 계산 유틸리티 클래스
 * Spencer 급수(연중 분수 각도) 기반, UTC 기준
 */
public final class SolarPositionCalculator {

    private static final Logger logger = LoggerFactory.getLogger(SolarPositionCalculator.class);

    private SolarPositionCalculator() {
    }

    /**
     * 주어진 시각 및 위치에 대한 태양 위치(고도, 천정각, 방위각) 계산
     */
    public static SolarPosition calculate(double latitude, double longitude, Instant instant) {
        ZonedDateTime utcDateTime = instant.atZone(ZoneOffset.UTC);

        // 1. 연중 일수 (1월 1일 = 1)
        int dayOfYear = utcDateTime.getDayOfYear();

        // 2. 연중 분수 각도 (라디안)
        double gamma = 2 * Math.PI * (dayOfYear - 1) / 365.0;

        // 3. 태양 적위 (라디안)
        double declination = 0.006918
                - 0.399912 * Math.cos(gamma)
                + 0.070257 * Math.sin(gamma)
                - 0.006758 * Math.cos(2 * gamma)
                + 0.000907 * Math.sin(2 * gamma)
                - 0.00205 * Math.cos(3 * gamma)
                + 0.00029 * Math.sin(3 * gamma);

        // 4. 균시차 (분)
        double equationOfTime = 229.18 * (0.017645 * Math.sin(2 * gamma)
                - 0.033827 * Math.cos(gamma)
                - 0.00969 * Math.sin(gamma)
                - 0.00569 * Math.cos(2 * gamma));

        // 5. 태양시 (경도 4분/도, 시간대 보정 없음)
        double utcMinutes = utcDateTime.getHour() * 60 + utcDateTime.getMinute();
        double solarHours = (utcMinutes + equationOfTime + longitude * 4) / 60.0;

        // 6. 시간각 (정오 기준 15도/시간, 라디안)
        double hourAngle = Math.toRadians((solarHours - 12.0) * 15.0);

        // 7. 태양 고도각
        double latRad = Math.toRadians(latitude);
        double sinElevation = Math.sin(latRad) * Math.sin(declination)
                + Math.cos(latRad) * Math.cos(declination) * Math.cos(hourAngle);
        double elevation = Math.asin(clamp(sinElevation));

        // 8. 태양 방위각 (북쪽=0, 오후는 360-방위각), 해가 진 경우 0
        double azimuth = 0;
        if (elevation > 0) {
            double denominator = Math.cos(elevation) * Math.cos(latRad);
            if (Math.abs(denominator) > 1e-12) {
                double cosAzimuth = (Math.sin(declination) - Math.sin(elevation) * Math.sin(latRad)) / denominator;
                azimuth = Math.acos(clamp(cosAzimuth));
                if (Math.sin(hourAngle) > 0) {
                    azimuth = 2 * Math.PI - azimuth;
                }
            }
        }

        double elevationDeg = Math.toDegrees(elevation);
        double zenithDeg = 90.0 - elevationDeg;
        double azimuthDeg = Math.toDegrees(azimuth);

        logger.debug("태양 위치 계산: UTC={}, 위도={}, 경도={} → 고도={}, 방위각={}",
                utcDateTime, latitude, longitude, elevationDeg, azimuthDeg);

        return new SolarPosition(elevationDeg, zenithDeg, azimuthDeg);
    }

    private static double clamp(double value) {
        return Math.max(-1, Math.min(1, value));
    }
}
