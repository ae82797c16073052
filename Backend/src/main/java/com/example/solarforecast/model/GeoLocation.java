package com.example.solarforecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class GeoLocation {

    @JsonProperty("latitude")
    private final double latitude;  // 위도 (도)

    @JsonProperty("longitude")
    private final double longitude; // 경도 (도)

    public GeoLocation(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * JSON 역직렬화용, 누락되거나 null 인 좌표는 0도로 대체하지 않고 거부
     */
    @JsonCreator
    public static GeoLocation fromJson(@JsonProperty("latitude") Double latitude,
                                       @JsonProperty("longitude") Double longitude) {
        if (latitude == null || longitude == null) {
            throw new IllegalArgumentException(
                    String.format("위도와 경도가 모두 필요합니다: 위도=%s, 경도=%s", latitude, longitude));
        }
        return new GeoLocation(latitude, longitude);
    }

    /**
     * 좌표 유효성 검사 (유한한 값, 위도 ±90, 경도 ±180)
     */
    public void validate() {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new IllegalArgumentException(
                    String.format("좌표가 유한한 값이 아닙니다: 위도=%s, 경도=%s", latitude, longitude));
        }
        if (latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("위도 범위 초과(-90~90): " + latitude);
        }
        if (longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("경도 범위 초과(-180~180): " + longitude);
        }
    }
}
