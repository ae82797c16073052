package com.example.solarforecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SolarPosition {
    private double elevation; // 태양 고도각 (도)
    private double zenith;    // 태양 천정각 (도)
    private double azimuth;   // 태양 방위각 (도, 북쪽=0)

    @JsonIgnore
    public boolean isBelowHorizon() {
        return elevation < 0;
    }
}
