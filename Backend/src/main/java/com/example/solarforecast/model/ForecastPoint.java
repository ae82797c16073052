package com.example.solarforecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ForecastPoint {

    @JsonProperty("time")
    private String time;

    @JsonProperty("predictedIrradiance")
    private double predictedIrradiance; // W/m²

    @JsonProperty("confidence")
    private double confidence; // 0 ~ 1
}
