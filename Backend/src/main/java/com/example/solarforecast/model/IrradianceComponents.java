package com.example.solarforecast.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class IrradianceComponents {
    private double dni; // 직달 일사량 (W/m²)
    private double dhi; // 산란 일사량 (W/m²)

    public static IrradianceComponents none() {
        return new IrradianceComponents(0, 0);
    }
}
