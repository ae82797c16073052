package com.example.solarforecast.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoLocationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsBothCoordinates() throws Exception {
        GeoLocation location = objectMapper.readValue("{\"latitude\":40.0,\"longitude\":-74.0}", GeoLocation.class);

        assertThat(location).isEqualTo(new GeoLocation(40.0, -74.0));
    }

    @Test
    void missingOrNullCoordinateIsNotTreatedAsZero() {
        assertThatThrownBy(() -> objectMapper.readValue("{\"longitude\":-74.0}", GeoLocation.class))
                .hasRootCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> objectMapper.readValue("{\"latitude\":40.0,\"longitude\":null}", GeoLocation.class))
                .hasRootCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GeoLocation.fromJson(null, 10.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
