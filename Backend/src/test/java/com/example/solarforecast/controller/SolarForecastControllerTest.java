package com.example.solarforecast.controller;

import com.example.solarforecast.config.SolarForecastConfig;
import com.example.solarforecast.service.SolarForecastService;
import com.example.solarforecast.service.WeatherAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SolarForecastController.class)
@Import({SolarForecastConfig.class, SolarForecastService.class, WeatherAnalysisService.class})
class SolarForecastControllerTest {

    private static final String WEATHER = "{"
            + "\"time\":[\"2024-06-21T04:00\",\"2024-06-21T16:00\"],"
            + "\"temperature_2m\":[18.0,25.0],"
            + "\"cloud_cover\":[85.0,0.0],"
            + "\"shortwave_radiation\":[0.0,800.0],"
            + "\"humidity\":[70.0,55.0]"
            + "}";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void forecastReturnsOnePointPerHour() throws Exception {
        String body = "{\"location\":{\"latitude\":40.0,\"longitude\":-74.0},\"weather\":" + WEATHER + "}";

        mockMvc.perform(post("/api/solar/forecast").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(2))
                .andExpect(jsonPath("$.forecast[0].time").value("2024-06-21T04:00"))
                .andExpect(jsonPath("$.forecast[0].predictedIrradiance").value(0.0))
                .andExpect(jsonPath("$.forecast[0].confidence").value(0.95))
                .andExpect(jsonPath("$.forecast[1].predictedIrradiance", closeTo(613.7, 0.1)))
                .andExpect(jsonPath("$.metrics.peakIrradiance", closeTo(613.7, 0.1)))
                .andExpect(jsonPath("$.metrics.avgHumidity", closeTo(62.5, 1e-9)));
    }

    @Test
    void parallelForecastGivesSameResult() throws Exception {
        String body = "{\"location\":{\"latitude\":40.0,\"longitude\":-74.0},\"parallel\":true,\"weather\":" + WEATHER + "}";

        mockMvc.perform(post("/api/solar/forecast").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.forecast[1].predictedIrradiance", closeTo(613.7, 0.1)));
    }

    @Test
    void outOfRangeLatitudeIsBadRequest() throws Exception {
        String body = "{\"location\":{\"latitude\":95.0,\"longitude\":-74.0},\"weather\":" + WEATHER + "}";

        mockMvc.perform(post("/api/solar/forecast").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("95")));
    }

    @Test
    void missingLatitudeIsBadRequest() throws Exception {
        String body = "{\"location\":{\"longitude\":-74.0},\"weather\":" + WEATHER + "}";

        mockMvc.perform(post("/api/solar/forecast").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("위도와 경도가 모두 필요합니다")));
    }

    @Test
    void nullLatitudeIsBadRequest() throws Exception {
        String body = "{\"location\":{\"latitude\":null,\"longitude\":-74.0},\"weather\":" + WEATHER + "}";

        mockMvc.perform(post("/api/solar/forecast").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists())
                .andExpect(jsonPath("$.forecast").doesNotExist());
    }

    @Test
    void missingWeatherIsBadRequest() throws Exception {
        String body = "{\"location\":{\"latitude\":40.0,\"longitude\":-74.0}}";

        mockMvc.perform(post("/api/solar/forecast").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void analysisReportsCloudAlert() throws Exception {
        mockMvc.perform(post("/api/solar/analysis").contentType(MediaType.APPLICATION_JSON).content(WEATHER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.analysis.weatherAlerts.cloudCoverAlert").value(true))
                .andExpect(jsonPath("$.analysis.currentConditions.cloudCover").value(85.0))
                .andExpect(jsonPath("$.analysis.dataFreshness").value("Real-time"))
                .andExpect(jsonPath("$.summary", containsString("짙은 구름")));
    }

    @Test
    void solarPositionLookup() throws Exception {
        mockMvc.perform(get("/api/solar/position")
                        .param("latitude", "40.0")
                        .param("longitude", "-74.0")
                        .param("dateTime", "2024-06-21T16:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.elevation", greaterThan(60.0)));
    }

    @Test
    void solarPositionWithBadTimeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/solar/position")
                        .param("latitude", "40.0")
                        .param("longitude", "-74.0")
                        .param("dateTime", "noon"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void healthCheck() throws Exception {
        mockMvc.perform(get("/api/solar/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
