package com.inventoryforecast.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ForecastControllerIntegrationTest {

    private static final List<Double> SCENARIO_A =
        List.of(10.0, 12.0, 11.0, 13.0, 12.0, 14.0, 13.0, 15.0, 14.0, 16.0);

    @Autowired TestRestTemplate restTemplate;

    private ResponseEntity<Map> post(String backend, Map<String, Object> body, String requestId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (requestId != null) {
            headers.set("X-Request-ID", requestId);
        }
        return restTemplate.postForEntity("/api/v1/forecasts/" + backend, new HttpEntity<>(body, headers), Map.class);
    }

    private static List<Double> weekly(int n) {
        double[] pattern = {0.0, 4.0, 6.0, 5.0, 3.0, -8.0, -10.0};
        return java.util.stream.IntStream.range(0, n).mapToObj(i -> 50.0 + pattern[i % 7]).toList();
    }

    @Test
    @SuppressWarnings("unchecked")
    void forecast_arima_returnsOkWithThirtySteps() {
        ResponseEntity<Map> resp = post("arima", Map.of("data_points", SCENARIO_A), "it-req-1");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("it-req-1");
        Map<String, Object> body = resp.getBody();
        assertThat(body.get("success")).isEqualTo(true);
        assertThat(body.get("model_type")).isEqualTo("ARIMA");
        assertThat(body.get("request_id")).isEqualTo("it-req-1");

        Map<String, Object> forecasts = (Map<String, Object>) body.get("forecasts");
        assertThat(forecasts.get("forecast_horizon")).isEqualTo(30);
        List<Map<String, Object>> points = (List<Map<String, Object>>) forecasts.get("forecasts");
        assertThat(points).hasSize(30);
        assertThat(points.get(0)).containsKeys("step", "date", "forecast", "lower_bound", "upper_bound", "confidence_level");
        assertThat(points.get(0).get("date")).asString().matches("\\d{4}-\\d{2}-\\d{2}");

        Map<String, Object> diagnostics = (Map<String, Object>) body.get("model_diagnostics");
        assertThat(diagnostics).containsKeys("order", "selection_method", "aic");
    }

    @Test
    @SuppressWarnings("unchecked")
    void forecast_forecastHorizonAlias_isAccepted() {
        ResponseEntity<Map> resp = post("arima", Map.of("data_points", SCENARIO_A, "forecast_horizon", 4), null);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isNotBlank();
        Map<String, Object> forecasts = (Map<String, Object>) resp.getBody().get("forecasts");
        assertThat(forecasts.get("forecast_horizon")).isEqualTo(4);
    }

    @Test
    void forecast_ninePoints_returnsUnprocessableWithRequiredAction() {
        ResponseEntity<Map> resp = post("arima", Map.of("data_points", SCENARIO_A.subList(0, 9)), null);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("success")).isEqualTo(false);
        assertThat((String) resp.getBody().get("error")).containsIgnoringCase("insufficient data");
        assertThat(resp.getBody().get("required_action")).isEqualTo("Collect more historical sales data");
        assertThat(resp.getBody()).doesNotContainKey("forecasts");
    }

    @Test
    void forecast_unorderedDatesForArima_returnsPreparationError() {
        Map<String, Object> body = new HashMap<>();
        body.put("data_points", SCENARIO_A);
        body.put("dates", List.of("2024-01-02", "2024-01-01", "2024-01-03", "2024-01-04", "2024-01-05",
                                  "2024-01-06", "2024-01-07", "2024-01-08", "2024-01-09", "2024-01-10"));

        ResponseEntity<Map> resp = post("arima", body, null);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("error_code")).isEqualTo("PREPARATION_ERROR");
    }

    @Test
    @SuppressWarnings("unchecked")
    void forecast_decomposition_returnsComponentsAndTrendAnalysis() {
        ResponseEntity<Map> resp = post("decomposition", Map.of("data_points", weekly(21), "forecast_steps", 7), "it-req-2");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = resp.getBody();
        assertThat(body.get("model_type")).isEqualTo("Decomposition");
        assertThat(body).containsKeys("trend_analysis", "business_context", "data_quality");
        Map<String, Object> forecasts = (Map<String, Object>) body.get("forecasts");
        assertThat((List<String>) forecasts.get("components_included")).containsExactly("trend", "seasonal", "holidays");
        assertThat((List<Object>) forecasts.get("forecasts")).hasSize(7);
    }

    @Test
    void forecast_unknownBackend_returnsNotFound() {
        ResponseEntity<Map> resp = post("neural-prophet", Map.of("data_points", SCENARIO_A), "it-req-3");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("error_code")).isEqualTo("UNSUPPORTED_BACKEND");
        assertThat(resp.getBody().get("request_id")).isEqualTo("it-req-3");
    }

    @Test
    @SuppressWarnings("unchecked")
    void forecast_confidenceOutOfRange_returnsValidationError() {
        ResponseEntity<Map> resp = post("arima", Map.of("data_points", SCENARIO_A, "confidence_level", 1.5), null);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("error_type")).isEqualTo("ValidationError");
        assertThat(resp.getBody().get("error_code")).isEqualTo("VALIDATION_ERROR");
        assertThat((List<String>) resp.getBody().get("recommendations"))
            .anyMatch(r -> r.contains("confidence_level must be between 0 and 1"));
    }

    @Test
    void forecast_malformedJson_returnsBadRequest() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasts/arima",
            new HttpEntity<>("{\"data_points\": [1, 2,", headers), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("error_code")).isEqualTo("PREPARATION_ERROR");
    }

    @Test
    @SuppressWarnings("unchecked")
    void backends_listsAllThree() {
        ResponseEntity<List> resp = restTemplate.getForEntity("/api/v1/forecasts/backends", List.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> backends = resp.getBody();
        assertThat(backends).hasSize(3);
        assertThat(backends).extracting(b -> b.get("backend"))
            .containsExactly("arima", "decomposition", "gradient-boosting");
        assertThat(backends.get(2).get("min_data_points")).isEqualTo(15);
    }
}
