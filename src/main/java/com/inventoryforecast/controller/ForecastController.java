package com.inventoryforecast.controller;

import com.inventoryforecast.dto.BackendInfoResponse;
import com.inventoryforecast.dto.ForecastRequest;
import com.inventoryforecast.dto.ForecastResponse;
import com.inventoryforecast.model.ForecastBackendType;
import com.inventoryforecast.service.ForecastService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/forecasts")
@RequiredArgsConstructor
public class ForecastController {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final ForecastService forecastService;

    @PostMapping("/{backend}")
    public ResponseEntity<ForecastResponse> forecast(
            @PathVariable String backend, @Valid @RequestBody ForecastRequest request,
            HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        ForecastBackendType type = ForecastBackendType.fromPath(backend);
        log.info("POST /forecasts/{} | points={} | steps={} | requestId={}", type.getPath(),
                 request.getDataPoints() == null ? 0 : request.getDataPoints().size(),
                 request.getForecastSteps(), requestId);
        ForecastResponse response = forecastService.forecast(type, request, requestId);
        HttpStatus status = response.isSuccess() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).header(REQUEST_ID_HEADER, requestId).body(response);
    }

    @GetMapping("/backends")
    public ResponseEntity<List<BackendInfoResponse>> backends() {
        return ResponseEntity.ok(forecastService.backends());
    }

    static String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader(REQUEST_ID_HEADER);
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
