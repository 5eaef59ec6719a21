package com.inventoryforecast.service;

import com.inventoryforecast.backend.BackendReport;
import com.inventoryforecast.backend.ForecastBackend;
import com.inventoryforecast.dto.BackendInfoResponse;
import com.inventoryforecast.dto.ForecastRequest;
import com.inventoryforecast.dto.ForecastResponse;
import com.inventoryforecast.exception.ForecastException;
import com.inventoryforecast.exception.InsufficientDataException;
import com.inventoryforecast.exception.PreparationException;
import com.inventoryforecast.model.FitOutcome;
import com.inventoryforecast.model.ForecastBackendType;
import com.inventoryforecast.model.ForecastJob;
import com.inventoryforecast.model.StepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a forecast request to its backend and always returns an envelope, never an exception.
 */
@Slf4j
@Service
public class ForecastService {

    private final Map<ForecastBackendType, ForecastBackend<?, ?>> backends = new EnumMap<>(ForecastBackendType.class);
    private final ForecastJobFactory jobFactory;
    private final ResultAssembler assembler;

    public ForecastService(List<ForecastBackend<?, ?>> backends, ForecastJobFactory jobFactory,
                           ResultAssembler assembler) {
        backends.forEach(b -> this.backends.put(b.type(), b));
        this.jobFactory = jobFactory;
        this.assembler = assembler;
    }

    public ForecastResponse forecast(ForecastBackendType type, ForecastRequest request, String requestId) {
        ForecastBackend<?, ?> backend = backends.get(type);
        if (backend == null) {
            throw new IllegalStateException("No backend registered for " + type);
        }
        long start = System.currentTimeMillis();
        try {
            ForecastJob job = jobFactory.create(type, request, requestId);
            ForecastResponse response = run(backend, job);
            log.info("Forecast completed | backend={} | success={} | steps={} | elapsedMs={} | requestId={}",
                     type.getPath(), response.isSuccess(),
                     response.getForecasts() != null ? response.getForecasts().getForecastHorizon() : 0,
                     System.currentTimeMillis() - start, requestId);
            return response;
        } catch (InsufficientDataException e) {
            log.warn("Forecast rejected | backend={} | reason={} | requestId={}", type.getPath(), e.getMessage(), requestId);
            return assembler.insufficientData(e, backend.failureRecommendations(), requestId);
        } catch (ForecastException e) {
            log.warn("Forecast failed | backend={} | code={} | reason={} | requestId={}",
                     type.getPath(), e.getErrorCode(), e.getMessage(), requestId);
            return assembler.failure(e, backend.failureRecommendations(), requestId);
        } catch (IllegalArgumentException e) {
            log.warn("Forecast input rejected | backend={} | reason={} | requestId={}", type.getPath(), e.getMessage(), requestId);
            return assembler.failure(new PreparationException(e.getMessage(), e), backend.failureRecommendations(), requestId);
        } catch (RuntimeException e) {
            log.error("Forecast crashed | backend={} | requestId={}", type.getPath(), requestId, e);
            return assembler.unexpected(e, backend.failureRecommendations(), requestId);
        }
    }

    public List<BackendInfoResponse> backends() {
        return Arrays.stream(ForecastBackendType.values())
            .filter(backends::containsKey)
            .map(t -> BackendInfoResponse.builder()
                .backend(t.getPath())
                .modelType(t.getModelType())
                .minDataPoints(backends.get(t).minimumPoints())
                .defaultForecastSteps(backends.get(t).defaultHorizon())
                .build())
            .toList();
    }

    private <I, M> ForecastResponse run(ForecastBackend<I, M> backend, ForecastJob job) {
        I input = backend.prepare(job);
        FitOutcome<M> outcome = backend.fit(input, job);
        if (!outcome.isSuccess()) {
            return assembler.fitFailure(backend.type(), outcome.error(), backend.failureRecommendations(),
                                        job.getRequestId());
        }
        List<StepResult> steps = backend.forecast(outcome.model(), input, job);
        BackendReport report = backend.diagnose(outcome.model(), input, job);
        return assembler.success(backend.type(), steps, confidenceOf(steps, job), report, job.getRequestId());
    }

    // The tree band always reports its own fixed confidence.
    private static double confidenceOf(List<StepResult> steps, ForecastJob job) {
        return steps.stream()
            .filter(StepResult::isSuccess)
            .findFirst()
            .map(s -> s.point().getConfidenceLevel())
            .orElse(job.getConfidenceLevel());
    }
}
