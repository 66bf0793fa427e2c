package com.autosem.digital.process.optimizer.infrastructure.outbound.adapter;

import com.autosem.digital.process.optimizer.domain.DTO.AdInsights;
import com.autosem.digital.process.optimizer.domain.exception.PlatformCallException;
import com.autosem.digital.process.optimizer.domain.port.service.AdPlatformClient;
import com.autosem.digital.process.optimizer.infrastructure.RetryHandler;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

/**
 * Base de los clientes de plataforma: reintentos de fallos transitorios y conversión de
 * cualquier error a {@link PlatformCallException}.
 */
@Slf4j
public abstract class AbstractAdPlatformClient implements AdPlatformClient {

    protected static final DateTimeFormatter DAY_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    protected static final String SIMULATED = "simulated";

    protected final WebClient webClient;
    private final int maxRetries;
    private final long initialBackoffMs;

    protected AbstractAdPlatformClient(WebClient webClient, int maxRetries, long initialBackoffMs) {
        this.webClient = webClient;
        this.maxRetries = maxRetries;
        this.initialBackoffMs = initialBackoffMs;
    }

    protected <T> Mono<T> call(String operation, Supplier<Mono<T>> request) {
        String operationName = platform() + "." + operation;
        return RetryHandler.withRetry(request, operationName, maxRetries, initialBackoffMs)
                .onErrorMap(error -> !(error instanceof PlatformCallException),
                        error -> new PlatformCallException(platform(), operation + " failed: " + describe(error), error));
    }

    protected Mono<String> simulated(String operation, String entityId) {
        log.info("[{}] modo simulado: {} {}", platform(), operation, entityId);
        return Mono.just(SIMULATED + " " + operation + " " + entityId);
    }

    protected Mono<AdInsights> simulatedInsights(String adId) {
        log.debug("[{}] modo simulado: sin métricas para {}", platform(), adId);
        return Mono.just(AdInsights.empty());
    }

    protected PlatformCallException unsupported(String operation) {
        return new PlatformCallException(platform(), operation + " is not supported on " + platform());
    }

    protected static String sinceDay(LocalDateTime since) {
        return (since != null ? since : LocalDateTime.now().minusDays(30)).format(DAY_FORMATTER);
    }

    protected static long asLong(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return 0L;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return 0L;
        }
        return (long) Double.parseDouble(text);
    }

    private static String describe(Throwable error) {
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            return "HTTP " + response.getStatusCode().value() + " " + response.getResponseBodyAsString();
        }
        return String.valueOf(error.getMessage());
    }
}
