package com.autosem.digital.process.optimizer.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Utilidad para reintentar llamadas a las plataformas publicitarias con backoff exponencial.
 * Sólo se reintentan fallos transitorios: errores de red, timeouts, 429 y 5xx.
 */
@Slf4j
public class RetryHandler {

    private RetryHandler() {
    }

    /**
     * Ejecuta una operación con reintentos en caso de fallo transitorio
     * @param operation Operación a ejecutar
     * @param operationName Nombre descriptivo de la operación (para logs)
     * @param maxRetries Número máximo de reintentos
     * @param initialBackoff Tiempo inicial de espera entre reintentos (en milisegundos)
     * @param <T> Tipo de resultado de la operación
     * @return Un Mono que emite el resultado de la operación
     */
    public static <T> Mono<T> withRetry(
            Supplier<Mono<T>> operation,
            String operationName,
            int maxRetries,
            long initialBackoff) {

        return Mono.defer(operation)
                .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(initialBackoff))
                        .filter(RetryHandler::isTransient)
                        .doBeforeRetry(retrySignal -> {
                            long attempt = retrySignal.totalRetries() + 1;

                            log.warn("Reintento {} de {} para operación {}: {}",
                                    attempt, maxRetries, operationName,
                                    retrySignal.failure().getMessage());
                        })
                        .onRetryExhaustedThrow((spec, signal) -> {
                            log.error("Reintentos agotados para operación {}: {}",
                                    operationName, signal.failure().getMessage());
                            return signal.failure();
                        })
                );
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) error).getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return error instanceof WebClientRequestException || error instanceof TimeoutException;
    }
}
