package com.autosem.digital.process.optimizer.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Mide la duración de las llamadas a las plataformas publicitarias y de las pasadas
 * de optimización. Las estadísticas se acumulan en memoria hasta que se resetean.
 */
@Component
@Slf4j
public class PerformanceMonitor {

    private final Map<String, OperationMetrics> operationMetrics = new ConcurrentHashMap<>();

    private static class OperationMetrics {
        final String operationName;
        final AtomicInteger invocationCount = new AtomicInteger(0);
        final AtomicInteger errorCount = new AtomicInteger(0);
        final AtomicLong totalTimeMs = new AtomicLong(0);
        final AtomicLong maxTimeMs = new AtomicLong(0);
        final AtomicLong minTimeMs = new AtomicLong(Long.MAX_VALUE);

        OperationMetrics(String operationName) {
            this.operationName = operationName;
        }

        void addExecution(long timeMs, boolean failed) {
            invocationCount.incrementAndGet();
            if (failed) {
                errorCount.incrementAndGet();
            }
            totalTimeMs.addAndGet(timeMs);
            maxTimeMs.accumulateAndGet(timeMs, Math::max);
            minTimeMs.accumulateAndGet(timeMs, Math::min);
        }

        double getAvgTimeMs() {
            int count = invocationCount.get();
            return count > 0 ? (double) totalTimeMs.get() / count : 0;
        }

        Map<String, Object> getMetricsMap() {
            Map<String, Object> metrics = new HashMap<>();
            metrics.put("operation", operationName);
            metrics.put("invocationCount", invocationCount.get());
            metrics.put("errorCount", errorCount.get());
            metrics.put("totalTimeMs", totalTimeMs.get());
            metrics.put("avgTimeMs", getAvgTimeMs());
            metrics.put("maxTimeMs", maxTimeMs.get());
            metrics.put("minTimeMs", minTimeMs.get() == Long.MAX_VALUE ? 0 : minTimeMs.get());
            return metrics;
        }
    }

    /**
     * Monitorea una operación reactiva; el tiempo se mide desde la suscripción hasta
     * la señal de finalización, error o cancelación.
     */
    public <T> Mono<T> monitorMono(String operationName, Supplier<Mono<T>> execution) {
        return Mono.defer(() -> {
            StopWatch stopWatch = new StopWatch();
            stopWatch.start();
            AtomicInteger failed = new AtomicInteger(0);
            return execution.get()
                    .doOnError(error -> failed.set(1))
                    .doFinally(signal -> {
                        stopWatch.stop();
                        record(operationName, stopWatch.getTotalTimeMillis(), failed.get() == 1);
                    });
        });
    }

    private void record(String operationName, long timeMs, boolean failed) {
        operationMetrics.computeIfAbsent(operationName, OperationMetrics::new)
                .addExecution(timeMs, failed);

        if (timeMs > 5000) {
            log.warn("¡ALERTA DE RENDIMIENTO! Operación {} tardó {} ms", operationName, timeMs);
        } else if (timeMs > 1000) {
            log.info("Rendimiento: Operación {} tardó {} ms", operationName, timeMs);
        } else if (log.isDebugEnabled()) {
            log.debug("Operación {} ejecutada en {} ms", operationName, timeMs);
        }
    }

    /**
     * Estadísticas de todas las operaciones monitoreadas
     */
    public Map<String, Object> getPerformanceStatistics() {
        Map<String, Object> statistics = new HashMap<>();

        statistics.put("operationCount", operationMetrics.size());
        statistics.put("operations", operationMetrics.values().stream()
                .map(OperationMetrics::getMetricsMap)
                .toArray());

        long totalInvocations = operationMetrics.values().stream()
                .mapToInt(m -> m.invocationCount.get())
                .sum();
        long totalErrors = operationMetrics.values().stream()
                .mapToInt(m -> m.errorCount.get())
                .sum();

        statistics.put("totalInvocations", totalInvocations);
        statistics.put("totalErrors", totalErrors);

        statistics.put("top5SlowestOperations", operationMetrics.values().stream()
                .filter(m -> m.invocationCount.get() > 0)
                .sorted((m1, m2) -> Double.compare(m2.getAvgTimeMs(), m1.getAvgTimeMs()))
                .limit(5)
                .map(OperationMetrics::getMetricsMap)
                .toArray());

        return statistics;
    }

    public void resetStatistics() {
        operationMetrics.clear();
        log.info("Estadísticas de rendimiento reseteadas");
    }
}
