package com.autosem.digital.process.optimizer.domain.port.service;

import com.autosem.digital.process.optimizer.domain.DTO.AdInsights;
import com.autosem.digital.process.optimizer.domain.DTO.VariantRef;
import com.autosem.digital.process.optimizer.domain.DTO.VariantSpec;
import com.autosem.digital.process.optimizer.domain.model.Platform;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Operaciones que el optimizador necesita de una plataforma publicitaria.
 * Los fallos se señalan con {@link com.autosem.digital.process.optimizer.domain.exception.PlatformCallException}.
 */
public interface AdPlatformClient {

    Platform platform();

    /**
     * Sin credenciales el cliente trabaja en modo simulado y no realiza llamadas HTTP.
     */
    boolean isConfigured();

    /**
     * Pausa una campaña o un conjunto de anuncios.
     * @return detalle legible de la operación
     */
    Mono<String> pause(String entityId);

    /**
     * Fija el presupuesto diario de una campaña o conjunto de anuncios, en centavos.
     * @return detalle legible de la operación
     */
    Mono<String> setBudget(String entityId, long cents);

    Mono<AdInsights> getAdInsights(String adId, LocalDateTime since);

    /**
     * Presupuesto diario actual del conjunto de anuncios, en centavos.
     */
    Mono<Long> getAdSetBudget(String adSetId);

    /**
     * Duplica el conjunto de anuncios original con el creativo de la variante.
     */
    Mono<VariantRef> createVariant(VariantSpec spec);
}
