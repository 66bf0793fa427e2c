package com.autosem.digital.process.optimizer.infrastructure;

import com.autosem.digital.process.optimizer.domain.exception.InvalidABTestRequestException;
import com.autosem.digital.process.optimizer.domain.model.ABTestStatus;
import com.autosem.digital.process.optimizer.domain.model.Campaign;
import com.autosem.digital.process.optimizer.domain.port.repository.ABTestRepository;
import com.autosem.digital.process.optimizer.domain.port.repository.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Servicio para validar la integridad referencial antes de crear una prueba A/B
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReferentialIntegrityValidator {

    private final CampaignRepository campaignRepository;
    private final ABTestRepository abTestRepository;

    /**
     * Verifica que la campaña especificada exista
     * @param campaignId ID de la campaña a verificar
     * @return Mono que emite true si existe, false en caso contrario
     */
    public Mono<Boolean> verifyCampaignExists(String campaignId) {
        if (campaignId == null || campaignId.isEmpty()) {
            log.warn("ID de campaña nulo o vacío");
            return Mono.just(false);
        }

        return campaignRepository.existsById(campaignId)
                .doOnNext(exists -> {
                    if (!exists) {
                        log.warn("Campaña no encontrada: {}", campaignId);
                    }
                });
    }

    /**
     * Verifica que el anuncio no participe ya en una prueba en curso
     * @param originalAdId ID del anuncio original
     * @return Mono que emite true si el anuncio está libre
     */
    public Mono<Boolean> verifyAdIsFree(String originalAdId) {
        return abTestRepository.existsByOriginalAdIdAndStatus(originalAdId, ABTestStatus.RUNNING)
                .map(inUse -> !inUse)
                .doOnNext(free -> {
                    if (!free) {
                        log.warn("El anuncio {} ya tiene una prueba en curso", originalAdId);
                    }
                });
    }

    /**
     * Valida las referencias de una nueva prueba y devuelve la campaña dueña
     * @param campaignId ID de la campaña
     * @param originalAdId ID del anuncio original
     * @return Mono con la campaña, o error {@link InvalidABTestRequestException}
     */
    public Mono<Campaign> validateNewTest(String campaignId, String originalAdId) {
        return verifyCampaignExists(campaignId)
                .flatMap(exists -> exists
                        ? verifyAdIsFree(originalAdId)
                        : Mono.error(new InvalidABTestRequestException("Campaign not found: " + campaignId)))
                .flatMap(free -> free
                        ? campaignRepository.findById(campaignId)
                        : Mono.error(new InvalidABTestRequestException(
                                "Ad " + originalAdId + " already has a running A/B test")));
    }
}
