package com.autosem.digital.process.optimizer.domain.port.repository;

import com.autosem.digital.process.optimizer.domain.model.ABTest;
import com.autosem.digital.process.optimizer.domain.model.ABTestStatus;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repositorio para las pruebas A/B
 */
@Repository
public interface ABTestRepository extends ReactiveMongoRepository<ABTest, String> {

    Flux<ABTest> findByStatus(ABTestStatus status);

    /**
     * Indica si el anuncio ya participa en una prueba con el estado indicado
     */
    Mono<Boolean> existsByOriginalAdIdAndStatus(String originalAdId, ABTestStatus status);
}
