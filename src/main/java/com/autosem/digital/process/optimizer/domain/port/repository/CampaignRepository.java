package com.autosem.digital.process.optimizer.domain.port.repository;

import com.autosem.digital.process.optimizer.domain.model.Campaign;
import com.autosem.digital.process.optimizer.domain.model.CampaignStatus;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Repositorio para acceder a la colección de campañas en MongoDB
 */
@Repository
public interface CampaignRepository extends ReactiveMongoRepository<Campaign, String> {

    /**
     * Busca campañas por estado
     */
    Flux<Campaign> findByStatus(CampaignStatus status);
}
