package com.autosem.digital.process.optimizer.domain.port.repository;

import com.autosem.digital.process.optimizer.domain.model.Setting;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface SettingRepository extends ReactiveMongoRepository<Setting, String> {

    Mono<Setting> findByKey(String key);
}
