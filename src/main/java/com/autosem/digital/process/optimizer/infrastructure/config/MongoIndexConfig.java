package com.autosem.digital.process.optimizer.infrastructure.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Crea al arranque los índices que usan las consultas de cada pasada
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MongoIndexConfig {

    private final ReactiveMongoTemplate mongoTemplate;

    private static class IndexDefinition {
        final Map<String, Sort.Direction> fields;
        final boolean unique;

        IndexDefinition(Map<String, Sort.Direction> fields, boolean unique) {
            this.fields = fields;
            this.unique = unique;
        }
    }

    @PostConstruct
    public void createIndexes() {
        log.info("Iniciando creación de índices del optimizador");

        Map<String, IndexDefinition> campaignIndexes = new HashMap<>();
        campaignIndexes.put("campaign_status_idx", new IndexDefinition(
                Map.of("status", Sort.Direction.ASC), false));

        Map<String, IndexDefinition> abTestIndexes = new HashMap<>();
        abTestIndexes.put("ab_test_status_idx", new IndexDefinition(
                Map.of("status", Sort.Direction.ASC), false));
        abTestIndexes.put("ab_test_original_ad_idx", new IndexDefinition(
                orderedFields("originalAdId", "status"), false));

        Map<String, IndexDefinition> auditIndexes = new HashMap<>();
        auditIndexes.put("audit_created_idx", new IndexDefinition(
                Map.of("createdAt", Sort.Direction.DESC), false));
        auditIndexes.put("audit_action_idx", new IndexDefinition(
                orderedFields("action", "createdAt"), false));

        Map<String, IndexDefinition> settingIndexes = new HashMap<>();
        settingIndexes.put("setting_key_idx", new IndexDefinition(
                Map.of("key", Sort.Direction.ASC), true));

        createCollectionIndexes("campaigns", campaignIndexes)
                .then(createCollectionIndexes("ab_tests", abTestIndexes))
                .then(createCollectionIndexes("audit_log", auditIndexes))
                .then(createCollectionIndexes("settings", settingIndexes))
                .subscribe(
                        v -> { },
                        e -> log.error("Error creando índices: {}", e.getMessage()),
                        () -> log.info("Índices verificados"));
    }

    private static Map<String, Sort.Direction> orderedFields(String first, String second) {
        Map<String, Sort.Direction> fields = new LinkedHashMap<>();
        fields.put(first, Sort.Direction.ASC);
        fields.put(second, Sort.Direction.DESC);
        return fields;
    }

    private Mono<Void> createCollectionIndexes(String collectionName, Map<String, IndexDefinition> indexes) {
        return mongoTemplate.indexOps(collectionName).getIndexInfo()
                .collectList()
                .flatMap(existingIndexes -> {
                    Map<String, IndexDefinition> missingIndexes = new HashMap<>(indexes);
                    for (IndexInfo indexInfo : existingIndexes) {
                        missingIndexes.remove(indexInfo.getName());
                    }

                    if (missingIndexes.isEmpty()) {
                        log.info("Todos los índices ya existen para la colección: {}", collectionName);
                        return Mono.empty();
                    }

                    log.info("Creando {} índices para la colección: {}", missingIndexes.size(), collectionName);
                    return Flux.fromIterable(missingIndexes.entrySet())
                            .concatMap(entry -> {
                                Index index = new Index();
                                entry.getValue().fields.forEach(index::on);
                                index.named(entry.getKey());
                                if (entry.getValue().unique) {
                                    index.unique();
                                }
                                return mongoTemplate.indexOps(collectionName)
                                        .ensureIndex(index)
                                        .doOnSuccess(indexName ->
                                                log.info("Índice creado: {} en colección: {}", indexName, collectionName));
                            })
                            .then();
                });
    }
}
