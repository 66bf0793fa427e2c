package com.autosem.digital.process.optimizer.infrastructure.config.mongo;

import com.autosem.digital.process.optimizer.domain.DTO.SecretDto;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Conexión a MongoDB con credenciales del gestor de secretos. Sólo se activa cuando
 * {@code route-secret-endpoint} tiene valor; si no, Spring Boot arma la conexión desde
 * {@code spring.data.mongodb.*}.
 */
@Configuration
@ConditionalOnExpression("!'${route-secret-endpoint:}'.isEmpty()")
@Slf4j
public class MongoConfig {

    @Bean
    public SecretDto mongoSecret(@Value("${route-secret-endpoint}") String route,
                                 @Value("${route-secret:}") String secretId,
                                 @Value("${app-key:}") String appKey,
                                 ObjectMapper objectMapper) throws JsonProcessingException {
        log.info("Leyendo credenciales de MongoDB desde el gestor de secretos: {}", route);

        HttpHeaders headers = new HttpHeaders();
        headers.set("app-key", appKey);
        String url = UriComponentsBuilder.fromUriString(route)
                .queryParam("secretId", secretId)
                .toUriString();

        String body = new RestTemplate()
                .exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class)
                .getBody();

        SecretDto secret = decodeSecret(objectMapper, body);
        log.info("Credenciales de MongoDB obtenidas, base de datos: {}", secret.getDatabase());
        return secret;
    }

    @Bean
    public MongoClient reactiveMongoClient(SecretDto mongoSecret) {
        return MongoClients.create(mongoSecret.getUri());
    }

    @Bean
    public ReactiveMongoTemplate reactiveMongoTemplate(MongoClient reactiveMongoClient, SecretDto mongoSecret) {
        return new ReactiveMongoTemplate(reactiveMongoClient, mongoSecret.getDatabase());
    }

    /**
     * El gestor responde {@code {"content": "<base64>"}} y el contenido decodificado es
     * el JSON de {@link SecretDto}.
     */
    static SecretDto decodeSecret(ObjectMapper objectMapper, String body) throws JsonProcessingException {
        JsonNode content = body != null ? objectMapper.readTree(body).path("content") : null;
        if (content == null || !content.isTextual() || content.asText().isEmpty()) {
            throw new IllegalStateException("La respuesta del gestor de secretos no trae 'content'");
        }
        byte[] decoded = Base64.getDecoder().decode(content.asText());
        SecretDto secret = objectMapper.readValue(new String(decoded, StandardCharsets.UTF_8), SecretDto.class);
        if (secret.getUri() == null || secret.getDatabase() == null) {
            throw new IllegalStateException("El secreto de MongoDB debe incluir uri y database");
        }
        return secret;
    }
}
