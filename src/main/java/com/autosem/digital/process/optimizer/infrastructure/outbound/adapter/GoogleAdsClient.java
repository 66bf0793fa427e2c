package com.autosem.digital.process.optimizer.infrastructure.outbound.adapter;

import com.autosem.digital.process.optimizer.domain.DTO.AdInsights;
import com.autosem.digital.process.optimizer.domain.DTO.VariantRef;
import com.autosem.digital.process.optimizer.domain.DTO.VariantSpec;
import com.autosem.digital.process.optimizer.domain.exception.PlatformCallException;
import com.autosem.digital.process.optimizer.domain.model.Platform;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cliente REST de Google Ads. Pausa y presupuesto se aplican con los endpoints
 * {@code :mutate}; las métricas y el presupuesto asociado a una campaña se leen con GAQL.
 * Las pruebas A/B no están soportadas.
 */
@Component
@Slf4j
public class GoogleAdsClient extends AbstractAdPlatformClient {

    private static final long MICROS_PER_CENT = 10_000L;
    private static final Pattern NUMERIC_ID = Pattern.compile("\\d+");

    private final String apiVersion;
    private final String developerToken;
    private final String accessToken;
    private final String customerId;

    public GoogleAdsClient(WebClient.Builder webClientBuilder,
                           @Value("${platforms.google.base-url:https://googleads.googleapis.com}") String baseUrl,
                           @Value("${platforms.google.api-version:v17}") String apiVersion,
                           @Value("${platforms.google.developer-token:}") String developerToken,
                           @Value("${platforms.google.access-token:}") String accessToken,
                           @Value("${platforms.google.customer-id:}") String customerId,
                           @Value("${platforms.retry.max-attempts:3}") int maxRetries,
                           @Value("${platforms.retry.initial-backoff-ms:500}") long initialBackoffMs) {
        super(webClientBuilder.baseUrl(baseUrl).build(), maxRetries, initialBackoffMs);
        this.apiVersion = apiVersion;
        this.developerToken = developerToken;
        this.accessToken = accessToken;
        this.customerId = customerId != null ? customerId.replace("-", "") : "";
    }

    @Override
    public Platform platform() {
        return Platform.GOOGLE;
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(developerToken) && StringUtils.hasText(accessToken) && StringUtils.hasText(customerId);
    }

    @Override
    public Mono<String> pause(String entityId) {
        if (!isConfigured()) {
            return simulated("pause", entityId);
        }
        return numericId("pause", entityId)
                .flatMap(id -> {
                    Map<String, Object> operation = Map.of(
                            "update", Map.of(
                                    "resourceName", "customers/" + customerId + "/campaigns/" + id,
                                    "status", "PAUSED"),
                            "updateMask", "status");
                    return call("pause", () -> mutate("campaigns", operation));
                })
                .map(response -> "paused campaign " + entityId);
    }

    /**
     * El identificador recibido es el de la campaña. El presupuesto en Google Ads es un
     * recurso aparte ({@code campaign_budget}), así que primero se resuelve cuál le
     * corresponde y luego se modifica su monto.
     */
    @Override
    public Mono<String> setBudget(String entityId, long cents) {
        if (!isConfigured()) {
            return simulated("set_budget " + cents + " cents", entityId);
        }
        return numericId("set_budget", entityId)
                .flatMap(id -> call("resolve_budget", () -> search(
                        "SELECT campaign.campaign_budget FROM campaign WHERE campaign.id = " + id)))
                .flatMap(response -> {
                    String budgetResource = response.path("results").path(0)
                            .path("campaign").path("campaignBudget").asText("");
                    if (budgetResource.isEmpty()) {
                        return Mono.<JsonNode>error(new PlatformCallException(platform(),
                                "set_budget failed: campaign " + entityId + " has no campaign budget"));
                    }
                    log.debug("[GOOGLE] campaña {} usa el presupuesto {}", entityId, budgetResource);
                    Map<String, Object> operation = Map.of(
                            "update", Map.of(
                                    "resourceName", budgetResource,
                                    "amountMicros", String.valueOf(cents * MICROS_PER_CENT)),
                            "updateMask", "amount_micros");
                    return call("set_budget", () -> mutate("campaignBudgets", operation));
                })
                .map(response -> "budget of campaign " + entityId + " set to " + cents + " cents");
    }

    @Override
    public Mono<AdInsights> getAdInsights(String adId, LocalDateTime since) {
        if (!isConfigured()) {
            return simulatedInsights(adId);
        }
        return numericId("get_insights", adId)
                .flatMap(id -> call("get_insights", () -> search(
                        "SELECT metrics.impressions, metrics.clicks FROM ad_group_ad"
                                + " WHERE ad_group_ad.ad.id = " + id
                                + " AND segments.date >= '" + sinceDay(since) + "'")))
                .map(response -> {
                    long impressions = 0;
                    long clicks = 0;
                    for (JsonNode row : response.path("results")) {
                        impressions += asLong(row.path("metrics").get("impressions"));
                        clicks += asLong(row.path("metrics").get("clicks"));
                    }
                    return new AdInsights(impressions, clicks);
                });
    }

    @Override
    public Mono<Long> getAdSetBudget(String adSetId) {
        return Mono.error(unsupported("get_adset_budget"));
    }

    @Override
    public Mono<VariantRef> createVariant(VariantSpec spec) {
        return Mono.error(unsupported("create_variant"));
    }

    private Mono<String> numericId(String operation, String id) {
        if (id == null || !NUMERIC_ID.matcher(id).matches()) {
            return Mono.error(new PlatformCallException(platform(),
                    operation + " failed: invalid Google Ads id '" + id + "'"));
        }
        return Mono.just(id);
    }

    private Mono<JsonNode> search(String query) {
        return webClient.post()
                .uri("/{version}/customers/{customerId}/googleAds:search", apiVersion, customerId)
                .headers(headers -> {
                    headers.setBearerAuth(accessToken);
                    headers.set("developer-token", developerToken);
                })
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", query))
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    private Mono<JsonNode> mutate(String resource, Map<String, Object> operation) {
        return webClient.post()
                .uri("/{version}/customers/{customerId}/" + resource + ":mutate", apiVersion, customerId)
                .headers(headers -> {
                    headers.setBearerAuth(accessToken);
                    headers.set("developer-token", developerToken);
                })
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("operations", List.of(operation)))
                .retrieve()
                .bodyToMono(JsonNode.class);
    }
}
