package com.autosem.digital.process.optimizer.infrastructure.outbound.adapter;

import com.autosem.digital.process.optimizer.application.service.rule.BudgetPolicy;
import com.autosem.digital.process.optimizer.domain.DTO.AdInsights;
import com.autosem.digital.process.optimizer.domain.DTO.VariantRef;
import com.autosem.digital.process.optimizer.domain.DTO.VariantSpec;
import com.autosem.digital.process.optimizer.domain.exception.PlatformCallException;
import com.autosem.digital.process.optimizer.domain.model.Platform;
import com.autosem.digital.process.optimizer.infrastructure.MoneyUtils;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Cliente de la Marketing API de Meta (Graph API). Las escrituras son POST con formulario
 * y el token viaja como parámetro {@code access_token}.
 */
@Component
@Slf4j
public class MetaAdsClient extends AbstractAdPlatformClient {

    private final String apiVersion;
    private final String accessToken;
    private final String adAccountId;

    public MetaAdsClient(WebClient.Builder webClientBuilder,
                         @Value("${platforms.meta.base-url:https://graph.facebook.com}") String baseUrl,
                         @Value("${platforms.meta.api-version:v21.0}") String apiVersion,
                         @Value("${platforms.meta.access-token:}") String accessToken,
                         @Value("${platforms.meta.ad-account-id:}") String adAccountId,
                         @Value("${platforms.retry.max-attempts:3}") int maxRetries,
                         @Value("${platforms.retry.initial-backoff-ms:500}") long initialBackoffMs) {
        super(webClientBuilder.baseUrl(baseUrl).build(), maxRetries, initialBackoffMs);
        this.apiVersion = apiVersion;
        this.accessToken = accessToken;
        this.adAccountId = adAccountId;
    }

    @Override
    public Platform platform() {
        return Platform.META;
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(accessToken) && StringUtils.hasText(adAccountId);
    }

    @Override
    public Mono<String> pause(String entityId) {
        if (!isConfigured()) {
            return simulated("pause", entityId);
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("status", "PAUSED");
        return call("pause", () -> post(entityId, form))
                .map(response -> "paused " + entityId);
    }

    @Override
    public Mono<String> setBudget(String entityId, long cents) {
        if (!isConfigured()) {
            return simulated("set_budget " + cents + " cents", entityId);
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("daily_budget", String.valueOf(cents));
        return call("set_budget", () -> post(entityId, form))
                .map(response -> "daily_budget of " + entityId + " set to " + cents + " cents");
    }

    @Override
    public Mono<AdInsights> getAdInsights(String adId, LocalDateTime since) {
        if (!isConfigured()) {
            return simulatedInsights(adId);
        }
        String timeRange = "{\"since\":\"" + sinceDay(since) + "\",\"until\":\""
                + LocalDate.now().format(DAY_FORMATTER) + "\"}";

        return call("get_insights", () -> webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/{version}/{adId}/insights")
                        .queryParam("fields", "impressions,clicks")
                        .queryParam("time_range", "{timeRange}")
                        .queryParam("access_token", "{token}")
                        .build(apiVersion, adId, timeRange, accessToken))
                .retrieve()
                .bodyToMono(JsonNode.class))
                .map(MetaAdsClient::sumInsights);
    }

    static AdInsights sumInsights(JsonNode response) {
        long impressions = 0;
        long clicks = 0;
        for (JsonNode row : response.path("data")) {
            impressions += asLong(row.get("impressions"));
            clicks += asLong(row.get("clicks"));
        }
        return new AdInsights(impressions, clicks);
    }

    @Override
    public Mono<Long> getAdSetBudget(String adSetId) {
        if (!isConfigured()) {
            return Mono.just(MoneyUtils.toCents(BudgetPolicy.DEFAULT_DAILY_BUDGET));
        }
        return call("get_adset_budget", () -> webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/{version}/{adSetId}")
                        .queryParam("fields", "daily_budget")
                        .queryParam("access_token", "{token}")
                        .build(apiVersion, adSetId, accessToken))
                .retrieve()
                .bodyToMono(JsonNode.class))
                .map(response -> {
                    if (!response.hasNonNull("daily_budget")) {
                        throw new PlatformCallException(Platform.META, "Ad set " + adSetId + " has no daily_budget");
                    }
                    return asLong(response.get("daily_budget"));
                });
    }

    /**
     * Copia profunda del conjunto de anuncios original, con la mitad del presupuesto y el
     * anuncio copiado renombrado con el cambio creativo de la variante.
     */
    @Override
    public Mono<VariantRef> createVariant(VariantSpec spec) {
        if (!isConfigured()) {
            String suffix = UUID.randomUUID().toString().substring(0, 8);
            log.info("[META] modo simulado: variante para {}", spec.getOriginalAdsetId());
            return Mono.just(new VariantRef("sim_ad_" + suffix, "sim_adset_" + suffix));
        }

        MultiValueMap<String, String> copy = new LinkedMultiValueMap<>();
        copy.add("deep_copy", "true");
        copy.add("status_option", "PAUSED");
        copy.add("rename_options", "{\"rename_suffix\":\" - " + spec.getTestName() + " variant\"}");

        return call("copy_adset", () -> post(spec.getOriginalAdsetId() + "/copies", copy))
                .map(response -> {
                    String copiedAdsetId = response.path("copied_adset_id").asText("");
                    if (copiedAdsetId.isEmpty()) {
                        throw new PlatformCallException(Platform.META, "Ad set copy returned no copied_adset_id");
                    }
                    return copiedAdsetId;
                })
                .flatMap(copiedAdsetId -> setBudget(copiedAdsetId, spec.getBudgetCents())
                        .then(findFirstAd(copiedAdsetId))
                        .flatMap(copiedAdId -> {
                            MultiValueMap<String, String> update = new LinkedMultiValueMap<>();
                            update.add("name", spec.getTestName() + " [" + spec.getVariantType().value() + ": "
                                    + spec.getVariantValue() + "]");
                            update.add("status", "ACTIVE");
                            return call("update_variant_ad", () -> post(copiedAdId, update))
                                    .thenReturn(new VariantRef(copiedAdId, copiedAdsetId));
                        }));
    }

    private Mono<String> findFirstAd(String adSetId) {
        return call("list_ads", () -> webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/{version}/{adSetId}/ads")
                        .queryParam("fields", "id")
                        .queryParam("access_token", "{token}")
                        .build(apiVersion, adSetId, accessToken))
                .retrieve()
                .bodyToMono(JsonNode.class))
                .map(response -> {
                    String adId = response.path("data").path(0).path("id").asText("");
                    if (adId.isEmpty()) {
                        throw new PlatformCallException(Platform.META, "Copied ad set " + adSetId + " has no ads");
                    }
                    return adId;
                });
    }

    private Mono<JsonNode> post(String path, MultiValueMap<String, String> form) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>(form);
        body.add("access_token", accessToken);
        return webClient.post()
                .uri("/{version}/" + path, apiVersion)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(body))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> {
                    if (response.has("success") && !response.path("success").asBoolean()) {
                        throw new PlatformCallException(Platform.META, "Graph API rejected " + path + ": " + response);
                    }
                    return response;
                });
    }
}
