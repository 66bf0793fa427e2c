package com.autosem.digital.process.optimizer.infrastructure.outbound.adapter;

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
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Cliente de TikTok Business API v1.3. Las respuestas llegan en un sobre
 * {@code {code, message, data}}; un código distinto de 0 es un rechazo.
 */
@Component
@Slf4j
public class TikTokAdsClient extends AbstractAdPlatformClient {

    private final String accessToken;
    private final String advertiserId;

    public TikTokAdsClient(WebClient.Builder webClientBuilder,
                           @Value("${platforms.tiktok.base-url:https://business-api.tiktok.com/open_api/v1.3}") String baseUrl,
                           @Value("${platforms.tiktok.access-token:}") String accessToken,
                           @Value("${platforms.tiktok.advertiser-id:}") String advertiserId,
                           @Value("${platforms.retry.max-attempts:3}") int maxRetries,
                           @Value("${platforms.retry.initial-backoff-ms:500}") long initialBackoffMs) {
        super(webClientBuilder.baseUrl(baseUrl).build(), maxRetries, initialBackoffMs);
        this.accessToken = accessToken;
        this.advertiserId = advertiserId;
    }

    @Override
    public Platform platform() {
        return Platform.TIKTOK;
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(accessToken) && StringUtils.hasText(advertiserId);
    }

    @Override
    public Mono<String> pause(String entityId) {
        if (!isConfigured()) {
            return simulated("pause", entityId);
        }
        Map<String, Object> body = Map.of(
                "advertiser_id", advertiserId,
                "campaign_ids", List.of(entityId),
                "operation_status", "DISABLE");
        return call("pause", () -> post("/campaign/status/update/", body))
                .map(data -> "disabled campaign " + entityId);
    }

    @Override
    public Mono<String> setBudget(String entityId, long cents) {
        if (!isConfigured()) {
            return simulated("set_budget " + cents + " cents", entityId);
        }
        BigDecimal dollars = MoneyUtils.fromCents(cents);
        Map<String, Object> body = Map.of(
                "advertiser_id", advertiserId,
                "campaign_id", entityId,
                "budget", dollars);
        return call("set_budget", () -> post("/campaign/update/", body))
                .map(data -> "budget of " + entityId + " set to " + dollars.toPlainString());
    }

    @Override
    public Mono<AdInsights> getAdInsights(String adId, LocalDateTime since) {
        if (!isConfigured()) {
            return simulatedInsights(adId);
        }
        return call("get_insights", () -> webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/report/integrated/get/")
                        .queryParam("advertiser_id", advertiserId)
                        .queryParam("report_type", "BASIC")
                        .queryParam("data_level", "AUCTION_AD")
                        .queryParam("dimensions", "{dimensions}")
                        .queryParam("metrics", "{metrics}")
                        .queryParam("filtering", "{filtering}")
                        .queryParam("start_date", sinceDay(since))
                        .queryParam("end_date", LocalDate.now().format(DAY_FORMATTER))
                        .build("[\"ad_id\"]", "[\"impressions\",\"clicks\"]",
                                "[{\"field_name\":\"ad_ids\",\"filter_type\":\"IN\",\"filter_value\":\"[\\\"" + adId + "\\\"]\"}]"))
                .header("Access-Token", accessToken)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::unwrap))
                .map(data -> {
                    long impressions = 0;
                    long clicks = 0;
                    for (JsonNode row : data.path("list")) {
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

    private Mono<JsonNode> post(String path, Map<String, Object> body) {
        return webClient.post()
                .uri(path)
                .header("Access-Token", accessToken)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::unwrap);
    }

    private JsonNode unwrap(JsonNode response) {
        int code = response.path("code").asInt(-1);
        if (code != 0) {
            throw new PlatformCallException(Platform.TIKTOK,
                    "TikTok API error " + code + ": " + response.path("message").asText());
        }
        return response.path("data");
    }
}
