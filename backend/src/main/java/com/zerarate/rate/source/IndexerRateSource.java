package com.zerarate.rate.source;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zerarate.domain.RateSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a rate via the indexer HTTP API: GET {baseUrl}/api/v1/exchange-rates/{instrumentId},
 * body {@code {"rate": <number>}}. Only registered when an API key is configured.
 */
@Slf4j
public class IndexerRateSource implements RateSourceAdapter {

    public static final String API_KEY_HEADER = "X-API-Key";
    static final String RATE_PATH = "/api/v1/exchange-rates/{instrumentId}";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final WebClient webClient;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public IndexerRateSource(WebClient.Builder webClientBuilder, String baseUrl, String apiKey, Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Indexer base URL is required");
        }
        this.webClient = webClientBuilder.build();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public RateSource source() {
        return RateSource.INDEXER;
    }

    @Override
    public SourceOutcome tryResolve(String instrumentId) {
        try {
            String response = webClient.get()
                    .uri(baseUrl + RATE_PATH, instrumentId)
                    .header(API_KEY_HEADER, apiKey)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return parseRate(response)
                    .map(rate -> SourceOutcome.resolved(rate, RateSource.INDEXER))
                    .orElseGet(() -> SourceOutcome.failed(RateSource.INDEXER, "Invalid exchange rate data received"));
        } catch (WebClientResponseException e) {
            return SourceOutcome.failed(RateSource.INDEXER,
                    "HTTP " + e.getStatusCode().value() + ": " + e.getStatusText());
        } catch (Exception e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                return SourceOutcome.failed(RateSource.INDEXER, "Request timeout after " + timeout.toMillis() + " ms");
            }
            log.debug("Indexer request error for {}", instrumentId, e);
            return SourceOutcome.failed(RateSource.INDEXER, e.getMessage());
        }
    }

    /**
     * Extracts a positive numeric {@code rate}; empty for missing, zero, non-numeric or malformed bodies.
     */
    static Optional<BigDecimal> parseRate(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode rate = MAPPER.readTree(json).path("rate");
            if (!rate.isNumber()) {
                return Optional.empty();
            }
            BigDecimal value = rate.decimalValue();
            return value.signum() > 0 ? Optional.of(value) : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
