package com.zerarate.rate.source;

import com.zerarate.domain.RateSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class IndexerRateSourceTest {

    private static final String BASE_URL = "https://indexer.example.com";

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private IndexerRateSource sourceRespondingWith(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> {
                    lastRequest.set(req);
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(body)
                            .build());
                });
        return new IndexerRateSource(builder, BASE_URL, "secret-key", Duration.ofMillis(2500));
    }

    @Test
    @DisplayName("resolves numeric rate and sends API key to the exchange-rates endpoint")
    void resolvesRate() {
        IndexerRateSource source = sourceRespondingWith(HttpStatus.OK, "{\"rate\": 0.1234}");

        SourceOutcome outcome = source.tryResolve("$ZRA+0000");

        assertThat(outcome.isResolved()).isTrue();
        assertThat(outcome.getSource()).isEqualTo(RateSource.INDEXER);
        assertThat(outcome.getRate()).hasValueSatisfying(r -> assertThat(r).isEqualByComparingTo("0.1234"));
        ClientRequest request = lastRequest.get();
        assertThat(request.url().getHost()).isEqualTo("indexer.example.com");
        assertThat(request.url().getRawPath()).isEqualTo("/api/v1/exchange-rates/%24ZRA%2B0000");
        assertThat(request.headers().getFirst(IndexerRateSource.API_KEY_HEADER)).isEqualTo("secret-key");
    }

    @Test
    @DisplayName("non-2xx response is a failed outcome, not an exception")
    void httpErrorFails() {
        IndexerRateSource source = sourceRespondingWith(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        SourceOutcome outcome = source.tryResolve("$ZRA+0000");

        assertThat(outcome.isResolved()).isFalse();
        assertThat(outcome.getFailureReason()).contains("HTTP 503");
    }

    @Test
    @DisplayName("missing or non-numeric rate is a failed outcome")
    void invalidBodyFails() {
        assertThat(sourceRespondingWith(HttpStatus.OK, "{\"price\": 1}").tryResolve("$ZRA+0000").getFailureReason())
                .isEqualTo("Invalid exchange rate data received");
        assertThat(sourceRespondingWith(HttpStatus.OK, "{\"rate\": \"0.1\"}").tryResolve("$ZRA+0000").isResolved())
                .isFalse();
        assertThat(sourceRespondingWith(HttpStatus.OK, "not json").tryResolve("$ZRA+0000").isResolved())
                .isFalse();
    }

    @Test
    @DisplayName("timeout is reported as a failed outcome")
    void timeoutFails() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> Mono.never());
        IndexerRateSource source = new IndexerRateSource(builder, BASE_URL, "secret-key", Duration.ofMillis(50));

        SourceOutcome outcome = source.tryResolve("$ZRA+0000");

        assertThat(outcome.isResolved()).isFalse();
        assertThat(outcome.getFailureReason()).contains("timeout");
    }

    @Test
    @DisplayName("parseRate keeps decimal precision and rejects zero")
    void parseRate() {
        assertThat(IndexerRateSource.parseRate("{\"rate\": 0.10000000000000000001}"))
                .hasValue(new BigDecimal("0.10000000000000000001"));
        assertThat(IndexerRateSource.parseRate("{\"rate\": 0}")).isEmpty();
        assertThat(IndexerRateSource.parseRate("{\"rate\": -1.5}")).isEmpty();
        assertThat(IndexerRateSource.parseRate(null)).isEmpty();
    }
}
