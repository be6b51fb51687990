package com.zerarate.rate.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Rate resolution configuration. Documented in application.yml under zerarate.rates.
 * Map keys containing '$' or '+' must be bracketed in YAML: {@code "[$ZRA+0000]": 0.10}.
 */
@ConfigurationProperties(prefix = "zerarate.rates")
@Getter
@Setter
public class RatesProperties {

    /**
     * How long a live-source rate is served from cache, in milliseconds.
     */
    private long cacheTtlMs = 3000;

    /**
     * Enforce minimum rates on every returned value.
     */
    private boolean safeguardsEnabled = true;

    /**
     * Static rates used when every live source fails. Exact identifiers or symbol-family keys (+0000).
     */
    private Map<String, BigDecimal> fallbackRates = new HashMap<>(Map.of("$ZRA+0000", new BigDecimal("0.10")));

    /**
     * Network-enforced floors for fee evaluation.
     */
    private Map<String, BigDecimal> minimumRates = new HashMap<>(Map.of("$ZRA+0000", new BigDecimal("0.10")));

    private IndexerProperties indexer = new IndexerProperties();

    private ValidatorProperties validator = new ValidatorProperties();

    @Getter
    @Setter
    public static class IndexerProperties {
        /** Indexer API base URL. */
        private String baseUrl = "https://api.zerascan.io";
        /** Access credential; the indexer source is only consulted when set. */
        private String apiKey;
        /** Client-side timeout per request in milliseconds. */
        private long timeoutMs = 2500;

        public boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    public static class ValidatorProperties {
        /** Base URL of the validator API gateway; blank disables the validator source. */
        private String baseUrl;
        /** Timeout per fee-info query in milliseconds. */
        private long timeoutMs = 5000;

        public boolean isEnabled() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }
}
