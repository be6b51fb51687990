package com.zerarate.rate.config;

import com.zerarate.rate.RateResolver;
import com.zerarate.rate.RateResolverSettings;
import com.zerarate.rate.ace.AceTokenRateService;
import com.zerarate.rate.source.IndexerRateSource;
import com.zerarate.rate.source.RateSourceAdapter;
import com.zerarate.rate.source.ValidatorRateSource;
import com.zerarate.rate.source.validator.WebClientValidatorFeeInfoClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Rate module wiring: properties, clock and the default resolver with its ordered sources
 * (indexer when an API key is set, then validator when a base URL is set).
 */
@Configuration
@EnableConfigurationProperties(RatesProperties.class)
@Slf4j
public class RatesConfig {

    @Bean
    public Clock rateClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateResolver rateResolver(RatesProperties properties,
                                     ObjectProvider<WebClient.Builder> webClientBuilders,
                                     Clock rateClock) {
        WebClient.Builder builder = webClientBuilders.getIfAvailable(WebClient::builder);
        return new RateResolver(toSettings(properties), rateSources(properties, builder), rateClock);
    }

    @Bean
    public AceTokenRateService aceTokenRateService(RatesProperties properties,
                                                   ObjectProvider<WebClient.Builder> webClientBuilders) {
        RatesProperties.ValidatorProperties validator = properties.getValidator();
        if (!validator.isEnabled()) {
            return new AceTokenRateService(null, Duration.ofMillis(validator.getTimeoutMs()));
        }
        WebClient.Builder builder = webClientBuilders.getIfAvailable(WebClient::builder);
        return new AceTokenRateService(
                new WebClientValidatorFeeInfoClient(builder.clone(), validator.getBaseUrl()),
                Duration.ofMillis(validator.getTimeoutMs()));
    }

    /**
     * Ordered live sources: indexer (API key set), then validator (base URL set).
     */
    static List<RateSourceAdapter> rateSources(RatesProperties properties, WebClient.Builder builder) {
        List<RateSourceAdapter> sources = new ArrayList<>();
        RatesProperties.IndexerProperties indexer = properties.getIndexer();
        if (indexer.isEnabled()) {
            sources.add(new IndexerRateSource(
                    builder.clone(),
                    indexer.getBaseUrl(),
                    indexer.getApiKey(),
                    Duration.ofMillis(indexer.getTimeoutMs())));
        } else {
            log.info("Indexer rate source disabled: no API key configured");
        }
        RatesProperties.ValidatorProperties validator = properties.getValidator();
        if (validator.isEnabled()) {
            sources.add(new ValidatorRateSource(
                    new WebClientValidatorFeeInfoClient(builder.clone(), validator.getBaseUrl()),
                    Duration.ofMillis(validator.getTimeoutMs())));
        } else {
            log.info("Validator rate source disabled: no base URL configured");
        }
        return List.copyOf(sources);
    }

    static RateResolverSettings toSettings(RatesProperties properties) {
        return new RateResolverSettings(
                Duration.ofMillis(properties.getCacheTtlMs()),
                properties.getFallbackRates(),
                properties.getMinimumRates(),
                properties.isSafeguardsEnabled());
    }
}
