package com.zerarate.api.controller;

import com.zerarate.api.dto.ConversionResponse;
import com.zerarate.api.dto.ErrorBody;
import com.zerarate.api.dto.ExternalRateRequest;
import com.zerarate.api.dto.RateResponse;
import com.zerarate.common.Amounts;
import com.zerarate.domain.RateSource;
import com.zerarate.rate.RateConversionService;
import com.zerarate.rate.RateResolver;
import com.zerarate.rate.ace.AceTokenRate;
import com.zerarate.rate.ace.AceTokenRateService;
import com.zerarate.rate.cache.RateCacheInfo;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * /api/v1/rates: resolution, external submission, conversion, validator ACE token rates and resolver
 * administration. Resolution and validator reads block on live sources, so it runs on the bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/rates")
@RequiredArgsConstructor
public class RateController {

    private final RateResolver rateResolver;
    private final RateConversionService conversionService;
    private final AceTokenRateService aceTokenRateService;

    @GetMapping("/{instrumentId}")
    public Mono<RateResponse> resolve(@PathVariable String instrumentId,
                                      @RequestParam(defaultValue = "true") boolean useCache) {
        return Mono.fromCallable(() -> new RateResponse(instrumentId, rateResolver.resolve(instrumentId, useCache)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{instrumentId}/external")
    public RateResponse submitExternal(@PathVariable String instrumentId,
                                       @RequestBody @Valid ExternalRateRequest request) {
        RateSource source = RateSource.fromTag(request.source());
        BigDecimal rate = rateResolver.submitExternalRate(instrumentId, request.rate(), source, request.useCacheOrDefault());
        return new RateResponse(instrumentId, rate);
    }

    @GetMapping("/convert/usd-to-instrument")
    public Mono<ConversionResponse> usdToInstrument(@RequestParam String amount, @RequestParam String instrumentId) {
        return Mono.fromCallable(() -> {
                    BigDecimal usd = Amounts.parseNonNegative(amount, "USD amount");
                    return new ConversionResponse(instrumentId, "usd-to-instrument", usd,
                            conversionService.usdToInstrument(usd, instrumentId));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/convert/instrument-to-usd")
    public Mono<ConversionResponse> instrumentToUsd(@RequestParam String amount, @RequestParam String instrumentId) {
        return Mono.fromCallable(() -> {
                    BigDecimal value = Amounts.parseNonNegative(amount, "Amount");
                    return new ConversionResponse(instrumentId, "instrument-to-usd", value,
                            conversionService.instrumentToUsd(value, instrumentId));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/ace")
    public Mono<List<AceTokenRate>> aceTokenRates() {
        return Mono.fromCallable(aceTokenRateService::listRates)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/ace/{contractId}")
    public Mono<ResponseEntity<?>> aceTokenRate(@PathVariable String contractId) {
        return Mono.<ResponseEntity<?>>fromCallable(() -> aceTokenRateService.findRate(contractId)
                        .<ResponseEntity<?>>map(rate -> ResponseEntity.ok(new RateResponse(contractId, rate)))
                        .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                                .body(ErrorBody.of("NO_ACE_RATE", "Validator does not authorize " + contractId))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/cache")
    public RateCacheInfo cache() {
        return rateResolver.cacheSnapshot();
    }

    @DeleteMapping("/cache")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearCache() {
        rateResolver.clearCache();
    }

    @GetMapping("/fallback/{instrumentId}")
    public ResponseEntity<?> fallbackInfo(@PathVariable String instrumentId) {
        return rateResolver.getFallbackInfo(instrumentId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("NO_FALLBACK", "No fallback rate configured for " + instrumentId)));
    }

    @PutMapping("/fallback")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void updateFallbackRates(@RequestBody Map<String, String> rates) {
        rateResolver.updateFallbackRates(parseRates(rates, "Fallback rate"));
    }

    @PutMapping("/minimum")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void updateMinimumRates(@RequestBody Map<String, String> rates) {
        rateResolver.updateMinimumRates(parseRates(rates, "Minimum rate"));
    }

    @PutMapping("/safeguards")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setSafeguards(@RequestParam boolean enabled) {
        rateResolver.setSafeguardsEnabled(enabled);
    }

    private static Map<String, BigDecimal> parseRates(Map<String, String> rates, String name) {
        if (rates == null || rates.isEmpty()) {
            throw new IllegalArgumentException(name + " table must not be empty");
        }
        Map<String, BigDecimal> parsed = new LinkedHashMap<>();
        rates.forEach((id, rate) -> parsed.put(id, Amounts.parseNonNegative(rate, name + " for " + id)));
        return parsed;
    }
}
