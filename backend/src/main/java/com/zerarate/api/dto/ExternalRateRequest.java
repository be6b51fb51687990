package com.zerarate.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * Rate pushed by an external feed. {@code useCache} defaults to true.
 */
public record ExternalRateRequest(
        @NotNull(message = "INVALID_RATE") @DecimalMin(value = "0", message = "INVALID_RATE") BigDecimal rate,
        @NotBlank(message = "INVALID_SOURCE") String source,
        Boolean useCache) {

    public boolean useCacheOrDefault() {
        return useCache == null || useCache;
    }
}
