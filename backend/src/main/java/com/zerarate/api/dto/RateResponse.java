package com.zerarate.api.dto;

import java.math.BigDecimal;

/**
 * Resolved USD rate per one unit of the instrument.
 */
public record RateResponse(String instrumentId, BigDecimal rate) {}
