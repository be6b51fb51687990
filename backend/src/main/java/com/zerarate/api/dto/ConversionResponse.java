package com.zerarate.api.dto;

import java.math.BigDecimal;

/**
 * Result of a USD/instrument conversion. {@code direction} is "usd-to-instrument" or "instrument-to-usd".
 */
public record ConversionResponse(String instrumentId, String direction, BigDecimal amount, BigDecimal result) {}
