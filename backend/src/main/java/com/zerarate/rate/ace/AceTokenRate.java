package com.zerarate.rate.ace;

import java.math.BigDecimal;

/**
 * Validator-authorized token rate in USD per human unit.
 */
public record AceTokenRate(String contractId, BigDecimal rate) {}
