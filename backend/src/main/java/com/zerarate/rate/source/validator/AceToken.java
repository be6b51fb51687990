package com.zerarate.rate.source.validator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Validator-authorized token with its fixed-point rate (scale 10^18).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AceToken(String contractId, String rate) {}
