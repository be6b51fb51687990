package com.zerarate.rate.source.validator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Optional contract-fee terms attached to a token record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContractFeeTerms(String feeType, String fee, List<String> allowedFeeInstruments) {}
