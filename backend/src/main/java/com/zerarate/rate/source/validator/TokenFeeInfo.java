package com.zerarate.rate.source.validator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One token record of a fee-info response. {@code rate} is a fixed-point string with scale 10^18;
 * only the rate is consumed by rate resolution.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenFeeInfo(
        String contractId,
        String rate,
        boolean authorized,
        String denomination,
        ContractFeeTerms contractFees) {}
